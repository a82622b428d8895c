package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Box or text shadow. A disabled shadow renders as {@code none}. */
@JsonPropertyOrder({"enabled","offsetX","offsetY","blur","spread","color","inset"})
public final class IrShadow {

    public static final IrShadow NONE = new IrShadow(false, 0, 0, 0, 0, null, false);

    public final boolean enabled;
    public final double offsetX;
    public final double offsetY;
    public final double blur;
    public final double spread;
    public final IrColor color;
    public final boolean inset;

    @JsonCreator
    public IrShadow(
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("offsetX") double offsetX,
            @JsonProperty("offsetY") double offsetY,
            @JsonProperty("blur") double blur,
            @JsonProperty("spread") double spread,
            @JsonProperty("color") IrColor color,
            @JsonProperty("inset") boolean inset
    ) {
        this.enabled = enabled;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
        this.blur = blur;
        this.spread = spread;
        this.color = color == null ? IrColor.rgba(0, 0, 0, 128) : color;
        this.inset = inset;
    }

    public static IrShadow of(double offsetX, double offsetY, double blur, double spread, IrColor color) {
        return new IrShadow(true, offsetX, offsetY, blur, spread, color, false);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrShadow)) return false;
        IrShadow that = (IrShadow) o;
        return enabled == that.enabled &&
                Double.compare(offsetX, that.offsetX) == 0 &&
                Double.compare(offsetY, that.offsetY) == 0 &&
                Double.compare(blur, that.blur) == 0 &&
                Double.compare(spread, that.spread) == 0 &&
                color.equals(that.color) &&
                inset == that.inset;
    }

    @Override public int hashCode() {
        return Objects.hash(enabled, offsetX, offsetY, blur, spread, color, inset);
    }
}
