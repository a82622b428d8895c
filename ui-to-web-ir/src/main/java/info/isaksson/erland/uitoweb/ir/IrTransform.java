package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** 2D transform: translation in px, scale factors, rotation in degrees. */
@JsonPropertyOrder({"translateX","translateY","scaleX","scaleY","rotate"})
public final class IrTransform {

    public static final IrTransform IDENTITY = new IrTransform(0, 0, null, null, 0);

    public final double translateX;
    public final double translateY;
    public final double scaleX;
    public final double scaleY;
    public final double rotate;

    @JsonCreator
    public IrTransform(
            @JsonProperty("translateX") double translateX,
            @JsonProperty("translateY") double translateY,
            @JsonProperty("scaleX") Double scaleX,
            @JsonProperty("scaleY") Double scaleY,
            @JsonProperty("rotate") double rotate
    ) {
        this.translateX = translateX;
        this.translateY = translateY;
        this.scaleX = scaleX == null ? 1 : scaleX;
        this.scaleY = scaleY == null ? 1 : scaleY;
        this.rotate = rotate;
    }

    @JsonIgnore
    public boolean isIdentity() {
        return translateX == 0 && translateY == 0 && scaleX == 1 && scaleY == 1 && rotate == 0;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrTransform)) return false;
        IrTransform that = (IrTransform) o;
        return Double.compare(translateX, that.translateX) == 0 &&
                Double.compare(translateY, that.translateY) == 0 &&
                Double.compare(scaleX, that.scaleX) == 0 &&
                Double.compare(scaleY, that.scaleY) == 0 &&
                Double.compare(rotate, that.rotate) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(translateX, translateY, scaleX, scaleY, rotate);
    }
}
