package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A gradient color stop. {@code position} is a fraction in [0, 1]. */
@JsonPropertyOrder({"position","color"})
public final class IrGradientStop {
    public final double position;
    public final IrColor color;

    @JsonCreator
    public IrGradientStop(
            @JsonProperty("position") double position,
            @JsonProperty("color") IrColor color
    ) {
        this.position = position;
        this.color = color == null ? IrColor.TRANSPARENT : color;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrGradientStop)) return false;
        IrGradientStop that = (IrGradientStop) o;
        return Double.compare(position, that.position) == 0 && color.equals(that.color);
    }

    @Override public int hashCode() {
        return Objects.hash(position, color);
    }
}
