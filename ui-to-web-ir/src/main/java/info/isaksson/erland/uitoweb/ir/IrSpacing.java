package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Four-sided box spacing (margin or padding). Missing sides are zero. */
@JsonPropertyOrder({"top","right","bottom","left"})
public final class IrSpacing {

    public static final IrSpacing ZERO = new IrSpacing(null, null, null, null);

    public final IrDimension top;
    public final IrDimension right;
    public final IrDimension bottom;
    public final IrDimension left;

    @JsonCreator
    public IrSpacing(
            @JsonProperty("top") IrDimension top,
            @JsonProperty("right") IrDimension right,
            @JsonProperty("bottom") IrDimension bottom,
            @JsonProperty("left") IrDimension left
    ) {
        this.top = top == null ? IrDimension.ZERO : top;
        this.right = right == null ? IrDimension.ZERO : right;
        this.bottom = bottom == null ? IrDimension.ZERO : bottom;
        this.left = left == null ? IrDimension.ZERO : left;
    }

    public static IrSpacing all(IrDimension value) {
        return new IrSpacing(value, value, value, value);
    }

    public static IrSpacing px(double top, double right, double bottom, double left) {
        return new IrSpacing(IrDimension.px(top), IrDimension.px(right), IrDimension.px(bottom), IrDimension.px(left));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrSpacing)) return false;
        IrSpacing that = (IrSpacing) o;
        return top.equals(that.top) && right.equals(that.right) && bottom.equals(that.bottom) && left.equals(that.left);
    }

    @Override public int hashCode() {
        return Objects.hash(top, right, bottom, left);
    }
}
