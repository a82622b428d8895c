package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A length: a number plus a unit. */
@JsonPropertyOrder({"value","unit"})
public final class IrDimension {

    public static final IrDimension AUTO = new IrDimension(0, IrDimensionUnit.AUTO);
    public static final IrDimension ZERO = new IrDimension(0, IrDimensionUnit.PX);

    public final double value;
    public final IrDimensionUnit unit;

    @JsonCreator
    public IrDimension(
            @JsonProperty("value") double value,
            @JsonProperty("unit") IrDimensionUnit unit
    ) {
        this.unit = unit == null ? IrDimensionUnit.PX : unit;
        this.value = this.unit == IrDimensionUnit.AUTO ? 0 : value;
    }

    public static IrDimension px(double value) {
        return new IrDimension(value, IrDimensionUnit.PX);
    }

    public static IrDimension percent(double value) {
        return new IrDimension(value, IrDimensionUnit.PERCENT);
    }

    public static IrDimension of(double value, IrDimensionUnit unit) {
        return new IrDimension(value, unit);
    }

    @JsonIgnore
    public boolean isAuto() {
        return unit == IrDimensionUnit.AUTO;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrDimension)) return false;
        IrDimension that = (IrDimension) o;
        return Double.compare(value, that.value) == 0 && unit == that.unit;
    }

    @Override public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override public String toString() {
        return isAuto() ? "auto" : value + unit.name().toLowerCase(java.util.Locale.ROOT);
    }
}
