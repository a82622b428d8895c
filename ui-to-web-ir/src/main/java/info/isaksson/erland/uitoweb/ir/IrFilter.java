package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One CSS filter function. Blur is in px, hue rotation in degrees, all others are amounts
 * where 1 is the identity.
 */
@JsonPropertyOrder({"kind","value"})
public final class IrFilter {
    public final IrFilterKind kind;
    public final double value;

    @JsonCreator
    public IrFilter(
            @JsonProperty("kind") IrFilterKind kind,
            @JsonProperty("value") double value
    ) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        this.kind = kind;
        this.value = value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrFilter)) return false;
        IrFilter that = (IrFilter) o;
        return kind == that.kind && Double.compare(value, that.value) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(kind, value);
    }
}
