package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A single media feature test; {@code value} is in px. */
@JsonPropertyOrder({"kind","value"})
public final class IrQueryCondition {
    public final IrQueryKind kind;
    public final double value;

    @JsonCreator
    public IrQueryCondition(
            @JsonProperty("kind") IrQueryKind kind,
            @JsonProperty("value") double value
    ) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        this.kind = kind;
        this.value = value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrQueryCondition)) return false;
        IrQueryCondition that = (IrQueryCondition) o;
        return kind == that.kind && Double.compare(value, that.value) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(kind, value);
    }
}
