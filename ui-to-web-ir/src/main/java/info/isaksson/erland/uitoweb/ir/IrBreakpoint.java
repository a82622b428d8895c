package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A responsive override: when all {@link #conditions} hold, the node resolves to {@link #style}.
 * Conditions are combined with {@code and}.
 */
@JsonPropertyOrder({"conditions","style"})
public final class IrBreakpoint {
    public final List<IrQueryCondition> conditions;
    public final IrStyle style;

    @JsonCreator
    public IrBreakpoint(
            @JsonProperty("conditions") List<IrQueryCondition> conditions,
            @JsonProperty("style") IrStyle style
    ) {
        this.conditions = conditions == null ? List.of() : List.copyOf(conditions);
        this.style = style == null ? IrStyle.DEFAULTS : style;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrBreakpoint)) return false;
        IrBreakpoint that = (IrBreakpoint) o;
        return conditions.equals(that.conditions) && style.equals(that.style);
    }

    @Override public int hashCode() {
        return Objects.hash(conditions, style);
    }
}
