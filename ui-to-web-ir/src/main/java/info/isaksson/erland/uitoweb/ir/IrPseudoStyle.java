package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** The complete resolved style a node takes on while in {@link #state}. */
@JsonPropertyOrder({"state","style"})
public final class IrPseudoStyle {
    public final IrPseudoState state;
    public final IrStyle style;

    @JsonCreator
    public IrPseudoStyle(
            @JsonProperty("state") IrPseudoState state,
            @JsonProperty("style") IrStyle style
    ) {
        if (state == null) throw new IllegalArgumentException("state must not be null");
        this.state = state;
        this.style = style == null ? IrStyle.DEFAULTS : style;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrPseudoStyle)) return false;
        IrPseudoStyle that = (IrPseudoStyle) o;
        return state == that.state && style.equals(that.style);
    }

    @Override public int hashCode() {
        return Objects.hash(state, style);
    }
}
