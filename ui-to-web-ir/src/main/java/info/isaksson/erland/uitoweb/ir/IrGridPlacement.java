package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Zero-based grid line placement; negative values mean unset. */
@JsonPropertyOrder({"start","end"})
public final class IrGridPlacement {

    public static final IrGridPlacement AUTO = new IrGridPlacement(-1, -1);

    public final int start;
    public final int end;

    @JsonCreator
    public IrGridPlacement(
            @JsonProperty("start") Integer start,
            @JsonProperty("end") Integer end
    ) {
        this.start = start == null ? -1 : start;
        this.end = end == null ? -1 : end;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrGridPlacement)) return false;
        IrGridPlacement that = (IrGridPlacement) o;
        return start == that.start && end == that.end;
    }

    @Override public int hashCode() {
        return 31 * start + end;
    }
}
