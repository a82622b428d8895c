package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A routed edge. {@link #points} is the precomputed poly-line, source end first. */
@JsonPropertyOrder({"from","to","type","label","points"})
public final class IrFlowchartEdge {
    public final String from;
    public final String to;
    public final IrFlowchartEdgeType type;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String label;

    public final List<IrPoint> points;

    @JsonCreator
    public IrFlowchartEdge(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("type") IrFlowchartEdgeType type,
            @JsonProperty("label") String label,
            @JsonProperty("points") List<IrPoint> points
    ) {
        this.from = from;
        this.to = to;
        this.type = type == null ? IrFlowchartEdgeType.ARROW : type;
        this.label = label;
        this.points = points == null ? List.of() : List.copyOf(points);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrFlowchartEdge)) return false;
        IrFlowchartEdge that = (IrFlowchartEdge) o;
        return Objects.equals(from, that.from) &&
                Objects.equals(to, that.to) &&
                type == that.type &&
                Objects.equals(label, that.label) &&
                points.equals(that.points);
    }

    @Override public int hashCode() {
        return Objects.hash(from, to, type, label, points);
    }
}
