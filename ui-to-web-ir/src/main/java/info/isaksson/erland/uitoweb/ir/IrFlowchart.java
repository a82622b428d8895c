package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Flowchart geometry as produced by the external layout pass.
 *
 * <p>When {@link #layoutComputed} is false the coordinates are meaningless and renderers must refuse
 * the input. {@link #contentWidth}/{@link #contentHeight} are the aggregate bounds of all laid-out
 * elements.</p>
 */
@JsonPropertyOrder({"layoutComputed","contentWidth","contentHeight","subgraphs","edges","nodes"})
public final class IrFlowchart {
    public final boolean layoutComputed;
    public final double contentWidth;
    public final double contentHeight;

    public final List<IrFlowchartSubgraph> subgraphs;
    public final List<IrFlowchartEdge> edges;
    public final List<IrFlowchartNode> nodes;

    @JsonCreator
    public IrFlowchart(
            @JsonProperty("layoutComputed") boolean layoutComputed,
            @JsonProperty("contentWidth") double contentWidth,
            @JsonProperty("contentHeight") double contentHeight,
            @JsonProperty("subgraphs") List<IrFlowchartSubgraph> subgraphs,
            @JsonProperty("edges") List<IrFlowchartEdge> edges,
            @JsonProperty("nodes") List<IrFlowchartNode> nodes
    ) {
        this.layoutComputed = layoutComputed;
        this.contentWidth = contentWidth;
        this.contentHeight = contentHeight;
        this.subgraphs = subgraphs == null ? List.of() : List.copyOf(subgraphs);
        this.edges = edges == null ? List.of() : List.copyOf(edges);
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrFlowchart)) return false;
        IrFlowchart that = (IrFlowchart) o;
        return layoutComputed == that.layoutComputed &&
                Double.compare(contentWidth, that.contentWidth) == 0 &&
                Double.compare(contentHeight, that.contentHeight) == 0 &&
                subgraphs.equals(that.subgraphs) &&
                edges.equals(that.edges) &&
                nodes.equals(that.nodes);
    }

    @Override public int hashCode() {
        return Objects.hash(layoutComputed, contentWidth, contentHeight, subgraphs, edges, nodes);
    }
}
