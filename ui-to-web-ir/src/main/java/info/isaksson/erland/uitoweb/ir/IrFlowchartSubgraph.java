package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A laid-out subgraph box. A missing title falls back to the id when rendered. */
@JsonPropertyOrder({"id","title","x","y","width","height"})
public final class IrFlowchartSubgraph {
    public final String id;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String title;

    public final double x;
    public final double y;
    public final double width;
    public final double height;

    @JsonCreator
    public IrFlowchartSubgraph(
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("x") double x,
            @JsonProperty("y") double y,
            @JsonProperty("width") double width,
            @JsonProperty("height") double height
    ) {
        if (id == null) throw new IllegalArgumentException("id must not be null");
        this.id = id;
        this.title = title;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrFlowchartSubgraph)) return false;
        IrFlowchartSubgraph that = (IrFlowchartSubgraph) o;
        return id.equals(that.id) &&
                Objects.equals(title, that.title) &&
                Double.compare(x, that.x) == 0 &&
                Double.compare(y, that.y) == 0 &&
                Double.compare(width, that.width) == 0 &&
                Double.compare(height, that.height) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(id, title, x, y, width, height);
    }
}
