package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A laid-out flowchart node: box in px plus label and shape. */
@JsonPropertyOrder({"id","shape","label","x","y","width","height"})
public final class IrFlowchartNode {
    public final String id;
    public final IrFlowchartShape shape;
    public final String label;
    public final double x;
    public final double y;
    public final double width;
    public final double height;

    @JsonCreator
    public IrFlowchartNode(
            @JsonProperty("id") String id,
            @JsonProperty("shape") IrFlowchartShape shape,
            @JsonProperty("label") String label,
            @JsonProperty("x") double x,
            @JsonProperty("y") double y,
            @JsonProperty("width") double width,
            @JsonProperty("height") double height
    ) {
        if (id == null) throw new IllegalArgumentException("id must not be null");
        this.id = id;
        this.shape = shape == null ? IrFlowchartShape.RECTANGLE : shape;
        this.label = label == null ? "" : label;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrFlowchartNode)) return false;
        IrFlowchartNode that = (IrFlowchartNode) o;
        return id.equals(that.id) &&
                shape == that.shape &&
                label.equals(that.label) &&
                Double.compare(x, that.x) == 0 &&
                Double.compare(y, that.y) == 0 &&
                Double.compare(width, that.width) == 0 &&
                Double.compare(height, that.height) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(id, shape, label, x, y, width, height);
    }
}
