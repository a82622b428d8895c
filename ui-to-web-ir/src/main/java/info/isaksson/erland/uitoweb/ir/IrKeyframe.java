package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A keyframe at {@code offset} (0..1). Unset properties are null. */
@JsonPropertyOrder({"offset","opacity","transform","backgroundColor"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrKeyframe {
    public final double offset;
    public final Double opacity;
    public final IrTransform transform;
    public final IrColor backgroundColor;

    @JsonCreator
    public IrKeyframe(
            @JsonProperty("offset") double offset,
            @JsonProperty("opacity") Double opacity,
            @JsonProperty("transform") IrTransform transform,
            @JsonProperty("backgroundColor") IrColor backgroundColor
    ) {
        this.offset = offset;
        this.opacity = opacity;
        this.transform = transform;
        this.backgroundColor = backgroundColor;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrKeyframe)) return false;
        IrKeyframe that = (IrKeyframe) o;
        return Double.compare(offset, that.offset) == 0 &&
                Objects.equals(opacity, that.opacity) &&
                Objects.equals(transform, that.transform) &&
                Objects.equals(backgroundColor, that.backgroundColor);
    }

    @Override public int hashCode() {
        return Objects.hash(offset, opacity, transform, backgroundColor);
    }
}
