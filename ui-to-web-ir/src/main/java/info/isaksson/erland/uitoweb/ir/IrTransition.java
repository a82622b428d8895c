package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"property","duration","delay","easing"})
public final class IrTransition {
    public final IrAnimatedProperty property;
    public final double duration;
    public final double delay;
    public final IrEasing easing;

    @JsonCreator
    public IrTransition(
            @JsonProperty("property") IrAnimatedProperty property,
            @JsonProperty("duration") double duration,
            @JsonProperty("delay") double delay,
            @JsonProperty("easing") IrEasing easing
    ) {
        this.property = property == null ? IrAnimatedProperty.ALL : property;
        this.duration = duration;
        this.delay = delay;
        this.easing = easing == null ? IrEasing.EASE : easing;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrTransition)) return false;
        IrTransition that = (IrTransition) o;
        return property == that.property &&
                Double.compare(duration, that.duration) == 0 &&
                Double.compare(delay, that.delay) == 0 &&
                easing == that.easing;
    }

    @Override public int hashCode() {
        return Objects.hash(property, duration, delay, easing);
    }
}
