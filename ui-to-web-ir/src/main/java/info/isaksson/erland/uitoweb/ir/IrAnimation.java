package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A named keyframe animation attached to a node.
 *
 * <p>Durations and delays are in seconds. A negative {@link #iterationCount} loops forever.</p>
 */
@JsonPropertyOrder({"name","duration","delay","easing","iterationCount","alternate","keyframes"})
public final class IrAnimation {
    public final String name;
    public final double duration;
    public final double delay;
    public final IrEasing easing;
    public final int iterationCount;
    public final boolean alternate;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrKeyframe> keyframes;

    @JsonCreator
    public IrAnimation(
            @JsonProperty("name") String name,
            @JsonProperty("duration") double duration,
            @JsonProperty("delay") double delay,
            @JsonProperty("easing") IrEasing easing,
            @JsonProperty("iterationCount") Integer iterationCount,
            @JsonProperty("alternate") boolean alternate,
            @JsonProperty("keyframes") List<IrKeyframe> keyframes
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        this.name = name.trim();
        this.duration = duration;
        this.delay = delay;
        this.easing = easing == null ? IrEasing.EASE : easing;
        this.iterationCount = iterationCount == null ? 1 : iterationCount;
        this.alternate = alternate;
        this.keyframes = keyframes == null ? List.of() : List.copyOf(keyframes);
    }

    @JsonIgnore
    public boolean isInfinite() {
        return iterationCount < 0;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrAnimation)) return false;
        IrAnimation that = (IrAnimation) o;
        return name.equals(that.name) &&
                Double.compare(duration, that.duration) == 0 &&
                Double.compare(delay, that.delay) == 0 &&
                easing == that.easing &&
                iterationCount == that.iterationCount &&
                alternate == that.alternate &&
                keyframes.equals(that.keyframes);
    }

    @Override public int hashCode() {
        return Objects.hash(name, duration, delay, easing, iterationCount, alternate, keyframes);
    }
}
