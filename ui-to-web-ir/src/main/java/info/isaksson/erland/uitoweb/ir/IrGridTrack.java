package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** One grid track size. {@code value} is ignored for the keyword kinds. */
@JsonPropertyOrder({"kind","value"})
public final class IrGridTrack {
    public final IrGridTrackKind kind;
    public final double value;

    @JsonCreator
    public IrGridTrack(
            @JsonProperty("kind") IrGridTrackKind kind,
            @JsonProperty("value") double value
    ) {
        this.kind = kind == null ? IrGridTrackKind.AUTO : kind;
        this.value = value;
    }

    public static IrGridTrack px(double value) {
        return new IrGridTrack(IrGridTrackKind.PX, value);
    }

    public static IrGridTrack fr(double value) {
        return new IrGridTrack(IrGridTrackKind.FR, value);
    }

    public static IrGridTrack of(IrGridTrackKind kind) {
        return new IrGridTrack(kind, 0);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrGridTrack)) return false;
        IrGridTrack that = (IrGridTrack) o;
        return kind == that.kind && Double.compare(value, that.value) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(kind, value);
    }
}
