package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Grid template for one axis.
 *
 * <p>With {@link IrGridRepeatMode#NONE} the explicit {@link #tracks} are used. Otherwise the template
 * is a single {@code repeat(...)} of {@link #repeatTrack}, or of {@code minmax(min, max)} when both
 * bounds are present.</p>
 */
@JsonPropertyOrder({"tracks","repeatMode","repeatCount","repeatTrack","minTrack","maxTrack"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class IrGridTemplate {

    public static final IrGridTemplate NONE = new IrGridTemplate(null, null, 0, null, null, null);

    public final List<IrGridTrack> tracks;
    public final IrGridRepeatMode repeatMode;
    public final int repeatCount;
    public final IrGridTrack repeatTrack;
    public final IrGridTrack minTrack;
    public final IrGridTrack maxTrack;

    @JsonCreator
    public IrGridTemplate(
            @JsonProperty("tracks") List<IrGridTrack> tracks,
            @JsonProperty("repeatMode") IrGridRepeatMode repeatMode,
            @JsonProperty("repeatCount") int repeatCount,
            @JsonProperty("repeatTrack") IrGridTrack repeatTrack,
            @JsonProperty("minTrack") IrGridTrack minTrack,
            @JsonProperty("maxTrack") IrGridTrack maxTrack
    ) {
        this.tracks = tracks == null ? List.of() : List.copyOf(tracks);
        this.repeatMode = repeatMode == null ? IrGridRepeatMode.NONE : repeatMode;
        this.repeatCount = repeatCount;
        this.repeatTrack = repeatTrack;
        this.minTrack = minTrack;
        this.maxTrack = maxTrack;
    }

    public static IrGridTemplate tracks(List<IrGridTrack> tracks) {
        return new IrGridTemplate(tracks, IrGridRepeatMode.NONE, 0, null, null, null);
    }

    public static IrGridTemplate repeat(IrGridRepeatMode mode, int count, IrGridTrack track) {
        return new IrGridTemplate(null, mode, count, track, null, null);
    }

    public static IrGridTemplate repeatMinMax(IrGridRepeatMode mode, int count, IrGridTrack min, IrGridTrack max) {
        return new IrGridTemplate(null, mode, count, null, min, max);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrGridTemplate)) return false;
        IrGridTemplate that = (IrGridTemplate) o;
        return repeatCount == that.repeatCount &&
                Objects.equals(tracks, that.tracks) &&
                repeatMode == that.repeatMode &&
                Objects.equals(repeatTrack, that.repeatTrack) &&
                Objects.equals(minTrack, that.minTrack) &&
                Objects.equals(maxTrack, that.maxTrack);
    }

    @Override public int hashCode() {
        return Objects.hash(tracks, repeatMode, repeatCount, repeatTrack, minTrack, maxTrack);
    }
}
