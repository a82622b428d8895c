package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A color value.
 *
 * <p>Which fields are meaningful depends on {@link #kind}: channels for {@code SOLID}, {@link #varId}
 * for {@code VAR_REF}, {@link #varName} for {@code NAMED_VAR} and the gradient fields for
 * {@code GRADIENT}. Channels are 0..255; gradient centers are fractions of the box.</p>
 */
@JsonPropertyOrder({"kind","r","g","b","a","varId","varName","gradientKind","angle","centerX","centerY","stops"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class IrColor {

    public static final IrColor TRANSPARENT = new IrColor(IrColorKind.TRANSPARENT, 0, 0, 0, 0, 0, null, null, 0, 0.5, 0.5, null);
    public static final IrColor INHERIT = new IrColor(IrColorKind.INHERIT, 0, 0, 0, 0, 0, null, null, 0, 0.5, 0.5, null);
    public static final IrColor CURRENT_COLOR = new IrColor(IrColorKind.CURRENT_COLOR, 0, 0, 0, 0, 0, null, null, 0, 0.5, 0.5, null);

    public final IrColorKind kind;

    public final int r;
    public final int g;
    public final int b;
    public final int a;

    public final int varId;
    public final String varName;

    public final IrGradientKind gradientKind;
    public final double angle;
    public final double centerX;
    public final double centerY;
    public final List<IrGradientStop> stops;

    @JsonCreator
    public IrColor(
            @JsonProperty("kind") IrColorKind kind,
            @JsonProperty("r") int r,
            @JsonProperty("g") int g,
            @JsonProperty("b") int b,
            @JsonProperty("a") Integer a,
            @JsonProperty("varId") int varId,
            @JsonProperty("varName") String varName,
            @JsonProperty("gradientKind") IrGradientKind gradientKind,
            @JsonProperty("angle") double angle,
            @JsonProperty("centerX") Double centerX,
            @JsonProperty("centerY") Double centerY,
            @JsonProperty("stops") List<IrGradientStop> stops
    ) {
        this.kind = kind == null ? IrColorKind.TRANSPARENT : kind;
        this.r = clamp(r);
        this.g = clamp(g);
        this.b = clamp(b);
        this.a = a == null ? 255 : clamp(a);
        this.varId = varId;
        this.varName = varName;
        this.gradientKind = gradientKind == null ? IrGradientKind.LINEAR : gradientKind;
        this.angle = angle;
        this.centerX = centerX == null ? 0.5 : centerX;
        this.centerY = centerY == null ? 0.5 : centerY;
        this.stops = stops == null ? List.of() : List.copyOf(stops);
    }

    public static IrColor rgb(int r, int g, int b) {
        return rgba(r, g, b, 255);
    }

    public static IrColor rgba(int r, int g, int b, int a) {
        return new IrColor(IrColorKind.SOLID, r, g, b, a, 0, null, null, 0, null, null, null);
    }

    /** Reference to a numbered theme color ({@code var(--color-N)}). */
    public static IrColor themeVar(int varId) {
        return new IrColor(IrColorKind.VAR_REF, 0, 0, 0, null, varId, null, null, 0, null, null, null);
    }

    /** Reference to a named custom property ({@code var(--name)}). */
    public static IrColor namedVar(String name) {
        return new IrColor(IrColorKind.NAMED_VAR, 0, 0, 0, null, 0, name, null, 0, null, null, null);
    }

    public static IrColor linearGradient(double angle, List<IrGradientStop> stops) {
        return new IrColor(IrColorKind.GRADIENT, 0, 0, 0, null, 0, null, IrGradientKind.LINEAR, angle, null, null, stops);
    }

    public static IrColor radialGradient(double centerX, double centerY, List<IrGradientStop> stops) {
        return new IrColor(IrColorKind.GRADIENT, 0, 0, 0, null, 0, null, IrGradientKind.RADIAL, 0, centerX, centerY, stops);
    }

    public static IrColor conicGradient(double centerX, double centerY, List<IrGradientStop> stops) {
        return new IrColor(IrColorKind.GRADIENT, 0, 0, 0, null, 0, null, IrGradientKind.CONIC, 0, centerX, centerY, stops);
    }

    private static int clamp(int channel) {
        return Math.max(0, Math.min(255, channel));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrColor)) return false;
        IrColor that = (IrColor) o;
        return kind == that.kind &&
                r == that.r && g == that.g && b == that.b && a == that.a &&
                varId == that.varId &&
                Objects.equals(varName, that.varName) &&
                gradientKind == that.gradientKind &&
                Double.compare(angle, that.angle) == 0 &&
                Double.compare(centerX, that.centerX) == 0 &&
                Double.compare(centerY, that.centerY) == 0 &&
                Objects.equals(stops, that.stops);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, r, g, b, a, varId, varName, gradientKind, angle, centerX, centerY, stops);
    }
}
