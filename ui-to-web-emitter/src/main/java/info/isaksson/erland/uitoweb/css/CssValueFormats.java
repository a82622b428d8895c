package info.isaksson.erland.uitoweb.css;

import info.isaksson.erland.uitoweb.ir.IrAlignment;
import info.isaksson.erland.uitoweb.ir.IrAnimation;
import info.isaksson.erland.uitoweb.ir.IrColor;
import info.isaksson.erland.uitoweb.ir.IrDimension;
import info.isaksson.erland.uitoweb.ir.IrDimensionUnit;
import info.isaksson.erland.uitoweb.ir.IrDisplay;
import info.isaksson.erland.uitoweb.ir.IrEasing;
import info.isaksson.erland.uitoweb.ir.IrFilter;
import info.isaksson.erland.uitoweb.ir.IrGradientStop;
import info.isaksson.erland.uitoweb.ir.IrGridPlacement;
import info.isaksson.erland.uitoweb.ir.IrGridRepeatMode;
import info.isaksson.erland.uitoweb.ir.IrGridTemplate;
import info.isaksson.erland.uitoweb.ir.IrGridTrack;
import info.isaksson.erland.uitoweb.ir.IrShadow;
import info.isaksson.erland.uitoweb.ir.IrSpacing;
import info.isaksson.erland.uitoweb.ir.IrTextDecoration;
import info.isaksson.erland.uitoweb.ir.IrTransform;
import info.isaksson.erland.uitoweb.ir.IrTransition;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Value formatters for CSS declarations.
 *
 * <p>All output is locale-independent. Numbers keep at most two decimals with trailing zeros
 * stripped, so {@code 16.0} prints as {@code 16} and {@code 50.5} as {@code 50.5}. Formatters
 * accept {@code null} and return {@code null} for "no value".</p>
 */
public final class CssValueFormats {

    private CssValueFormats() {}

    // ---------------------------------------------------------------------
    // numbers and dimensions
    // ---------------------------------------------------------------------

    public static String number(double v) {
        if (v == 0 || Double.isNaN(v) || Double.isInfinite(v)) return "0";
        BigDecimal bd = BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        if (bd.signum() == 0) return "0";
        return bd.toPlainString();
    }

    public static String pixels(double v) {
        String n = number(v);
        return "0".equals(n) ? "0" : n + "px";
    }

    public static String seconds(double v) {
        return number(v) + "s";
    }

    public static String degrees(double v) {
        return number(v) + "deg";
    }

    public static String dimension(IrDimension d) {
        if (d == null) return null;
        if (d.unit == IrDimensionUnit.AUTO) return "auto";
        String n = number(d.value);
        if ("0".equals(n)) return d.unit == IrDimensionUnit.FR ? "0fr" : "0";
        return n + unitSuffix(d.unit);
    }

    /** Like {@link #dimension(IrDimension)}, but automatic sizing prints {@code none}. */
    public static String maxDimension(IrDimension d) {
        if (d == null) return null;
        return d.isAuto() ? "none" : dimension(d);
    }

    public static String fontSize(IrDimension d) {
        if (d == null) return null;
        return d.isAuto() ? "medium" : dimension(d);
    }

    static String unitSuffix(IrDimensionUnit unit) {
        switch (unit) {
            case PX: return "px";
            case PERCENT: return "%";
            case VW: return "vw";
            case VH: return "vh";
            case VMIN: return "vmin";
            case VMAX: return "vmax";
            case REM: return "rem";
            case EM: return "em";
            case FR: return "fr";
            default: return "";
        }
    }

    /** Box shorthand with one to four values. */
    public static String spacing(IrSpacing s) {
        if (s == null) return null;
        String t = dimension(s.top);
        String r = dimension(s.right);
        String b = dimension(s.bottom);
        String l = dimension(s.left);
        if (t.equals(r) && t.equals(b) && t.equals(l)) return t;
        if (t.equals(b) && r.equals(l)) return t + " " + r;
        if (r.equals(l)) return t + " " + r + " " + b;
        return t + " " + r + " " + b + " " + l;
    }

    // ---------------------------------------------------------------------
    // colors
    // ---------------------------------------------------------------------

    public static String color(IrColor c) {
        return color(c, true);
    }

    private static String color(IrColor c, boolean allowGradient) {
        if (c == null) return null;
        switch (c.kind) {
            case TRANSPARENT:
                return "transparent";
            case INHERIT:
                return "inherit";
            case CURRENT_COLOR:
                return "currentColor";
            case SOLID:
                if (c.a >= 255) return String.format(Locale.ROOT, "#%02x%02x%02x", c.r, c.g, c.b);
                return "rgba(" + c.r + ", " + c.g + ", " + c.b + ", " + number(c.a / 255.0) + ")";
            case VAR_REF:
                return "var(--color-" + c.varId + ")";
            case NAMED_VAR:
                return namedVar(c.varName);
            case GRADIENT:
                return allowGradient ? gradient(c) : "transparent";
            default:
                return "transparent";
        }
    }

    private static String namedVar(String name) {
        if (name == null || name.isBlank()) return "transparent";
        String n = name.trim();
        if (n.startsWith("var(")) return n;
        return n.startsWith("--") ? "var(" + n + ")" : "var(--" + n + ")";
    }

    private static String gradient(IrColor c) {
        if (c.stops.size() < 2) return "transparent";

        StringBuilder sb = new StringBuilder();
        switch (c.gradientKind) {
            case RADIAL:
                sb.append("radial-gradient(circle at ")
                        .append(number(c.centerX * 100)).append("% ")
                        .append(number(c.centerY * 100)).append('%');
                break;
            case CONIC:
                sb.append("conic-gradient(from 0deg at ")
                        .append(number(c.centerX * 100)).append("% ")
                        .append(number(c.centerY * 100)).append('%');
                break;
            default:
                sb.append("linear-gradient(").append(degrees(c.angle));
                break;
        }
        for (IrGradientStop stop : c.stops) {
            sb.append(", ").append(color(stop.color, false))
                    .append(' ').append(number(stop.position * 100)).append('%');
        }
        return sb.append(')').toString();
    }

    // ---------------------------------------------------------------------
    // keywords
    // ---------------------------------------------------------------------

    /** {@code INLINE_BLOCK} becomes {@code inline-block}. */
    public static String keyword(Enum<?> e) {
        if (e == null) return null;
        return e.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /** Automatic display has no CSS form. */
    public static String display(IrDisplay d) {
        if (d == null || d == IrDisplay.AUTO) return null;
        return keyword(d);
    }

    public static String alignment(IrAlignment a) {
        if (a == null) return null;
        switch (a) {
            case START: return "flex-start";
            case END: return "flex-end";
            default: return keyword(a);
        }
    }

    public static String easing(IrEasing e) {
        if (e == null) return null;
        switch (e) {
            case EASE_IN_QUAD: return "cubic-bezier(0.55, 0.085, 0.68, 0.53)";
            case EASE_OUT_QUAD: return "cubic-bezier(0.25, 0.46, 0.45, 0.94)";
            case EASE_IN_OUT_QUAD: return "cubic-bezier(0.455, 0.03, 0.515, 0.955)";
            case EASE_IN_CUBIC: return "cubic-bezier(0.55, 0.055, 0.675, 0.19)";
            case EASE_OUT_CUBIC: return "cubic-bezier(0.215, 0.61, 0.355, 1)";
            case EASE_IN_OUT_CUBIC: return "cubic-bezier(0.645, 0.045, 0.355, 1)";
            case EASE_IN_BOUNCE: return "cubic-bezier(0.6, -0.28, 0.735, 0.045)";
            case EASE_OUT_BOUNCE: return "cubic-bezier(0.68, -0.55, 0.265, 1.55)";
            default: return keyword(e);
        }
    }

    public static String fontWeight(int weight) {
        if (weight <= 0 || weight == 400) return "normal";
        if (weight == 700) return "bold";
        return Integer.toString(weight);
    }

    public static String fontFamily(String family) {
        if (family == null || family.isBlank()) return "inherit";
        return family.trim();
    }

    /** Unitless multiplier; anything that prints as zero or less means {@code normal}. */
    public static String lineHeight(double v) {
        String n = number(v);
        return v <= 0 || "0".equals(n) ? "normal" : n;
    }

    /** Letter and word spacing in px; anything that prints as zero means {@code normal}. */
    public static String textSpacing(double v) {
        String px = pixels(v);
        return "0".equals(px) ? "normal" : px;
    }

    public static String aspectRatio(double v) {
        String n = number(v);
        return v <= 0 || "0".equals(n) ? "auto" : n;
    }

    public static String zIndex(Integer z) {
        return z == null ? "auto" : Integer.toString(z);
    }

    public static String visibility(boolean visible) {
        return visible ? "visible" : "hidden";
    }

    public static String flexWrap(boolean wrap) {
        return wrap ? "wrap" : "nowrap";
    }

    public static String textDecoration(List<IrTextDecoration> decorations) {
        if (decorations == null || decorations.isEmpty()) return "none";
        EnumSet<IrTextDecoration> set = EnumSet.noneOf(IrTextDecoration.class);
        for (IrTextDecoration d : decorations) {
            if (d != null) set.add(d);
        }
        if (set.isEmpty()) return "none";
        List<String> parts = new ArrayList<>();
        for (IrTextDecoration d : set) parts.add(keyword(d));
        return String.join(" ", parts);
    }

    // ---------------------------------------------------------------------
    // composite values
    // ---------------------------------------------------------------------

    public static String transform(IrTransform t) {
        if (t == null) return null;
        if (t.isIdentity()) return "none";
        List<String> parts = new ArrayList<>();
        if (t.translateX != 0 || t.translateY != 0) {
            parts.add("translate(" + pixels(t.translateX) + ", " + pixels(t.translateY) + ")");
        }
        if (t.scaleX != 1 || t.scaleY != 1) {
            parts.add("scale(" + number(t.scaleX) + ", " + number(t.scaleY) + ")");
        }
        if (t.rotate != 0) {
            parts.add("rotate(" + degrees(t.rotate) + ")");
        }
        return parts.isEmpty() ? "none" : String.join(" ", parts);
    }

    public static String boxShadow(IrShadow s) {
        if (s == null) return null;
        if (!s.enabled) return "none";
        return (s.inset ? "inset " : "")
                + pixels(s.offsetX) + " " + pixels(s.offsetY) + " "
                + pixels(s.blur) + " " + pixels(s.spread) + " "
                + color(s.color);
    }

    /** Text shadows have neither spread nor inset. */
    public static String textShadow(IrShadow s) {
        if (s == null) return null;
        if (!s.enabled) return "none";
        return pixels(s.offsetX) + " " + pixels(s.offsetY) + " " + pixels(s.blur) + " " + color(s.color);
    }

    public static String filters(List<IrFilter> filters) {
        if (filters == null || filters.isEmpty()) return "none";
        List<String> parts = new ArrayList<>();
        for (IrFilter f : filters) {
            switch (f.kind) {
                case BLUR:
                    parts.add("blur(" + pixels(f.value) + ")");
                    break;
                case HUE_ROTATE:
                    parts.add("hue-rotate(" + degrees(f.value) + ")");
                    break;
                default:
                    parts.add(keyword(f.kind) + "(" + number(f.value) + ")");
                    break;
            }
        }
        return String.join(" ", parts);
    }

    public static String gridTrack(IrGridTrack t) {
        if (t == null) return "auto";
        switch (t.kind) {
            case PX: return pixels(t.value);
            case PERCENT: return "0".equals(number(t.value)) ? "0" : number(t.value) + "%";
            case FR: return number(t.value) + "fr";
            case MIN_CONTENT: return "min-content";
            case MAX_CONTENT: return "max-content";
            default: return "auto";
        }
    }

    public static String gridTemplate(IrGridTemplate g) {
        if (g == null) return null;
        if (g.repeatMode == IrGridRepeatMode.NONE) {
            if (g.tracks.isEmpty()) return "none";
            List<String> parts = new ArrayList<>();
            for (IrGridTrack t : g.tracks) parts.add(gridTrack(t));
            return String.join(" ", parts);
        }

        String count;
        switch (g.repeatMode) {
            case AUTO_FIT: count = "auto-fit"; break;
            case AUTO_FILL: count = "auto-fill"; break;
            default: count = Integer.toString(Math.max(1, g.repeatCount)); break;
        }
        String track = g.minTrack != null && g.maxTrack != null
                ? "minmax(" + gridTrack(g.minTrack) + ", " + gridTrack(g.maxTrack) + ")"
                : gridTrack(g.repeatTrack);
        return "repeat(" + count + ", " + track + ")";
    }

    /** Zero-based lines become one-based CSS lines. */
    public static String gridPlacement(IrGridPlacement p) {
        if (p == null) return null;
        if (p.start < 0) return "auto";
        if (p.end < 0) return Integer.toString(p.start + 1);
        return (p.start + 1) + " / " + (p.end + 1);
    }

    public static String animations(List<IrAnimation> animations) {
        if (animations == null || animations.isEmpty()) return "none";
        List<String> parts = new ArrayList<>();
        for (IrAnimation a : animations) {
            StringBuilder sb = new StringBuilder()
                    .append(a.name).append(' ')
                    .append(seconds(a.duration)).append(' ')
                    .append(easing(a.easing)).append(' ')
                    .append(seconds(a.delay));
            if (a.isInfinite()) sb.append(" infinite");
            else if (a.iterationCount != 1) sb.append(' ').append(a.iterationCount);
            if (a.alternate) sb.append(" alternate");
            parts.add(sb.toString());
        }
        return String.join(", ", parts);
    }

    public static String transitions(List<IrTransition> transitions) {
        if (transitions == null || transitions.isEmpty()) return "none";
        List<String> parts = new ArrayList<>();
        for (IrTransition t : transitions) {
            parts.add(keyword(t.property) + " " + seconds(t.duration) + " "
                    + easing(t.easing) + " " + seconds(t.delay));
        }
        return String.join(", ", parts);
    }
}
