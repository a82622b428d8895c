package info.isaksson.erland.uitoweb.svg;

import info.isaksson.erland.uitoweb.ir.IrFlowchartNode;

import java.util.Locale;

/**
 * Shape geometry for flowchart nodes.
 *
 * <p>Every outline is derived from the node box alone. Coordinates are printed with one decimal
 * regardless of the default locale.</p>
 */
final class SvgShapes {

    static final double HEXAGON_SIDE_OFFSET = 0.25;
    static final double CYLINDER_CAP = 0.15;
    static final double SUBROUTINE_INSET = 0.10;
    static final double ASYMMETRIC_SLANT = 0.15;
    static final double ROUNDED_RADIUS = 8;

    private SvgShapes() {}

    /** One or more SVG elements outlining {@code node}, each on its own line with {@code indent}. */
    static String outline(IrFlowchartNode node, SvgTheme theme, String indent) {
        double x = node.x;
        double y = node.y;
        double w = node.width;
        double h = node.height;
        double cx = x + w / 2;
        double cy = y + h / 2;
        double hw = w / 2;
        double hh = h / 2;
        String paint = paint(theme);

        switch (node.shape) {
            case ROUNDED:
                return indent + rect(x, y, w, h) + " rx=\"" + f(ROUNDED_RADIUS) + "\"" + paint + " />\n";
            case STADIUM:
                return indent + rect(x, y, w, h) + " rx=\"" + f(Math.min(w, h) / 2) + "\"" + paint + " />\n";
            case DIAMOND:
                return indent + "<path d=\"M " + p(cx, cy - hh) + " L " + p(cx + hw, cy)
                        + " L " + p(cx, cy + hh) + " L " + p(cx - hw, cy) + " Z\"" + paint + " />\n";
            case CIRCLE:
                return indent + "<circle cx=\"" + f(cx) + "\" cy=\"" + f(cy) + "\" r=\"" + f(Math.min(w, h) / 2) + "\""
                        + paint + " />\n";
            case HEXAGON: {
                double o = hw * HEXAGON_SIDE_OFFSET;
                return indent + "<path d=\"M " + p(cx - hw + o, cy - hh) + " L " + p(cx + hw - o, cy - hh)
                        + " L " + p(cx + hw, cy) + " L " + p(cx + hw - o, cy + hh)
                        + " L " + p(cx - hw + o, cy + hh) + " L " + p(cx - hw, cy) + " Z\"" + paint + " />\n";
            }
            case CYLINDER: {
                double ry = h * CYLINDER_CAP;
                String arc = "A " + f(hw) + "," + f(ry) + " 0 0,0 ";
                return indent + "<path d=\"M " + p(x, y + ry) + " L " + p(x, y + h - ry)
                        + " " + arc + p(x + w, y + h - ry) + " L " + p(x + w, y + ry)
                        + " " + arc + p(x, y + ry) + " Z\"" + paint + " />\n"
                        + indent + "<ellipse cx=\"" + f(cx) + "\" cy=\"" + f(y + ry) + "\" rx=\"" + f(hw)
                        + "\" ry=\"" + f(ry) + "\"" + paint + " />\n";
            }
            case SUBROUTINE: {
                double inset = w * SUBROUTINE_INSET;
                return indent + rect(x, y, w, h) + paint + " />\n"
                        + indent + line(x + inset, y, x + inset, y + h, theme) + "\n"
                        + indent + line(x + w - inset, y, x + w - inset, y + h, theme) + "\n";
            }
            case ASYMMETRIC: {
                double slant = w * ASYMMETRIC_SLANT;
                return indent + "<path d=\"M " + p(x + slant, y) + " L " + p(x + w, y)
                        + " L " + p(x + w - slant, y + h) + " L " + p(x, y + h) + " Z\"" + paint + " />\n";
            }
            case RECTANGLE:
            default:
                return indent + rect(x, y, w, h) + paint + " />\n";
        }
    }

    private static String rect(double x, double y, double w, double h) {
        return "<rect x=\"" + f(x) + "\" y=\"" + f(y) + "\" width=\"" + f(w) + "\" height=\"" + f(h) + "\"";
    }

    private static String line(double x1, double y1, double x2, double y2, SvgTheme theme) {
        return "<line x1=\"" + f(x1) + "\" y1=\"" + f(y1) + "\" x2=\"" + f(x2) + "\" y2=\"" + f(y2)
                + "\" stroke=\"" + theme.nodeStroke + "\" stroke-width=\"2\" />";
    }

    private static String paint(SvgTheme theme) {
        return " fill=\"" + theme.nodeFill + "\" stroke=\"" + theme.nodeStroke + "\" stroke-width=\"2\"";
    }

    static String p(double x, double y) {
        return f(x) + "," + f(y);
    }

    static String f(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
