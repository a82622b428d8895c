package info.isaksson.erland.uitoweb.svg;

import java.util.Locale;

/** Flowchart color palettes. */
public enum SvgTheme {
    DEFAULT("#5588FF", "#3366CC", "#1a1d2e", "#888888", "#f5f5f5", "#999999", "#333333"),
    DARK("#2d4a7c", "#4a7cc2", "#e0e8ff", "#a0a0a0", "#2a2a2a", "#555555", "#e0e0e0"),
    LIGHT("#e0e8ff", "#5588FF", "#1a1d2e", "#666666", "#f5f5f5", "#999999", "#333333"),
    HIGH_CONTRAST("#000000", "#FFFF00", "#FFFFFF", "#FFFFFF", "#000000", "#FFFF00", "#FFFFFF");

    public final String nodeFill;
    public final String nodeStroke;
    public final String nodeText;
    public final String edgeColor;
    public final String subgraphFill;
    public final String subgraphStroke;
    public final String subgraphTitle;

    SvgTheme(String nodeFill, String nodeStroke, String nodeText, String edgeColor,
             String subgraphFill, String subgraphStroke, String subgraphTitle) {
        this.nodeFill = nodeFill;
        this.nodeStroke = nodeStroke;
        this.nodeText = nodeText;
        this.edgeColor = edgeColor;
        this.subgraphFill = subgraphFill;
        this.subgraphStroke = subgraphStroke;
        this.subgraphTitle = subgraphTitle;
    }

    /** {@code default}, {@code dark}, {@code light} or {@code high-contrast}. */
    public String cssName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /** Parses a theme name; null and unknown names give {@link #DEFAULT}. */
    public static SvgTheme fromString(String name) {
        if (name == null) return DEFAULT;
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (SvgTheme t : values()) {
            if (t.cssName().equals(n)) return t;
        }
        return DEFAULT;
    }
}
