package info.isaksson.erland.uitoweb.svg;

/** Options for rendering a flowchart as SVG. */
public final class SvgOptions {

    /** Fixed canvas size; ignored when {@link #responsive} is set. */
    public final int width;
    public final int height;

    /**
     * When true, the canvas is sized to the laid-out content plus padding and scales with its
     * container, bounded by {@link #maxWidth}/{@link #maxHeight} (0 = unbounded).
     */
    public final boolean responsive;
    public final int maxWidth;
    public final int maxHeight;

    public final SvgTheme theme;

    /** Adds {@code data-node-id}/{@code data-shape} attributes for scripting. */
    public final boolean interactive;

    /** Adds {@code role}, {@code aria-label}, {@code <title>} and {@code <desc>}. */
    public final boolean accessibility;
    public final String title;
    public final String description;

    public SvgOptions(
            int width,
            int height,
            boolean responsive,
            int maxWidth,
            int maxHeight,
            SvgTheme theme,
            boolean interactive,
            boolean accessibility,
            String title,
            String description
    ) {
        this.width = width <= 0 ? 800 : width;
        this.height = height <= 0 ? 600 : height;
        this.responsive = responsive;
        this.maxWidth = Math.max(0, maxWidth);
        this.maxHeight = Math.max(0, maxHeight);
        this.theme = theme == null ? SvgTheme.DEFAULT : theme;
        this.interactive = interactive;
        this.accessibility = accessibility;
        this.title = title;
        this.description = description;
    }

    public static SvgOptions defaults() {
        return new SvgOptions(800, 600, false, 0, 0, SvgTheme.DEFAULT, true, true, "Flowchart", "A flowchart diagram");
    }

    public SvgOptions withSize(int width, int height) {
        return new SvgOptions(width, height, responsive, maxWidth, maxHeight, theme, interactive, accessibility, title, description);
    }

    public SvgOptions withResponsive(boolean responsive, int maxWidth, int maxHeight) {
        return new SvgOptions(width, height, responsive, maxWidth, maxHeight, theme, interactive, accessibility, title, description);
    }

    public SvgOptions withTheme(SvgTheme theme) {
        return new SvgOptions(width, height, responsive, maxWidth, maxHeight, theme, interactive, accessibility, title, description);
    }

    public SvgOptions withInteractive(boolean interactive) {
        return new SvgOptions(width, height, responsive, maxWidth, maxHeight, theme, interactive, accessibility, title, description);
    }

    public SvgOptions withAccessibility(boolean accessibility) {
        return new SvgOptions(width, height, responsive, maxWidth, maxHeight, theme, interactive, accessibility, title, description);
    }

    public SvgOptions withTitle(String title, String description) {
        return new SvgOptions(width, height, responsive, maxWidth, maxHeight, theme, interactive, accessibility, title, description);
    }

    @Override
    public String toString() {
        return "SvgOptions{" +
                "width=" + width +
                ", height=" + height +
                ", responsive=" + responsive +
                ", maxWidth=" + maxWidth +
                ", maxHeight=" + maxHeight +
                ", theme=" + theme +
                ", interactive=" + interactive +
                ", accessibility=" + accessibility +
                ", title='" + title + '\'' +
                ", description='" + description + '\'' +
                '}';
    }
}
