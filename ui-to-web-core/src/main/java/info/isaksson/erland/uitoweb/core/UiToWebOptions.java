package info.isaksson.erland.uitoweb.core;

import info.isaksson.erland.uitoweb.css.CssOptions;
import info.isaksson.erland.uitoweb.html.HtmlOptions;
import info.isaksson.erland.uitoweb.selector.ClassNameDeriver;
import info.isaksson.erland.uitoweb.svg.SvgOptions;
import info.isaksson.erland.uitoweb.svg.SvgTheme;

/**
 * Core (server-friendly) options for one web generation pass.
 *
 * <p>Groups the CSS, HTML and SVG settings in one structured form; the generators themselves take
 * the immutable option classes built by {@link #cssOptions()}, {@link #htmlOptions()} and
 * {@link #svgOptions()}.</p>
 */
public final class UiToWebOptions {

    // document
    public String title = "Web Application";
    public String lang = "en";
    public String htmlFileName = "index.html";
    public String stylesheetFileName = "styles.css";
    public boolean minify = false;
    public boolean inlineCss = false;
    public boolean preserveIds = false;
    public boolean includeRuntime = false;
    public String runtimeScript = "runtime.js";

    // stylesheet
    public boolean cssHeader = true;
    public boolean pseudoRules = true;
    public boolean mediaRules = true;
    public boolean keyframes = true;
    public boolean omitEmptyRules = false;

    /** Render laid-out flowcharts inline in the HTML document. */
    public boolean embedFlowcharts = true;

    /** Also produce a standalone SVG document per laid-out flowchart ({@code flowchart-<id>.svg}). */
    public boolean exportFlowcharts = true;

    public SvgTheme flowchartTheme = SvgTheme.DEFAULT;
    public int flowchartWidth = 800;
    public int flowchartHeight = 600;
    public boolean flowchartResponsive = false;
    public int flowchartMaxWidth = 0;
    public int flowchartMaxHeight = 0;
    public boolean flowchartInteractive = true;
    public boolean flowchartAccessibility = true;

    /**
     * Class names for generated selectors. Null means the default deriver. The same deriver feeds
     * the stylesheet and the document so class attributes always match the rules.
     */
    public ClassNameDeriver classNameDeriver;

    public CssOptions cssOptions() {
        return new CssOptions(cssHeader, pseudoRules, mediaRules, keyframes, omitEmptyRules);
    }

    public HtmlOptions htmlOptions() {
        return new HtmlOptions(minify, inlineCss, preserveIds, includeRuntime, title, stylesheetFileName, runtimeScript, lang);
    }

    public SvgOptions svgOptions() {
        return SvgOptions.defaults()
                .withSize(flowchartWidth, flowchartHeight)
                .withResponsive(flowchartResponsive, flowchartMaxWidth, flowchartMaxHeight)
                .withTheme(flowchartTheme)
                .withInteractive(flowchartInteractive)
                .withAccessibility(flowchartAccessibility);
    }
}
