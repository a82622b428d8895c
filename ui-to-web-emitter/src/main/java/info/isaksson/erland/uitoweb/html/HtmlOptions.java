package info.isaksson.erland.uitoweb.html;

/** Options for generating an HTML document from a component tree. */
public final class HtmlOptions {

    /** Drops indentation. Element structure and line breaks are unchanged. */
    public final boolean minify;

    /** Embed the stylesheet in a {@code <style>} block instead of linking {@link #stylesheetHref}. */
    public final boolean inlineCss;

    /** Write {@code id} attributes ({@code btn-3}, {@code elem-7}, ...) on every element. */
    public final boolean preserveIds;

    public final boolean includeRuntime;

    public final String title;
    public final String stylesheetHref;
    public final String scriptSrc;
    public final String lang;

    public HtmlOptions(
            boolean minify,
            boolean inlineCss,
            boolean preserveIds,
            boolean includeRuntime,
            String title,
            String stylesheetHref,
            String scriptSrc,
            String lang
    ) {
        this.minify = minify;
        this.inlineCss = inlineCss;
        this.preserveIds = preserveIds;
        this.includeRuntime = includeRuntime;
        this.title = (title == null || title.isBlank()) ? "Web Application" : title.trim();
        this.stylesheetHref = (stylesheetHref == null || stylesheetHref.isBlank()) ? "styles.css" : stylesheetHref.trim();
        this.scriptSrc = (scriptSrc == null || scriptSrc.isBlank()) ? "runtime.js" : scriptSrc.trim();
        this.lang = (lang == null || lang.isBlank()) ? "en" : lang.trim();
    }

    public static HtmlOptions defaults() {
        return new HtmlOptions(false, false, false, false, null, null, null, null);
    }

    public HtmlOptions withMinify(boolean minify) {
        return new HtmlOptions(minify, inlineCss, preserveIds, includeRuntime, title, stylesheetHref, scriptSrc, lang);
    }

    public HtmlOptions withInlineCss(boolean inline) {
        return new HtmlOptions(minify, inline, preserveIds, includeRuntime, title, stylesheetHref, scriptSrc, lang);
    }

    public HtmlOptions withPreserveIds(boolean preserve) {
        return new HtmlOptions(minify, inlineCss, preserve, includeRuntime, title, stylesheetHref, scriptSrc, lang);
    }

    public HtmlOptions withRuntime(boolean include, String scriptSrc) {
        return new HtmlOptions(minify, inlineCss, preserveIds, include, title, stylesheetHref, scriptSrc, lang);
    }

    public HtmlOptions withTitle(String title) {
        return new HtmlOptions(minify, inlineCss, preserveIds, includeRuntime, title, stylesheetHref, scriptSrc, lang);
    }

    public HtmlOptions withStylesheetHref(String href) {
        return new HtmlOptions(minify, inlineCss, preserveIds, includeRuntime, title, href, scriptSrc, lang);
    }

    public HtmlOptions withLang(String lang) {
        return new HtmlOptions(minify, inlineCss, preserveIds, includeRuntime, title, stylesheetHref, scriptSrc, lang);
    }

    @Override
    public String toString() {
        return "HtmlOptions{" +
                "minify=" + minify +
                ", inlineCss=" + inlineCss +
                ", preserveIds=" + preserveIds +
                ", includeRuntime=" + includeRuntime +
                ", title='" + title + '\'' +
                ", stylesheetHref='" + stylesheetHref + '\'' +
                ", scriptSrc='" + scriptSrc + '\'' +
                ", lang='" + lang + '\'' +
                '}';
    }
}
