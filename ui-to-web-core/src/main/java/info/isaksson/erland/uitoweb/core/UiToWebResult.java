package info.isaksson.erland.uitoweb.core;

import info.isaksson.erland.uitoweb.emitter.EmitterWarning;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Generation result container for programmatic usage. */
public final class UiToWebResult {

    public final String html;

    /** Stylesheet text; null when the stylesheet was inlined into {@link #html}. */
    public final String css;

    /** Number of CSS rules generated (base, pseudo-state and media rules). */
    public final int cssRuleCount;

    /** Standalone SVG documents keyed by file stem ({@code flowchart-<id>}), in document order. */
    public final Map<String, String> svgs;

    /** Warnings of all generators, de-duplicated and deterministically ordered. */
    public final List<EmitterWarning> warnings;

    UiToWebResult(String html, String css, int cssRuleCount, Map<String, String> svgs, List<EmitterWarning> warnings) {
        this.html = html;
        this.css = css;
        this.cssRuleCount = cssRuleCount;
        this.svgs = svgs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(svgs));
        this.warnings = warnings == null ? List.of() : warnings;
    }

    /** Total size of all generated documents in UTF-8 bytes. */
    public long totalBytes() {
        long total = html.getBytes(StandardCharsets.UTF_8).length;
        if (css != null) total += css.getBytes(StandardCharsets.UTF_8).length;
        for (String svg : svgs.values()) total += svg.getBytes(StandardCharsets.UTF_8).length;
        return total;
    }
}
