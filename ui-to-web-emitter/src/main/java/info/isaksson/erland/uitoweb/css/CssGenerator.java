package info.isaksson.erland.uitoweb.css;

import info.isaksson.erland.uitoweb.classify.ClassificationEntry;
import info.isaksson.erland.uitoweb.classify.ClassificationTable;
import info.isaksson.erland.uitoweb.emitter.EmitterWarning;
import info.isaksson.erland.uitoweb.emitter.EmitterWarnings;
import info.isaksson.erland.uitoweb.emitter.MarkupWriter;
import info.isaksson.erland.uitoweb.emitter.OutputFiles;
import info.isaksson.erland.uitoweb.ir.IrAnimation;
import info.isaksson.erland.uitoweb.ir.IrBreakpoint;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrKeyframe;
import info.isaksson.erland.uitoweb.ir.IrManifest;
import info.isaksson.erland.uitoweb.ir.IrManifestVariable;
import info.isaksson.erland.uitoweb.ir.IrPseudoStyle;
import info.isaksson.erland.uitoweb.ir.IrQueryCondition;
import info.isaksson.erland.uitoweb.selector.ClassNameDeriver;
import info.isaksson.erland.uitoweb.selector.DefaultClassNameDeriver;
import info.isaksson.erland.uitoweb.selector.SelectorSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Public API: generate a stylesheet from a component tree.
 *
 * <p>Nodes are visited depth-first in document order. Each node with a non-empty selector gets one
 * rule whose declarations come from {@link CssPropertyTables}; a selector seen before is not written
 * again. Manifest variables with the {@code css:} prefix become a {@code :root} block ahead of all
 * component rules.</p>
 *
 * <p>An instance remembers the output of its last call ({@link #getBuffer()}, {@link #getSize()}),
 * so it must not be shared between threads. Separate instances may run concurrently over the same
 * tree.</p>
 */
public final class CssGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CssGenerator.class);

    static final String HEADER = "/* ui-to-web generated CSS */\n/* Auto-generated from IR format */\n\n";

    public static final class Result {
        public final String css;
        /** Component rules written: base, pseudo-state and media rules. */
        public final int ruleCount;
        public final List<EmitterWarning> warnings;

        Result(String css, int ruleCount, List<EmitterWarning> warnings) {
            this.css = css;
            this.ruleCount = ruleCount;
            this.warnings = warnings == null ? List.of() : warnings;
        }

        /** Size of {@link #css} in UTF-8 bytes. */
        public int size() {
            return css.getBytes(StandardCharsets.UTF_8).length;
        }
    }

    private final CssOptions options;
    private final SelectorSynthesizer selectors;

    private Result last;

    public CssGenerator() {
        this(CssOptions.defaults(), new DefaultClassNameDeriver());
    }

    public CssGenerator(CssOptions options, ClassNameDeriver deriver) {
        this.options = options == null ? CssOptions.defaults() : options;
        this.selectors = new SelectorSynthesizer(deriver == null ? new DefaultClassNameDeriver() : deriver);
    }

    public Result generate(IrComponent root) {
        return generate(root, IrManifest.EMPTY);
    }

    public Result generate(IrComponent root, IrManifest manifest) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (manifest == null) manifest = IrManifest.EMPTY;

        Pass pass = new Pass();
        if (options.includeHeader) pass.out.append(HEADER);

        writeRootVariables(pass.out, manifest);
        writeComponent(pass, root);
        if (options.includeKeyframes) writeKeyframes(pass.out, root);

        Result result = new Result(pass.out.toString(), pass.ruleCount, pass.warnings.toDeterministicList());
        LOG.debug("Generated CSS: {} rules, {} bytes, {} warnings", result.ruleCount, result.size(), result.warnings.size());
        last = result;
        return result;
    }

    /**
     * Generates the stylesheet and writes it to {@code path}.
     *
     * @return false when the file could not be written; the generated text stays available via
     *         {@link #getBuffer()}
     */
    public boolean writeToFile(IrComponent root, IrManifest manifest, Path path) {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        Result result = generate(root, manifest);
        return OutputFiles.writeUtf8(path, result.css);
    }

    /** Stylesheet text of the last call, or null before the first one. */
    public String getBuffer() {
        return last == null ? null : last.css;
    }

    public int getSize() {
        return last == null ? 0 : last.size();
    }

    /** Warnings of the last call; the only way to see them after {@link #writeToFile}. */
    public List<EmitterWarning> lastWarnings() {
        return last == null ? List.of() : last.warnings;
    }

    // ---------------------------------------------------------------------

    private static final class Pass {
        final MarkupWriter out = new MarkupWriter();
        final EmitterWarnings warnings = new EmitterWarnings();
        final Set<String> written = new HashSet<>();
        int ruleCount;
    }

    private static void writeRootVariables(MarkupWriter out, IrManifest manifest) {
        List<String> declarations = new ArrayList<>();
        for (IrManifestVariable v : manifest.variables) {
            String name = customPropertyName(v);
            if (name == null) continue;
            declarations.add("--" + name + ": " + v.value + ";");
        }
        if (declarations.isEmpty()) return;

        out.line(":root {");
        out.push();
        for (String d : declarations) out.line(d);
        out.pop();
        out.line("}").newline();
    }

    /** Property name without the {@code css:} prefix and leading dashes, or null when nothing is left. */
    static String customPropertyName(IrManifestVariable v) {
        if (v == null || v.name == null || v.value == null) return null;
        if (!v.name.startsWith(IrManifest.CSS_VARIABLE_PREFIX)) return null;
        String name = v.name.substring(IrManifest.CSS_VARIABLE_PREFIX.length()).trim();
        if (name.startsWith("--")) name = name.substring(2).trim();
        return name.isEmpty() ? null : name;
    }

    private void writeComponent(Pass pass, IrComponent node) {
        ClassificationEntry entry = ClassificationTable.classify(node, pass.warnings);
        String selector = selectors.selectorFor(node, pass.warnings);

        if (!selector.isEmpty() && pass.written.add(selector)) {
            writeRule(pass, selector, CssPropertyTables.declarations(node.style, entry));

            if (options.includePseudoRules) {
                for (IrPseudoStyle ps : node.pseudoStyles) {
                    if (ps == null || ps.state == null) continue;
                    String pseudoSelector = SelectorSynthesizer.selectorForPseudo(selector, CssValueFormats.keyword(ps.state));
                    if (!pass.written.add(pseudoSelector)) continue;
                    List<CssDeclaration> diff = CssPropertyTables.differences(node.style, ps.style);
                    if (!diff.isEmpty()) writeRule(pass, pseudoSelector, diff);
                }
            }

            if (options.includeMediaRules) {
                for (IrBreakpoint bp : node.breakpoints) {
                    writeMediaRule(pass, selector, node, bp);
                }
            }
        }

        for (IrComponent child : node.children) {
            writeComponent(pass, child);
        }
    }

    private void writeRule(Pass pass, String selector, List<CssDeclaration> declarations) {
        if (declarations.isEmpty() && options.omitEmptyRules) return;
        MarkupWriter out = pass.out;
        out.line(selector + " {");
        out.push();
        for (CssDeclaration d : declarations) out.line(d.toString());
        out.pop();
        out.line("}").newline();
        pass.ruleCount++;
    }

    private static void writeMediaRule(Pass pass, String selector, IrComponent node, IrBreakpoint bp) {
        if (bp == null || bp.conditions.isEmpty()) return;
        String query = mediaQuery(bp.conditions);
        if (query.isEmpty()) return;
        if (!pass.written.add(query + "|" + selector)) return;

        List<CssDeclaration> diff = CssPropertyTables.differences(node.style, bp.style);
        if (diff.isEmpty()) return;

        MarkupWriter out = pass.out;
        out.line("@media " + query + " {");
        out.push();
        out.line(selector + " {");
        out.push();
        for (CssDeclaration d : diff) out.line(d.toString());
        out.pop();
        out.line("}");
        out.pop();
        out.line("}").newline();
        pass.ruleCount++;
    }

    /** {@code (min-width: 768px) and (max-width: 1024px)}. */
    static String mediaQuery(List<IrQueryCondition> conditions) {
        StringBuilder sb = new StringBuilder();
        for (IrQueryCondition c : conditions) {
            if (c == null || c.kind == null) continue;
            if (sb.length() > 0) sb.append(" and ");
            sb.append('(').append(CssValueFormats.keyword(c.kind)).append(": ")
                    .append(CssValueFormats.pixels(c.value)).append(')');
        }
        return sb.toString();
    }

    private static void writeKeyframes(MarkupWriter out, IrComponent root) {
        Map<String, IrAnimation> byName = new LinkedHashMap<>();
        collectAnimations(root, byName);
        if (byName.isEmpty()) return;

        out.line("/* Keyframe Animations */");
        for (IrAnimation a : byName.values()) {
            out.line("@keyframes " + a.name + " {");
            out.push();
            for (IrKeyframe kf : a.keyframes) {
                out.line(CssValueFormats.number(kf.offset * 100) + "% {");
                out.push();
                if (kf.opacity != null) out.line("opacity: " + CssValueFormats.number(kf.opacity) + ";");
                if (kf.transform != null) out.line("transform: " + CssValueFormats.transform(kf.transform) + ";");
                if (kf.backgroundColor != null) {
                    out.line("background-color: " + CssValueFormats.color(kf.backgroundColor) + ";");
                }
                out.pop();
                out.line("}");
            }
            out.pop();
            out.line("}").newline();
        }
    }

    /** First animation with keyframes wins for a given name. */
    private static void collectAnimations(IrComponent node, Map<String, IrAnimation> byName) {
        for (IrAnimation a : node.style.animations) {
            if (!a.keyframes.isEmpty()) byName.putIfAbsent(a.name, a);
        }
        for (IrComponent child : node.children) {
            collectAnimations(child, byName);
        }
    }
}
