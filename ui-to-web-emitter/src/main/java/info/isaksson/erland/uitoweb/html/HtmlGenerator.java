package info.isaksson.erland.uitoweb.html;

import info.isaksson.erland.uitoweb.classify.ClassificationEntry;
import info.isaksson.erland.uitoweb.classify.ClassificationTable;
import info.isaksson.erland.uitoweb.css.CssGenerator;
import info.isaksson.erland.uitoweb.css.CssOptions;
import info.isaksson.erland.uitoweb.emitter.EmitterWarning;
import info.isaksson.erland.uitoweb.emitter.EmitterWarnings;
import info.isaksson.erland.uitoweb.emitter.MarkupWriter;
import info.isaksson.erland.uitoweb.emitter.OutputFiles;
import info.isaksson.erland.uitoweb.emitter.WarningCodes;
import info.isaksson.erland.uitoweb.ir.ComponentDataKeys;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrComponentType;
import info.isaksson.erland.uitoweb.ir.IrDimension;
import info.isaksson.erland.uitoweb.ir.IrDimensionUnit;
import info.isaksson.erland.uitoweb.ir.IrManifest;
import info.isaksson.erland.uitoweb.ir.IrSelectorKind;
import info.isaksson.erland.uitoweb.selector.ClassNameDeriver;
import info.isaksson.erland.uitoweb.selector.DefaultClassNameDeriver;
import info.isaksson.erland.uitoweb.selector.SelectorSynthesizer;
import info.isaksson.erland.uitoweb.svg.SvgFlowchartRenderer;
import info.isaksson.erland.uitoweb.svg.SvgOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static info.isaksson.erland.uitoweb.emitter.HtmlEscaper.escape;

/**
 * Public API: generate an HTML document from a component tree.
 *
 * <p>The tree is walked depth-first in document order. Each node becomes one element whose tag
 * comes from the classification table and whose {@code class} attribute matches the selector the
 * {@link CssGenerator} writes for it, provided both use the same {@link ClassNameDeriver}.
 * Self-closing elements never get children, even when the tree has some.</p>
 *
 * <p>When constructed with {@link SvgOptions}, flowchart components are rendered inline as SVG.</p>
 */
public final class HtmlGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlGenerator.class);

    public static final class Result {
        public final String html;
        public final List<EmitterWarning> warnings;

        Result(String html, List<EmitterWarning> warnings) {
            this.html = html;
            this.warnings = warnings == null ? List.of() : warnings;
        }

        /** Size of {@link #html} in UTF-8 bytes. */
        public int size() {
            return html.getBytes(StandardCharsets.UTF_8).length;
        }
    }

    private final HtmlOptions options;
    private final ClassNameDeriver deriver;
    private final SelectorSynthesizer selectors;
    private final SvgOptions flowchartOptions;
    private final SvgFlowchartRenderer flowcharts = new SvgFlowchartRenderer();

    private Result last;

    public HtmlGenerator() {
        this(HtmlOptions.defaults(), new DefaultClassNameDeriver(), null);
    }

    public HtmlGenerator(HtmlOptions options, ClassNameDeriver deriver) {
        this(options, deriver, null);
    }

    /**
     * @param flowchartOptions SVG options for embedded flowcharts, or null to render flowcharts as
     *                         plain containers
     */
    public HtmlGenerator(HtmlOptions options, ClassNameDeriver deriver, SvgOptions flowchartOptions) {
        this.options = options == null ? HtmlOptions.defaults() : options;
        this.deriver = deriver == null ? new DefaultClassNameDeriver() : deriver;
        this.selectors = new SelectorSynthesizer(this.deriver);
        this.flowchartOptions = flowchartOptions;
    }

    public Result generate(IrComponent root) {
        return generate(root, IrManifest.EMPTY);
    }

    /** With {@code inlineCss}, the stylesheet is generated here with default CSS options. */
    public Result generate(IrComponent root, IrManifest manifest) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        String css = null;
        if (options.inlineCss) {
            css = new CssGenerator(CssOptions.defaults(), deriver).generate(root, manifest).css;
        }
        return generate(root, manifest, css);
    }

    /**
     * Generates the document around an already generated stylesheet. {@code css} is embedded only
     * when {@code inlineCss} is set and the text is not empty.
     */
    public Result generate(IrComponent root, IrManifest manifest, String css) {
        if (root == null) throw new IllegalArgumentException("root must not be null");

        Pass pass = new Pass(new MarkupWriter(!options.minify));
        writeHead(pass.out, css);

        IrComponent body = bodyComponent(root);
        if (body != null) {
            writeBody(pass, body);
        } else {
            pass.out.line("<body>");
            pass.out.push();
            writeComponent(pass, root);
            pass.out.pop();
            pass.out.line("</body>");
        }
        pass.out.line("</html>");

        Result result = new Result(pass.out.toString(), pass.warnings.toDeterministicList());
        LOG.debug("Generated HTML: {} elements, {} bytes, {} warnings", pass.elements, result.size(), result.warnings.size());
        last = result;
        return result;
    }

    /**
     * Generates the document and writes it to {@code path}.
     *
     * @return false when the file could not be written; the generated text stays available via
     *         {@link #getBuffer()}
     */
    public boolean writeToFile(IrComponent root, IrManifest manifest, Path path) {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        Result result = generate(root, manifest);
        return OutputFiles.writeUtf8(path, result.html);
    }

    /** Document text of the last call, or null before the first one. */
    public String getBuffer() {
        return last == null ? null : last.html;
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
        final MarkupWriter out;
        final EmitterWarnings warnings = new EmitterWarnings();
        int elements;

        Pass(MarkupWriter out) {
            this.out = out;
        }
    }

    private void writeHead(MarkupWriter out, String css) {
        out.line("<!DOCTYPE html>");
        out.line("<html lang=\"" + escape(options.lang) + "\">");
        out.line("<head>");
        out.push();
        out.line("<meta charset=\"UTF-8\">");
        out.line("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">");
        out.line("<title>" + escape(options.title) + "</title>");
        if (options.inlineCss) {
            if (css != null && !css.isEmpty()) {
                out.line("<style>");
                out.append(css);
                if (!css.endsWith("\n")) out.newline();
                out.line("</style>");
            }
        } else {
            out.line("<link rel=\"stylesheet\" href=\"" + escape(options.stylesheetHref) + "\">");
        }
        if (options.includeRuntime) {
            out.line("<script src=\"" + escape(options.scriptSrc) + "\"></script>");
        }
        out.pop();
        out.line("</head>");
    }

    /** The root, or its first child, when tagged {@code Body}. */
    static IrComponent bodyComponent(IrComponent root) {
        if (root.hasTag(ComponentDataKeys.TAG_BODY)) return root;
        if (!root.children.isEmpty() && root.children.get(0).hasTag(ComponentDataKeys.TAG_BODY)) {
            return root.children.get(0);
        }
        return null;
    }

    private void writeBody(Pass pass, IrComponent body) {
        ClassificationTable.classify(body, pass.warnings);
        String classes = SelectorSynthesizer.selectorToClassList(selectors.selectorFor(body, pass.warnings));

        StringBuilder open = new StringBuilder("<body");
        if (hasTagHint(body, IrSelectorKind.ID)) {
            attr(open, "id", body.tag.trim());
        } else if (options.preserveIds) {
            attr(open, "id", elementId(body));
        }
        if (!classes.isEmpty()) attr(open, "class", classes);
        pass.out.line(open.append('>').toString());
        pass.out.push();
        writeContent(pass, body);
        for (IrComponent child : body.children) {
            writeComponent(pass, child);
        }
        pass.out.pop();
        pass.out.line("</body>");
    }

    private void writeComponent(Pass pass, IrComponent node) {
        ClassificationEntry entry = ClassificationTable.classify(node, pass.warnings);
        String tag = elementTag(node, entry);
        String selector = selectors.selectorFor(node, pass.warnings);
        pass.elements++;

        StringBuilder open = new StringBuilder("<").append(tag);
        if (hasTagHint(node, IrSelectorKind.ID)) {
            attr(open, "id", node.tag.trim());
        } else if (options.preserveIds) {
            attr(open, "id", elementId(node));
        }
        String classes = SelectorSynthesizer.selectorToClassList(selector);
        if (!classes.isEmpty()) attr(open, "class", classes);
        if (node.tag != null && !node.tag.isBlank()
                && !hasTagHint(node, IrSelectorKind.ELEMENT) && !hasTagHint(node, IrSelectorKind.ID)) {
            attr(open, "data-tag", node.tag.trim());
        }
        writeTypeAttributes(open, node, entry);

        MarkupWriter out = pass.out;
        if (entry.selfClosing) {
            out.line(open.append(" />").toString());
            return;
        }

        out.line(open.append('>').toString());
        out.push();
        boolean embedded = writeContent(pass, node);
        if (!embedded) {
            for (IrComponent child : node.children) {
                writeComponent(pass, child);
            }
        }
        out.pop();
        out.line("</" + tag + ">");
    }

    /** Writes text or embedded SVG; returns true when the content replaces the children. */
    private boolean writeContent(Pass pass, IrComponent node) {
        MarkupWriter out = pass.out;

        if (node.type == IrComponentType.CODE_BLOCK) {
            StringBuilder code = new StringBuilder("<code");
            String lang = node.data.get(ComponentDataKeys.CODE_LANGUAGE);
            if (lang != null && !lang.isBlank()) attr(code, "class", "language-" + lang.trim());
            code.append('>').append(escape(node.text)).append("</code>");
            out.line(code.toString());
            return false;
        }

        if (node.type == IrComponentType.FLOWCHART && flowchartOptions != null) {
            Optional<String> svg = flowcharts.render(node, flowchartOptions, pass.warnings);
            if (svg.isPresent()) {
                for (String line : svg.get().split("\n")) {
                    if (!line.isEmpty()) out.line(line);
                }
                return true;
            }
            pass.warnings.warn(WarningCodes.FLOWCHART_NOT_RENDERED,
                    "Flowchart has no computed layout; rendered as container", node);
        }

        if (node.text != null && !node.text.isEmpty()) {
            out.line(escape(node.text));
        }
        return false;
    }

    static String elementTag(IrComponent node, ClassificationEntry entry) {
        if (hasTagHint(node, IrSelectorKind.ELEMENT) && SelectorSynthesizer.isValidElementName(node.tag.trim())) {
            return node.tag.trim();
        }
        switch (node.type) {
            case HEADING: {
                int level = Math.max(1, Math.min(6, node.dataInt(ComponentDataKeys.HEADING_LEVEL, 1)));
                return "h" + level;
            }
            case LIST:
                return node.dataFlag(ComponentDataKeys.LIST_ORDERED) ? "ol" : "ul";
            default:
                return entry.tagName;
        }
    }

    private static boolean hasTagHint(IrComponent node, IrSelectorKind kind) {
        return node.selectorKind == kind && node.tag != null && !node.tag.isBlank();
    }

    static String elementId(IrComponent node) {
        String prefix;
        switch (node.type) {
            case BUTTON: prefix = "btn"; break;
            case INPUT: prefix = "input"; break;
            case CHECKBOX: prefix = "checkbox"; break;
            default: prefix = "elem"; break;
        }
        return prefix + "-" + node.id;
    }

    private static void writeTypeAttributes(StringBuilder sb, IrComponent node, ClassificationEntry entry) {
        switch (node.type) {
            case BUTTON:
                attr(sb, "type", "button");
                break;
            case INPUT:
                if (node.payload != null) attr(sb, "placeholder", node.payload);
                attr(sb, "type", "text");
                break;
            case CHECKBOX:
                attr(sb, "type", "checkbox");
                if (node.text != null && !node.text.isEmpty()) attr(sb, "data-label", node.text);
                break;
            case IMAGE:
                if (node.payload != null) attr(sb, "src", node.payload);
                if (node.text != null) attr(sb, "alt", node.text);
                break;
            case TABLE_CELL:
            case TABLE_HEADER_CELL: {
                int colspan = node.dataInt(ComponentDataKeys.CELL_COLSPAN, 1);
                int rowspan = node.dataInt(ComponentDataKeys.CELL_ROWSPAN, 1);
                if (colspan > 1) attr(sb, "colspan", Integer.toString(colspan));
                if (rowspan > 1) attr(sb, "rowspan", Integer.toString(rowspan));
                break;
            }
            case CODE_BLOCK: {
                String lang = node.data.get(ComponentDataKeys.CODE_LANGUAGE);
                if (lang != null && !lang.isBlank()) attr(sb, "data-language", lang.trim());
                break;
            }
            case LIST: {
                int start = node.dataInt(ComponentDataKeys.LIST_START, 1);
                if (node.dataFlag(ComponentDataKeys.LIST_ORDERED) && start > 1) attr(sb, "start", Integer.toString(start));
                break;
            }
            case LIST_ITEM: {
                int number = node.dataInt(ComponentDataKeys.LIST_ITEM_NUMBER, 0);
                if (number > 0) attr(sb, "value", Integer.toString(number));
                break;
            }
            case LINK: {
                if (node.payload != null) attr(sb, "href", node.payload);
                String title = node.data.get(ComponentDataKeys.LINK_TITLE);
                if (title != null && !title.isEmpty()) attr(sb, "title", title);
                break;
            }
            default:
                break;
        }

        if (entry.inlineDimensions) {
            pixelAttr(sb, "width", node.style.width);
            pixelAttr(sb, "height", node.style.height);
        }
    }

    private static void pixelAttr(StringBuilder sb, String name, IrDimension d) {
        if (d != null && d.unit == IrDimensionUnit.PX && d.value > 0) {
            attr(sb, name, Long.toString(Math.round(d.value)));
        }
    }

    private static void attr(StringBuilder sb, String name, String value) {
        sb.append(' ').append(name).append("=\"").append(escape(value)).append('"');
    }
}
