package info.isaksson.erland.uitoweb.classify;

import info.isaksson.erland.uitoweb.emitter.EmitterWarnings;
import info.isaksson.erland.uitoweb.emitter.WarningCodes;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrComponentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Variant to tag/class/display lookup shared by the CSS and HTML generators.
 *
 * <p>The table is closed and total: every known variant has an entry, and anything else
 * (including {@code null} and {@link IrComponentType#UNKNOWN}) resolves to the container entry.</p>
 */
public final class ClassificationTable {

    private static final Logger LOG = LoggerFactory.getLogger(ClassificationTable.class);

    private static final int CONTAINER = 1;
    private static final int TEXT = 1 << 1;
    private static final int FORM = 1 << 2;
    private static final int SELF_CLOSING = 1 << 3;
    private static final int INLINE_DIMENSIONS = 1 << 4;

    private static final Map<IrComponentType, ClassificationEntry> ENTRIES;

    static {
        EnumMap<IrComponentType, ClassificationEntry> m = new EnumMap<>(IrComponentType.class);

        // layout
        put(m, IrComponentType.CONTAINER, "div", "block", CONTAINER);
        put(m, IrComponentType.ROW, "div", "block", CONTAINER);
        put(m, IrComponentType.COLUMN, "div", "block", CONTAINER);
        put(m, IrComponentType.CENTER, "div", "block", CONTAINER);
        put(m, IrComponentType.MODAL, "div", "block", CONTAINER);

        // text
        put(m, IrComponentType.TEXT, "span", "inline", TEXT);
        put(m, IrComponentType.SPAN, "span", "inline", CONTAINER | TEXT);
        put(m, IrComponentType.STRONG, "strong", "inline", CONTAINER | TEXT);
        put(m, IrComponentType.EM, "em", "inline", CONTAINER | TEXT);
        put(m, IrComponentType.CODE_INLINE, "code", "inline", TEXT);
        put(m, IrComponentType.SMALL, "small", "inline", CONTAINER | TEXT);
        put(m, IrComponentType.MARK, "mark", "inline", CONTAINER | TEXT);

        // form
        put(m, IrComponentType.BUTTON, "button", "inline-block", TEXT | FORM);
        put(m, IrComponentType.INPUT, "input", "inline-block", FORM | SELF_CLOSING);
        put(m, IrComponentType.CHECKBOX, "input", "inline-block", FORM | SELF_CLOSING);
        put(m, IrComponentType.DROPDOWN, "div", "block", CONTAINER | FORM);

        // media
        put(m, IrComponentType.IMAGE, "img", "inline", SELF_CLOSING);
        put(m, IrComponentType.CANVAS, "canvas", "inline", INLINE_DIMENSIONS);
        put(m, IrComponentType.NATIVE_CANVAS, "canvas", "inline", INLINE_DIMENSIONS);
        put(m, IrComponentType.SPRITE, "canvas", "inline", INLINE_DIMENSIONS);

        // tabs
        put(m, IrComponentType.TAB_GROUP, "div", "block", CONTAINER);
        put(m, IrComponentType.TAB_BAR, "div", "block", CONTAINER);
        put(m, IrComponentType.TAB, "button", "inline-block", TEXT | FORM);
        put(m, IrComponentType.TAB_CONTENT, "div", "block", CONTAINER);
        put(m, IrComponentType.TAB_PANEL, "div", "block", CONTAINER);

        // table
        put(m, IrComponentType.TABLE, "table", "table", CONTAINER);
        put(m, IrComponentType.TABLE_HEAD, "thead", "table-header-group", CONTAINER);
        put(m, IrComponentType.TABLE_BODY, "tbody", "table-row-group", CONTAINER);
        put(m, IrComponentType.TABLE_FOOT, "tfoot", "table-footer-group", CONTAINER);
        put(m, IrComponentType.TABLE_ROW, "tr", "table-row", CONTAINER);
        put(m, IrComponentType.TABLE_CELL, "td", "table-cell", CONTAINER | TEXT);
        put(m, IrComponentType.TABLE_HEADER_CELL, "th", "table-cell", CONTAINER | TEXT);

        // markdown
        put(m, IrComponentType.MARKDOWN, "div", "block", CONTAINER);
        put(m, IrComponentType.HEADING, "h1", "block", CONTAINER | TEXT);
        put(m, IrComponentType.PARAGRAPH, "p", "block", CONTAINER | TEXT);
        put(m, IrComponentType.BLOCKQUOTE, "blockquote", "block", CONTAINER | TEXT);
        put(m, IrComponentType.CODE_BLOCK, "pre", "block", TEXT);
        put(m, IrComponentType.HORIZONTAL_RULE, "hr", "block", SELF_CLOSING);
        put(m, IrComponentType.LIST, "ul", "block", CONTAINER);
        put(m, IrComponentType.LIST_ITEM, "li", "list-item", CONTAINER | TEXT);
        put(m, IrComponentType.LINK, "a", "inline", CONTAINER | TEXT);

        // flowchart
        put(m, IrComponentType.FLOWCHART, "div", "block", CONTAINER);
        put(m, IrComponentType.FLOWCHART_NODE, "div", "block", 0);
        put(m, IrComponentType.FLOWCHART_EDGE, "div", "block", 0);
        put(m, IrComponentType.FLOWCHART_SUBGRAPH, "div", "block", CONTAINER);
        put(m, IrComponentType.FLOWCHART_LABEL, "span", "inline", TEXT);

        // template constructs are expanded before rendering; leftovers stay hidden
        put(m, IrComponentType.CUSTOM, "div", "block", CONTAINER);
        put(m, IrComponentType.STATIC_BLOCK, "div", "none", CONTAINER);
        put(m, IrComponentType.FOR_LOOP, "div", "none", CONTAINER);
        put(m, IrComponentType.FOR_EACH, "div", "none", CONTAINER);
        put(m, IrComponentType.VAR_DECL, "div", "none", 0);
        put(m, IrComponentType.PLACEHOLDER, "div", "none", 0);

        ENTRIES = Collections.unmodifiableMap(m);
    }

    private ClassificationTable() {}

    /** Entry for {@code type}; unrecognized variants get the container entry. */
    public static ClassificationEntry classify(IrComponentType type) {
        ClassificationEntry e = type == null ? null : ENTRIES.get(type);
        return e != null ? e : ENTRIES.get(IrComponentType.CONTAINER);
    }

    /**
     * Entry for {@code component}'s variant. A container fallback is recorded against the node's id
     * so several unknown nodes stay distinguishable.
     */
    public static ClassificationEntry classify(IrComponent component, EmitterWarnings warnings) {
        IrComponentType type = component == null ? null : component.type;
        if (!isKnown(type)) {
            LOG.warn("Unknown component variant {} on node {}, treating it as a container",
                    type, component == null ? null : component.id);
            if (warnings != null) {
                warnings.warn(WarningCodes.UNKNOWN_VARIANT,
                        "Unknown component variant; rendered as container", component);
            }
        }
        return classify(type);
    }

    public static boolean isKnown(IrComponentType type) {
        return type != null && ENTRIES.containsKey(type);
    }

    /** All known entries, in variant order. */
    public static Map<IrComponentType, ClassificationEntry> entries() {
        return ENTRIES;
    }

    private static void put(Map<IrComponentType, ClassificationEntry> m, IrComponentType type,
                            String tag, String display, int flags) {
        m.put(type, new ClassificationEntry(
                className(type), tag, display,
                (flags & CONTAINER) != 0,
                (flags & TEXT) != 0,
                (flags & FORM) != 0,
                (flags & SELF_CLOSING) != 0,
                (flags & INLINE_DIMENSIONS) != 0));
    }

    private static String className(IrComponentType type) {
        return type.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
