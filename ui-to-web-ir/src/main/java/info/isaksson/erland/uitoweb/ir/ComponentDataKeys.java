package info.isaksson.erland.uitoweb.ir;

/**
 * Schema-stable keys for the typed extras a component carries in {@link IrComponent#data}.
 *
 * <p>The primary payload (image source, link target, input placeholder) lives in
 * {@link IrComponent#payload}; these keys cover the rest. Generators must tolerate missing or
 * malformed values.</p>
 */
public final class ComponentDataKeys {

    private ComponentDataKeys() {}

    /** Heading level 1..6. */
    public static final String HEADING_LEVEL = "heading.level";

    public static final String LIST_ORDERED = "list.ordered"; // true|false
    public static final String LIST_START = "list.start";
    public static final String LIST_ITEM_NUMBER = "listItem.number";

    public static final String CELL_COLSPAN = "cell.colspan";
    public static final String CELL_ROWSPAN = "cell.rowspan";

    public static final String LINK_TITLE = "link.title";
    public static final String CODE_LANGUAGE = "code.language";

    /** Tag value that turns a node into the document's {@code <body>} element. */
    public static final String TAG_BODY = "Body";
}
