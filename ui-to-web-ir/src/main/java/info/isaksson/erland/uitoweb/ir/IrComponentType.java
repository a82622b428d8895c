package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Variant tag of a component node.
 *
 * <p>The set is closed for a given IR schema version, but newer producers may emit kinds this
 * version does not know about. Those deserialize to {@link #UNKNOWN}, which every generator
 * treats like a plain container.</p>
 */
public enum IrComponentType {
    // layout
    CONTAINER,
    ROW,
    COLUMN,
    CENTER,
    MODAL,

    // text
    TEXT,
    SPAN,
    STRONG,
    EM,
    CODE_INLINE,
    SMALL,
    MARK,

    // form
    BUTTON,
    INPUT,
    CHECKBOX,
    DROPDOWN,

    // media
    IMAGE,
    CANVAS,
    NATIVE_CANVAS,
    SPRITE,

    // tabs
    TAB_GROUP,
    TAB_BAR,
    TAB,
    TAB_CONTENT,
    TAB_PANEL,

    // table
    TABLE,
    TABLE_HEAD,
    TABLE_BODY,
    TABLE_FOOT,
    TABLE_ROW,
    TABLE_CELL,
    TABLE_HEADER_CELL,

    // markdown / rich text
    MARKDOWN,
    HEADING,
    PARAGRAPH,
    BLOCKQUOTE,
    CODE_BLOCK,
    HORIZONTAL_RULE,
    LIST,
    LIST_ITEM,
    LINK,

    // flowchart
    FLOWCHART,
    FLOWCHART_NODE,
    FLOWCHART_EDGE,
    FLOWCHART_SUBGRAPH,
    FLOWCHART_LABEL,

    // template / compile-time constructs
    CUSTOM,
    STATIC_BLOCK,
    FOR_LOOP,
    FOR_EACH,
    VAR_DECL,
    PLACEHOLDER,

    @JsonEnumDefaultValue
    UNKNOWN
}
