package info.isaksson.erland.uitoweb.ir;

/**
 * CSS display mode of a node.
 *
 * <p>{@link #AUTO} means the element keeps the display its HTML tag gets by default.</p>
 */
public enum IrDisplay {
    AUTO,
    FLEX,
    INLINE_FLEX,
    GRID,
    INLINE_GRID,
    BLOCK,
    INLINE,
    INLINE_BLOCK,
    CONTENTS,
    NONE
}
