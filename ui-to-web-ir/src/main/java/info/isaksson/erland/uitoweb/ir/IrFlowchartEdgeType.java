package info.isaksson.erland.uitoweb.ir;

/**
 * Edge styles.
 *
 * <p>{@code ARROW} is one-way, {@code OPEN} has no arrow heads, {@code BIDIRECTIONAL} has both.</p>
 */
public enum IrFlowchartEdgeType {
    ARROW,
    OPEN,
    DOTTED,
    THICK,
    BIDIRECTIONAL
}
