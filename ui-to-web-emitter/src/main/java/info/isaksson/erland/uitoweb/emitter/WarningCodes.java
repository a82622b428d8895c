package info.isaksson.erland.uitoweb.emitter;

/** Stable codes used in {@link EmitterWarning#code}. */
public final class WarningCodes {

    private WarningCodes() {}

    /** A node carried a variant this version does not know; it was rendered as a container. */
    public static final String UNKNOWN_VARIANT = "UNKNOWN_VARIANT";

    /** The class-name deriver failed for a node; the node got no selector. */
    public static final String CLASS_NAME_DERIVATION_FAILED = "CLASS_NAME_DERIVATION_FAILED";

    public static final String FLOWCHART_EDGE_SKIPPED = "FLOWCHART_EDGE_SKIPPED";
    public static final String FLOWCHART_SUBGRAPH_SKIPPED = "FLOWCHART_SUBGRAPH_SKIPPED";

    /** A flowchart node could not be rendered as SVG (no geometry or layout not computed). */
    public static final String FLOWCHART_NOT_RENDERED = "FLOWCHART_NOT_RENDERED";
}
