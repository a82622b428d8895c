package info.isaksson.erland.uitoweb.ir;

/** Interaction or structural states a node can carry an alternate style for. */
public enum IrPseudoState {
    HOVER,
    ACTIVE,
    FOCUS,
    DISABLED,
    CHECKED,
    FIRST_CHILD,
    LAST_CHILD,
    VISITED
}
