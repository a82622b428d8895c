package info.isaksson.erland.uitoweb.ir;

/** How a node prefers to be addressed from CSS. */
public enum IrSelectorKind {
    CLASS,
    ELEMENT,
    ID
}
