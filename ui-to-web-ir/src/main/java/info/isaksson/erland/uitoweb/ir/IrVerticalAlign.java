package info.isaksson.erland.uitoweb.ir;

public enum IrVerticalAlign {
    BASELINE,
    TOP,
    MIDDLE,
    BOTTOM,
    TEXT_TOP,
    TEXT_BOTTOM
}
