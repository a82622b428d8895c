package info.isaksson.erland.uitoweb.ir;

public enum IrQueryKind {
    MIN_WIDTH,
    MAX_WIDTH,
    MIN_HEIGHT,
    MAX_HEIGHT
}
