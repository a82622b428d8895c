package info.isaksson.erland.uitoweb.ir;

public enum IrGridTrackKind {
    PX,
    PERCENT,
    FR,
    AUTO,
    MIN_CONTENT,
    MAX_CONTENT
}
