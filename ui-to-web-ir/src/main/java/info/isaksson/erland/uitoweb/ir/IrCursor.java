package info.isaksson.erland.uitoweb.ir;

public enum IrCursor {
    AUTO,
    DEFAULT,
    POINTER,
    TEXT,
    MOVE,
    GRAB,
    CROSSHAIR,
    NOT_ALLOWED
}
