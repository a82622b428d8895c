package info.isaksson.erland.uitoweb.ir;

public enum IrPositionMode {
    STATIC,
    RELATIVE,
    ABSOLUTE,
    FIXED,
    STICKY
}
