package info.isaksson.erland.uitoweb.ir;

public enum IrBorderStyle {
    NONE,
    SOLID,
    DASHED,
    DOTTED,
    DOUBLE
}
