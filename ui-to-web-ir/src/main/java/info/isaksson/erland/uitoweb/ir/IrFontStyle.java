package info.isaksson.erland.uitoweb.ir;

public enum IrFontStyle {
    NORMAL,
    ITALIC,
    OBLIQUE
}
