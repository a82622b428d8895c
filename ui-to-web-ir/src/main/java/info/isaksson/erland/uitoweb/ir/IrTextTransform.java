package info.isaksson.erland.uitoweb.ir;

public enum IrTextTransform {
    NONE,
    UPPERCASE,
    LOWERCASE,
    CAPITALIZE
}
