package info.isaksson.erland.uitoweb.ir;

public enum IrTextDirection {
    LTR,
    RTL
}
