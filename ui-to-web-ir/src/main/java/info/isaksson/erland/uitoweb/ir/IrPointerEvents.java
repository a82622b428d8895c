package info.isaksson.erland.uitoweb.ir;

public enum IrPointerEvents {
    AUTO,
    NONE
}
