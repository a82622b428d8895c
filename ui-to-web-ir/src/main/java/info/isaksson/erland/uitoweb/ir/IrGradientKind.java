package info.isaksson.erland.uitoweb.ir;

public enum IrGradientKind {
    LINEAR,
    RADIAL,
    CONIC
}
