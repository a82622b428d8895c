package info.isaksson.erland.uitoweb.ir;

public enum IrFilterKind {
    BLUR,
    BRIGHTNESS,
    CONTRAST,
    GRAYSCALE,
    HUE_ROTATE,
    INVERT,
    OPACITY,
    SATURATE,
    SEPIA
}
