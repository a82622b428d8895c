package info.isaksson.erland.uitoweb.ir;

public enum IrOverflow {
    VISIBLE,
    HIDDEN,
    SCROLL,
    AUTO,
    CLIP
}
