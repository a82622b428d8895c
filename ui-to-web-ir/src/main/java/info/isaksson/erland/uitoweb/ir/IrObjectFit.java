package info.isaksson.erland.uitoweb.ir;

/** How replaced content (images, canvases) fits its box. */
public enum IrObjectFit {
    FILL,
    CONTAIN,
    COVER,
    NONE,
    SCALE_DOWN
}
