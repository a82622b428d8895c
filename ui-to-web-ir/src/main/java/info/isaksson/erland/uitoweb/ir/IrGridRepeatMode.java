package info.isaksson.erland.uitoweb.ir;

/** Repeat mode of a grid template. {@link #NONE} means the explicit track list is used. */
public enum IrGridRepeatMode {
    NONE,
    COUNT,
    AUTO_FIT,
    AUTO_FILL
}
