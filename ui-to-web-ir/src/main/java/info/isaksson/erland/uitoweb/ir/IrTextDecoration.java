package info.isaksson.erland.uitoweb.ir;

/** Text decoration lines; a style carries a set of these (empty means none). */
public enum IrTextDecoration {
    UNDERLINE,
    OVERLINE,
    LINE_THROUGH
}
