package info.isaksson.erland.uitoweb.ir;

/** Discriminator for {@link IrColor}. */
public enum IrColorKind {
    TRANSPARENT,
    SOLID,
    INHERIT,
    CURRENT_COLOR,
    VAR_REF,
    NAMED_VAR,
    GRADIENT
}
