package info.isaksson.erland.uitoweb.ir;

/** Units a {@link IrDimension} can carry. {@link #AUTO} ignores the numeric value. */
public enum IrDimensionUnit {
    PX,
    PERCENT,
    VW,
    VH,
    VMIN,
    VMAX,
    REM,
    EM,
    FR,
    AUTO
}
