package info.isaksson.erland.uitoweb.ir;

/** Main/cross axis alignment used by flexbox and grid properties. */
public enum IrAlignment {
    AUTO,
    START,
    CENTER,
    END,
    STRETCH,
    BASELINE,
    SPACE_BETWEEN,
    SPACE_AROUND,
    SPACE_EVENLY
}
