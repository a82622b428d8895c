package info.isaksson.erland.uitoweb.ir;

public enum IrTextAlign {
    LEFT,
    RIGHT,
    CENTER,
    JUSTIFY,
    START,
    END
}
