package info.isaksson.erland.uitoweb.ir;

public enum IrFlexDirection {
    ROW,
    COLUMN,
    ROW_REVERSE,
    COLUMN_REVERSE
}
