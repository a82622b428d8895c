package info.isaksson.erland.uitoweb.ir;

public enum IrWhiteSpace {
    NORMAL,
    NOWRAP,
    PRE,
    PRE_WRAP,
    PRE_LINE
}
