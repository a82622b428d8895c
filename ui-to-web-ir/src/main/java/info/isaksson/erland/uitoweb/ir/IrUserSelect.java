package info.isaksson.erland.uitoweb.ir;

public enum IrUserSelect {
    AUTO,
    NONE,
    TEXT,
    ALL
}
