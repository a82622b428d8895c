package info.isaksson.erland.uitoweb.ir;

public enum IrBoxSizing {
    CONTENT_BOX,
    BORDER_BOX
}
