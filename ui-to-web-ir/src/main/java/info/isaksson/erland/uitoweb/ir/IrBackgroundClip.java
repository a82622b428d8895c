package info.isaksson.erland.uitoweb.ir;

public enum IrBackgroundClip {
    BORDER_BOX,
    PADDING_BOX,
    CONTENT_BOX,
    TEXT
}
