package info.isaksson.erland.uitoweb.ir;

public enum IrTextOverflow {
    CLIP,
    ELLIPSIS
}
