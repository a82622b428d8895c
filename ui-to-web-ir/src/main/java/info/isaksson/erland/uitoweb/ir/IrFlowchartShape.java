package info.isaksson.erland.uitoweb.ir;

/** Node geometries supported by the flowchart renderer. */
public enum IrFlowchartShape {
    RECTANGLE,
    ROUNDED,
    STADIUM,
    DIAMOND,
    CIRCLE,
    HEXAGON,
    CYLINDER,
    SUBROUTINE,
    ASYMMETRIC
}
