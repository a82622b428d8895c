package info.isaksson.erland.uitoweb.ir;

/** Properties an animation keyframe or a transition can target. {@link #ALL} is the generic transition target. */
public enum IrAnimatedProperty {
    ALL,
    OPACITY,
    TRANSFORM,
    BACKGROUND_COLOR,
    COLOR,
    BORDER_COLOR,
    WIDTH,
    HEIGHT
}
