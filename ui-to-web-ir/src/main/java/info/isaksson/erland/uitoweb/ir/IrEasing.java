package info.isaksson.erland.uitoweb.ir;

/** Timing functions for animations and transitions. */
public enum IrEasing {
    LINEAR,
    EASE,
    EASE_IN,
    EASE_OUT,
    EASE_IN_OUT,
    EASE_IN_QUAD,
    EASE_OUT_QUAD,
    EASE_IN_OUT_QUAD,
    EASE_IN_CUBIC,
    EASE_OUT_CUBIC,
    EASE_IN_OUT_CUBIC,
    EASE_IN_BOUNCE,
    EASE_OUT_BOUNCE,
    STEP_START,
    STEP_END
}
