package info.isaksson.erland.uitoweb.css;

import java.util.Locale;

/** Property groups, in the order their declarations appear inside a rule. */
public enum CssCategory {
    LAYOUT,
    SPACING,
    FLEXBOX,
    GRID,
    COLOR,
    BORDER,
    ALIGNMENT,
    TYPOGRAPHY,
    TRANSFORM,
    EFFECTS,
    ANIMATION,
    POSITION,
    MISC;

    public String cssName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
