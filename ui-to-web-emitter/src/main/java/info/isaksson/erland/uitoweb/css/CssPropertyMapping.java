package info.isaksson.erland.uitoweb.css;

import info.isaksson.erland.uitoweb.ir.IrStyle;

import java.util.function.Function;

/**
 * Maps one {@link IrStyle} field to one CSS property.
 *
 * <p>{@link #defaultValue} is compared against the formatted text, not the raw value: a declaration
 * is dropped only when its output string is identical to the default. A {@code null} default means
 * the default comes from the component's classification (used for {@code display}).</p>
 */
public final class CssPropertyMapping {

    public final String property;
    public final CssCategory category;
    public final CssValueType valueType;
    /** Name of the {@link IrStyle} field read by this mapping. */
    public final String field;
    public final String defaultValue;

    private final Function<IrStyle, Object> accessor;

    CssPropertyMapping(String property, CssCategory category, CssValueType valueType,
                       String field, Function<IrStyle, Object> accessor, String defaultValue) {
        this.property = property;
        this.category = category;
        this.valueType = valueType;
        this.field = field;
        this.accessor = accessor;
        this.defaultValue = defaultValue;
    }

    public boolean defaultFromClassification() {
        return defaultValue == null;
    }

    public Object read(IrStyle style) {
        return accessor.apply(style);
    }

    /** Formatted value of this field in {@code style}, or {@code null} when it has no CSS form. */
    public String format(IrStyle style) {
        if (style == null) return null;
        return valueType.format(read(style));
    }

    @Override public String toString() {
        return category.cssName() + ":" + property + "<-" + field;
    }
}
