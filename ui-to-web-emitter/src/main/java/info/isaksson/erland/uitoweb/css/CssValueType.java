package info.isaksson.erland.uitoweb.css;

import info.isaksson.erland.uitoweb.ir.IrAlignment;
import info.isaksson.erland.uitoweb.ir.IrAnimation;
import info.isaksson.erland.uitoweb.ir.IrColor;
import info.isaksson.erland.uitoweb.ir.IrDimension;
import info.isaksson.erland.uitoweb.ir.IrDisplay;
import info.isaksson.erland.uitoweb.ir.IrFilter;
import info.isaksson.erland.uitoweb.ir.IrGridPlacement;
import info.isaksson.erland.uitoweb.ir.IrGridTemplate;
import info.isaksson.erland.uitoweb.ir.IrShadow;
import info.isaksson.erland.uitoweb.ir.IrSpacing;
import info.isaksson.erland.uitoweb.ir.IrTextDecoration;
import info.isaksson.erland.uitoweb.ir.IrTransform;
import info.isaksson.erland.uitoweb.ir.IrTransition;

import java.util.List;

/**
 * Value shape of a style field, each with its own formatting rule.
 *
 * <p>{@link #format(Object)} takes the raw field value and returns the CSS text, or {@code null}
 * when the value has no CSS form. {@code null} input always yields {@code null}.</p>
 */
public enum CssValueType {

    DISPLAY {
        @Override String formatValue(Object v) { return CssValueFormats.display((IrDisplay) v); }
    },
    DIMENSION {
        @Override String formatValue(Object v) { return CssValueFormats.dimension((IrDimension) v); }
    },
    MAX_DIMENSION {
        @Override String formatValue(Object v) { return CssValueFormats.maxDimension((IrDimension) v); }
    },
    FONT_SIZE {
        @Override String formatValue(Object v) { return CssValueFormats.fontSize((IrDimension) v); }
    },
    SPACING {
        @Override String formatValue(Object v) { return CssValueFormats.spacing((IrSpacing) v); }
    },
    PIXELS {
        @Override String formatValue(Object v) { return CssValueFormats.pixels((Double) v); }
    },
    NUMBER {
        @Override String formatValue(Object v) { return CssValueFormats.number((Double) v); }
    },
    ASPECT_RATIO {
        @Override String formatValue(Object v) { return CssValueFormats.aspectRatio((Double) v); }
    },
    KEYWORD {
        @Override String formatValue(Object v) { return CssValueFormats.keyword((Enum<?>) v); }
    },
    ALIGNMENT {
        @Override String formatValue(Object v) { return CssValueFormats.alignment((IrAlignment) v); }
    },
    FLEX_WRAP {
        @Override String formatValue(Object v) { return CssValueFormats.flexWrap((Boolean) v); }
    },
    GRID_TEMPLATE {
        @Override String formatValue(Object v) { return CssValueFormats.gridTemplate((IrGridTemplate) v); }
    },
    GRID_PLACEMENT {
        @Override String formatValue(Object v) { return CssValueFormats.gridPlacement((IrGridPlacement) v); }
    },
    COLOR {
        @Override String formatValue(Object v) { return CssValueFormats.color((IrColor) v); }
    },
    FONT_FAMILY {
        @Override String formatValue(Object v) { return CssValueFormats.fontFamily((String) v); }
    },
    FONT_WEIGHT {
        @Override String formatValue(Object v) { return CssValueFormats.fontWeight((Integer) v); }
    },
    LINE_HEIGHT {
        @Override String formatValue(Object v) { return CssValueFormats.lineHeight((Double) v); }
    },
    TEXT_SPACING {
        @Override String formatValue(Object v) { return CssValueFormats.textSpacing((Double) v); }
    },
    TEXT_DECORATION {
        @SuppressWarnings("unchecked")
        @Override String formatValue(Object v) { return CssValueFormats.textDecoration((List<IrTextDecoration>) v); }
    },
    TRANSFORM {
        @Override String formatValue(Object v) { return CssValueFormats.transform((IrTransform) v); }
    },
    BOX_SHADOW {
        @Override String formatValue(Object v) { return CssValueFormats.boxShadow((IrShadow) v); }
    },
    TEXT_SHADOW {
        @Override String formatValue(Object v) { return CssValueFormats.textShadow((IrShadow) v); }
    },
    FILTER_LIST {
        @SuppressWarnings("unchecked")
        @Override String formatValue(Object v) { return CssValueFormats.filters((List<IrFilter>) v); }
    },
    ANIMATION_LIST {
        @SuppressWarnings("unchecked")
        @Override String formatValue(Object v) { return CssValueFormats.animations((List<IrAnimation>) v); }
    },
    TRANSITION_LIST {
        @SuppressWarnings("unchecked")
        @Override String formatValue(Object v) { return CssValueFormats.transitions((List<IrTransition>) v); }
    },
    Z_INDEX {
        @Override String formatValue(Object v) { return CssValueFormats.zIndex((Integer) v); }

        @Override public String format(Object value) {
            // an unset z-index is null and still has a CSS form
            return formatValue(value);
        }
    },
    VISIBILITY {
        @Override String formatValue(Object v) { return CssValueFormats.visibility((Boolean) v); }
    };

    abstract String formatValue(Object value);

    public String format(Object value) {
        if (value == null) return null;
        return formatValue(value);
    }
}
