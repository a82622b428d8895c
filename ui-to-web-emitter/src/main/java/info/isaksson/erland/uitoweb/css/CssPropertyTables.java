package info.isaksson.erland.uitoweb.css;

import info.isaksson.erland.uitoweb.classify.ClassificationEntry;
import info.isaksson.erland.uitoweb.ir.IrStyle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import static info.isaksson.erland.uitoweb.css.CssCategory.*;

/**
 * Category tables mapping every {@link IrStyle} field to exactly one CSS property.
 *
 * <p>Declarations are produced category by category in {@link CssCategory} order and, inside a
 * category, in table order, so output is stable from run to run.</p>
 */
public final class CssPropertyTables {

    private static final Map<CssCategory, List<CssPropertyMapping>> TABLES;
    private static final List<CssPropertyMapping> ALL;

    static {
        Map<CssCategory, List<CssPropertyMapping>> t = new EnumMap<>(CssCategory.class);

        t.put(LAYOUT, List.of(
                map("display", LAYOUT, CssValueType.DISPLAY, "display", s -> s.display, null),
                map("width", LAYOUT, CssValueType.DIMENSION, "width", s -> s.width, "auto"),
                map("height", LAYOUT, CssValueType.DIMENSION, "height", s -> s.height, "auto"),
                map("min-width", LAYOUT, CssValueType.DIMENSION, "minWidth", s -> s.minWidth, "auto"),
                map("min-height", LAYOUT, CssValueType.DIMENSION, "minHeight", s -> s.minHeight, "auto"),
                map("max-width", LAYOUT, CssValueType.MAX_DIMENSION, "maxWidth", s -> s.maxWidth, "none"),
                map("max-height", LAYOUT, CssValueType.MAX_DIMENSION, "maxHeight", s -> s.maxHeight, "none"),
                map("aspect-ratio", LAYOUT, CssValueType.ASPECT_RATIO, "aspectRatio", s -> s.aspectRatio, "auto")
        ));

        t.put(SPACING, List.of(
                map("margin", SPACING, CssValueType.SPACING, "margin", s -> s.margin, "0"),
                map("padding", SPACING, CssValueType.SPACING, "padding", s -> s.padding, "0"),
                map("gap", SPACING, CssValueType.PIXELS, "gap", s -> s.gap, "0")
        ));

        t.put(FLEXBOX, List.of(
                map("flex-direction", FLEXBOX, CssValueType.KEYWORD, "flexDirection", s -> s.flexDirection, "row"),
                map("flex-wrap", FLEXBOX, CssValueType.FLEX_WRAP, "flexWrap", s -> s.flexWrap, "nowrap"),
                map("flex-grow", FLEXBOX, CssValueType.NUMBER, "flexGrow", s -> s.flexGrow, "0"),
                map("flex-shrink", FLEXBOX, CssValueType.NUMBER, "flexShrink", s -> s.flexShrink, "1"),
                map("flex-basis", FLEXBOX, CssValueType.DIMENSION, "flexBasis", s -> s.flexBasis, "auto"),
                map("justify-content", FLEXBOX, CssValueType.ALIGNMENT, "justifyContent", s -> s.justifyContent, "flex-start"),
                map("align-items", FLEXBOX, CssValueType.ALIGNMENT, "alignItems", s -> s.alignItems, "stretch"),
                map("align-content", FLEXBOX, CssValueType.ALIGNMENT, "alignContent", s -> s.alignContent, "stretch"),
                map("align-self", FLEXBOX, CssValueType.ALIGNMENT, "alignSelf", s -> s.alignSelf, "auto")
        ));

        t.put(GRID, List.of(
                map("grid-template-columns", GRID, CssValueType.GRID_TEMPLATE, "gridTemplateColumns", s -> s.gridTemplateColumns, "none"),
                map("grid-template-rows", GRID, CssValueType.GRID_TEMPLATE, "gridTemplateRows", s -> s.gridTemplateRows, "none"),
                map("grid-column", GRID, CssValueType.GRID_PLACEMENT, "gridColumn", s -> s.gridColumn, "auto"),
                map("grid-row", GRID, CssValueType.GRID_PLACEMENT, "gridRow", s -> s.gridRow, "auto"),
                map("row-gap", GRID, CssValueType.PIXELS, "rowGap", s -> s.rowGap, "0"),
                map("column-gap", GRID, CssValueType.PIXELS, "columnGap", s -> s.columnGap, "0"),
                map("justify-items", GRID, CssValueType.ALIGNMENT, "justifyItems", s -> s.justifyItems, "stretch"),
                map("justify-self", GRID, CssValueType.ALIGNMENT, "justifySelf", s -> s.justifySelf, "auto")
        ));

        t.put(COLOR, List.of(
                map("background", COLOR, CssValueType.COLOR, "background", s -> s.background, "transparent"),
                map("color", COLOR, CssValueType.COLOR, "color", s -> s.color, "inherit"),
                map("opacity", COLOR, CssValueType.NUMBER, "opacity", s -> s.opacity, "1")
        ));

        t.put(BORDER, List.of(
                map("border-width", BORDER, CssValueType.PIXELS, "borderWidth", s -> s.borderWidth, "0"),
                map("border-style", BORDER, CssValueType.KEYWORD, "borderStyle", s -> s.borderStyle, "none"),
                map("border-color", BORDER, CssValueType.COLOR, "borderColor", s -> s.borderColor, "currentColor"),
                map("border-radius", BORDER, CssValueType.PIXELS, "borderRadius", s -> s.borderRadius, "0")
        ));

        t.put(ALIGNMENT, List.of(
                map("text-align", ALIGNMENT, CssValueType.KEYWORD, "textAlign", s -> s.textAlign, "start"),
                map("vertical-align", ALIGNMENT, CssValueType.KEYWORD, "verticalAlign", s -> s.verticalAlign, "baseline")
        ));

        t.put(TYPOGRAPHY, List.of(
                map("font-family", TYPOGRAPHY, CssValueType.FONT_FAMILY, "fontFamily", s -> s.fontFamily, "inherit"),
                map("font-size", TYPOGRAPHY, CssValueType.FONT_SIZE, "fontSize", s -> s.fontSize, "medium"),
                map("font-weight", TYPOGRAPHY, CssValueType.FONT_WEIGHT, "fontWeight", s -> s.fontWeight, "normal"),
                map("font-style", TYPOGRAPHY, CssValueType.KEYWORD, "fontStyle", s -> s.fontStyle, "normal"),
                map("line-height", TYPOGRAPHY, CssValueType.LINE_HEIGHT, "lineHeight", s -> s.lineHeight, "normal"),
                map("letter-spacing", TYPOGRAPHY, CssValueType.TEXT_SPACING, "letterSpacing", s -> s.letterSpacing, "normal"),
                map("word-spacing", TYPOGRAPHY, CssValueType.TEXT_SPACING, "wordSpacing", s -> s.wordSpacing, "normal"),
                map("text-decoration", TYPOGRAPHY, CssValueType.TEXT_DECORATION, "textDecoration", s -> s.textDecoration, "none"),
                map("text-transform", TYPOGRAPHY, CssValueType.KEYWORD, "textTransform", s -> s.textTransform, "none"),
                map("text-overflow", TYPOGRAPHY, CssValueType.KEYWORD, "textOverflow", s -> s.textOverflow, "clip"),
                map("white-space", TYPOGRAPHY, CssValueType.KEYWORD, "whiteSpace", s -> s.whiteSpace, "normal"),
                map("direction", TYPOGRAPHY, CssValueType.KEYWORD, "direction", s -> s.direction, "ltr")
        ));

        t.put(TRANSFORM, List.of(
                map("transform", TRANSFORM, CssValueType.TRANSFORM, "transform", s -> s.transform, "none")
        ));

        t.put(EFFECTS, List.of(
                map("box-shadow", EFFECTS, CssValueType.BOX_SHADOW, "boxShadow", s -> s.boxShadow, "none"),
                map("text-shadow", EFFECTS, CssValueType.TEXT_SHADOW, "textShadow", s -> s.textShadow, "none"),
                map("filter", EFFECTS, CssValueType.FILTER_LIST, "filters", s -> s.filters, "none"),
                map("background-clip", EFFECTS, CssValueType.KEYWORD, "backgroundClip", s -> s.backgroundClip, "border-box")
        ));

        t.put(ANIMATION, List.of(
                map("animation", ANIMATION, CssValueType.ANIMATION_LIST, "animations", s -> s.animations, "none"),
                map("transition", ANIMATION, CssValueType.TRANSITION_LIST, "transitions", s -> s.transitions, "none")
        ));

        t.put(POSITION, List.of(
                map("position", POSITION, CssValueType.KEYWORD, "position", s -> s.position, "static"),
                map("top", POSITION, CssValueType.DIMENSION, "top", s -> s.top, "auto"),
                map("right", POSITION, CssValueType.DIMENSION, "right", s -> s.right, "auto"),
                map("bottom", POSITION, CssValueType.DIMENSION, "bottom", s -> s.bottom, "auto"),
                map("left", POSITION, CssValueType.DIMENSION, "left", s -> s.left, "auto"),
                map("z-index", POSITION, CssValueType.Z_INDEX, "zIndex", s -> s.zIndex, "auto")
        ));

        t.put(MISC, List.of(
                map("overflow-x", MISC, CssValueType.KEYWORD, "overflowX", s -> s.overflowX, "visible"),
                map("overflow-y", MISC, CssValueType.KEYWORD, "overflowY", s -> s.overflowY, "visible"),
                map("cursor", MISC, CssValueType.KEYWORD, "cursor", s -> s.cursor, "auto"),
                map("pointer-events", MISC, CssValueType.KEYWORD, "pointerEvents", s -> s.pointerEvents, "auto"),
                map("user-select", MISC, CssValueType.KEYWORD, "userSelect", s -> s.userSelect, "auto"),
                map("visibility", MISC, CssValueType.VISIBILITY, "visible", s -> s.visible, "visible"),
                map("box-sizing", MISC, CssValueType.KEYWORD, "boxSizing", s -> s.boxSizing, "content-box"),
                map("object-fit", MISC, CssValueType.KEYWORD, "objectFit", s -> s.objectFit, "fill")
        ));

        List<CssPropertyMapping> all = new ArrayList<>();
        for (CssCategory c : CssCategory.values()) {
            List<CssPropertyMapping> entries = t.get(c);
            if (entries == null) throw new IllegalStateException("missing table for category " + c);
            all.addAll(entries);
        }
        TABLES = Collections.unmodifiableMap(t);
        ALL = Collections.unmodifiableList(all);
    }

    private CssPropertyTables() {}

    public static List<CssPropertyMapping> forCategory(CssCategory category) {
        if (category == null) throw new IllegalArgumentException("category must not be null");
        return TABLES.get(category);
    }

    /** Every mapping, in emission order. */
    public static List<CssPropertyMapping> all() {
        return ALL;
    }

    /**
     * Declarations for {@code style}, leaving out every property whose formatted value equals its
     * default. {@code entry} supplies the default display of the component.
     */
    public static List<CssDeclaration> declarations(IrStyle style, ClassificationEntry entry) {
        if (style == null) throw new IllegalArgumentException("style must not be null");
        List<CssDeclaration> out = new ArrayList<>();
        for (CssPropertyMapping m : ALL) {
            String value = m.format(style);
            if (value == null) continue;
            String def = m.defaultFromClassification()
                    ? (entry == null ? null : entry.defaultDisplay)
                    : m.defaultValue;
            if (value.equals(def)) continue;
            out.add(new CssDeclaration(m.property, value));
        }
        return out;
    }

    /** Declarations of {@code override} whose formatted value differs from the one in {@code base}. */
    public static List<CssDeclaration> differences(IrStyle base, IrStyle override) {
        if (base == null) throw new IllegalArgumentException("base must not be null");
        if (override == null) throw new IllegalArgumentException("override must not be null");
        List<CssDeclaration> out = new ArrayList<>();
        for (CssPropertyMapping m : ALL) {
            String value = m.format(override);
            if (value == null) continue;
            if (Objects.equals(value, m.format(base))) continue;
            out.add(new CssDeclaration(m.property, value));
        }
        return out;
    }

    private static CssPropertyMapping map(String property, CssCategory category, CssValueType type,
                                          String field, Function<IrStyle, Object> accessor, String def) {
        return new CssPropertyMapping(property, category, type, field, accessor, def);
    }
}
