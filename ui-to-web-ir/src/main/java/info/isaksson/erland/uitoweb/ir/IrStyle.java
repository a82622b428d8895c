package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.List;
import java.util.Objects;

/**
 * The resolved (cascade-merged) style of one component.
 *
 * <p>Every field always holds a value; a freshly built instance ({@link #DEFAULTS}) describes an element
 * that needs no CSS at all. The CSS property tables in the emitter module map each field to exactly one
 * CSS property, so a new field here must also get a table entry.</p>
 *
 * <p>Instances are immutable. Use {@link #builder()} or {@link #toBuilder()} to derive variants.</p>
 */
@JsonPropertyOrder({"display","width","height","minWidth","minHeight","maxWidth","maxHeight","aspectRatio","margin","padding","gap","flexDirection","flexWrap","flexGrow","flexShrink","flexBasis","justifyContent","alignItems","alignContent","alignSelf","gridTemplateColumns","gridTemplateRows","gridColumn","gridRow","rowGap","columnGap","justifyItems","justifySelf","background","color","opacity","borderWidth","borderStyle","borderColor","borderRadius","textAlign","verticalAlign","fontFamily","fontSize","fontWeight","fontStyle","lineHeight","letterSpacing","wordSpacing","textDecoration","textTransform","textOverflow","whiteSpace","direction","transform","boxShadow","textShadow","filters","backgroundClip","animations","transitions","position","top","right","bottom","left","zIndex","overflowX","overflowY","cursor","pointerEvents","userSelect","visible","boxSizing","objectFit"})
@JsonDeserialize(builder = IrStyle.Builder.class)
public final class IrStyle {

    public static final IrStyle DEFAULTS = builder().build();

    // layout
    public final IrDisplay display;
    public final IrDimension width;
    public final IrDimension height;
    public final IrDimension minWidth;
    public final IrDimension minHeight;
    public final IrDimension maxWidth;
    public final IrDimension maxHeight;
    public final double aspectRatio;

    // spacing
    public final IrSpacing margin;
    public final IrSpacing padding;
    public final double gap;

    // flexbox
    public final IrFlexDirection flexDirection;
    public final boolean flexWrap;
    public final double flexGrow;
    public final double flexShrink;
    public final IrDimension flexBasis;
    public final IrAlignment justifyContent;
    public final IrAlignment alignItems;
    public final IrAlignment alignContent;
    public final IrAlignment alignSelf;

    // grid
    public final IrGridTemplate gridTemplateColumns;
    public final IrGridTemplate gridTemplateRows;
    public final IrGridPlacement gridColumn;
    public final IrGridPlacement gridRow;
    public final double rowGap;
    public final double columnGap;
    public final IrAlignment justifyItems;
    public final IrAlignment justifySelf;

    // color
    public final IrColor background;
    public final IrColor color;
    public final double opacity;

    // border
    public final double borderWidth;
    public final IrBorderStyle borderStyle;
    public final IrColor borderColor;
    public final double borderRadius;

    // alignment
    public final IrTextAlign textAlign;
    public final IrVerticalAlign verticalAlign;

    // typography
    public final String fontFamily;
    public final IrDimension fontSize;
    public final int fontWeight;
    public final IrFontStyle fontStyle;
    public final double lineHeight;
    public final double letterSpacing;
    public final double wordSpacing;
    public final List<IrTextDecoration> textDecoration;
    public final IrTextTransform textTransform;
    public final IrTextOverflow textOverflow;
    public final IrWhiteSpace whiteSpace;
    public final IrTextDirection direction;

    // transform
    public final IrTransform transform;

    // effects
    public final IrShadow boxShadow;
    public final IrShadow textShadow;
    public final List<IrFilter> filters;
    public final IrBackgroundClip backgroundClip;

    // animation
    public final List<IrAnimation> animations;
    public final List<IrTransition> transitions;

    // position
    public final IrPositionMode position;
    public final IrDimension top;
    public final IrDimension right;
    public final IrDimension bottom;
    public final IrDimension left;
    public final Integer zIndex;

    // misc
    public final IrOverflow overflowX;
    public final IrOverflow overflowY;
    public final IrCursor cursor;
    public final IrPointerEvents pointerEvents;
    public final IrUserSelect userSelect;
    public final boolean visible;
    public final IrBoxSizing boxSizing;
    public final IrObjectFit objectFit;

    private IrStyle(Builder b) {
        this.display = b.display;
        this.width = b.width;
        this.height = b.height;
        this.minWidth = b.minWidth;
        this.minHeight = b.minHeight;
        this.maxWidth = b.maxWidth;
        this.maxHeight = b.maxHeight;
        this.aspectRatio = b.aspectRatio;
        this.margin = b.margin;
        this.padding = b.padding;
        this.gap = b.gap;
        this.flexDirection = b.flexDirection;
        this.flexWrap = b.flexWrap;
        this.flexGrow = b.flexGrow;
        this.flexShrink = b.flexShrink;
        this.flexBasis = b.flexBasis;
        this.justifyContent = b.justifyContent;
        this.alignItems = b.alignItems;
        this.alignContent = b.alignContent;
        this.alignSelf = b.alignSelf;
        this.gridTemplateColumns = b.gridTemplateColumns;
        this.gridTemplateRows = b.gridTemplateRows;
        this.gridColumn = b.gridColumn;
        this.gridRow = b.gridRow;
        this.rowGap = b.rowGap;
        this.columnGap = b.columnGap;
        this.justifyItems = b.justifyItems;
        this.justifySelf = b.justifySelf;
        this.background = b.background;
        this.color = b.color;
        this.opacity = b.opacity;
        this.borderWidth = b.borderWidth;
        this.borderStyle = b.borderStyle;
        this.borderColor = b.borderColor;
        this.borderRadius = b.borderRadius;
        this.textAlign = b.textAlign;
        this.verticalAlign = b.verticalAlign;
        this.fontFamily = b.fontFamily;
        this.fontSize = b.fontSize;
        this.fontWeight = b.fontWeight;
        this.fontStyle = b.fontStyle;
        this.lineHeight = b.lineHeight;
        this.letterSpacing = b.letterSpacing;
        this.wordSpacing = b.wordSpacing;
        this.textDecoration = b.textDecoration;
        this.textTransform = b.textTransform;
        this.textOverflow = b.textOverflow;
        this.whiteSpace = b.whiteSpace;
        this.direction = b.direction;
        this.transform = b.transform;
        this.boxShadow = b.boxShadow;
        this.textShadow = b.textShadow;
        this.filters = b.filters;
        this.backgroundClip = b.backgroundClip;
        this.animations = b.animations;
        this.transitions = b.transitions;
        this.position = b.position;
        this.top = b.top;
        this.right = b.right;
        this.bottom = b.bottom;
        this.left = b.left;
        this.zIndex = b.zIndex;
        this.overflowX = b.overflowX;
        this.overflowY = b.overflowY;
        this.cursor = b.cursor;
        this.pointerEvents = b.pointerEvents;
        this.userSelect = b.userSelect;
        this.visible = b.visible;
        this.boxSizing = b.boxSizing;
        this.objectFit = b.objectFit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.display = display;
        b.width = width;
        b.height = height;
        b.minWidth = minWidth;
        b.minHeight = minHeight;
        b.maxWidth = maxWidth;
        b.maxHeight = maxHeight;
        b.aspectRatio = aspectRatio;
        b.margin = margin;
        b.padding = padding;
        b.gap = gap;
        b.flexDirection = flexDirection;
        b.flexWrap = flexWrap;
        b.flexGrow = flexGrow;
        b.flexShrink = flexShrink;
        b.flexBasis = flexBasis;
        b.justifyContent = justifyContent;
        b.alignItems = alignItems;
        b.alignContent = alignContent;
        b.alignSelf = alignSelf;
        b.gridTemplateColumns = gridTemplateColumns;
        b.gridTemplateRows = gridTemplateRows;
        b.gridColumn = gridColumn;
        b.gridRow = gridRow;
        b.rowGap = rowGap;
        b.columnGap = columnGap;
        b.justifyItems = justifyItems;
        b.justifySelf = justifySelf;
        b.background = background;
        b.color = color;
        b.opacity = opacity;
        b.borderWidth = borderWidth;
        b.borderStyle = borderStyle;
        b.borderColor = borderColor;
        b.borderRadius = borderRadius;
        b.textAlign = textAlign;
        b.verticalAlign = verticalAlign;
        b.fontFamily = fontFamily;
        b.fontSize = fontSize;
        b.fontWeight = fontWeight;
        b.fontStyle = fontStyle;
        b.lineHeight = lineHeight;
        b.letterSpacing = letterSpacing;
        b.wordSpacing = wordSpacing;
        b.textDecoration = textDecoration;
        b.textTransform = textTransform;
        b.textOverflow = textOverflow;
        b.whiteSpace = whiteSpace;
        b.direction = direction;
        b.transform = transform;
        b.boxShadow = boxShadow;
        b.textShadow = textShadow;
        b.filters = filters;
        b.backgroundClip = backgroundClip;
        b.animations = animations;
        b.transitions = transitions;
        b.position = position;
        b.top = top;
        b.right = right;
        b.bottom = bottom;
        b.left = left;
        b.zIndex = zIndex;
        b.overflowX = overflowX;
        b.overflowY = overflowY;
        b.cursor = cursor;
        b.pointerEvents = pointerEvents;
        b.userSelect = userSelect;
        b.visible = visible;
        b.boxSizing = boxSizing;
        b.objectFit = objectFit;
        return b;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrStyle)) return false;
        IrStyle that = (IrStyle) o;
        return display == that.display &&
                Objects.equals(width, that.width) &&
                Objects.equals(height, that.height) &&
                Objects.equals(minWidth, that.minWidth) &&
                Objects.equals(minHeight, that.minHeight) &&
                Objects.equals(maxWidth, that.maxWidth) &&
                Objects.equals(maxHeight, that.maxHeight) &&
                Double.compare(aspectRatio, that.aspectRatio) == 0 &&
                Objects.equals(margin, that.margin) &&
                Objects.equals(padding, that.padding) &&
                Double.compare(gap, that.gap) == 0 &&
                flexDirection == that.flexDirection &&
                flexWrap == that.flexWrap &&
                Double.compare(flexGrow, that.flexGrow) == 0 &&
                Double.compare(flexShrink, that.flexShrink) == 0 &&
                Objects.equals(flexBasis, that.flexBasis) &&
                justifyContent == that.justifyContent &&
                alignItems == that.alignItems &&
                alignContent == that.alignContent &&
                alignSelf == that.alignSelf &&
                Objects.equals(gridTemplateColumns, that.gridTemplateColumns) &&
                Objects.equals(gridTemplateRows, that.gridTemplateRows) &&
                Objects.equals(gridColumn, that.gridColumn) &&
                Objects.equals(gridRow, that.gridRow) &&
                Double.compare(rowGap, that.rowGap) == 0 &&
                Double.compare(columnGap, that.columnGap) == 0 &&
                justifyItems == that.justifyItems &&
                justifySelf == that.justifySelf &&
                Objects.equals(background, that.background) &&
                Objects.equals(color, that.color) &&
                Double.compare(opacity, that.opacity) == 0 &&
                Double.compare(borderWidth, that.borderWidth) == 0 &&
                borderStyle == that.borderStyle &&
                Objects.equals(borderColor, that.borderColor) &&
                Double.compare(borderRadius, that.borderRadius) == 0 &&
                textAlign == that.textAlign &&
                verticalAlign == that.verticalAlign &&
                Objects.equals(fontFamily, that.fontFamily) &&
                Objects.equals(fontSize, that.fontSize) &&
                fontWeight == that.fontWeight &&
                fontStyle == that.fontStyle &&
                Double.compare(lineHeight, that.lineHeight) == 0 &&
                Double.compare(letterSpacing, that.letterSpacing) == 0 &&
                Double.compare(wordSpacing, that.wordSpacing) == 0 &&
                Objects.equals(textDecoration, that.textDecoration) &&
                textTransform == that.textTransform &&
                textOverflow == that.textOverflow &&
                whiteSpace == that.whiteSpace &&
                direction == that.direction &&
                Objects.equals(transform, that.transform) &&
                Objects.equals(boxShadow, that.boxShadow) &&
                Objects.equals(textShadow, that.textShadow) &&
                Objects.equals(filters, that.filters) &&
                backgroundClip == that.backgroundClip &&
                Objects.equals(animations, that.animations) &&
                Objects.equals(transitions, that.transitions) &&
                position == that.position &&
                Objects.equals(top, that.top) &&
                Objects.equals(right, that.right) &&
                Objects.equals(bottom, that.bottom) &&
                Objects.equals(left, that.left) &&
                Objects.equals(zIndex, that.zIndex) &&
                overflowX == that.overflowX &&
                overflowY == that.overflowY &&
                cursor == that.cursor &&
                pointerEvents == that.pointerEvents &&
                userSelect == that.userSelect &&
                visible == that.visible &&
                boxSizing == that.boxSizing &&
                objectFit == that.objectFit;
    }

    @Override public int hashCode() {
        return Objects.hash(display, width, height, minWidth, minHeight, maxWidth, maxHeight, aspectRatio, margin, padding, gap, flexDirection, flexWrap, flexGrow, flexShrink, flexBasis, justifyContent, alignItems, alignContent, alignSelf, gridTemplateColumns, gridTemplateRows, gridColumn, gridRow, rowGap, columnGap, justifyItems, justifySelf, background, color, opacity, borderWidth, borderStyle, borderColor, borderRadius, textAlign, verticalAlign, fontFamily, fontSize, fontWeight, fontStyle, lineHeight, letterSpacing, wordSpacing, textDecoration, textTransform, textOverflow, whiteSpace, direction, transform, boxShadow, textShadow, filters, backgroundClip, animations, transitions, position, top, right, bottom, left, zIndex, overflowX, overflowY, cursor, pointerEvents, userSelect, visible, boxSizing, objectFit);
    }

    /** Mutable builder; null arguments reset a field to its default. */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private IrDisplay display = IrDisplay.AUTO;
        private IrDimension width = IrDimension.AUTO;
        private IrDimension height = IrDimension.AUTO;
        private IrDimension minWidth = IrDimension.AUTO;
        private IrDimension minHeight = IrDimension.AUTO;
        private IrDimension maxWidth = IrDimension.AUTO;
        private IrDimension maxHeight = IrDimension.AUTO;
        private double aspectRatio = 0;
        private IrSpacing margin = IrSpacing.ZERO;
        private IrSpacing padding = IrSpacing.ZERO;
        private double gap = 0;
        private IrFlexDirection flexDirection = IrFlexDirection.ROW;
        private boolean flexWrap = false;
        private double flexGrow = 0;
        private double flexShrink = 1;
        private IrDimension flexBasis = IrDimension.AUTO;
        private IrAlignment justifyContent = IrAlignment.START;
        private IrAlignment alignItems = IrAlignment.STRETCH;
        private IrAlignment alignContent = IrAlignment.STRETCH;
        private IrAlignment alignSelf = IrAlignment.AUTO;
        private IrGridTemplate gridTemplateColumns = IrGridTemplate.NONE;
        private IrGridTemplate gridTemplateRows = IrGridTemplate.NONE;
        private IrGridPlacement gridColumn = IrGridPlacement.AUTO;
        private IrGridPlacement gridRow = IrGridPlacement.AUTO;
        private double rowGap = 0;
        private double columnGap = 0;
        private IrAlignment justifyItems = IrAlignment.STRETCH;
        private IrAlignment justifySelf = IrAlignment.AUTO;
        private IrColor background = IrColor.TRANSPARENT;
        private IrColor color = IrColor.INHERIT;
        private double opacity = 1;
        private double borderWidth = 0;
        private IrBorderStyle borderStyle = IrBorderStyle.NONE;
        private IrColor borderColor = IrColor.CURRENT_COLOR;
        private double borderRadius = 0;
        private IrTextAlign textAlign = IrTextAlign.START;
        private IrVerticalAlign verticalAlign = IrVerticalAlign.BASELINE;
        private String fontFamily = "";
        private IrDimension fontSize = IrDimension.AUTO;
        private int fontWeight = 400;
        private IrFontStyle fontStyle = IrFontStyle.NORMAL;
        private double lineHeight = 0;
        private double letterSpacing = 0;
        private double wordSpacing = 0;
        private List<IrTextDecoration> textDecoration = List.of();
        private IrTextTransform textTransform = IrTextTransform.NONE;
        private IrTextOverflow textOverflow = IrTextOverflow.CLIP;
        private IrWhiteSpace whiteSpace = IrWhiteSpace.NORMAL;
        private IrTextDirection direction = IrTextDirection.LTR;
        private IrTransform transform = IrTransform.IDENTITY;
        private IrShadow boxShadow = IrShadow.NONE;
        private IrShadow textShadow = IrShadow.NONE;
        private List<IrFilter> filters = List.of();
        private IrBackgroundClip backgroundClip = IrBackgroundClip.BORDER_BOX;
        private List<IrAnimation> animations = List.of();
        private List<IrTransition> transitions = List.of();
        private IrPositionMode position = IrPositionMode.STATIC;
        private IrDimension top = IrDimension.AUTO;
        private IrDimension right = IrDimension.AUTO;
        private IrDimension bottom = IrDimension.AUTO;
        private IrDimension left = IrDimension.AUTO;
        private Integer zIndex = null;
        private IrOverflow overflowX = IrOverflow.VISIBLE;
        private IrOverflow overflowY = IrOverflow.VISIBLE;
        private IrCursor cursor = IrCursor.AUTO;
        private IrPointerEvents pointerEvents = IrPointerEvents.AUTO;
        private IrUserSelect userSelect = IrUserSelect.AUTO;
        private boolean visible = true;
        private IrBoxSizing boxSizing = IrBoxSizing.CONTENT_BOX;
        private IrObjectFit objectFit = IrObjectFit.FILL;

        public Builder() {}

        public Builder display(IrDisplay display) {
            this.display = display == null ? IrDisplay.AUTO : display;
            return this;
        }

        public Builder width(IrDimension width) {
            this.width = width == null ? IrDimension.AUTO : width;
            return this;
        }

        public Builder height(IrDimension height) {
            this.height = height == null ? IrDimension.AUTO : height;
            return this;
        }

        public Builder minWidth(IrDimension minWidth) {
            this.minWidth = minWidth == null ? IrDimension.AUTO : minWidth;
            return this;
        }

        public Builder minHeight(IrDimension minHeight) {
            this.minHeight = minHeight == null ? IrDimension.AUTO : minHeight;
            return this;
        }

        public Builder maxWidth(IrDimension maxWidth) {
            this.maxWidth = maxWidth == null ? IrDimension.AUTO : maxWidth;
            return this;
        }

        public Builder maxHeight(IrDimension maxHeight) {
            this.maxHeight = maxHeight == null ? IrDimension.AUTO : maxHeight;
            return this;
        }

        public Builder aspectRatio(double aspectRatio) {
            this.aspectRatio = aspectRatio;
            return this;
        }

        public Builder margin(IrSpacing margin) {
            this.margin = margin == null ? IrSpacing.ZERO : margin;
            return this;
        }

        public Builder padding(IrSpacing padding) {
            this.padding = padding == null ? IrSpacing.ZERO : padding;
            return this;
        }

        public Builder gap(double gap) {
            this.gap = gap;
            return this;
        }

        public Builder flexDirection(IrFlexDirection flexDirection) {
            this.flexDirection = flexDirection == null ? IrFlexDirection.ROW : flexDirection;
            return this;
        }

        public Builder flexWrap(boolean flexWrap) {
            this.flexWrap = flexWrap;
            return this;
        }

        public Builder flexGrow(double flexGrow) {
            this.flexGrow = flexGrow;
            return this;
        }

        public Builder flexShrink(double flexShrink) {
            this.flexShrink = flexShrink;
            return this;
        }

        public Builder flexBasis(IrDimension flexBasis) {
            this.flexBasis = flexBasis == null ? IrDimension.AUTO : flexBasis;
            return this;
        }

        public Builder justifyContent(IrAlignment justifyContent) {
            this.justifyContent = justifyContent == null ? IrAlignment.START : justifyContent;
            return this;
        }

        public Builder alignItems(IrAlignment alignItems) {
            this.alignItems = alignItems == null ? IrAlignment.STRETCH : alignItems;
            return this;
        }

        public Builder alignContent(IrAlignment alignContent) {
            this.alignContent = alignContent == null ? IrAlignment.STRETCH : alignContent;
            return this;
        }

        public Builder alignSelf(IrAlignment alignSelf) {
            this.alignSelf = alignSelf == null ? IrAlignment.AUTO : alignSelf;
            return this;
        }

        public Builder gridTemplateColumns(IrGridTemplate gridTemplateColumns) {
            this.gridTemplateColumns = gridTemplateColumns == null ? IrGridTemplate.NONE : gridTemplateColumns;
            return this;
        }

        public Builder gridTemplateRows(IrGridTemplate gridTemplateRows) {
            this.gridTemplateRows = gridTemplateRows == null ? IrGridTemplate.NONE : gridTemplateRows;
            return this;
        }

        public Builder gridColumn(IrGridPlacement gridColumn) {
            this.gridColumn = gridColumn == null ? IrGridPlacement.AUTO : gridColumn;
            return this;
        }

        public Builder gridRow(IrGridPlacement gridRow) {
            this.gridRow = gridRow == null ? IrGridPlacement.AUTO : gridRow;
            return this;
        }

        public Builder rowGap(double rowGap) {
            this.rowGap = rowGap;
            return this;
        }

        public Builder columnGap(double columnGap) {
            this.columnGap = columnGap;
            return this;
        }

        public Builder justifyItems(IrAlignment justifyItems) {
            this.justifyItems = justifyItems == null ? IrAlignment.STRETCH : justifyItems;
            return this;
        }

        public Builder justifySelf(IrAlignment justifySelf) {
            this.justifySelf = justifySelf == null ? IrAlignment.AUTO : justifySelf;
            return this;
        }

        public Builder background(IrColor background) {
            this.background = background == null ? IrColor.TRANSPARENT : background;
            return this;
        }

        public Builder color(IrColor color) {
            this.color = color == null ? IrColor.INHERIT : color;
            return this;
        }

        public Builder opacity(double opacity) {
            this.opacity = opacity;
            return this;
        }

        public Builder borderWidth(double borderWidth) {
            this.borderWidth = borderWidth;
            return this;
        }

        public Builder borderStyle(IrBorderStyle borderStyle) {
            this.borderStyle = borderStyle == null ? IrBorderStyle.NONE : borderStyle;
            return this;
        }

        public Builder borderColor(IrColor borderColor) {
            this.borderColor = borderColor == null ? IrColor.CURRENT_COLOR : borderColor;
            return this;
        }

        public Builder borderRadius(double borderRadius) {
            this.borderRadius = borderRadius;
            return this;
        }

        public Builder textAlign(IrTextAlign textAlign) {
            this.textAlign = textAlign == null ? IrTextAlign.START : textAlign;
            return this;
        }

        public Builder verticalAlign(IrVerticalAlign verticalAlign) {
            this.verticalAlign = verticalAlign == null ? IrVerticalAlign.BASELINE : verticalAlign;
            return this;
        }

        public Builder fontFamily(String fontFamily) {
            this.fontFamily = fontFamily == null ? "" : fontFamily;
            return this;
        }

        public Builder fontSize(IrDimension fontSize) {
            this.fontSize = fontSize == null ? IrDimension.AUTO : fontSize;
            return this;
        }

        public Builder fontWeight(int fontWeight) {
            this.fontWeight = fontWeight;
            return this;
        }

        public Builder fontStyle(IrFontStyle fontStyle) {
            this.fontStyle = fontStyle == null ? IrFontStyle.NORMAL : fontStyle;
            return this;
        }

        public Builder lineHeight(double lineHeight) {
            this.lineHeight = lineHeight;
            return this;
        }

        public Builder letterSpacing(double letterSpacing) {
            this.letterSpacing = letterSpacing;
            return this;
        }

        public Builder wordSpacing(double wordSpacing) {
            this.wordSpacing = wordSpacing;
            return this;
        }

        public Builder textDecoration(List<IrTextDecoration> textDecoration) {
            this.textDecoration = textDecoration == null ? List.of() : List.copyOf(textDecoration);
            return this;
        }

        public Builder textTransform(IrTextTransform textTransform) {
            this.textTransform = textTransform == null ? IrTextTransform.NONE : textTransform;
            return this;
        }

        public Builder textOverflow(IrTextOverflow textOverflow) {
            this.textOverflow = textOverflow == null ? IrTextOverflow.CLIP : textOverflow;
            return this;
        }

        public Builder whiteSpace(IrWhiteSpace whiteSpace) {
            this.whiteSpace = whiteSpace == null ? IrWhiteSpace.NORMAL : whiteSpace;
            return this;
        }

        public Builder direction(IrTextDirection direction) {
            this.direction = direction == null ? IrTextDirection.LTR : direction;
            return this;
        }

        public Builder transform(IrTransform transform) {
            this.transform = transform == null ? IrTransform.IDENTITY : transform;
            return this;
        }

        public Builder boxShadow(IrShadow boxShadow) {
            this.boxShadow = boxShadow == null ? IrShadow.NONE : boxShadow;
            return this;
        }

        public Builder textShadow(IrShadow textShadow) {
            this.textShadow = textShadow == null ? IrShadow.NONE : textShadow;
            return this;
        }

        public Builder filters(List<IrFilter> filters) {
            this.filters = filters == null ? List.of() : List.copyOf(filters);
            return this;
        }

        public Builder backgroundClip(IrBackgroundClip backgroundClip) {
            this.backgroundClip = backgroundClip == null ? IrBackgroundClip.BORDER_BOX : backgroundClip;
            return this;
        }

        public Builder animations(List<IrAnimation> animations) {
            this.animations = animations == null ? List.of() : List.copyOf(animations);
            return this;
        }

        public Builder transitions(List<IrTransition> transitions) {
            this.transitions = transitions == null ? List.of() : List.copyOf(transitions);
            return this;
        }

        public Builder position(IrPositionMode position) {
            this.position = position == null ? IrPositionMode.STATIC : position;
            return this;
        }

        public Builder top(IrDimension top) {
            this.top = top == null ? IrDimension.AUTO : top;
            return this;
        }

        public Builder right(IrDimension right) {
            this.right = right == null ? IrDimension.AUTO : right;
            return this;
        }

        public Builder bottom(IrDimension bottom) {
            this.bottom = bottom == null ? IrDimension.AUTO : bottom;
            return this;
        }

        public Builder left(IrDimension left) {
            this.left = left == null ? IrDimension.AUTO : left;
            return this;
        }

        public Builder zIndex(Integer zIndex) {
            this.zIndex = zIndex;
            return this;
        }

        public Builder overflowX(IrOverflow overflowX) {
            this.overflowX = overflowX == null ? IrOverflow.VISIBLE : overflowX;
            return this;
        }

        public Builder overflowY(IrOverflow overflowY) {
            this.overflowY = overflowY == null ? IrOverflow.VISIBLE : overflowY;
            return this;
        }

        public Builder cursor(IrCursor cursor) {
            this.cursor = cursor == null ? IrCursor.AUTO : cursor;
            return this;
        }

        public Builder pointerEvents(IrPointerEvents pointerEvents) {
            this.pointerEvents = pointerEvents == null ? IrPointerEvents.AUTO : pointerEvents;
            return this;
        }

        public Builder userSelect(IrUserSelect userSelect) {
            this.userSelect = userSelect == null ? IrUserSelect.AUTO : userSelect;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder boxSizing(IrBoxSizing boxSizing) {
            this.boxSizing = boxSizing == null ? IrBoxSizing.CONTENT_BOX : boxSizing;
            return this;
        }

        public Builder objectFit(IrObjectFit objectFit) {
            this.objectFit = objectFit == null ? IrObjectFit.FILL : objectFit;
            return this;
        }

        public IrStyle build() {
            return new IrStyle(this);
        }
    }
}
