package info.isaksson.erland.uitoweb.css;

import info.isaksson.erland.uitoweb.ir.IrAlignment;
import info.isaksson.erland.uitoweb.ir.IrAnimatedProperty;
import info.isaksson.erland.uitoweb.ir.IrAnimation;
import info.isaksson.erland.uitoweb.ir.IrColor;
import info.isaksson.erland.uitoweb.ir.IrDimension;
import info.isaksson.erland.uitoweb.ir.IrDimensionUnit;
import info.isaksson.erland.uitoweb.ir.IrDisplay;
import info.isaksson.erland.uitoweb.ir.IrEasing;
import info.isaksson.erland.uitoweb.ir.IrFilter;
import info.isaksson.erland.uitoweb.ir.IrFilterKind;
import info.isaksson.erland.uitoweb.ir.IrGradientStop;
import info.isaksson.erland.uitoweb.ir.IrGridPlacement;
import info.isaksson.erland.uitoweb.ir.IrGridRepeatMode;
import info.isaksson.erland.uitoweb.ir.IrGridTemplate;
import info.isaksson.erland.uitoweb.ir.IrGridTrack;
import info.isaksson.erland.uitoweb.ir.IrGridTrackKind;
import info.isaksson.erland.uitoweb.ir.IrShadow;
import info.isaksson.erland.uitoweb.ir.IrSpacing;
import info.isaksson.erland.uitoweb.ir.IrTextDecoration;
import info.isaksson.erland.uitoweb.ir.IrTransform;
import info.isaksson.erland.uitoweb.ir.IrTransition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CssValueFormatsTest {

    @Test
    void numbersKeepAtMostTwoDecimals() {
        assertEquals("16", CssValueFormats.number(16.0));
        assertEquals("50.5", CssValueFormats.number(50.5));
        assertEquals("0.33", CssValueFormats.number(1.0 / 3));
        assertEquals("0", CssValueFormats.number(0.001));
        assertEquals("0", CssValueFormats.number(Double.NaN));
        assertEquals("-4", CssValueFormats.number(-4));
    }

    @Test
    void dimensionsCarryTheirUnit() {
        assertEquals("16px", CssValueFormats.dimension(IrDimension.px(16)));
        assertEquals("50%", CssValueFormats.dimension(IrDimension.percent(50)));
        assertEquals("100vh", CssValueFormats.dimension(IrDimension.of(100, IrDimensionUnit.VH)));
        assertEquals("1.5rem", CssValueFormats.dimension(IrDimension.of(1.5, IrDimensionUnit.REM)));
        assertEquals("auto", CssValueFormats.dimension(IrDimension.AUTO));
        assertEquals("0", CssValueFormats.dimension(IrDimension.px(0)));
        assertEquals("0fr", CssValueFormats.dimension(IrDimension.of(0, IrDimensionUnit.FR)));
        assertNull(CssValueFormats.dimension(null));

        assertEquals("none", CssValueFormats.maxDimension(IrDimension.AUTO));
        assertEquals("medium", CssValueFormats.fontSize(IrDimension.AUTO));
        assertEquals("14px", CssValueFormats.fontSize(IrDimension.px(14)));
    }

    @Test
    void spacingUsesShortestShorthand() {
        assertEquals("4px", CssValueFormats.spacing(IrSpacing.px(4, 4, 4, 4)));
        assertEquals("1px 2px", CssValueFormats.spacing(IrSpacing.px(1, 2, 1, 2)));
        assertEquals("1px 2px 3px", CssValueFormats.spacing(IrSpacing.px(1, 2, 3, 2)));
        assertEquals("1px 2px 3px 4px", CssValueFormats.spacing(IrSpacing.px(1, 2, 3, 4)));
        assertEquals("0", CssValueFormats.spacing(IrSpacing.ZERO));
    }

    @Test
    void solidColorsUseHexOrRgba() {
        assertEquals("#ff0080", CssValueFormats.color(IrColor.rgb(255, 0, 128)));
        assertEquals("rgba(0, 0, 0, 0.5)", CssValueFormats.color(IrColor.rgba(0, 0, 0, 128)));
        assertEquals("rgba(10, 20, 30, 0)", CssValueFormats.color(IrColor.rgba(10, 20, 30, 0)));
        assertEquals("transparent", CssValueFormats.color(IrColor.TRANSPARENT));
        assertEquals("currentColor", CssValueFormats.color(IrColor.CURRENT_COLOR));
    }

    @Test
    void variableColorsBecomeVarReferences() {
        assertEquals("var(--color-3)", CssValueFormats.color(IrColor.themeVar(3)));
        assertEquals("var(--primary)", CssValueFormats.color(IrColor.namedVar("primary")));
        assertEquals("var(--accent)", CssValueFormats.color(IrColor.namedVar("--accent")));
        assertEquals("transparent", CssValueFormats.color(IrColor.namedVar(" ")));
    }

    @Test
    void gradientsListStopsInOrder() {
        List<IrGradientStop> stops = List.of(
                new IrGradientStop(0, IrColor.rgb(255, 0, 0)),
                new IrGradientStop(1, IrColor.rgb(0, 0, 255)));

        assertEquals("linear-gradient(90deg, #ff0000 0%, #0000ff 100%)",
                CssValueFormats.color(IrColor.linearGradient(90, stops)));
        assertEquals("radial-gradient(circle at 50% 25%, #ff0000 0%, #0000ff 100%)",
                CssValueFormats.color(IrColor.radialGradient(0.5, 0.25, stops)));
        assertEquals("conic-gradient(from 0deg at 50% 50%, #ff0000 0%, #0000ff 100%)",
                CssValueFormats.color(IrColor.conicGradient(0.5, 0.5, stops)));
    }

    @Test
    void degenerateGradientsAreTransparent() {
        assertEquals("transparent", CssValueFormats.color(IrColor.linearGradient(0,
                List.of(new IrGradientStop(0, IrColor.rgb(1, 2, 3))))));

        IrColor inner = IrColor.linearGradient(0, List.of(
                new IrGradientStop(0, IrColor.rgb(0, 0, 0)),
                new IrGradientStop(1, IrColor.rgb(255, 255, 255))));
        String nested = CssValueFormats.color(IrColor.linearGradient(180, List.of(
                new IrGradientStop(0, inner),
                new IrGradientStop(1, IrColor.rgb(255, 255, 255)))));
        assertEquals("linear-gradient(180deg, transparent 0%, #ffffff 100%)", nested);
    }

    @Test
    void keywordsAndAlignment() {
        assertEquals("inline-block", CssValueFormats.display(IrDisplay.INLINE_BLOCK));
        assertNull(CssValueFormats.display(IrDisplay.AUTO));
        assertEquals("flex-start", CssValueFormats.alignment(IrAlignment.START));
        assertEquals("flex-end", CssValueFormats.alignment(IrAlignment.END));
        assertEquals("space-between", CssValueFormats.alignment(IrAlignment.SPACE_BETWEEN));
    }

    @Test
    void easingPresetsExpandToCubicBezier() {
        assertEquals("ease-in-out", CssValueFormats.easing(IrEasing.EASE_IN_OUT));
        assertEquals("linear", CssValueFormats.easing(IrEasing.LINEAR));
        assertEquals("cubic-bezier(0.215, 0.61, 0.355, 1)", CssValueFormats.easing(IrEasing.EASE_OUT_CUBIC));
        assertEquals("step-end", CssValueFormats.easing(IrEasing.STEP_END));
    }

    @Test
    void fontWeightUsesNamedValuesWhereTheyExist() {
        assertEquals("normal", CssValueFormats.fontWeight(400));
        assertEquals("normal", CssValueFormats.fontWeight(0));
        assertEquals("bold", CssValueFormats.fontWeight(700));
        assertEquals("600", CssValueFormats.fontWeight(600));
    }

    @Test
    void textDecorationsFollowDeclarationOrder() {
        assertEquals("none", CssValueFormats.textDecoration(List.of()));
        assertEquals("underline line-through", CssValueFormats.textDecoration(
                List.of(IrTextDecoration.LINE_THROUGH, IrTextDecoration.UNDERLINE, IrTextDecoration.UNDERLINE)));
    }

    @Test
    void gridTemplatesAndPlacements() {
        assertEquals("100px 1fr auto", CssValueFormats.gridTemplate(IrGridTemplate.tracks(List.of(
                IrGridTrack.px(100), IrGridTrack.fr(1), IrGridTrack.of(IrGridTrackKind.AUTO)))));
        assertEquals("repeat(3, 1fr)", CssValueFormats.gridTemplate(
                IrGridTemplate.repeat(IrGridRepeatMode.COUNT, 3, IrGridTrack.fr(1))));
        assertEquals("repeat(auto-fill, minmax(200px, 1fr))", CssValueFormats.gridTemplate(
                IrGridTemplate.repeatMinMax(IrGridRepeatMode.AUTO_FILL, 0, IrGridTrack.px(200), IrGridTrack.fr(1))));
        assertEquals("none", CssValueFormats.gridTemplate(IrGridTemplate.NONE));

        assertEquals("auto", CssValueFormats.gridPlacement(IrGridPlacement.AUTO));
        assertEquals("2", CssValueFormats.gridPlacement(new IrGridPlacement(1, -1)));
        assertEquals("1 / 3", CssValueFormats.gridPlacement(new IrGridPlacement(0, 2)));
    }

    @Test
    void transformsListOnlyNonIdentityParts() {
        assertEquals("none", CssValueFormats.transform(IrTransform.IDENTITY));
        assertEquals("rotate(45deg)", CssValueFormats.transform(new IrTransform(0, 0, null, null, 45)));
        assertEquals("translate(10px, 0) scale(2, 2) rotate(45deg)",
                CssValueFormats.transform(new IrTransform(10, 0, 2.0, 2.0, 45)));
    }

    @Test
    void shadows() {
        assertEquals("none", CssValueFormats.boxShadow(IrShadow.NONE));
        assertEquals("0 2px 4px 0 rgba(0, 0, 0, 0.25)",
                CssValueFormats.boxShadow(IrShadow.of(0, 2, 4, 0, IrColor.rgba(0, 0, 0, 64))));
        assertEquals("inset 1px 1px 0 0 #000000",
                CssValueFormats.boxShadow(new IrShadow(true, 1, 1, 0, 0, IrColor.rgb(0, 0, 0), true)));
        assertEquals("1px 1px 2px #000000",
                CssValueFormats.textShadow(IrShadow.of(1, 1, 2, 5, IrColor.rgb(0, 0, 0))));
    }

    @Test
    void filterFunctionsUseTheirUnits() {
        assertEquals("none", CssValueFormats.filters(List.of()));
        assertEquals("blur(4px) hue-rotate(90deg) brightness(1.2)", CssValueFormats.filters(List.of(
                new IrFilter(IrFilterKind.BLUR, 4),
                new IrFilter(IrFilterKind.HUE_ROTATE, 90),
                new IrFilter(IrFilterKind.BRIGHTNESS, 1.2))));
    }

    @Test
    void animationAndTransitionShorthands() {
        IrAnimation pulse = new IrAnimation("pulse", 1.5, 0, IrEasing.EASE_IN_OUT, -1, true, null);
        IrAnimation fade = new IrAnimation("fade", 0.25, 0.1, IrEasing.LINEAR, 3, false, null);
        IrAnimation once = new IrAnimation("once", 1, 0, null, null, false, null);

        assertEquals("pulse 1.5s ease-in-out 0s infinite alternate", CssValueFormats.animations(List.of(pulse)));
        assertEquals("fade 0.25s linear 0.1s 3, once 1s ease 0s", CssValueFormats.animations(List.of(fade, once)));
        assertEquals("none", CssValueFormats.animations(List.of()));

        assertEquals("opacity 0.3s ease 0s, background-color 1s linear 0.5s", CssValueFormats.transitions(List.of(
                new IrTransition(IrAnimatedProperty.OPACITY, 0.3, 0, null),
                new IrTransition(IrAnimatedProperty.BACKGROUND_COLOR, 1, 0.5, IrEasing.LINEAR))));
    }

    @Test
    void scalarKeywords() {
        assertEquals("normal", CssValueFormats.lineHeight(0));
        assertEquals("1.4", CssValueFormats.lineHeight(1.4));
        assertEquals("normal", CssValueFormats.textSpacing(0));
        assertEquals("0.5px", CssValueFormats.textSpacing(0.5));
        assertEquals("normal", CssValueFormats.lineHeight(0.004));
        assertEquals("normal", CssValueFormats.textSpacing(0.004));
        assertEquals("normal", CssValueFormats.textSpacing(-0.001));
        assertEquals("auto", CssValueFormats.aspectRatio(0));
        assertEquals("auto", CssValueFormats.aspectRatio(0.001));
        assertEquals("1.78", CssValueFormats.aspectRatio(16.0 / 9));
        assertEquals("auto", CssValueFormats.zIndex(null));
        assertEquals("-1", CssValueFormats.zIndex(-1));
        assertEquals("hidden", CssValueFormats.visibility(false));
        assertEquals("nowrap", CssValueFormats.flexWrap(false));
        assertEquals("inherit", CssValueFormats.fontFamily(""));
        assertEquals("Inter, sans-serif", CssValueFormats.fontFamily(" Inter, sans-serif "));
    }
}
