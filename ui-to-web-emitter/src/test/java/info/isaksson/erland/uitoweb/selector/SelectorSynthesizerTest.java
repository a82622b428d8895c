package info.isaksson.erland.uitoweb.selector;

import info.isaksson.erland.uitoweb.emitter.EmitterWarning;
import info.isaksson.erland.uitoweb.emitter.EmitterWarnings;
import info.isaksson.erland.uitoweb.emitter.WarningCodes;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrComponentType;
import info.isaksson.erland.uitoweb.ir.IrSelectorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SelectorSynthesizerTest {

    private final SelectorSynthesizer synth = new SelectorSynthesizer();

    @Test
    void classListBecomesCompoundSelector() {
        assertEquals(".btn.primary", SelectorSynthesizer.classesToSelector("btn primary"));
        assertEquals(".a.b", SelectorSynthesizer.classesToSelector("  a   b "));
        assertEquals("", SelectorSynthesizer.classesToSelector(""));
        assertEquals("", SelectorSynthesizer.classesToSelector(null));
    }

    @Test
    void elementHintYieldsBareTag() {
        IrComponent header = IrComponent.builder(IrComponentType.CONTAINER).id(4).elementSelector("header").build();
        assertEquals("header", synth.selectorFor(header));
    }

    @Test
    void invalidElementHintFallsBackToClassSelector() {
        IrComponent odd = IrComponent.builder(IrComponentType.ROW).id(5).elementSelector("not a tag").build();
        assertEquals(".row-5", synth.selectorFor(odd));

        assertTrue(SelectorSynthesizer.isValidElementName("my-widget"));
        assertFalse(SelectorSynthesizer.isValidElementName("1st"));
        assertFalse(SelectorSynthesizer.isValidElementName("a b"));
        assertFalse(SelectorSynthesizer.isValidElementName(null));
    }

    @Test
    void idHintYieldsIdSelector() {
        IrComponent main = new IrComponent(5, IrComponentType.CONTAINER, "main", IrSelectorKind.ID,
                null, null, null, null, null, null, null, null, null);
        assertEquals("#main", synth.selectorFor(main));
    }

    @Test
    void defaultDeriverUsesExplicitClassOrVariantAndId() {
        IrComponent plain = IrComponent.builder(IrComponentType.BUTTON).id(3).build();
        assertEquals(".button-3", synth.selectorFor(plain));

        IrComponent styled = IrComponent.builder(IrComponentType.BUTTON).id(3).cssClass("btn  primary").build();
        assertEquals(".btn.primary", synth.selectorFor(styled));

        IrComponent unknown = IrComponent.builder(IrComponentType.UNKNOWN).id(9).build();
        assertEquals(".container-9", synth.selectorFor(unknown));
    }

    @Test
    void failingDeriverDegradesToEmptySelector() {
        SelectorSynthesizer failing = new SelectorSynthesizer(c -> {
            throw new ClassNameDerivationException("no name for " + c.id);
        });
        EmitterWarnings w = new EmitterWarnings();

        String sel = failing.selectorFor(IrComponent.builder(IrComponentType.TEXT).id(2).build(), w);

        assertEquals("", sel);
        List<EmitterWarning> out = w.toDeterministicList();
        assertEquals(1, out.size());
        assertEquals(WarningCodes.CLASS_NAME_DERIVATION_FAILED, out.get(0).code);
        assertEquals("2", out.get(0).context.get("componentId"));
    }

    @Test
    void blankDerivedClassesYieldEmptySelector() {
        SelectorSynthesizer blank = new SelectorSynthesizer(c -> "   ");
        assertEquals("", blank.selectorFor(IrComponent.builder(IrComponentType.TEXT).build()));
    }

    @Test
    void pseudoSelectorAppendsState() {
        assertEquals(".btn:hover", SelectorSynthesizer.selectorForPseudo(".btn", "hover"));
        assertEquals("", SelectorSynthesizer.selectorForPseudo("", "hover"));
    }

    @Test
    void extractBaseClassRecoversFirstClassToken() {
        assertEquals("btn", SelectorSynthesizer.extractBaseClass(".btn.primary:hover"));
        assertEquals("card-7", SelectorSynthesizer.extractBaseClass(".card-7"));
        assertEquals("nav", SelectorSynthesizer.extractBaseClass(".nav a"));
        assertEquals("item", SelectorSynthesizer.extractBaseClass(".item[data-x]"));
        assertEquals("", SelectorSynthesizer.extractBaseClass(""));

        String sel = synth.selectorFor(IrComponent.builder(IrComponentType.ROW).id(11).cssClass("toolbar dense").build());
        assertEquals("toolbar", SelectorSynthesizer.extractBaseClass(sel));
    }

    @Test
    void selectorConvertsBackToClassAttribute() {
        assertEquals("btn primary", SelectorSynthesizer.selectorToClassList(".btn.primary"));
        assertEquals("", SelectorSynthesizer.selectorToClassList("header"));
        assertEquals("", SelectorSynthesizer.selectorToClassList("#main"));
        assertEquals("", SelectorSynthesizer.selectorToClassList(""));
    }

    @Test
    void selectorKindPredicates() {
        assertTrue(SelectorSynthesizer.isElementSelector("div"));
        assertFalse(SelectorSynthesizer.isElementSelector("div span"));
        assertFalse(SelectorSynthesizer.isElementSelector(".a"));

        assertTrue(SelectorSynthesizer.isClassSelector(".a"));
        assertFalse(SelectorSynthesizer.isClassSelector(".a:hover"));

        assertTrue(SelectorSynthesizer.isIdSelector("#x"));
        assertFalse(SelectorSynthesizer.isIdSelector("x"));

        assertFalse(SelectorSynthesizer.isElementSelector(""));
        assertFalse(SelectorSynthesizer.isClassSelector(null));
    }
}
