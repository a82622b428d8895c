package info.isaksson.erland.uitoweb.classify;

import info.isaksson.erland.uitoweb.emitter.EmitterWarning;
import info.isaksson.erland.uitoweb.emitter.EmitterWarnings;
import info.isaksson.erland.uitoweb.emitter.WarningCodes;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrComponentType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ClassificationTableTest {

    @Test
    void everyKnownVariantHasACompleteEntry() {
        for (IrComponentType t : IrComponentType.values()) {
            if (t == IrComponentType.UNKNOWN) continue;
            assertTrue(ClassificationTable.isKnown(t), t.name());
            ClassificationEntry e = ClassificationTable.classify(t);
            assertNotNull(e, t.name());
            assertFalse(e.className.isEmpty(), t.name());
            assertFalse(e.tagName.isEmpty(), t.name());
            assertFalse(e.defaultDisplay.isEmpty(), t.name());
        }
        assertEquals(IrComponentType.values().length - 1, ClassificationTable.entries().size());
    }

    @Test
    void unknownAndNullResolveToTheContainerEntry() {
        ClassificationEntry container = ClassificationTable.classify(IrComponentType.CONTAINER);
        assertEquals(container, ClassificationTable.classify(IrComponentType.UNKNOWN));
        assertEquals(container, ClassificationTable.classify(null));
        assertFalse(ClassificationTable.isKnown(IrComponentType.UNKNOWN));
        assertFalse(ClassificationTable.isKnown(null));
    }

    @Test
    void fallbackIsRecordedAsWarning() {
        EmitterWarnings w = new EmitterWarnings();
        ClassificationTable.classify(IrComponent.builder(IrComponentType.BUTTON).id(1).build(), w);
        assertTrue(w.isEmpty());

        ClassificationEntry e = ClassificationTable.classify(IrComponent.builder(IrComponentType.UNKNOWN).id(7).build(), w);
        assertEquals("container", e.className);

        List<EmitterWarning> out = w.toDeterministicList();
        assertEquals(1, out.size());
        assertEquals(WarningCodes.UNKNOWN_VARIANT, out.get(0).code);
        assertEquals("UNKNOWN", out.get(0).context.get("type"));
        assertEquals("7", out.get(0).context.get("componentId"));
    }

    @Test
    void eachUnknownNodeGetsItsOwnWarning() {
        EmitterWarnings w = new EmitterWarnings();
        ClassificationTable.classify(IrComponent.builder(IrComponentType.UNKNOWN).id(3).build(), w);
        ClassificationTable.classify(IrComponent.builder(IrComponentType.UNKNOWN).id(4).build(), w);
        ClassificationTable.classify((IrComponent) null, w);

        List<EmitterWarning> out = w.toDeterministicList();
        assertEquals(3, out.size());
        assertTrue(out.get(0).context.isEmpty());
        assertEquals("3", out.get(1).context.get("componentId"));
        assertEquals("4", out.get(2).context.get("componentId"));
    }

    @Test
    void onlyVoidElementsAreSelfClosing() {
        Set<IrComponentType> selfClosing = EnumSet.noneOf(IrComponentType.class);
        for (Map.Entry<IrComponentType, ClassificationEntry> e : ClassificationTable.entries().entrySet()) {
            if (e.getValue().selfClosing) selfClosing.add(e.getKey());
        }
        assertEquals(EnumSet.of(IrComponentType.INPUT, IrComponentType.CHECKBOX,
                IrComponentType.IMAGE, IrComponentType.HORIZONTAL_RULE), selfClosing);
    }

    @Test
    void semanticTagsAndBrowserDisplays() {
        ClassificationEntry button = ClassificationTable.classify(IrComponentType.BUTTON);
        assertEquals("button", button.tagName);
        assertEquals("inline-block", button.defaultDisplay);
        assertTrue(button.form);
        assertFalse(button.container);

        ClassificationEntry cell = ClassificationTable.classify(IrComponentType.TABLE_CELL);
        assertEquals("td", cell.tagName);
        assertEquals("table-cell", cell.defaultDisplay);

        assertEquals("li", ClassificationTable.classify(IrComponentType.LIST_ITEM).tagName);
        assertEquals("list-item", ClassificationTable.classify(IrComponentType.LIST_ITEM).defaultDisplay);
        assertEquals("span", ClassificationTable.classify(IrComponentType.TEXT).tagName);
        assertEquals("inline", ClassificationTable.classify(IrComponentType.TEXT).defaultDisplay);
        assertTrue(ClassificationTable.classify(IrComponentType.CANVAS).inlineDimensions);
        assertEquals("none", ClassificationTable.classify(IrComponentType.FOR_EACH).defaultDisplay);
    }

    @Test
    void classNamesAreKebabCaseVariantNames() {
        assertEquals("table-header-cell", ClassificationTable.classify(IrComponentType.TABLE_HEADER_CELL).className);
        assertEquals("code-inline", ClassificationTable.classify(IrComponentType.CODE_INLINE).className);
        assertEquals("flowchart-node", ClassificationTable.classify(IrComponentType.FLOWCHART_NODE).className);
    }
}
