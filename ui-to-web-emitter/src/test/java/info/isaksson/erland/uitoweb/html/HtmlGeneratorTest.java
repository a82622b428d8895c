package info.isaksson.erland.uitoweb.html;

import info.isaksson.erland.uitoweb.emitter.EmitterWarning;
import info.isaksson.erland.uitoweb.emitter.WarningCodes;
import info.isaksson.erland.uitoweb.ir.ComponentDataKeys;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrComponentType;
import info.isaksson.erland.uitoweb.ir.IrDimension;
import info.isaksson.erland.uitoweb.ir.IrDisplay;
import info.isaksson.erland.uitoweb.ir.IrFlowchart;
import info.isaksson.erland.uitoweb.ir.IrFlowchartNode;
import info.isaksson.erland.uitoweb.ir.IrManifest;
import info.isaksson.erland.uitoweb.ir.IrSelectorKind;
import info.isaksson.erland.uitoweb.ir.IrStyle;
import info.isaksson.erland.uitoweb.svg.SvgOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HtmlGeneratorTest {

    private static IrComponent helloGo() {
        return IrComponent.builder(IrComponentType.CONTAINER).id(1)
                .style(IrStyle.builder().display(IrDisplay.FLEX).build())
                .child(IrComponent.builder(IrComponentType.TEXT).id(2).text("Hello").build())
                .child(IrComponent.builder(IrComponentType.BUTTON).id(3).text("Go").build())
                .build();
    }

    private static String body(IrComponent root) {
        return new HtmlGenerator().generate(root).html;
    }

    @Test
    void generatesCompleteDocument() {
        String expected =
                "<!DOCTYPE html>\n" +
                "<html lang=\"en\">\n" +
                "<head>\n" +
                "  <meta charset=\"UTF-8\">\n" +
                "  <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n" +
                "  <title>Web Application</title>\n" +
                "  <link rel=\"stylesheet\" href=\"styles.css\">\n" +
                "</head>\n" +
                "<body>\n" +
                "  <div class=\"container-1\">\n" +
                "    <span class=\"text-2\">\n" +
                "      Hello\n" +
                "    </span>\n" +
                "    <button class=\"button-3\" type=\"button\">\n" +
                "      Go\n" +
                "    </button>\n" +
                "  </div>\n" +
                "</body>\n" +
                "</html>\n";

        HtmlGenerator.Result r = new HtmlGenerator().generate(helloGo());

        assertEquals(expected, r.html);
        assertTrue(r.warnings.isEmpty());
    }

    @Test
    void minifiedOutputHasNoIndentation() {
        HtmlGenerator gen = new HtmlGenerator(HtmlOptions.defaults().withMinify(true), null);
        String html = gen.generate(helloGo()).html;

        for (String line : html.split("\n")) {
            assertFalse(line.startsWith(" "), line);
        }
        assertTrue(html.contains("<button class=\"button-3\" type=\"button\">\nGo\n</button>\n"));
    }

    @Test
    void selfClosingElementsDropChildren() {
        IrComponent input = IrComponent.builder(IrComponentType.INPUT).id(4).payload("Your name")
                .child(IrComponent.builder(IrComponentType.TEXT).id(5).text("ignored").build())
                .build();

        String html = body(IrComponent.builder(IrComponentType.COLUMN).id(1).child(input).build());

        assertTrue(html.contains("<input class=\"input-4\" placeholder=\"Your name\" type=\"text\" />\n"), html);
        assertFalse(html.contains("ignored"));
        assertFalse(html.contains("</input>"));
    }

    @Test
    void textAndAttributesAreEscaped() {
        IrComponent root = IrComponent.builder(IrComponentType.CONTAINER).id(1)
                .child(IrComponent.builder(IrComponentType.TEXT).id(2).text("<b>Tom & \"Jerry\"</b>").build())
                .child(IrComponent.builder(IrComponentType.IMAGE).id(3).payload("a.png?x=1&y=2").text("it's").build())
                .build();

        String html = body(root);

        assertTrue(html.contains("&lt;b&gt;Tom &amp; &quot;Jerry&quot;&lt;/b&gt;"));
        assertTrue(html.contains("<img class=\"image-3\" src=\"a.png?x=1&amp;y=2\" alt=\"it&#x27;s\" />"), html);
    }

    @Test
    void headingLevelsAndListKindsPickTheTag() {
        IrComponent root = IrComponent.builder(IrComponentType.MARKDOWN).id(1)
                .child(IrComponent.builder(IrComponentType.HEADING).id(2).text("Intro").data(ComponentDataKeys.HEADING_LEVEL, "3").build())
                .child(IrComponent.builder(IrComponentType.HEADING).id(3).text("Deep").data(ComponentDataKeys.HEADING_LEVEL, "9").build())
                .child(IrComponent.builder(IrComponentType.LIST).id(4)
                        .data(ComponentDataKeys.LIST_ORDERED, "true").data(ComponentDataKeys.LIST_START, "3")
                        .child(IrComponent.builder(IrComponentType.LIST_ITEM).id(5).text("third")
                                .data(ComponentDataKeys.LIST_ITEM_NUMBER, "3").build())
                        .build())
                .child(IrComponent.builder(IrComponentType.LIST).id(6).build())
                .build();

        String html = body(root);

        assertTrue(html.contains("<h3 class=\"heading-2\">"));
        assertTrue(html.contains("</h3>"));
        assertTrue(html.contains("<h6 class=\"heading-3\">"));
        assertTrue(html.contains("<ol class=\"list-4\" start=\"3\">"));
        assertTrue(html.contains("<li class=\"list-item-5\" value=\"3\">"));
        assertTrue(html.contains("<ul class=\"list-6\">"));
    }

    @Test
    void typeSpecificAttributes() {
        IrComponent root = IrComponent.builder(IrComponentType.CONTAINER).id(1)
                .child(IrComponent.builder(IrComponentType.CHECKBOX).id(2).text("Agree").build())
                .child(IrComponent.builder(IrComponentType.LINK).id(3).payload("https://example.org")
                        .data(ComponentDataKeys.LINK_TITLE, "Example").text("site").build())
                .child(IrComponent.builder(IrComponentType.TABLE_CELL).id(4)
                        .data(ComponentDataKeys.CELL_COLSPAN, "2").data(ComponentDataKeys.CELL_ROWSPAN, "1").build())
                .child(IrComponent.builder(IrComponentType.CANVAS).id(5)
                        .style(IrStyle.builder().width(IrDimension.px(320.4)).height(IrDimension.percent(50)).build())
                        .build())
                .build();

        String html = body(root);

        assertTrue(html.contains("<input class=\"checkbox-2\" type=\"checkbox\" data-label=\"Agree\" />"));
        assertTrue(html.contains("<a class=\"link-3\" href=\"https://example.org\" title=\"Example\">"));
        assertTrue(html.contains("<td class=\"table-cell-4\" colspan=\"2\">"));
        assertTrue(html.contains("<canvas class=\"canvas-5\" width=\"320\">"));
    }

    @Test
    void codeBlockWrapsEscapedSource() {
        IrComponent code = IrComponent.builder(IrComponentType.CODE_BLOCK).id(6)
                .data(ComponentDataKeys.CODE_LANGUAGE, "java").text("if (a < b) {}").build();

        String html = body(IrComponent.builder(IrComponentType.MARKDOWN).id(1).child(code).build());

        assertTrue(html.contains("<pre class=\"code-block-6\" data-language=\"java\">\n"
                + "      <code class=\"language-java\">if (a &lt; b) {}</code>\n"
                + "    </pre>"), html);
    }

    @Test
    void selectorHintsShapeTagsAndAttributes() {
        IrComponent root = IrComponent.builder(IrComponentType.CONTAINER).id(1)
                .child(IrComponent.builder(IrComponentType.CONTAINER).id(2).elementSelector("nav").build())
                .child(new IrComponent(3, IrComponentType.CONTAINER, "main", IrSelectorKind.ID,
                        null, null, null, null, null, null, null, null, null))
                .child(IrComponent.builder(IrComponentType.ROW).id(4).tag("Toolbar").build())
                .child(IrComponent.builder(IrComponentType.ROW).id(5).elementSelector("not a tag").build())
                .build();

        String html = body(root);

        assertTrue(html.contains("<nav>\n"));
        assertTrue(html.contains("</nav>"));
        assertTrue(html.contains("<div id=\"main\">"));
        assertTrue(html.contains("<div class=\"row-4\" data-tag=\"Toolbar\">"));
        assertTrue(html.contains("<div class=\"row-5\">\n"));
        assertFalse(html.contains("not a tag"));
    }

    @Test
    void preservedIdsUseTypePrefixes() {
        HtmlGenerator gen = new HtmlGenerator(HtmlOptions.defaults().withPreserveIds(true), null);

        String html = gen.generate(helloGo()).html;

        assertTrue(html.contains("<div id=\"elem-1\" class=\"container-1\">"));
        assertTrue(html.contains("<button id=\"btn-3\" class=\"button-3\" type=\"button\">"));
    }

    @Test
    void bodyTaggedRootBecomesBodyElement() {
        IrComponent root = IrComponent.builder(IrComponentType.CONTAINER).id(1).tag(ComponentDataKeys.TAG_BODY)
                .child(IrComponent.builder(IrComponentType.TEXT).id(2).text("Hi").build())
                .build();

        String html = body(root);

        assertTrue(html.contains("<body class=\"container-1\">\n  <span class=\"text-2\">"), html);
        assertFalse(html.contains("data-tag"));
        assertFalse(html.contains("<div"));
    }

    @Test
    void bodyKeepsItsIdHint() {
        IrComponent root = new IrComponent(1, IrComponentType.CONTAINER, ComponentDataKeys.TAG_BODY, IrSelectorKind.ID,
                null, null, null, null, null, null, null, null, null);

        String html = body(root);

        assertTrue(html.contains("<body id=\"" + ComponentDataKeys.TAG_BODY + "\">"), html);
        assertFalse(html.contains("data-tag"));
    }

    @Test
    void bodyTaggedFirstChildReplacesRoot() {
        IrComponent root = IrComponent.builder(IrComponentType.CONTAINER).id(1)
                .child(IrComponent.builder(IrComponentType.COLUMN).id(2).tag(ComponentDataKeys.TAG_BODY)
                        .child(IrComponent.builder(IrComponentType.TEXT).id(3).text("inside").build())
                        .build())
                .child(IrComponent.builder(IrComponentType.TEXT).id(4).text("outside").build())
                .build();

        String html = body(root);

        assertTrue(html.contains("<body class=\"column-2\">"));
        assertTrue(html.contains("inside"));
        assertFalse(html.contains("outside"));
        assertFalse(html.contains("container-1"));
    }

    @Test
    void inlineStylesheetReplacesLink() {
        HtmlGenerator gen = new HtmlGenerator(HtmlOptions.defaults().withInlineCss(true).withRuntime(true, "app.js"), null);

        String html = gen.generate(helloGo(), IrManifest.EMPTY).html;

        assertTrue(html.contains("  <style>\n/* ui-to-web generated CSS */\n"), html);
        assertTrue(html.contains(".container-1 {\n  display: flex;\n}\n"));
        assertTrue(html.contains("</style>\n"));
        assertTrue(html.contains("  <script src=\"app.js\"></script>\n"));
        assertFalse(html.contains("<link"));
    }

    @Test
    void emptyInlineStylesheetIsOmitted() {
        HtmlGenerator gen = new HtmlGenerator(HtmlOptions.defaults().withInlineCss(true), null);

        String html = gen.generate(helloGo(), IrManifest.EMPTY, "").html;

        assertFalse(html.contains("<style>"));
        assertFalse(html.contains("<link"));
    }

    @Test
    void headOptionsAreEscaped() {
        HtmlGenerator gen = new HtmlGenerator(HtmlOptions.defaults()
                .withTitle("A & B").withLang("sv").withStylesheetHref("css/site.css"), null);

        String html = gen.generate(helloGo()).html;

        assertTrue(html.contains("<html lang=\"sv\">"));
        assertTrue(html.contains("<title>A &amp; B</title>"));
        assertTrue(html.contains("href=\"css/site.css\""));
    }

    @Test
    void laidOutFlowchartIsEmbeddedAsSvg() {
        IrComponent chart = IrComponent.builder(IrComponentType.FLOWCHART).id(2)
                .flowchart(new IrFlowchart(true, 100, 50, null, null,
                        List.of(new IrFlowchartNode("A", null, "Start", 0, 0, 100, 50))))
                .child(IrComponent.builder(IrComponentType.FLOWCHART_NODE).id(3).text("fallback").build())
                .build();
        IrComponent root = IrComponent.builder(IrComponentType.CONTAINER).id(1).child(chart).build();
        HtmlGenerator gen = new HtmlGenerator(HtmlOptions.defaults(), null, SvgOptions.defaults());

        HtmlGenerator.Result r = gen.generate(root);

        assertTrue(r.html.contains("<div class=\"flowchart-2\">\n      <svg xmlns="), r.html);
        assertTrue(r.html.contains(">Start</text>"));
        assertFalse(r.html.contains("fallback"));
        assertTrue(r.warnings.isEmpty());
    }

    @Test
    void flowchartWithoutLayoutFallsBackToContainer() {
        IrComponent chart = IrComponent.builder(IrComponentType.FLOWCHART).id(2)
                .child(IrComponent.builder(IrComponentType.FLOWCHART_LABEL).id(3).text("fallback").build())
                .build();
        HtmlGenerator gen = new HtmlGenerator(HtmlOptions.defaults(), null, SvgOptions.defaults());

        HtmlGenerator.Result r = gen.generate(IrComponent.builder(IrComponentType.CONTAINER).id(1).child(chart).build());

        assertFalse(r.html.contains("<svg"));
        assertTrue(r.html.contains("fallback"));
        List<EmitterWarning> w = r.warnings;
        assertEquals(1, w.size());
        assertEquals(WarningCodes.FLOWCHART_NOT_RENDERED, w.get(0).code);
        assertEquals("2", w.get(0).context.get("componentId"));
    }

    @Test
    void flowchartsAreContainersWithoutSvgOptions() {
        IrComponent chart = IrComponent.builder(IrComponentType.FLOWCHART).id(2)
                .flowchart(new IrFlowchart(true, 100, 50, null, null, null))
                .build();

        HtmlGenerator.Result r = new HtmlGenerator().generate(IrComponent.builder(IrComponentType.CONTAINER).id(1).child(chart).build());

        assertFalse(r.html.contains("<svg"));
        assertTrue(r.warnings.isEmpty());
    }

    @Test
    void unknownVariantRendersAsDivWithWarning() {
        HtmlGenerator.Result r = new HtmlGenerator().generate(IrComponent.builder(IrComponentType.UNKNOWN).id(9).build());

        assertTrue(r.html.contains("<div class=\"container-9\">"));
        assertEquals(1, r.warnings.size());
        assertEquals(WarningCodes.UNKNOWN_VARIANT, r.warnings.get(0).code);
    }

    @Test
    void classAttributeMatchesCssSelector() {
        IrComponent button = IrComponent.builder(IrComponentType.BUTTON).id(3).cssClass("btn  primary").build();

        String html = body(IrComponent.builder(IrComponentType.CONTAINER).id(1).child(button).build());

        assertTrue(html.contains("<button class=\"btn primary\" type=\"button\">"));
    }

    @Test
    void writesDocumentToFile(@TempDir Path tmp) throws Exception {
        HtmlGenerator gen = new HtmlGenerator();
        Path out = tmp.resolve("site/index.html");

        assertTrue(gen.writeToFile(helloGo(), IrManifest.EMPTY, out));
        assertEquals(gen.getBuffer(), Files.readString(out, StandardCharsets.UTF_8));
        assertEquals(Files.size(out), gen.getSize());
    }

    @Test
    void warningsOfAFileWriteStayAvailable(@TempDir Path tmp) {
        HtmlGenerator gen = new HtmlGenerator();
        assertTrue(gen.lastWarnings().isEmpty());

        IrComponent root = IrComponent.builder(IrComponentType.ROW).id(1)
                .child(IrComponent.builder(IrComponentType.UNKNOWN).id(4).build())
                .child(IrComponent.builder(IrComponentType.UNKNOWN).id(5).build())
                .build();
        assertTrue(gen.writeToFile(root, IrManifest.EMPTY, tmp.resolve("index.html")));

        List<EmitterWarning> w = gen.lastWarnings();
        assertEquals(2, w.size());
        assertEquals("4", w.get(0).context.get("componentId"));
        assertEquals("5", w.get(1).context.get("componentId"));
    }

    @Test
    void rejectsNullRoot() {
        assertThrows(IllegalArgumentException.class, () -> new HtmlGenerator().generate(null));
    }
}
