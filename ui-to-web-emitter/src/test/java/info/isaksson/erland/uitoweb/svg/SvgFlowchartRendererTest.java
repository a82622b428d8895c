package info.isaksson.erland.uitoweb.svg;

import info.isaksson.erland.uitoweb.emitter.EmitterWarning;
import info.isaksson.erland.uitoweb.emitter.EmitterWarnings;
import info.isaksson.erland.uitoweb.emitter.WarningCodes;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrComponentType;
import info.isaksson.erland.uitoweb.ir.IrFlowchart;
import info.isaksson.erland.uitoweb.ir.IrFlowchartEdge;
import info.isaksson.erland.uitoweb.ir.IrFlowchartEdgeType;
import info.isaksson.erland.uitoweb.ir.IrFlowchartNode;
import info.isaksson.erland.uitoweb.ir.IrFlowchartShape;
import info.isaksson.erland.uitoweb.ir.IrFlowchartSubgraph;
import info.isaksson.erland.uitoweb.ir.IrPoint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SvgFlowchartRendererTest {

    private final SvgFlowchartRenderer renderer = new SvgFlowchartRenderer();

    private static IrComponent chart(List<IrFlowchartSubgraph> subgraphs, List<IrFlowchartEdge> edges,
                                     List<IrFlowchartNode> nodes) {
        return IrComponent.builder(IrComponentType.FLOWCHART).id(1)
                .flowchart(new IrFlowchart(true, 200, 200, subgraphs, edges, nodes))
                .build();
    }

    private static IrComponent startDecide() {
        return chart(
                List.of(new IrFlowchartSubgraph("sg1", null, 0, 0, 120, 180)),
                List.of(new IrFlowchartEdge("A", "B", IrFlowchartEdgeType.ARROW, "yes",
                        List.of(new IrPoint(50, 40), new IrPoint(50, 100)))),
                List.of(new IrFlowchartNode("A", IrFlowchartShape.RECTANGLE, "Start", 0, 0, 100, 40),
                        new IrFlowchartNode("B", IrFlowchartShape.DIAMOND, "Ok?", 0, 100, 100, 60)));
    }

    private String render(IrComponent c, SvgOptions options) {
        Optional<String> svg = renderer.render(c, options);
        assertTrue(svg.isPresent());
        return svg.get();
    }

    @Test
    void fixedSizeDocumentWithAccessibilityMetadata() {
        String svg = render(startDecide(), SvgOptions.defaults());

        assertTrue(svg.startsWith("<svg xmlns=\"http://www.w3.org/2000/svg\" viewBox=\"0 0 800 600\""
                + " width=\"800\" height=\"600\" class=\"flowchart flowchart-theme-default\""
                + " role=\"img\" aria-label=\"Flowchart: Flowchart\">\n"), svg);
        assertTrue(svg.contains("  <title>Flowchart</title>\n  <desc>A flowchart diagram</desc>\n"));
        assertTrue(svg.contains("<marker id=\"arrow\""));
        assertTrue(svg.contains("<marker id=\"arrow-bi\""));
        assertTrue(svg.endsWith("</svg>\n"));
    }

    @Test
    void layersAreDrawnBackToFront() {
        String svg = render(startDecide(), SvgOptions.defaults());

        int subgraphs = svg.indexOf("<g class=\"subgraphs\">");
        int edges = svg.indexOf("<g class=\"edges\">");
        int nodes = svg.indexOf("<g class=\"nodes\">");
        assertTrue(subgraphs > 0);
        assertTrue(subgraphs < edges);
        assertTrue(edges < nodes);
        assertTrue(svg.indexOf("<rect x=\"0.0\" y=\"0.0\" width=\"120.0\"") < edges);
        assertTrue(svg.indexOf("class=\"edge\"") > edges && svg.indexOf("class=\"edge\"") < nodes);
    }

    @Test
    void edgesAreDrawnAsPathsWithLabels() {
        String svg = render(startDecide(), SvgOptions.defaults());

        assertTrue(svg.contains("<path d=\"M 50.0,40.0 L 50.0,100.0\" class=\"edge\" fill=\"none\""
                + " stroke=\"#888888\" stroke-width=\"2\" marker-end=\"url(#arrow)\" />"), svg);
        assertTrue(svg.contains("<text x=\"50.0\" y=\"70.0\""));
        assertTrue(svg.contains("class=\"edge-label\">yes</text>"));
    }

    @Test
    void nodesCarryShapeOutlineAndLabel() {
        String svg = render(startDecide(), SvgOptions.defaults());

        assertTrue(svg.contains("<g class=\"node\" data-node-id=\"A\" data-shape=\"rectangle\">"));
        assertTrue(svg.contains("<rect x=\"0.0\" y=\"0.0\" width=\"100.0\" height=\"40.0\""
                + " fill=\"#5588FF\" stroke=\"#3366CC\" stroke-width=\"2\" />"));
        assertTrue(svg.contains("<path d=\"M 50.0,100.0 L 100.0,130.0 L 50.0,160.0 L 0.0,130.0 Z\""));
        assertTrue(svg.contains(">Start</text>"));
        assertTrue(svg.contains(">Ok?</text>"));
    }

    @Test
    void subgraphTitleFallsBackToId() {
        String svg = render(startDecide(), SvgOptions.defaults());

        assertTrue(svg.contains("data-subgraph-id=\"sg1\""));
        assertTrue(svg.contains("<text x=\"60.0\" y=\"20.0\""));
        assertTrue(svg.contains(">sg1</text>"));
    }

    @Test
    void responsiveModeSizesFromContent() {
        String svg = render(startDecide(), SvgOptions.defaults().withResponsive(true, 0, 0));
        assertTrue(svg.contains(" viewBox=\"0 0 240 240\" width=\"100%\" style=\"max-width: 240px;\""
                + " preserveAspectRatio=\"xMidYMid meet\""), svg);
        assertFalse(svg.contains("height=\"600\""));

        String clamped = render(startDecide(), SvgOptions.defaults().withResponsive(true, 150, 100));
        assertTrue(clamped.contains("viewBox=\"0 0 150 100\""));
    }

    @Test
    void nonInteractiveOutputHasNoDataAttributes() {
        String svg = render(startDecide(), SvgOptions.defaults().withInteractive(false).withAccessibility(false));

        assertFalse(svg.contains("data-node-id"));
        assertFalse(svg.contains("role=\"img\""));
        assertFalse(svg.contains("<title>"));
        assertTrue(svg.contains("<g class=\"node\">"));
    }

    @Test
    void themeChangesPaletteAndClass() {
        String svg = render(startDecide(), SvgOptions.defaults().withTheme(SvgTheme.HIGH_CONTRAST));

        assertTrue(svg.contains("class=\"flowchart flowchart-theme-high-contrast\""));
        assertTrue(svg.contains("fill=\"#000000\" stroke=\"#FFFF00\""));
        assertFalse(svg.contains("#5588FF"));
    }

    @Test
    void edgeTypesSelectStrokeAndMarkers() {
        List<IrPoint> pts = List.of(new IrPoint(0, 0), new IrPoint(10, 0));
        IrComponent c = chart(List.of(), List.of(
                new IrFlowchartEdge("a", "b", IrFlowchartEdgeType.OPEN, null, pts),
                new IrFlowchartEdge("b", "c", IrFlowchartEdgeType.DOTTED, null, pts),
                new IrFlowchartEdge("c", "d", IrFlowchartEdgeType.THICK, null, pts),
                new IrFlowchartEdge("d", "e", IrFlowchartEdgeType.BIDIRECTIONAL, null, pts)), List.of());

        String[] lines = render(c, SvgOptions.defaults()).split("\n");
        int seen = 0;
        for (String line : lines) {
            if (!line.contains("class=\"edge\"")) continue;
            switch (seen++) {
                case 0:
                    assertFalse(line.contains("marker"), line);
                    break;
                case 1:
                    assertTrue(line.contains("stroke-dasharray=\"5,5\" marker-end=\"url(#arrow)\""), line);
                    break;
                case 2:
                    assertTrue(line.contains("stroke-width=\"4\""), line);
                    break;
                default:
                    assertTrue(line.contains("marker-start=\"url(#arrow-bi)\" marker-end=\"url(#arrow)\""), line);
                    break;
            }
        }
        assertEquals(4, seen);
    }

    @Test
    void degenerateElementsAreSkippedWithWarnings() {
        IrComponent c = chart(
                List.of(new IrFlowchartSubgraph("empty", "Empty", 0, 0, 0, 50)),
                List.of(new IrFlowchartEdge("A", "B", null, null, List.of(new IrPoint(1, 1)))),
                List.of(new IrFlowchartNode("A", null, "A", 0, 0, 10, 10)));
        EmitterWarnings warnings = new EmitterWarnings();

        String svg = renderer.render(c, SvgOptions.defaults(), warnings).orElseThrow();

        assertFalse(svg.contains("data-subgraph-id"));
        assertFalse(svg.contains("class=\"edge\""));
        List<EmitterWarning> w = warnings.toDeterministicList();
        assertEquals(2, w.size());
        assertEquals(WarningCodes.FLOWCHART_EDGE_SKIPPED, w.get(0).code);
        assertEquals("A->B", w.get(0).context.get("edge"));
        assertEquals(WarningCodes.FLOWCHART_SUBGRAPH_SKIPPED, w.get(1).code);
    }

    @Test
    void labelsAreEscaped() {
        IrComponent c = chart(List.of(), List.of(),
                List.of(new IrFlowchartNode("n&1", IrFlowchartShape.CIRCLE, "<b> & \"x\"", 0, 0, 40, 40)));

        String svg = render(c, SvgOptions.defaults());

        assertTrue(svg.contains("data-node-id=\"n&amp;1\""));
        assertTrue(svg.contains(">&lt;b&gt; &amp; &quot;x&quot;</text>"));
        assertTrue(svg.contains("<circle cx=\"20.0\" cy=\"20.0\" r=\"20.0\""));
    }

    @Test
    void onlyLaidOutFlowchartsRender() {
        assertFalse(renderer.render(IrComponent.builder(IrComponentType.CONTAINER).build(), null).isPresent());
        assertFalse(renderer.render(IrComponent.builder(IrComponentType.FLOWCHART).build(), null).isPresent());
        assertFalse(renderer.render(null, null).isPresent());

        IrComponent pending = IrComponent.builder(IrComponentType.FLOWCHART)
                .flowchart(new IrFlowchart(false, 100, 100, null, null, null))
                .build();
        assertFalse(renderer.render(pending, SvgOptions.defaults()).isPresent());
    }

    @Test
    void labelAnchorIsMidpointOfMiddleSegment() {
        IrPoint two = SvgFlowchartRenderer.labelAnchor(List.of(new IrPoint(0, 0), new IrPoint(10, 20)));
        assertEquals(5, two.x);
        assertEquals(10, two.y);

        IrPoint four = SvgFlowchartRenderer.labelAnchor(List.of(
                new IrPoint(0, 0), new IrPoint(10, 0), new IrPoint(10, 10), new IrPoint(20, 10)));
        assertEquals(10, four.x);
        assertEquals(5, four.y);
    }

    @Test
    void themeNamesParseLeniently() {
        assertEquals(SvgTheme.HIGH_CONTRAST, SvgTheme.fromString(" High-Contrast "));
        assertEquals(SvgTheme.DARK, SvgTheme.fromString("dark"));
        assertEquals(SvgTheme.DEFAULT, SvgTheme.fromString("sepia"));
        assertEquals(SvgTheme.DEFAULT, SvgTheme.fromString(null));
    }

    @Test
    void invalidSizesFallBackToDefaults() {
        SvgOptions o = SvgOptions.defaults().withSize(0, -5);
        assertEquals(800, o.width);
        assertEquals(600, o.height);
    }
}
