package info.isaksson.erland.uitoweb.svg;

import info.isaksson.erland.uitoweb.emitter.EmitterWarnings;
import info.isaksson.erland.uitoweb.emitter.HtmlEscaper;
import info.isaksson.erland.uitoweb.emitter.MarkupWriter;
import info.isaksson.erland.uitoweb.emitter.WarningCodes;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrComponentType;
import info.isaksson.erland.uitoweb.ir.IrFlowchart;
import info.isaksson.erland.uitoweb.ir.IrFlowchartEdge;
import info.isaksson.erland.uitoweb.ir.IrFlowchartEdgeType;
import info.isaksson.erland.uitoweb.ir.IrFlowchartNode;
import info.isaksson.erland.uitoweb.ir.IrFlowchartSubgraph;
import info.isaksson.erland.uitoweb.ir.IrPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static info.isaksson.erland.uitoweb.svg.SvgShapes.f;
import static info.isaksson.erland.uitoweb.svg.SvgShapes.p;

/**
 * Renders a laid-out flowchart component as a standalone SVG document.
 *
 * <p>Layers are written back to front: subgraph backgrounds, then edges, then nodes, so nodes
 * always cover the edges that end at them. Rendering never computes layout; a flowchart whose
 * layout has not been computed is rejected.</p>
 */
public final class SvgFlowchartRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(SvgFlowchartRenderer.class);

    static final double PADDING = 20;
    static final double SUBGRAPH_TITLE_OFFSET = 20;

    public Optional<String> render(IrComponent flowchart, SvgOptions options) {
        return render(flowchart, options, null);
    }

    /**
     * @return the SVG text, or empty when {@code flowchart} is not a flowchart component or carries
     *         no computed layout
     */
    public Optional<String> render(IrComponent flowchart, SvgOptions options, EmitterWarnings warnings) {
        if (flowchart == null || flowchart.type != IrComponentType.FLOWCHART) {
            LOG.debug("Not a flowchart component: {}", flowchart);
            return Optional.empty();
        }
        IrFlowchart fc = flowchart.flowchart;
        if (fc == null || !fc.layoutComputed) {
            LOG.debug("Flowchart {} has no computed layout", flowchart);
            return Optional.empty();
        }
        if (options == null) options = SvgOptions.defaults();

        SvgTheme theme = options.theme;
        MarkupWriter out = new MarkupWriter();

        writeOpenTag(out, fc, options);
        writeDefs(out, theme);

        out.append("  <!-- Subgraphs -->\n");
        out.append("  <g class=\"subgraphs\">\n");
        for (IrFlowchartSubgraph sg : fc.subgraphs) {
            if (sg.width <= 0 || sg.height <= 0) {
                if (warnings != null) {
                    warnings.warn(WarningCodes.FLOWCHART_SUBGRAPH_SKIPPED,
                            "Subgraph has no area and was not drawn", "subgraph", sg.id);
                }
                continue;
            }
            writeSubgraph(out, sg, theme);
        }
        out.append("  </g>\n\n");

        out.append("  <!-- Edges -->\n");
        out.append("  <g class=\"edges\">\n");
        for (IrFlowchartEdge edge : fc.edges) {
            if (edge.points.size() < 2) {
                if (warnings != null) {
                    warnings.warn(WarningCodes.FLOWCHART_EDGE_SKIPPED,
                            "Edge has fewer than two path points and was not drawn",
                            "edge", edge.from + "->" + edge.to);
                }
                continue;
            }
            writeEdge(out, edge, theme);
        }
        out.append("  </g>\n\n");

        out.append("  <!-- Nodes -->\n");
        out.append("  <g class=\"nodes\">\n");
        for (IrFlowchartNode node : fc.nodes) {
            writeNode(out, node, options);
        }
        out.append("  </g>\n");
        out.append("</svg>\n");

        LOG.debug("Rendered flowchart {}: {} nodes, {} edges, {} subgraphs",
                flowchart, fc.nodes.size(), fc.edges.size(), fc.subgraphs.size());
        return Optional.of(out.toString());
    }

    private static void writeOpenTag(MarkupWriter out, IrFlowchart fc, SvgOptions options) {
        String themeClass = "flowchart flowchart-theme-" + options.theme.cssName();
        out.append("<svg xmlns=\"http://www.w3.org/2000/svg\"");
        if (options.responsive) {
            double w = fc.contentWidth + PADDING * 2;
            double h = fc.contentHeight + PADDING * 2;
            if (options.maxWidth > 0 && w > options.maxWidth) w = options.maxWidth;
            if (options.maxHeight > 0 && h > options.maxHeight) h = options.maxHeight;
            out.append(" viewBox=\"0 0 ").append(whole(w)).append(' ').append(whole(h)).append('"')
                    .append(" width=\"100%\"")
                    .append(" style=\"max-width: ").append(whole(w)).append("px;\"")
                    .append(" preserveAspectRatio=\"xMidYMid meet\"");
        } else {
            out.append(" viewBox=\"0 0 ").append(Integer.toString(options.width)).append(' ')
                    .append(Integer.toString(options.height)).append('"')
                    .append(" width=\"").append(Integer.toString(options.width)).append('"')
                    .append(" height=\"").append(Integer.toString(options.height)).append('"');
        }
        out.append(" class=\"").append(themeClass).append('"');

        if (options.accessibility) {
            out.append(" role=\"img\"");
            if (options.title != null) {
                out.append(" aria-label=\"Flowchart: ").append(HtmlEscaper.escape(options.title)).append('"');
            }
        }
        out.append(">\n");

        if (options.accessibility) {
            if (options.title != null) {
                out.append("  <title>").append(HtmlEscaper.escape(options.title)).append("</title>\n");
            }
            if (options.description != null) {
                out.append("  <desc>").append(HtmlEscaper.escape(options.description)).append("</desc>\n");
            }
        }
    }

    private static void writeDefs(MarkupWriter out, SvgTheme theme) {
        out.append("  <defs>\n");
        out.append("    <marker id=\"arrow\" markerWidth=\"10\" markerHeight=\"10\" refX=\"9\" refY=\"3\" orient=\"auto\">\n");
        out.append("      <path d=\"M0,0 L0,6 L9,3 z\" fill=\"").append(theme.edgeColor).append("\" />\n");
        out.append("    </marker>\n");
        out.append("    <marker id=\"arrow-bi\" markerWidth=\"10\" markerHeight=\"10\" refX=\"1\" refY=\"3\" orient=\"auto\">\n");
        out.append("      <path d=\"M9,0 L9,6 L0,3 z\" fill=\"").append(theme.edgeColor).append("\" />\n");
        out.append("    </marker>\n");
        out.append("  </defs>\n\n");
    }

    private static void writeSubgraph(MarkupWriter out, IrFlowchartSubgraph sg, SvgTheme theme) {
        String title = sg.title != null && !sg.title.isEmpty() ? sg.title : sg.id;
        out.append("    <g class=\"subgraph\" data-subgraph-id=\"").append(HtmlEscaper.escape(sg.id)).append("\">\n");
        out.append("      <rect x=\"").append(f(sg.x)).append("\" y=\"").append(f(sg.y))
                .append("\" width=\"").append(f(sg.width)).append("\" height=\"").append(f(sg.height))
                .append("\" fill=\"").append(theme.subgraphFill).append("\" stroke=\"").append(theme.subgraphStroke)
                .append("\" stroke-width=\"2\" rx=\"8\" ry=\"8\" opacity=\"0.85\" />\n");
        out.append("      <text x=\"").append(f(sg.x + sg.width / 2)).append("\" y=\"").append(f(sg.y + SUBGRAPH_TITLE_OFFSET))
                .append("\" text-anchor=\"middle\" dominant-baseline=\"middle\" font-size=\"16px\" font-weight=\"bold\" fill=\"")
                .append(theme.subgraphTitle).append("\">").append(HtmlEscaper.escape(title)).append("</text>\n");
        out.append("    </g>\n");
    }

    private static void writeEdge(MarkupWriter out, IrFlowchartEdge edge, SvgTheme theme) {
        List<IrPoint> pts = edge.points;
        StringBuilder d = new StringBuilder("M ").append(p(pts.get(0).x, pts.get(0).y));
        for (int i = 1; i < pts.size(); i++) {
            d.append(" L ").append(p(pts.get(i).x, pts.get(i).y));
        }

        out.append("    <path d=\"").append(d.toString()).append("\" class=\"edge\" fill=\"none\"")
                .append(" stroke=\"").append(theme.edgeColor).append('"')
                .append(" stroke-width=\"").append(edge.type == IrFlowchartEdgeType.THICK ? "4" : "2").append('"');
        if (edge.type == IrFlowchartEdgeType.DOTTED) {
            out.append(" stroke-dasharray=\"5,5\"");
        }
        if (edge.type == IrFlowchartEdgeType.BIDIRECTIONAL) {
            out.append(" marker-start=\"url(#arrow-bi)\" marker-end=\"url(#arrow)\"");
        } else if (edge.type != IrFlowchartEdgeType.OPEN) {
            out.append(" marker-end=\"url(#arrow)\"");
        }
        out.append(" />\n");

        if (edge.label != null && !edge.label.isEmpty()) {
            IrPoint mid = labelAnchor(pts);
            out.append("    <text x=\"").append(f(mid.x)).append("\" y=\"").append(f(mid.y))
                    .append("\" fill=\"").append(theme.nodeText)
                    .append("\" font-size=\"12px\" text-anchor=\"middle\" dominant-baseline=\"middle\" class=\"edge-label\">")
                    .append(HtmlEscaper.escape(edge.label)).append("</text>\n");
        }
    }

    /** Midpoint of the middle path segment; with two points that is the only segment. */
    static IrPoint labelAnchor(List<IrPoint> pts) {
        int mid = pts.size() / 2;
        IrPoint a = pts.get(mid - 1);
        IrPoint b = pts.get(mid);
        return new IrPoint((a.x + b.x) / 2, (a.y + b.y) / 2);
    }

    private static void writeNode(MarkupWriter out, IrFlowchartNode node, SvgOptions options) {
        SvgTheme theme = options.theme;
        out.append("    <g class=\"node\"");
        if (options.interactive) {
            out.append(" data-node-id=\"").append(HtmlEscaper.escape(node.id)).append('"')
                    .append(" data-shape=\"").append(node.shape.name().toLowerCase(Locale.ROOT)).append('"');
        }
        out.append(">\n");
        out.append(SvgShapes.outline(node, theme, "      "));
        out.append("      <text x=\"").append(f(node.x + node.width / 2)).append("\" y=\"").append(f(node.y + node.height / 2))
                .append("\" fill=\"").append(theme.nodeText)
                .append("\" text-anchor=\"middle\" dominant-baseline=\"middle\" font-size=\"14px\">")
                .append(HtmlEscaper.escape(node.label)).append("</text>\n");
        out.append("    </g>\n");
    }

    private static String whole(double v) {
        return String.format(Locale.ROOT, "%.0f", v);
    }
}
