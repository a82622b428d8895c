package info.isaksson.erland.uitoweb.core;

import info.isaksson.erland.uitoweb.css.CssGenerator;
import info.isaksson.erland.uitoweb.emitter.EmitterWarning;
import info.isaksson.erland.uitoweb.emitter.EmitterWarnings;
import info.isaksson.erland.uitoweb.emitter.OutputFiles;
import info.isaksson.erland.uitoweb.emitter.WarningCodes;
import info.isaksson.erland.uitoweb.html.HtmlGenerator;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrComponentType;
import info.isaksson.erland.uitoweb.ir.IrJson;
import info.isaksson.erland.uitoweb.ir.IrManifest;
import info.isaksson.erland.uitoweb.selector.ClassNameDeriver;
import info.isaksson.erland.uitoweb.selector.DefaultClassNameDeriver;
import info.isaksson.erland.uitoweb.svg.SvgFlowchartRenderer;
import info.isaksson.erland.uitoweb.svg.SvgOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Core (server-friendly) API for generating web artifacts from a component tree.
 *
 * <p>One call runs a full web pass: the stylesheet, the HTML document and one SVG per laid-out
 * flowchart. Nothing touches the file system unless {@link #writeToDirectory} is called. Wrappers
 * should use this class instead of wiring the generators themselves.</p>
 */
public final class UiToWebService {

    private static final Logger LOG = LoggerFactory.getLogger(UiToWebService.class);

    public UiToWebResult generate(IrComponent root, IrManifest manifest, UiToWebOptions options) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (manifest == null) manifest = IrManifest.EMPTY;
        if (options == null) options = new UiToWebOptions();

        ClassNameDeriver deriver = options.classNameDeriver == null
                ? new DefaultClassNameDeriver()
                : options.classNameDeriver;
        SvgOptions svgOptions = options.svgOptions();

        CssGenerator.Result css = new CssGenerator(options.cssOptions(), deriver).generate(root, manifest);
        HtmlGenerator.Result html = new HtmlGenerator(options.htmlOptions(), deriver,
                options.embedFlowcharts ? svgOptions : null).generate(root, manifest, css.css);

        EmitterWarnings svgWarnings = new EmitterWarnings();
        Map<String, String> svgs = new LinkedHashMap<>();
        if (options.exportFlowcharts) {
            exportFlowcharts(root, new SvgFlowchartRenderer(), svgOptions, svgs, svgWarnings);
        }

        List<EmitterWarning> warnings = merge(css.warnings, html.warnings, svgWarnings.toDeterministicList());
        UiToWebResult result = new UiToWebResult(html.html, options.inlineCss ? null : css.css,
                css.ruleCount, svgs, warnings);
        LOG.debug("Web pass done: {} CSS rules, {} SVGs, {} bytes, {} warnings",
                result.cssRuleCount, result.svgs.size(), result.totalBytes(), result.warnings.size());
        return result;
    }

    /** Generate from an IR JSON file and an optional manifest JSON file. */
    public UiToWebResult generateFromJson(Path irJson, Path manifestJson, UiToWebOptions options) throws IOException {
        if (irJson == null) throw new IllegalArgumentException("irJson must not be null");
        IrComponent root = IrJson.read(irJson);
        IrManifest manifest = manifestJson == null ? IrManifest.EMPTY : IrJson.readManifest(manifestJson);
        return generate(root, manifest, options);
    }

    /**
     * Writes every document of {@code result} into {@code outDir}: the HTML document, the
     * stylesheet unless it was inlined, and {@code <stem>.svg} per exported flowchart.
     *
     * @return false when at least one file could not be written
     */
    public boolean writeToDirectory(UiToWebResult result, Path outDir, UiToWebOptions options) {
        if (result == null) throw new IllegalArgumentException("result must not be null");
        if (outDir == null) throw new IllegalArgumentException("outDir must not be null");
        if (options == null) options = new UiToWebOptions();

        boolean ok = OutputFiles.writeUtf8(outDir.resolve(options.htmlFileName), result.html);
        if (result.css != null) {
            ok &= OutputFiles.writeUtf8(outDir.resolve(options.stylesheetFileName), result.css);
        }
        for (Map.Entry<String, String> svg : result.svgs.entrySet()) {
            ok &= OutputFiles.writeUtf8(outDir.resolve(svg.getKey() + ".svg"), svg.getValue());
        }
        if (!ok) LOG.warn("Some web artifacts could not be written to {}", outDir);
        return ok;
    }

    private static void exportFlowcharts(IrComponent node, SvgFlowchartRenderer renderer, SvgOptions svgOptions,
                                         Map<String, String> svgs, EmitterWarnings warnings) {
        if (node.type == IrComponentType.FLOWCHART) {
            Optional<String> svg = renderer.render(node, svgOptions, warnings);
            if (svg.isPresent()) {
                svgs.putIfAbsent("flowchart-" + node.id, svg.get());
            } else {
                warnings.warn(WarningCodes.FLOWCHART_NOT_RENDERED,
                        "Flowchart has no computed layout; no SVG exported", node);
            }
        }
        for (IrComponent child : node.children) {
            exportFlowcharts(child, renderer, svgOptions, svgs, warnings);
        }
    }

    /** The stylesheet and document walk the same tree, so identical warnings are reported once. */
    @SafeVarargs
    private static List<EmitterWarning> merge(List<EmitterWarning>... lists) {
        Map<String, EmitterWarning> unique = new LinkedHashMap<>();
        for (List<EmitterWarning> list : lists) {
            for (EmitterWarning w : list) unique.putIfAbsent(w.toString(), w);
        }
        EmitterWarnings all = new EmitterWarnings();
        all.addAll(new ArrayList<>(unique.values()));
        return all.toDeterministicList();
    }
}
