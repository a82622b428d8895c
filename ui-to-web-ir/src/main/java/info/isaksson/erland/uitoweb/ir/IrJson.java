package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization utilities for component trees and variable manifests.
 *
 * <p>Writing is deterministic: the tree is normalized first and map keys are ordered.</p>
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private IrJson() {}

    public static IrComponent read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, IrComponent.class);
        }
    }

    /** Parse a component tree from a JSON string. */
    public static IrComponent readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, IrComponent.class);
    }

    public static IrManifest readManifest(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, IrManifest.class);
        }
    }

    public static void write(IrComponent root, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        IrComponent normalized = IrNormalizer.normalize(root);
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, normalized);
            // Ensure trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(IrComponent root) throws IOException {
        IrComponent normalized = IrNormalizer.normalize(root);
        return MAPPER.writer(PRETTY).writeValueAsString(normalized) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Variants added by newer producers map to IrComponentType.UNKNOWN.
        om.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
