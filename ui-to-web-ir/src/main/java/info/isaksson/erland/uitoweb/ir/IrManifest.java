package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Reactive variable manifest: ordered name/value bindings supplied alongside a component tree.
 *
 * <p>Only variables named with {@link #CSS_VARIABLE_PREFIX} become CSS custom properties; the rest
 * belong to the scripting runtime and are ignored by the web generators.</p>
 */
@JsonPropertyOrder({"variables"})
public final class IrManifest {

    public static final String CSS_VARIABLE_PREFIX = "css:";

    public static final IrManifest EMPTY = new IrManifest(null);

    /** Order is significant and preserved. */
    public final List<IrManifestVariable> variables;

    @JsonCreator
    public IrManifest(@JsonProperty("variables") List<IrManifestVariable> variables) {
        this.variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public static IrManifest of(IrManifestVariable... variables) {
        return new IrManifest(List.of(variables));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrManifest)) return false;
        return variables.equals(((IrManifest) o).variables);
    }

    @Override public int hashCode() {
        return variables.hashCode();
    }
}
