package info.isaksson.erland.uitoweb.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces a canonical form of a component tree so JSON output is reproducible.
 *
 * <p>Rules are deliberately small: blank strings become absent, class lists are collapsed to single
 * spaces, tags are trimmed. Child order is semantic and always preserved (do not sort).</p>
 */
public final class IrNormalizer {

    private IrNormalizer() {}

    public static IrComponent normalize(IrComponent in) {
        if (in == null) return null;

        List<IrComponent> children = new ArrayList<>(in.children.size());
        for (IrComponent c : in.children) {
            children.add(normalize(c));
        }

        return new IrComponent(
                in.id,
                in.type,
                trimToNull(in.tag),
                in.selectorKind,
                normalizeClassList(in.cssClass),
                in.text,
                emptyToNull(in.payload),
                in.data,
                in.style,
                in.pseudoStyles,
                in.breakpoints,
                in.flowchart,
                children
        );
    }

    /** Collapses runs of whitespace in a class list; returns null when nothing remains. */
    public static String normalizeClassList(String classes) {
        String t = trimToNull(classes);
        if (t == null) return null;
        return String.join(" ", t.split("\\s+"));
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
