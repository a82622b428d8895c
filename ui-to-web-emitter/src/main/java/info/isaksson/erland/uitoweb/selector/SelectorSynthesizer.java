package info.isaksson.erland.uitoweb.selector;

import info.isaksson.erland.uitoweb.emitter.EmitterWarnings;
import info.isaksson.erland.uitoweb.emitter.WarningCodes;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrSelectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Builds the CSS selector that links a component's rule block to its markup element.
 *
 * <p>Nodes with an id hint, or an element hint naming a valid tag, are addressed by their tag. Everything else goes through the
 * {@link ClassNameDeriver} and becomes a compound class selector. A deriver failure never aborts
 * generation: the node simply gets the empty selector, and no rule.</p>
 */
public final class SelectorSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(SelectorSynthesizer.class);

    private static final Pattern ELEMENT_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9-]*");

    private final ClassNameDeriver deriver;

    public SelectorSynthesizer() {
        this(new DefaultClassNameDeriver());
    }

    public SelectorSynthesizer(ClassNameDeriver deriver) {
        if (deriver == null) throw new IllegalArgumentException("deriver must not be null");
        this.deriver = deriver;
    }

    public String selectorFor(IrComponent component) {
        return selectorFor(component, null);
    }

    /** Selector for {@code component}, or {@code ""} when none can be built. */
    public String selectorFor(IrComponent component, EmitterWarnings warnings) {
        if (component == null) throw new IllegalArgumentException("component must not be null");

        String tag = component.tag == null ? null : component.tag.trim();
        if (tag != null && !tag.isEmpty()) {
            if (component.selectorKind == IrSelectorKind.ELEMENT && isValidElementName(tag)) return tag;
            if (component.selectorKind == IrSelectorKind.ID) return "#" + tag;
        }

        String classes;
        try {
            classes = deriver.deriveClassNames(component);
        } catch (ClassNameDerivationException | RuntimeException e) {
            LOG.warn("Class name derivation failed for {}: {}", component, e.getMessage());
            if (warnings != null) {
                warnings.warn(WarningCodes.CLASS_NAME_DERIVATION_FAILED,
                        "Class name derivation failed; node has no selector", component);
            }
            return "";
        }
        return classesToSelector(classes);
    }

    /** True for names usable both as an HTML tag and as a CSS type selector. */
    public static boolean isValidElementName(String name) {
        return name != null && ELEMENT_NAME.matcher(name).matches();
    }

    /** {@code "btn primary"} becomes {@code ".btn.primary"}; blank input yields {@code ""}. */
    public static String classesToSelector(String classes) {
        if (classes == null) return "";
        String t = classes.trim();
        if (t.isEmpty()) return "";
        return "." + String.join(".", t.split("\\s+"));
    }

    public static String selectorForPseudo(String base, String pseudo) {
        if (base == null || base.isEmpty()) return "";
        if (pseudo == null || pseudo.isEmpty()) return base;
        return base + ":" + pseudo;
    }

    /**
     * First class token of a selector without the leading dot; stops at {@code . : space [ #}.
     * Returns {@code ""} for null or empty input.
     */
    public static String extractBaseClass(String selector) {
        if (selector == null || selector.isEmpty()) return "";
        int start = selector.charAt(0) == '.' ? 1 : 0;
        int end = start;
        while (end < selector.length()) {
            char c = selector.charAt(end);
            if (c == '.' || c == ':' || c == ' ' || c == '[' || c == '#') break;
            end++;
        }
        return selector.substring(start, end);
    }

    /** Inverse of {@link #classesToSelector(String)}; non-class selectors give {@code ""}. */
    public static String selectorToClassList(String selector) {
        if (!isClassSelector(selector)) return "";
        StringBuilder sb = new StringBuilder();
        for (String part : selector.substring(1).split("\\.")) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(part);
        }
        return sb.toString();
    }

    public static boolean isElementSelector(String selector) {
        if (!isSimple(selector)) return false;
        char c = selector.charAt(0);
        return c != '.' && c != '#';
    }

    public static boolean isClassSelector(String selector) {
        return isSimple(selector) && selector.charAt(0) == '.';
    }

    public static boolean isIdSelector(String selector) {
        return isSimple(selector) && selector.charAt(0) == '#';
    }

    private static boolean isSimple(String selector) {
        return selector != null && !selector.isEmpty()
                && selector.indexOf(' ') < 0 && selector.indexOf(':') < 0;
    }
}
