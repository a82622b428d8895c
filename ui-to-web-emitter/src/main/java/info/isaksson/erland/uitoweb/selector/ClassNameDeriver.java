package info.isaksson.erland.uitoweb.selector;

import info.isaksson.erland.uitoweb.ir.IrComponent;

/**
 * Produces the natural class list of a component.
 *
 * <p>Implementations return a space-separated list such as {@code "btn primary"}. An empty string
 * means the node gets no selector.</p>
 */
@FunctionalInterface
public interface ClassNameDeriver {

    String deriveClassNames(IrComponent component) throws ClassNameDerivationException;
}
