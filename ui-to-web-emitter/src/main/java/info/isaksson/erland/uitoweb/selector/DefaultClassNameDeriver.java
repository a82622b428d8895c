package info.isaksson.erland.uitoweb.selector;

import info.isaksson.erland.uitoweb.classify.ClassificationTable;
import info.isaksson.erland.uitoweb.ir.IrComponent;
import info.isaksson.erland.uitoweb.ir.IrNormalizer;

/**
 * Uses the node's explicit {@code cssClass} when present, otherwise {@code <variant-class>-<id>}.
 */
public final class DefaultClassNameDeriver implements ClassNameDeriver {

    @Override
    public String deriveClassNames(IrComponent component) throws ClassNameDerivationException {
        if (component == null) throw new ClassNameDerivationException("component is null");

        String explicit = IrNormalizer.normalizeClassList(component.cssClass);
        if (explicit != null && !explicit.isEmpty()) return explicit;

        return ClassificationTable.classify(component.type).className + "-" + component.id;
    }
}
