package info.isaksson.erland.uitoweb.css;

import java.util.Objects;

/** One {@code property: value;} line. */
public final class CssDeclaration {
    public final String property;
    public final String value;

    public CssDeclaration(String property, String value) {
        if (property == null) throw new IllegalArgumentException("property must not be null");
        if (value == null) throw new IllegalArgumentException("value must not be null");
        this.property = property;
        this.value = value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CssDeclaration)) return false;
        CssDeclaration that = (CssDeclaration) o;
        return property.equals(that.property) && value.equals(that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(property, value);
    }

    @Override public String toString() {
        return property + ": " + value + ";";
    }
}
