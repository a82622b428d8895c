package info.isaksson.erland.uitoweb.css;

/** Options for generating a stylesheet from a component tree. */
public final class CssOptions {

    /** When true, the stylesheet starts with a generator comment. */
    public final boolean includeHeader;

    /** Pseudo-state rules ({@code :hover}, {@code :focus}, ...) for nodes that carry them. */
    public final boolean includePseudoRules;

    /** {@code @media} rules for nodes with breakpoints. */
    public final boolean includeMediaRules;

    public final boolean includeKeyframes;

    /** When true, rules without declarations are left out instead of written as empty blocks. */
    public final boolean omitEmptyRules;

    public CssOptions(
            boolean includeHeader,
            boolean includePseudoRules,
            boolean includeMediaRules,
            boolean includeKeyframes,
            boolean omitEmptyRules
    ) {
        this.includeHeader = includeHeader;
        this.includePseudoRules = includePseudoRules;
        this.includeMediaRules = includeMediaRules;
        this.includeKeyframes = includeKeyframes;
        this.omitEmptyRules = omitEmptyRules;
    }

    public static CssOptions defaults() {
        return new CssOptions(true, true, true, true, false);
    }

    public CssOptions withHeader(boolean include) {
        return new CssOptions(include, includePseudoRules, includeMediaRules, includeKeyframes, omitEmptyRules);
    }

    public CssOptions withPseudoRules(boolean include) {
        return new CssOptions(includeHeader, include, includeMediaRules, includeKeyframes, omitEmptyRules);
    }

    public CssOptions withMediaRules(boolean include) {
        return new CssOptions(includeHeader, includePseudoRules, include, includeKeyframes, omitEmptyRules);
    }

    public CssOptions withKeyframes(boolean include) {
        return new CssOptions(includeHeader, includePseudoRules, includeMediaRules, include, omitEmptyRules);
    }

    public CssOptions withOmitEmptyRules(boolean omit) {
        return new CssOptions(includeHeader, includePseudoRules, includeMediaRules, includeKeyframes, omit);
    }

    @Override
    public String toString() {
        return "CssOptions{" +
                "includeHeader=" + includeHeader +
                ", includePseudoRules=" + includePseudoRules +
                ", includeMediaRules=" + includeMediaRules +
                ", includeKeyframes=" + includeKeyframes +
                ", omitEmptyRules=" + omitEmptyRules +
                '}';
    }
}
