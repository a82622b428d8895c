package info.isaksson.erland.uitoweb.classify;

import java.util.Objects;

/**
 * Static rendering facts about one component variant.
 *
 * <p>{@link #defaultDisplay} is the browser default of {@link #tagName}; the CSS generator uses it
 * to elide {@code display} declarations that would not change anything.</p>
 */
public final class ClassificationEntry {

    public final String className;
    public final String tagName;
    public final String defaultDisplay;

    public final boolean container;
    public final boolean text;
    public final boolean form;
    public final boolean selfClosing;
    public final boolean inlineDimensions;

    ClassificationEntry(String className, String tagName, String defaultDisplay,
                        boolean container, boolean text, boolean form,
                        boolean selfClosing, boolean inlineDimensions) {
        this.className = Objects.requireNonNull(className, "className");
        this.tagName = Objects.requireNonNull(tagName, "tagName");
        this.defaultDisplay = Objects.requireNonNull(defaultDisplay, "defaultDisplay");
        this.container = container;
        this.text = text;
        this.form = form;
        this.selfClosing = selfClosing;
        this.inlineDimensions = inlineDimensions;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassificationEntry)) return false;
        ClassificationEntry that = (ClassificationEntry) o;
        return container == that.container &&
                text == that.text &&
                form == that.form &&
                selfClosing == that.selfClosing &&
                inlineDimensions == that.inlineDimensions &&
                className.equals(that.className) &&
                tagName.equals(that.tagName) &&
                defaultDisplay.equals(that.defaultDisplay);
    }

    @Override public int hashCode() {
        return Objects.hash(className, tagName, defaultDisplay, container, text, form, selfClosing, inlineDimensions);
    }

    @Override public String toString() {
        return "ClassificationEntry{" +
                "className='" + className + '\'' +
                ", tagName='" + tagName + '\'' +
                ", defaultDisplay='" + defaultDisplay + '\'' +
                ", container=" + container +
                ", text=" + text +
                ", form=" + form +
                ", selfClosing=" + selfClosing +
                ", inlineDimensions=" + inlineDimensions +
                '}';
    }
}
