package info.isaksson.erland.uitoweb.emitter;

/**
 * Append-only text accumulator for one generation call.
 *
 * <p>Tracks an indentation level (two spaces per level). When indentation is disabled, lines are
 * still terminated but never indented.</p>
 */
public final class MarkupWriter {

    private static final String INDENT = "  ";

    private final StringBuilder sb;
    private final boolean indent;
    private int level;

    public MarkupWriter() {
        this(true);
    }

    public MarkupWriter(boolean indent) {
        this.sb = new StringBuilder(4096);
        this.indent = indent;
    }

    public MarkupWriter append(String text) {
        sb.append(text);
        return this;
    }

    public MarkupWriter append(char c) {
        sb.append(c);
        return this;
    }

    /** Writes the current indentation, then {@code text}, then a newline. */
    public MarkupWriter line(String text) {
        writeIndent();
        sb.append(text).append('\n');
        return this;
    }

    private void writeIndent() {
        if (indent) {
            for (int i = 0; i < level; i++) sb.append(INDENT);
        }
    }

    public MarkupWriter newline() {
        sb.append('\n');
        return this;
    }

    public void push() {
        level++;
    }

    public void pop() {
        if (level == 0) throw new IllegalStateException("indentation underflow");
        level--;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
