package info.isaksson.erland.uitoweb.emitter;

/** Escapes user text for HTML/SVG text content and attribute values. */
public final class HtmlEscaper {

    private HtmlEscaper() {}

    public static String escape(String text) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            String replacement;
            switch (ch) {
                case '&':
                    replacement = "&amp;";
                    break;
                case '<':
                    replacement = "&lt;";
                    break;
                case '>':
                    replacement = "&gt;";
                    break;
                case '"':
                    replacement = "&quot;";
                    break;
                case '\'':
                    replacement = "&#x27;";
                    break;
                default:
                    replacement = null;
            }
            if (replacement == null) {
                if (sb != null) sb.append(ch);
            } else {
                if (sb == null) {
                    sb = new StringBuilder(text.length() + 16);
                    sb.append(text, 0, i);
                }
                sb.append(replacement);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
