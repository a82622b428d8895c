package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One node of the component tree.
 *
 * <p>Nodes are immutable and own their children, so a tree built from them is finite and acyclic.
 * Child order is document order and is never rearranged by any generator.</p>
 */
@JsonPropertyOrder({"id","type","tag","selectorKind","cssClass","text","payload","data","style","pseudoStyles","breakpoints","flowchart","children"})
public final class IrComponent {
    public final int id;
    public final IrComponentType type;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String tag;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrSelectorKind selectorKind;

    /** Space-separated class list chosen by the source, if any. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String cssClass;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String text;

    /** Opaque primary payload: image source, link target, input placeholder. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String payload;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> data;

    public final IrStyle style;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrPseudoStyle> pseudoStyles;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrBreakpoint> breakpoints;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrFlowchart flowchart;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrComponent> children;

    @JsonCreator
    public IrComponent(
            @JsonProperty("id") int id,
            @JsonProperty("type") IrComponentType type,
            @JsonProperty("tag") String tag,
            @JsonProperty("selectorKind") IrSelectorKind selectorKind,
            @JsonProperty("cssClass") String cssClass,
            @JsonProperty("text") String text,
            @JsonProperty("payload") String payload,
            @JsonProperty("data") Map<String, String> data,
            @JsonProperty("style") IrStyle style,
            @JsonProperty("pseudoStyles") List<IrPseudoStyle> pseudoStyles,
            @JsonProperty("breakpoints") List<IrBreakpoint> breakpoints,
            @JsonProperty("flowchart") IrFlowchart flowchart,
            @JsonProperty("children") List<IrComponent> children
    ) {
        this.id = id;
        this.type = type == null ? IrComponentType.UNKNOWN : type;
        this.tag = tag;
        this.selectorKind = selectorKind;
        this.cssClass = cssClass;
        this.text = text;
        this.payload = payload;
        this.data = data == null || data.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(data));
        this.style = style == null ? IrStyle.DEFAULTS : style;
        this.pseudoStyles = pseudoStyles == null ? List.of() : List.copyOf(pseudoStyles);
        this.breakpoints = breakpoints == null ? List.of() : List.copyOf(breakpoints);
        this.flowchart = flowchart;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public static Builder builder(IrComponentType type) {
        return new Builder(type);
    }

    /** Value of a data entry parsed as int, or {@code fallback} when absent or malformed. */
    public int dataInt(String key, int fallback) {
        String v = data.get(key);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public boolean dataFlag(String key) {
        return Boolean.parseBoolean(data.get(key));
    }

    public boolean hasTag(String value) {
        return tag != null && tag.equals(value);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrComponent)) return false;
        IrComponent that = (IrComponent) o;
        return id == that.id &&
                type == that.type &&
                Objects.equals(tag, that.tag) &&
                selectorKind == that.selectorKind &&
                Objects.equals(cssClass, that.cssClass) &&
                Objects.equals(text, that.text) &&
                Objects.equals(payload, that.payload) &&
                data.equals(that.data) &&
                style.equals(that.style) &&
                pseudoStyles.equals(that.pseudoStyles) &&
                breakpoints.equals(that.breakpoints) &&
                Objects.equals(flowchart, that.flowchart) &&
                children.equals(that.children);
    }

    @Override public int hashCode() {
        return Objects.hash(id, type, tag, selectorKind, cssClass, text, payload, data, style, pseudoStyles, breakpoints, flowchart, children);
    }

    @Override public String toString() {
        return "IrComponent{" + type + "#" + id + "}";
    }

    /** Convenience builder for programmatic trees (tests, adapters). */
    public static final class Builder {
        private final IrComponentType type;
        private int id;
        private String tag;
        private IrSelectorKind selectorKind;
        private String cssClass;
        private String text;
        private String payload;
        private final Map<String, String> data = new TreeMap<>();
        private IrStyle style;
        private final List<IrPseudoStyle> pseudoStyles = new ArrayList<>();
        private final List<IrBreakpoint> breakpoints = new ArrayList<>();
        private IrFlowchart flowchart;
        private final List<IrComponent> children = new ArrayList<>();

        private Builder(IrComponentType type) {
            this.type = type;
        }

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        /** Marks the node as addressed by its bare tag name. */
        public Builder elementSelector(String tag) {
            this.tag = tag;
            this.selectorKind = IrSelectorKind.ELEMENT;
            return this;
        }

        public Builder cssClass(String cssClass) {
            this.cssClass = cssClass;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder data(String key, String value) {
            this.data.put(key, value);
            return this;
        }

        public Builder style(IrStyle style) {
            this.style = style;
            return this;
        }

        public Builder pseudoStyle(IrPseudoState state, IrStyle style) {
            this.pseudoStyles.add(new IrPseudoStyle(state, style));
            return this;
        }

        public Builder breakpoint(IrBreakpoint breakpoint) {
            this.breakpoints.add(breakpoint);
            return this;
        }

        public Builder flowchart(IrFlowchart flowchart) {
            this.flowchart = flowchart;
            return this;
        }

        public Builder child(IrComponent child) {
            if (child == null) throw new IllegalArgumentException("child must not be null");
            this.children.add(child);
            return this;
        }

        public IrComponent build() {
            return new IrComponent(id, type, tag, selectorKind, cssClass, text, payload, data, style,
                    pseudoStyles, breakpoints, flowchart, children);
        }
    }
}
