package info.isaksson.erland.uitoweb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"name","value"})
public final class IrManifestVariable {
    public final String name;
    public final String value;

    @JsonCreator
    public IrManifestVariable(
            @JsonProperty("name") String name,
            @JsonProperty("value") String value
    ) {
        this.name = name;
        this.value = value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrManifestVariable)) return false;
        IrManifestVariable that = (IrManifestVariable) o;
        return Objects.equals(name, that.name) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override public String toString() {
        return "IrManifestVariable{" + name + "=" + value + "}";
    }
}
