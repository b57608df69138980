package info.isaksson.erland.soltouml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"name","type","visibility"})
public final class EntityAttribute {
    public final String name;
    /** Canonical type string, see {@code TypeNameFormatter}. For enum values, the ordinal. */
    public final String type;

    /** Only set for contract state variables. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final Visibility visibility;

    @JsonCreator
    public EntityAttribute(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("visibility") Visibility visibility
    ) {
        this.name = Objects.requireNonNullElse(name, "");
        this.type = Objects.requireNonNullElse(type, "");
        this.visibility = visibility;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityAttribute)) return false;
        EntityAttribute that = (EntityAttribute) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                visibility == that.visibility;
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, visibility);
    }

    @Override public String toString() {
        return name + ": " + type;
    }
}
