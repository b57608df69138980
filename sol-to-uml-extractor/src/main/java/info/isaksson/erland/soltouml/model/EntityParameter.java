package info.isaksson.erland.soltouml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Name and canonical type string of a parameter or nested struct member. */
@JsonPropertyOrder({"name","type"})
public final class EntityParameter {
    /** Empty for unnamed parameters. */
    public final String name;
    public final String type;

    @JsonCreator
    public EntityParameter(@JsonProperty("name") String name, @JsonProperty("type") String type) {
        this.name = Objects.requireNonNullElse(name, "");
        this.type = Objects.requireNonNullElse(type, "");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityParameter)) return false;
        EntityParameter that = (EntityParameter) o;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override public String toString() {
        return name + ": " + type;
    }
}
