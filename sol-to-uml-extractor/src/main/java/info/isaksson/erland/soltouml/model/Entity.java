package info.isaksson.erland.soltouml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One contract, interface, library, abstract contract, struct or enum extracted from a source file.
 *
 * <p>Instances are immutable. Attribute and operator order is declaration order. Associations are keyed
 * by target entity name and iterate in discovery order; the map may reference entities that were never
 * extracted (external contracts, or identifiers that only look like type names).</p>
 */
@JsonPropertyOrder({"name","stereotype","absolutePath","relativePath","attributes","operators","structs","enums","associations","importedPaths"})
public final class Entity {
    public final String name;
    public final ClassStereotype stereotype;
    public final String absolutePath;
    public final String relativePath;

    public final List<EntityAttribute> attributes;
    public final List<EntityOperator> operators;

    /** Structs declared inside a contract: struct name -> members. */
    public final Map<String, List<EntityParameter>> structs;
    /** Enums declared inside a contract: enum name -> value names. */
    public final Map<String, List<String>> enums;

    public final Map<String, Association> associations;

    /** Resolved import targets of the file this entity was declared in. */
    public final List<String> importedPaths;

    @JsonCreator
    public Entity(
            @JsonProperty("name") String name,
            @JsonProperty("stereotype") ClassStereotype stereotype,
            @JsonProperty("absolutePath") String absolutePath,
            @JsonProperty("relativePath") String relativePath,
            @JsonProperty("attributes") List<EntityAttribute> attributes,
            @JsonProperty("operators") List<EntityOperator> operators,
            @JsonProperty("structs") Map<String, List<EntityParameter>> structs,
            @JsonProperty("enums") Map<String, List<String>> enums,
            @JsonProperty("associations") Map<String, Association> associations,
            @JsonProperty("importedPaths") List<String> importedPaths
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.stereotype = stereotype == null ? ClassStereotype.NONE : stereotype;
        this.absolutePath = Objects.requireNonNullElse(absolutePath, "");
        this.relativePath = Objects.requireNonNullElse(relativePath, "");
        this.attributes = attributes == null ? List.of() : List.copyOf(attributes);
        this.operators = operators == null ? List.of() : List.copyOf(operators);
        this.structs = copyOfLists(structs);
        this.enums = copyOfLists(enums);
        this.associations = associations == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(associations));
        this.importedPaths = importedPaths == null ? List.of() : List.copyOf(importedPaths);
    }

    public Association association(String targetName) {
        return associations.get(targetName);
    }

    private static <T> Map<String, List<T>> copyOfLists(Map<String, List<T>> in) {
        if (in == null || in.isEmpty()) return Collections.emptyMap();
        Map<String, List<T>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<T>> e : in.entrySet()) {
            out.put(e.getKey(), e.getValue() == null ? List.of() : List.copyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity)) return false;
        Entity that = (Entity) o;
        return Objects.equals(name, that.name) &&
                stereotype == that.stereotype &&
                Objects.equals(absolutePath, that.absolutePath) &&
                Objects.equals(relativePath, that.relativePath) &&
                Objects.equals(attributes, that.attributes) &&
                Objects.equals(operators, that.operators) &&
                Objects.equals(structs, that.structs) &&
                Objects.equals(enums, that.enums) &&
                Objects.equals(associations, that.associations) &&
                Objects.equals(importedPaths, that.importedPaths);
    }

    @Override public int hashCode() {
        return Objects.hash(name, stereotype, absolutePath, relativePath, attributes, operators, structs, enums, associations, importedPaths);
    }

    @Override public String toString() {
        return stereotype + " " + name + " (" + relativePath + ")";
    }
}
