package info.isaksson.erland.soltouml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A function, constructor, fallback, modifier or event of an entity. */
@JsonPropertyOrder({"name","stereotype","visibility","parameters","returnParameters","payable"})
public final class EntityOperator {
    /** {@code constructor} for constructors, empty for fallback and receive functions. */
    public final String name;
    public final OperatorStereotype stereotype;

    /** Not set for constructors, fallbacks, modifiers and events. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final Visibility visibility;

    public final List<EntityParameter> parameters;
    public final List<EntityParameter> returnParameters;

    /** Only set for fallback functions. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final Boolean payable;

    @JsonCreator
    public EntityOperator(
            @JsonProperty("name") String name,
            @JsonProperty("stereotype") OperatorStereotype stereotype,
            @JsonProperty("visibility") Visibility visibility,
            @JsonProperty("parameters") List<EntityParameter> parameters,
            @JsonProperty("returnParameters") List<EntityParameter> returnParameters,
            @JsonProperty("payable") Boolean payable
    ) {
        this.name = Objects.requireNonNullElse(name, "");
        this.stereotype = stereotype == null ? OperatorStereotype.NONE : stereotype;
        this.visibility = visibility;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.returnParameters = returnParameters == null ? List.of() : List.copyOf(returnParameters);
        this.payable = payable;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityOperator)) return false;
        EntityOperator that = (EntityOperator) o;
        return Objects.equals(name, that.name) &&
                stereotype == that.stereotype &&
                visibility == that.visibility &&
                Objects.equals(parameters, that.parameters) &&
                Objects.equals(returnParameters, that.returnParameters) &&
                Objects.equals(payable, that.payable);
    }

    @Override public int hashCode() {
        return Objects.hash(name, stereotype, visibility, parameters, returnParameters, payable);
    }

    @Override public String toString() {
        return name + parameters;
    }
}
