package info.isaksson.erland.soltouml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Directed edge from an {@link Entity} to the entity named {@link #targetName}. */
@JsonPropertyOrder({"targetName","referenceType","realization"})
public final class Association {
    public final String targetName;
    public final ReferenceType referenceType;
    /** True for inheritance / interface implementation edges. */
    public final boolean realization;

    @JsonCreator
    public Association(
            @JsonProperty("targetName") String targetName,
            @JsonProperty("referenceType") ReferenceType referenceType,
            @JsonProperty("realization") boolean realization
    ) {
        this.targetName = Objects.requireNonNull(targetName, "targetName");
        this.referenceType = referenceType == null ? ReferenceType.MEMORY : referenceType;
        this.realization = realization;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Association)) return false;
        Association that = (Association) o;
        return realization == that.realization &&
                Objects.equals(targetName, that.targetName) &&
                referenceType == that.referenceType;
    }

    @Override public int hashCode() {
        return Objects.hash(targetName, referenceType, realization);
    }

    @Override public String toString() {
        return targetName + "(" + referenceType + (realization ? ", realization" : "") + ")";
    }
}
