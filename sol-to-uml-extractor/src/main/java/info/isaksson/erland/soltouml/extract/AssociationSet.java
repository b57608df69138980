package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.model.Association;
import info.isaksson.erland.soltouml.model.ReferenceType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Associations discovered for one entity, keyed by target name in discovery order.
 *
 * <p>Repeated discoveries of a target merge into its single record: {@code referenceType} is the one of the
 * first discovery, and {@code realization} stays true once set.
 * Empty names, the owning entity's own name and elementary type keywords are never recorded.</p>
 *
 * <p>Not thread-safe; an instance belongs to the extraction of a single entity.</p>
 */
public final class AssociationSet {

    private final String ownerName;
    private final Map<String, Association> byTarget = new LinkedHashMap<>();

    public AssociationSet(String ownerName) {
        this.ownerName = ownerName;
    }

    public void record(String targetName, ReferenceType referenceType, boolean realization) {
        if (targetName == null) return;
        String target = targetName.trim();
        if (target.isEmpty()) return;
        if (target.equals(ownerName)) return;
        if (ElementaryTypes.isElementary(target)) return;

        ReferenceType rt = referenceType == null ? ReferenceType.MEMORY : referenceType;
        Association existing = byTarget.get(target);
        if (existing == null) {
            byTarget.put(target, new Association(target, rt, realization));
            return;
        }

        if (realization && !existing.realization) {
            byTarget.put(target, new Association(target, existing.referenceType, true));
        }
    }

    public Association get(String targetName) {
        return byTarget.get(targetName);
    }

    public boolean isEmpty() {
        return byTarget.isEmpty();
    }

    public int size() {
        return byTarget.size();
    }

    /** Snapshot in discovery order. */
    public Map<String, Association> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(byTarget));
    }
}
