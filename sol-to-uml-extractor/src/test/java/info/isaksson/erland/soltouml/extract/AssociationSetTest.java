package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.model.Association;
import info.isaksson.erland.soltouml.model.ReferenceType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AssociationSetTest {

    @Test
    void dropsSelfElementaryAndEmptyTargets() {
        AssociationSet set = new AssociationSet("Token");
        set.record("Token", ReferenceType.STORAGE, false);
        set.record("address", ReferenceType.STORAGE, false);
        set.record("uint256", ReferenceType.MEMORY, false);
        set.record("", ReferenceType.MEMORY, false);
        set.record("  ", ReferenceType.MEMORY, false);
        set.record(null, ReferenceType.MEMORY, false);

        assertTrue(set.isEmpty(), "recorded: " + set.toMap());
    }

    @Test
    void realizationIsSticky() {
        AssociationSet set = new AssociationSet("A");
        set.record("B", ReferenceType.STORAGE, true);
        set.record("B", ReferenceType.MEMORY, false);

        assertEquals(new Association("B", ReferenceType.STORAGE, true), set.get("B"));
        assertEquals(1, set.size());
    }

    @Test
    void storageIsNeverDowngraded() {
        AssociationSet set = new AssociationSet("A");
        set.record("S", ReferenceType.STORAGE, false);
        set.record("S", ReferenceType.MEMORY, false);
        assertEquals(ReferenceType.STORAGE, set.get("S").referenceType);
    }

    @Test
    void firstReferenceTypeWins() {
        AssociationSet set = new AssociationSet("A");
        set.record("C", ReferenceType.MEMORY, false);
        set.record("C", ReferenceType.STORAGE, false);

        assertEquals(new Association("C", ReferenceType.MEMORY, false), set.get("C"));
    }

    @Test
    void laterRealizationKeepsFirstReferenceType() {
        AssociationSet set = new AssociationSet("A");
        set.record("R", ReferenceType.MEMORY, false);
        set.record("R", ReferenceType.STORAGE, true);

        assertEquals(new Association("R", ReferenceType.MEMORY, true), set.get("R"));
    }

    @Test
    void keepsDiscoveryOrder() {
        AssociationSet set = new AssociationSet("A");
        set.record("Z", ReferenceType.MEMORY, false);
        set.record("M", ReferenceType.STORAGE, false);
        set.record("Z", ReferenceType.STORAGE, false);
        set.record("B", ReferenceType.MEMORY, false);

        assertEquals(List.of("Z", "M", "B"), List.copyOf(set.toMap().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> set.toMap().clear());
    }
}
