package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.model.ClassStereotype;
import info.isaksson.erland.soltouml.model.Visibility;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class KeywordClassifierTest {

    @Test
    void classifiesContractKinds() {
        assertEquals(ClassStereotype.NONE, StereotypeClassifier.classify("contract"));
        assertEquals(ClassStereotype.INTERFACE, StereotypeClassifier.classify("interface"));
        assertEquals(ClassStereotype.LIBRARY, StereotypeClassifier.classify("library"));
        assertEquals(ClassStereotype.ABSTRACT, StereotypeClassifier.classify("abstract"));
    }

    @Test
    void rejectsUnknownContractKind() {
        ValidationException ex = assertThrows(ValidationException.class, () -> StereotypeClassifier.classify("trait"));
        assertTrue(ex.getMessage().contains("trait"));
        assertThrows(ValidationException.class, () -> StereotypeClassifier.classify(null));
    }

    @Test
    void mapsVisibilities() {
        assertEquals(Visibility.PUBLIC, VisibilityMapper.map("default"));
        assertEquals(Visibility.PUBLIC, VisibilityMapper.map("public"));
        assertEquals(Visibility.PUBLIC, VisibilityMapper.map(null));
        assertEquals(Visibility.EXTERNAL, VisibilityMapper.map("external"));
        assertEquals(Visibility.INTERNAL, VisibilityMapper.map("internal"));
        assertEquals(Visibility.PRIVATE, VisibilityMapper.map("private"));
    }

    @Test
    void rejectsUnknownVisibility() {
        assertThrows(ValidationException.class, () -> VisibilityMapper.map("protected"));
        assertThrows(ValidationException.class, () -> VisibilityMapper.map("PUBLIC"));
    }

    @Test
    void recognizesElementaryTypes() {
        for (String t : new String[] {"address", "address payable", "bool", "string", "bytes", "byte", "bytes32",
                "uint", "uint8", "int256", "fixed", "ufixed128x18", "var"}) {
            assertTrue(ElementaryTypes.isElementary(t), t);
        }
        for (String t : new String[] {"IERC20", "Set", "uints", "bytesX", "", "Int256"}) {
            assertFalse(ElementaryTypes.isElementary(t), t);
        }
        assertFalse(ElementaryTypes.isElementary(null));
    }
}
