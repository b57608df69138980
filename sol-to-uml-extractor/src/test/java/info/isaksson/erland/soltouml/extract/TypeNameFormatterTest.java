package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.ast.FunctionTypeName;
import info.isaksson.erland.soltouml.ast.UnknownTypeName;
import org.junit.jupiter.api.Test;

import static info.isaksson.erland.soltouml.extract.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class TypeNameFormatterTest {

    @Test
    void formatsElementaryAndUserDefinedTypes() {
        assertEquals("uint256", TypeNameFormatter.format(elem("uint256")));
        assertEquals("Set.Data", TypeNameFormatter.format(udt("Set.Data")), "dotted path is kept as written");
    }

    @Test
    void formatsArrays() {
        assertEquals("uint256[]", TypeNameFormatter.format(array(elem("uint256"))));
        assertEquals("S[][]", TypeNameFormatter.format(array(array(udt("S")))));
    }

    @Test
    void formatsMappings() {
        assertEquals("mapping(address=>uint256)", TypeNameFormatter.format(mapping(elem("address"), elem("uint256"))));
        assertEquals("mapping(Ids.Key=>mapping(uint8=>Set.Data[]))",
                TypeNameFormatter.format(mapping(udt("Ids.Key"), mapping(elem("uint8"), array(udt("Set.Data"))))));
    }

    @Test
    void functionTypesUsePlaceholder() {
        assertEquals(TypeNameFormatter.FUNCTION_TYPE, TypeNameFormatter.format(new FunctionTypeName()));
    }

    @Test
    void unknownKindsFail() {
        TypeFormatException ex = assertThrows(TypeFormatException.class,
                () -> TypeNameFormatter.format(new UnknownTypeName("TupleTypeName")));
        assertTrue(ex.getMessage().contains("TupleTypeName"), ex.getMessage());
        assertThrows(TypeFormatException.class, () -> TypeNameFormatter.format(null));
        assertThrows(TypeFormatException.class, () -> TypeNameFormatter.format(array(new UnknownTypeName("X"))));
    }
}
