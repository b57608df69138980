package info.isaksson.erland.soltouml.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EntityJsonTest {

    private static Entity token() {
        Map<String, Association> associations = new LinkedHashMap<>();
        associations.put("Ownable", new Association("Ownable", ReferenceType.STORAGE, true));
        associations.put("IERC20", new Association("IERC20", ReferenceType.MEMORY, false));

        Map<String, List<EntityParameter>> structs = new LinkedHashMap<>();
        structs.put("Lock", List.of(new EntityParameter("until", "uint64")));

        return new Entity("Token", ClassStereotype.NONE, "/src/Token.sol", "src/Token.sol",
                List.of(new EntityAttribute("balances", "mapping(address=>uint256)", Visibility.PRIVATE)),
                List.of(
                        new EntityOperator("transfer", OperatorStereotype.NONE, Visibility.EXTERNAL,
                                List.of(new EntityParameter("to", "address"), new EntityParameter("amount", "uint256")),
                                List.of(new EntityParameter("", "bool")), null),
                        new EntityOperator("", OperatorStereotype.FALLBACK, null, null, null, true)),
                structs,
                Map.of("Phase", List.of("Init", "Live")),
                associations,
                List.of("/src/Ownable.sol"));
    }

    @Test
    void writesSortedKeysAndTrailingNewline() throws Exception {
        String json = EntityJson.toJsonString(List.of(token()));

        assertTrue(json.endsWith("}\n]\n"), json);
        assertTrue(json.indexOf("\"IERC20\"") < json.indexOf("\"Ownable\""), "association keys must be sorted");
        assertFalse(json.contains("\"payable\" : null"), "null payable is omitted");
        assertTrue(json.contains("\"payable\" : true"), json);
        assertTrue(json.contains("\n  {\n    \"name\" : \"Token\""), "two-space indentation expected:\n" + json);
        assertEquals(json, EntityJson.toJsonString(List.of(token())));
    }

    @Test
    void readsBackWhatWasWritten(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("nested/entities.json");
        EntityJson.write(List.of(token()), out);

        assertTrue(Files.readString(out).endsWith("\n"));
        List<Entity> back = EntityJson.read(out);
        assertEquals(List.of(token()), back);
        assertEquals(ReferenceType.STORAGE, back.get(0).association("Ownable").referenceType);
    }

    @Test
    void emptyListIsAnEmptyArray() throws Exception {
        assertEquals("[ ]\n", EntityJson.toJsonString(List.of()));
        assertEquals(List.of(), EntityJson.readFromString("[]"));
    }
}
