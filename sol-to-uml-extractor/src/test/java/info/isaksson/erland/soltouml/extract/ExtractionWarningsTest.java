package info.isaksson.erland.soltouml.extract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExtractionWarningsTest {

    @Test
    public void unresolvedImportsAreSortedByFileThenImport() {
        ExtractionWarnings w = new ExtractionWarnings();
        w.importUnresolved(new ImportResolutionException("./Z.sol", "b/B.sol", "no such file"));
        w.importUnresolved(new ImportResolutionException("./B.sol", "a/A.sol", "no such file"));
        w.importUnresolved(new ImportResolutionException("./A.sol", "b/B.sol", "no such file"));

        List<ExtractionWarning> out = w.toDeterministicList();
        assertEquals(3, out.size());
        assertEquals("a/A.sol", out.get(0).file);
        assertEquals("./B.sol", out.get(0).importPath);
        assertEquals("./A.sol", out.get(1).importPath);
        assertEquals("./Z.sol", out.get(2).importPath);
        for (ExtractionWarning warning : out) {
            assertEquals(ExtractionWarnings.IMPORT_UNRESOLVED, warning.code);
        }
        assertEquals("Failed to resolve import ./B.sol from file a/A.sol: no such file", out.get(0).message);
    }

    @Test
    public void addAllTakesOverFileWarnings() {
        ExtractionWarnings file = new ExtractionWarnings();
        file.importUnresolved(new ImportResolutionException("@oz/Gone.sol", "A.sol", "no such file"));
        ExtractionWarnings all = new ExtractionWarnings();
        all.addAll(file);
        all.addAll(all);
        all.addAll(null);

        assertEquals(1, all.size());
        assertEquals("@oz/Gone.sol", all.toDeterministicList().get(0).importPath);
    }
}
