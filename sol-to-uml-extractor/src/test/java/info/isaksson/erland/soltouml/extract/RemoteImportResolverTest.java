package info.isaksson.erland.soltouml.extract;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RemoteImportResolverTest {

    private final RemoteImportResolver resolver = new RemoteImportResolver();

    @Test
    void joinsAgainstImportingFolder() throws Exception {
        assertEquals("contracts/B.sol", resolver.resolve("./B.sol", "contracts/A.sol"));
        assertEquals("lib/C.sol", resolver.resolve("../lib/C.sol", "contracts/A.sol"));
        assertEquals("B.sol", resolver.resolve("./B.sol", "A.sol"));
        assertEquals("/src/token/ERC20.sol", resolver.resolve("./token/ERC20.sol", "/src/Main.sol"));
    }

    @Test
    void packagePathsAreJoinedToo() throws Exception {
        assertEquals("contracts/@oz/access/Ownable.sol", resolver.resolve("@oz/access/Ownable.sol", "contracts/A.sol"));
    }

    @Test
    void keepsLeadingParentSegments() throws Exception {
        assertEquals("../x.sol", resolver.resolve("../../x.sol", "a/B.sol"));
        assertEquals("/x.sol", resolver.resolve("../../x.sol", "/a/B.sol"));
    }

    @Test
    void rejectsEmptyImport() {
        assertThrows(ImportResolutionException.class, () -> resolver.resolve(" ", "A.sol"));
    }

    @Test
    void dirnameAndNormalize() {
        assertEquals(".", RemoteImportResolver.dirname("A.sol"));
        assertEquals("/", RemoteImportResolver.dirname("/A.sol"));
        assertEquals("a/b", RemoteImportResolver.dirname("a\\b\\C.sol"));
        assertEquals(".", RemoteImportResolver.normalize("./a/.."));
        assertEquals("a/c", RemoteImportResolver.normalize("a//b/../c/"));
    }
}
