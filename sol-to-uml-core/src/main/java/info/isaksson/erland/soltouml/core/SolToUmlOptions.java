package info.isaksson.erland.soltouml.core;

/** Options for {@link SolToUmlService}. */
public final class SolToUmlOptions {

    /**
     * Resolve imports against the local filesystem (Node-style module lookup).
     * When false, imports are joined textually against the importing file's folder.
     * Explorer extraction always uses textual joining.
     */
    public boolean filesystemImports = true;

    /**
     * Abort the whole run on the first file that fails to extract.
     * When false, the failure is recorded and the remaining files are still processed.
     */
    public boolean failFast = false;
}
