package info.isaksson.erland.soltouml.extract;

/** An import path that could not be mapped to a concrete file. Never fatal for extraction. */
public class ImportResolutionException extends Exception {

    private final String importPath;
    private final String importingFile;

    public ImportResolutionException(String importPath, String importingFile, String reason) {
        this(importPath, importingFile, reason, null);
    }

    public ImportResolutionException(String importPath, String importingFile, String reason, Throwable cause) {
        super("Failed to resolve import " + importPath + " from file " + importingFile + ": " + reason, cause);
        this.importPath = importPath;
        this.importingFile = importingFile;
    }

    public String getImportPath() {
        return importPath;
    }

    public String getImportingFile() {
        return importingFile;
    }
}
