package info.isaksson.erland.soltouml.extract;

import java.util.Objects;

/** A non-fatal condition met while extracting one source file. */
public final class ExtractionWarning {

    /** Stable code, e.g. {@link ExtractionWarnings#IMPORT_UNRESOLVED}. */
    public final String code;

    /** Path label of the file the condition was met in. */
    public final String file;

    /** The import path as written in the source. */
    public final String importPath;

    public final String message;

    public ExtractionWarning(String code, String file, String importPath, String message) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.file = Objects.requireNonNullElse(file, "");
        this.importPath = Objects.requireNonNullElse(importPath, "");
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    @Override public String toString() {
        return code + " " + file + ": " + message;
    }
}
