package info.isaksson.erland.soltouml.core;

import info.isaksson.erland.soltouml.extract.ExtractionException;

/** A file whose extraction failed and was skipped. */
public final class FileFailure {
    public final String relativePath;
    public final ExtractionException error;

    FileFailure(String relativePath, ExtractionException error) {
        this.relativePath = relativePath;
        this.error = error;
    }

    @Override public String toString() {
        return error.getMessage();
    }
}
