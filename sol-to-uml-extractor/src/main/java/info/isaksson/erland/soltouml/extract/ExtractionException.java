package info.isaksson.erland.soltouml.extract;

/**
 * Fatal extraction failure for one source file.
 *
 * <p>Once the failing file is known the exception is attributed to it via {@link #attributeTo(String)},
 * and the path is prefixed to {@link #getMessage()}.</p>
 */
public class ExtractionException extends RuntimeException {

    private String sourcePath;

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Path of the file being extracted, or {@code null} if not yet attributed. */
    public String getSourcePath() {
        return sourcePath;
    }

    /** Attribute to {@code sourcePath} unless already attributed. */
    public ExtractionException attributeTo(String sourcePath) {
        if (this.sourcePath == null) this.sourcePath = sourcePath;
        return this;
    }

    @Override public String getMessage() {
        String m = super.getMessage();
        return sourcePath == null ? m : sourcePath + ": " + m;
    }
}
