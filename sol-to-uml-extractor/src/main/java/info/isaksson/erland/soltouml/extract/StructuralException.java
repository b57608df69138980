package info.isaksson.erland.soltouml.extract;

/** The syntax tree root is not a source unit. */
public class StructuralException extends ExtractionException {
    public StructuralException(String message) {
        super(message);
    }
}
