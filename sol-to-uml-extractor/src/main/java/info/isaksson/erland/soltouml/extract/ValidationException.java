package info.isaksson.erland.soltouml.extract;

/**
 * A visibility or contract-kind keyword outside the known set.
 *
 * <p>Signals that the syntax tree comes from a grammar version the classifiers do not know.</p>
 */
public class ValidationException extends ExtractionException {
    public ValidationException(String message) {
        super(message);
    }
}
