package info.isaksson.erland.soltouml.extract;

/** A type-name node of a kind {@link TypeNameFormatter} cannot render. */
public class TypeFormatException extends ExtractionException {
    public TypeFormatException(String message) {
        super(message);
    }
}
