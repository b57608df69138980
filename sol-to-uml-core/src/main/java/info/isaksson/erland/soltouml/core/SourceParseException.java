package info.isaksson.erland.soltouml.core;

import info.isaksson.erland.soltouml.extract.ExtractionException;

/** Source text of one fetched file could not be parsed into a syntax tree. */
public class SourceParseException extends ExtractionException {

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
