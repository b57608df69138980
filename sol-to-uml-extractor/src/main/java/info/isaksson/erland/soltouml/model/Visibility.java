package info.isaksson.erland.soltouml.model;

public enum Visibility {
    PUBLIC,
    EXTERNAL,
    INTERNAL,
    PRIVATE
}
