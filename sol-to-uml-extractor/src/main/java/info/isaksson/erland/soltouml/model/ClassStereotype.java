package info.isaksson.erland.soltouml.model;

public enum ClassStereotype {
    NONE,
    INTERFACE,
    LIBRARY,
    ABSTRACT,
    STRUCT,
    ENUM
}
