package info.isaksson.erland.soltouml.model;

public enum OperatorStereotype {
    NONE,
    ABSTRACT,
    PAYABLE,
    FALLBACK,
    MODIFIER,
    EVENT
}
