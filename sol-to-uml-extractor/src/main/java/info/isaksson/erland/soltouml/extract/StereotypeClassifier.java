package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.model.ClassStereotype;

/** Maps the declared contract kind keyword to a {@link ClassStereotype}. */
public final class StereotypeClassifier {

    private StereotypeClassifier() {}

    public static ClassStereotype classify(String kind) {
        if (kind == null) throw new ValidationException("Missing contract kind");
        return switch (kind) {
            case "contract" -> ClassStereotype.NONE;
            case "interface" -> ClassStereotype.INTERFACE;
            case "library" -> ClassStereotype.LIBRARY;
            case "abstract" -> ClassStereotype.ABSTRACT;
            default -> throw new ValidationException("Invalid contract kind " + kind
                    + ". Was not contract, interface, library or abstract");
        };
    }
}
