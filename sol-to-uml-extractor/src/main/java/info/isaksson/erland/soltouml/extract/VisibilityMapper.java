package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.model.Visibility;

/** Maps raw visibility keywords to {@link Visibility}. */
public final class VisibilityMapper {

    private VisibilityMapper() {}

    /**
     * @param keyword {@code default}, {@code public}, {@code external}, {@code internal} or {@code private};
     *                {@code null} is read as {@code default}
     */
    public static Visibility map(String keyword) {
        if (keyword == null) return Visibility.PUBLIC;
        return switch (keyword) {
            case "default", "public" -> Visibility.PUBLIC;
            case "external" -> Visibility.EXTERNAL;
            case "internal" -> Visibility.INTERNAL;
            case "private" -> Visibility.PRIVATE;
            default -> throw new ValidationException("Invalid visibility " + keyword
                    + ". Was not public, external, internal or private");
        };
    }
}
