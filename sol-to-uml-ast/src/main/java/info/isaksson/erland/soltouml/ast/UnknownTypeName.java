package info.isaksson.erland.soltouml.ast;

/** A type-name node whose kind is not one of the known type-name kinds. */
public final class UnknownTypeName extends TypeName {
    public UnknownTypeName(String type) {
        super(type == null ? "" : type);
    }
}
