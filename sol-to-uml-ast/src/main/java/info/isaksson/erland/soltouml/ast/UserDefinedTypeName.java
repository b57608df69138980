package info.isaksson.erland.soltouml.ast;

/** Reference to a contract, struct, enum or library member type, e.g. {@code IERC20} or {@code Set.Data}. */
public final class UserDefinedTypeName extends TypeName {
    public final String namePath;

    public UserDefinedTypeName(String namePath) {
        super("UserDefinedTypeName");
        this.namePath = namePath;
    }
}
