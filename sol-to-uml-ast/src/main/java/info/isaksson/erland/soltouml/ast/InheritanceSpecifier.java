package info.isaksson.erland.soltouml.ast;

public final class InheritanceSpecifier extends AstNode {
    public final UserDefinedTypeName baseName;

    public InheritanceSpecifier(UserDefinedTypeName baseName) {
        super("InheritanceSpecifier");
        this.baseName = baseName;
    }
}
