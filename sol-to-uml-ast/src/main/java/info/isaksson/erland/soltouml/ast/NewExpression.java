package info.isaksson.erland.soltouml.ast;

public final class NewExpression extends AstNode {
    public final TypeName typeName;

    public NewExpression(TypeName typeName) {
        super("NewExpression");
        this.typeName = typeName;
    }
}
