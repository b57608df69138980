package info.isaksson.erland.soltouml.ast;

public final class UnaryOperation extends AstNode {
    public final AstNode subExpression;

    public UnaryOperation(AstNode subExpression) {
        super("UnaryOperation");
        this.subExpression = subExpression;
    }
}
