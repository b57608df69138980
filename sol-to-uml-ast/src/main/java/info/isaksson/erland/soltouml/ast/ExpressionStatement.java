package info.isaksson.erland.soltouml.ast;

public final class ExpressionStatement extends AstNode {
    public final AstNode expression;

    public ExpressionStatement(AstNode expression) {
        super("ExpressionStatement");
        this.expression = expression;
    }
}
