package info.isaksson.erland.soltouml.ast;

public final class ReturnStatement extends AstNode {
    /** {@code null} for a bare {@code return;}. */
    public final AstNode expression;

    public ReturnStatement(AstNode expression) {
        super("ReturnStatement");
        this.expression = expression;
    }
}
