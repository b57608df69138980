package info.isaksson.erland.soltouml.ast;

public final class DoWhileStatement extends AstNode {
    public final AstNode condition;
    public final AstNode body;

    public DoWhileStatement(AstNode condition, AstNode body) {
        super("DoWhileStatement");
        this.condition = condition;
        this.body = body;
    }
}
