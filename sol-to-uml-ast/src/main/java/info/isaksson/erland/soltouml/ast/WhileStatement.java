package info.isaksson.erland.soltouml.ast;

public final class WhileStatement extends AstNode {
    public final AstNode condition;
    public final AstNode body;

    public WhileStatement(AstNode condition, AstNode body) {
        super("WhileStatement");
        this.condition = condition;
        this.body = body;
    }
}
