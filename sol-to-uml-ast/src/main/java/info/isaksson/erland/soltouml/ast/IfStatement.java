package info.isaksson.erland.soltouml.ast;

public final class IfStatement extends AstNode {
    public final AstNode condition;
    public final AstNode trueBody;
    /** {@code null} when there is no else branch. */
    public final AstNode falseBody;

    public IfStatement(AstNode condition, AstNode trueBody, AstNode falseBody) {
        super("IfStatement");
        this.condition = condition;
        this.trueBody = trueBody;
        this.falseBody = falseBody;
    }
}
