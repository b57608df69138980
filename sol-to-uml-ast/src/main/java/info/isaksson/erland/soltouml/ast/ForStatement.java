package info.isaksson.erland.soltouml.ast;

/** {@code for (init; condition; loop) body}. The init statement is not kept. */
public final class ForStatement extends AstNode {
    public final AstNode conditionExpression;
    public final ExpressionStatement loopExpression;
    public final AstNode body;

    public ForStatement(AstNode conditionExpression, ExpressionStatement loopExpression, AstNode body) {
        super("ForStatement");
        this.conditionExpression = conditionExpression;
        this.loopExpression = loopExpression;
        this.body = body;
    }
}
