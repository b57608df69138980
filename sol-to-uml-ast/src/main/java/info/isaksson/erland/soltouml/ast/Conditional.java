package info.isaksson.erland.soltouml.ast;

/** Ternary {@code condition ? trueExpression : falseExpression}. The condition is not kept. */
public final class Conditional extends AstNode {
    public final AstNode trueExpression;
    public final AstNode falseExpression;

    public Conditional(AstNode trueExpression, AstNode falseExpression) {
        super("Conditional");
        this.trueExpression = trueExpression;
        this.falseExpression = falseExpression;
    }
}
