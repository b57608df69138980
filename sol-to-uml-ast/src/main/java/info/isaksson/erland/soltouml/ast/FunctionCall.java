package info.isaksson.erland.soltouml.ast;

import java.util.List;

public final class FunctionCall extends AstNode {
    /** The callee, e.g. an {@link Identifier}, {@link MemberAccess} or {@link NewExpression}. */
    public final AstNode expression;
    public final List<AstNode> arguments;

    public FunctionCall(AstNode expression, List<AstNode> arguments) {
        super("FunctionCall");
        this.expression = expression;
        this.arguments = nodes(arguments);
    }
}
