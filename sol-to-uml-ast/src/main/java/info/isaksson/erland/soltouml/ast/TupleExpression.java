package info.isaksson.erland.soltouml.ast;

import java.util.List;

/** Tuple or inline array. Empty positions are {@code null} components. */
public final class TupleExpression extends AstNode {
    public final List<AstNode> components;

    public TupleExpression(List<AstNode> components) {
        super("TupleExpression");
        this.components = nodes(components);
    }
}
