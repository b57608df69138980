package info.isaksson.erland.soltouml.ast;

/** Binary operator application. The operator itself is not kept. */
public final class BinaryOperation extends AstNode {
    public final AstNode left;
    public final AstNode right;

    public BinaryOperation(AstNode left, AstNode right) {
        super("BinaryOperation");
        this.left = left;
        this.right = right;
    }
}
