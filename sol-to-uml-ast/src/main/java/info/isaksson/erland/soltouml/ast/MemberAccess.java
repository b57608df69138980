package info.isaksson.erland.soltouml.ast;

/** {@code expression.member}. Only the accessed object is kept. */
public final class MemberAccess extends AstNode {
    public final AstNode expression;

    public MemberAccess(AstNode expression) {
        super("MemberAccess");
        this.expression = expression;
    }
}
