package info.isaksson.erland.soltouml.ast;

public final class IndexAccess extends AstNode {
    public final AstNode base;
    public final AstNode index;

    public IndexAccess(AstNode base, AstNode index) {
        super("IndexAccess");
        this.base = base;
        this.index = index;
    }
}
