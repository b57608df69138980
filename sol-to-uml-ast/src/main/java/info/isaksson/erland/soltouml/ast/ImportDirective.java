package info.isaksson.erland.soltouml.ast;

public final class ImportDirective extends AstNode {
    /** Import path exactly as written in the source, e.g. {@code "./Ownable.sol"}. */
    public final String path;

    public ImportDirective(String path) {
        super("ImportDirective");
        this.path = path;
    }
}
