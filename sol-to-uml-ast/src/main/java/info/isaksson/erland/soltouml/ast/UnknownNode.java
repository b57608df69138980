package info.isaksson.erland.soltouml.ast;

/** Any node kind the reader has no dedicated class for (pragmas, literals, assembly, ...). */
public final class UnknownNode extends AstNode {
    public UnknownNode(String type) {
        super(type == null ? "" : type);
    }
}
