package info.isaksson.erland.soltouml.ast;

/** Base class of the type-name node kinds. */
public abstract class TypeName extends AstNode {
    protected TypeName(String type) {
        super(type);
    }
}
