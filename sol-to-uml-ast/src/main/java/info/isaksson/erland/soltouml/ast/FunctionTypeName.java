package info.isaksson.erland.soltouml.ast;

/** A function type such as {@code function (uint) external returns (bool)}. Signatures are not kept. */
public final class FunctionTypeName extends TypeName {

    public FunctionTypeName() {
        super("FunctionTypeName");
    }
}
