package info.isaksson.erland.soltouml.ast;

/**
 * A declared variable: state variable, struct member, function/event/modifier parameter or local.
 *
 * <p>{@link #typeName} is {@code null} for untyped {@code var} declarations.</p>
 */
public final class VariableDeclaration extends AstNode {
    public final String name;
    public final TypeName typeName;
    /** Raw visibility keyword; {@code null} for anything that is not a state variable. */
    public final String visibility;
    public final boolean isStateVar;

    public VariableDeclaration(String name, TypeName typeName, String visibility, boolean isStateVar) {
        super("VariableDeclaration");
        this.name = name;
        this.typeName = typeName;
        this.visibility = visibility;
        this.isStateVar = isStateVar;
    }
}
