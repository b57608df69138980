package info.isaksson.erland.soltouml.ast;

import java.util.List;

public final class ModifierDefinition extends AstNode {
    public final String name;
    /** Empty when the modifier is declared without a parameter list. */
    public final List<VariableDeclaration> parameters;
    public final Block body;

    public ModifierDefinition(String name, List<VariableDeclaration> parameters, Block body) {
        super("ModifierDefinition");
        this.name = name;
        this.parameters = nodes(parameters);
        this.body = body;
    }
}
