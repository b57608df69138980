package info.isaksson.erland.soltouml.ast;

import java.util.List;

/**
 * Contract-level variable declaration. Its {@link #variables} carry {@code isStateVar = true}.
 * The initializer expression is not kept.
 */
public final class StateVariableDeclaration extends AstNode {
    public final List<VariableDeclaration> variables;

    public StateVariableDeclaration(List<VariableDeclaration> variables) {
        super("StateVariableDeclaration");
        this.variables = nodes(variables);
    }
}
