package info.isaksson.erland.soltouml.ast;

import java.util.List;

/**
 * Local variable declaration, possibly destructuring.
 *
 * <p>Skipped tuple positions ({@code var (a,,c) = f();}) are {@code null} entries in {@link #variables}.</p>
 */
public final class VariableDeclarationStatement extends AstNode {
    public final List<VariableDeclaration> variables;
    public final AstNode initialValue;

    public VariableDeclarationStatement(List<VariableDeclaration> variables, AstNode initialValue) {
        super("VariableDeclarationStatement");
        this.variables = nodes(variables);
        this.initialValue = initialValue;
    }
}
