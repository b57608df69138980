package info.isaksson.erland.soltouml.ast;

import java.util.List;

/**
 * Function, constructor, fallback or receive declaration.
 *
 * <p>Fallback and receive functions are flagged by {@link #isFallback} and {@link #isReceiveEther}; parsers
 * for Solidity before 0.6 only leave their {@link #name} empty. {@link #body} is {@code null} for functions
 * declared without an implementation.</p>
 */
public final class FunctionDefinition extends AstNode {
    public final String name;
    public final List<VariableDeclaration> parameters;
    /** {@code null} when no {@code returns (...)} clause is present. */
    public final List<VariableDeclaration> returnParameters;
    public final Block body;
    public final String visibility;
    /** {@code pure}, {@code view}, {@code payable}, {@code constant} or {@code null}. */
    public final String stateMutability;
    public final boolean isConstructor;
    public final boolean isReceiveEther;
    public final boolean isFallback;

    public FunctionDefinition(String name,
                              List<VariableDeclaration> parameters,
                              List<VariableDeclaration> returnParameters,
                              Block body,
                              String visibility,
                              String stateMutability,
                              boolean isConstructor,
                              boolean isReceiveEther,
                              boolean isFallback) {
        super("FunctionDefinition");
        this.name = name;
        this.parameters = nodes(parameters);
        this.returnParameters = returnParameters == null ? null : nodes(returnParameters);
        this.body = body;
        this.visibility = visibility;
        this.stateMutability = stateMutability;
        this.isConstructor = isConstructor;
        this.isReceiveEther = isReceiveEther;
        this.isFallback = isFallback;
    }
}
