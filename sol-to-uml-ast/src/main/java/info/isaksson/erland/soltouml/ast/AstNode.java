package info.isaksson.erland.soltouml.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of all syntax tree nodes.
 *
 * <p>{@link #type} is the node kind as emitted by the Solidity parser, e.g. {@code "ContractDefinition"}.</p>
 */
public abstract class AstNode {
    public final String type;

    protected AstNode(String type) {
        this.type = type;
    }

    /** Unmodifiable copy that keeps {@code null} slots (skipped tuple positions are significant). */
    protected static <T> List<T> nodes(List<T> in) {
        if (in == null || in.isEmpty()) return List.of();
        return Collections.unmodifiableList(new ArrayList<>(in));
    }

    @Override public String toString() {
        return type;
    }
}
