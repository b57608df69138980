package info.isaksson.erland.soltouml.ast;

import java.util.List;

/** Root of a parsed Solidity file. */
public final class SourceUnit extends AstNode {
    public final List<AstNode> children;

    public SourceUnit(List<AstNode> children) {
        super("SourceUnit");
        this.children = nodes(children);
    }
}
