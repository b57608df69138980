package info.isaksson.erland.soltouml.ast;

import java.util.List;

public final class Block extends AstNode {
    public final List<AstNode> statements;

    public Block(List<AstNode> statements) {
        super("Block");
        this.statements = nodes(statements);
    }
}
