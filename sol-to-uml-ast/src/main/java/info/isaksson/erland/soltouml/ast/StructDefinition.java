package info.isaksson.erland.soltouml.ast;

import java.util.List;

public final class StructDefinition extends AstNode {
    public final String name;
    public final List<VariableDeclaration> members;

    public StructDefinition(String name, List<VariableDeclaration> members) {
        super("StructDefinition");
        this.name = name;
        this.members = nodes(members);
    }
}
