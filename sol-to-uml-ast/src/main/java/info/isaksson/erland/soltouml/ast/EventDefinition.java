package info.isaksson.erland.soltouml.ast;

import java.util.List;

public final class EventDefinition extends AstNode {
    public final String name;
    public final List<VariableDeclaration> parameters;

    public EventDefinition(String name, List<VariableDeclaration> parameters) {
        super("EventDefinition");
        this.name = name;
        this.parameters = nodes(parameters);
    }
}
