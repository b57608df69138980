package info.isaksson.erland.soltouml.ast;

import java.util.List;

public final class EnumDefinition extends AstNode {
    public final String name;
    public final List<EnumValue> members;

    public EnumDefinition(String name, List<EnumValue> members) {
        super("EnumDefinition");
        this.name = name;
        this.members = nodes(members);
    }
}
