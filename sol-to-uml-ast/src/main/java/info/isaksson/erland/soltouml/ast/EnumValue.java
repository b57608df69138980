package info.isaksson.erland.soltouml.ast;

public final class EnumValue extends AstNode {
    public final String name;

    public EnumValue(String name) {
        super("EnumValue");
        this.name = name;
    }
}
