package info.isaksson.erland.soltouml.ast;

public final class Identifier extends AstNode {
    public final String name;

    public Identifier(String name) {
        super("Identifier");
        this.name = name;
    }
}
