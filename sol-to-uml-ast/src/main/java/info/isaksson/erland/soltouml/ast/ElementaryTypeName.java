package info.isaksson.erland.soltouml.ast;

/** Built-in type such as {@code uint256}, {@code address} or {@code bytes32}. */
public final class ElementaryTypeName extends TypeName {
    public final String name;

    public ElementaryTypeName(String name) {
        super("ElementaryTypeName");
        this.name = name;
    }
}
