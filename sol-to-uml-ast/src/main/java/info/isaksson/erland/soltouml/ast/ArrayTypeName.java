package info.isaksson.erland.soltouml.ast;

/** Fixed or dynamic array of {@link #baseTypeName}. */
public final class ArrayTypeName extends TypeName {
    public final TypeName baseTypeName;

    public ArrayTypeName(TypeName baseTypeName) {
        super("ArrayTypeName");
        this.baseTypeName = baseTypeName;
    }
}
