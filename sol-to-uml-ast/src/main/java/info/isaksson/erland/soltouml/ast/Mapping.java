package info.isaksson.erland.soltouml.ast;

public final class Mapping extends TypeName {
    public final TypeName keyType;
    public final TypeName valueType;

    public Mapping(TypeName keyType, TypeName valueType) {
        super("Mapping");
        this.keyType = keyType;
        this.valueType = valueType;
    }
}
