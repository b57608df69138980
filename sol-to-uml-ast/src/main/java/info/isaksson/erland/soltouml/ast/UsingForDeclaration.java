package info.isaksson.erland.soltouml.ast;

/** {@code using Lib for T;} */
public final class UsingForDeclaration extends AstNode {
    public final String libraryName;

    public UsingForDeclaration(String libraryName) {
        super("UsingForDeclaration");
        this.libraryName = libraryName;
    }
}
