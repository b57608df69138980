package info.isaksson.erland.soltouml.core;

import info.isaksson.erland.soltouml.ast.AstNode;
import info.isaksson.erland.soltouml.ast.SyntaxTreeJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/** A parsed source file: its path label and syntax tree. */
public final class SourceUnitInput {
    public final String relativePath;
    public final AstNode tree;

    public SourceUnitInput(String relativePath, AstNode tree) {
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
        this.tree = tree;
    }

    /**
     * Load a syntax tree saved as parser JSON.
     *
     * @param file         JSON syntax tree file
     * @param relativePath path label of the Solidity file the tree was parsed from
     */
    public static SourceUnitInput fromJsonFile(Path file, String relativePath) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        try {
            return new SourceUnitInput(relativePath, SyntaxTreeJson.read(file));
        } catch (IOException | IllegalArgumentException e) {
            throw new IOException("Failed to read syntax tree file " + file + ": " + e.getMessage(), e);
        }
    }
}
