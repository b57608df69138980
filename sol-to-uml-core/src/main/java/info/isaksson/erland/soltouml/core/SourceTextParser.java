package info.isaksson.erland.soltouml.core;

import info.isaksson.erland.soltouml.ast.AstNode;

import java.io.IOException;

/** Parses Solidity source text into a syntax tree. */
public interface SourceTextParser {

    /**
     * @param sourceText Solidity source code
     * @param path       path label used in error messages
     * @throws IOException if the text cannot be parsed
     */
    AstNode parse(String sourceText, String path) throws IOException;
}
