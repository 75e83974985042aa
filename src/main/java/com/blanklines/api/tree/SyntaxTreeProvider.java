package com.blanklines.api.tree;

/**
 * Turns source text into a {@link SyntaxTree}.
 */
public interface SyntaxTreeProvider {
    SyntaxTree parse(String sourceCode) throws SourceParseException;
}
