package com.blanklines.api.tree;

import java.util.List;

/**
 * A parsed source file together with the code units it declares.
 */
public class SyntaxTree {
    private final SyntaxNode root;
    private final List<SyntaxNode> codeUnits;

    public SyntaxTree(SyntaxNode root, List<SyntaxNode> codeUnits) {
        this.root = root;
        this.codeUnits = List.copyOf(codeUnits);
    }

    public SyntaxNode getRoot() {
        return root;
    }

    /**
     * Units that own an executable body (methods, constructors, initializers,
     * block lambdas), in document order.
     */
    public List<SyntaxNode> getCodeUnits() {
        return codeUnits;
    }
}
