package com.blanklines.api.tree;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a node in a parsed syntax tree.
 */
public interface SyntaxNode {

    NodeKind getKind();

    /**
     * Direct children in source order.
     */
    List<SyntaxNode> getChildNodes();

    SourceSpan getSpan();

    /**
     * The wrapped expression, present only on {@link NodeKind#EXPRESSION_STATEMENT} nodes.
     */
    Optional<SyntaxNode> getExpression();
}
