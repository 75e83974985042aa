package com.blanklines.plugins.java;

import com.blanklines.api.tree.NodeKind;
import com.blanklines.api.tree.SourceSpan;
import com.blanklines.api.tree.SyntaxNode;
import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.TryStmt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@link SyntaxNode} view over a JavaParser node.
 * <p>
 * JavaParser has no node for the {@code else} and {@code finally} parts of a
 * statement, so those are synthesised here: a clause node starts at its
 * keyword and holds the statement that follows it as its only child.
 */
public class JavaSyntaxNode implements SyntaxNode {
    private static final Comparator<Node> SOURCE_ORDER =
            Comparator.comparing(n -> n.getRange().get().begin);

    private final Node node;
    private final NodeKind kind;
    private final SourceSpan span;
    private final boolean clause;

    private JavaSyntaxNode(Node node, NodeKind kind, SourceSpan span, boolean clause) {
        this.node = node;
        this.kind = kind;
        this.span = span;
        this.clause = clause;
    }

    /**
     * Wraps a parsed node. Apart from the compilation unit of an empty source,
     * the node must carry a range.
     */
    public static JavaSyntaxNode of(Node node) {
        Optional<Range> range = node.getRange();

        if (range.isEmpty()) {
            if (node instanceof CompilationUnit) {
                return new JavaSyntaxNode(node, NodeKind.COMPILATION_UNIT, new SourceSpan(1, 1, 1, 1), false);
            }
            throw new IllegalArgumentException("Node has no source range: " + node.getClass().getSimpleName());
        }

        return new JavaSyntaxNode(node, JavaNodeKinds.kindOf(node), _toSpan(range.get().begin, range.get().end), false);
    }

    private static JavaSyntaxNode _clause(NodeKind kind, String keyword, Node body) {
        Range bodyRange = body.getRange().get();
        Position begin = _findKeyword(body, keyword).orElse(bodyRange.begin);
        return new JavaSyntaxNode(body, kind, _toSpan(begin, bodyRange.end), true);
    }

    /**
     * Walks back from the first token of {@code body} to the keyword that introduces it.
     */
    private static Optional<Position> _findKeyword(Node body, String keyword) {
        Optional<JavaToken> token = body.getTokenRange().flatMap(r -> r.getBegin().getPreviousToken());

        while (token.isPresent()) {
            JavaToken current = token.get();
            if (!current.getCategory().isWhitespaceOrComment()) {
                if (keyword.equals(current.getText())) {
                    return current.getRange().map(r -> r.begin);
                }
                return Optional.empty();
            }
            token = current.getPreviousToken();
        }
        return Optional.empty();
    }

    private static SourceSpan _toSpan(Position begin, Position end) {
        return new SourceSpan(begin.line, begin.column, end.line, end.column);
    }

    @Override
    public NodeKind getKind() {
        return kind;
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        List<SyntaxNode> children = new ArrayList<>();

        if (clause) {
            children.add(of(node));
            return children;
        }

        List<Node> childNodes = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment) && child.getRange().isPresent()) {
                childNodes.add(child);
            }
        }
        childNodes.sort(SOURCE_ORDER);

        for (Node child : childNodes) {
            children.add(_wrapChild(child));
        }
        return children;
    }

    private SyntaxNode _wrapChild(Node child) {
        if (node instanceof IfStmt) {
            Optional<?> elseStmt = ((IfStmt) node).getElseStmt();
            if (elseStmt.isPresent() && elseStmt.get() == child) {
                return _clause(NodeKind.ELSE_CLAUSE, "else", child);
            }
        }
        if (node instanceof TryStmt) {
            Optional<?> finallyBlock = ((TryStmt) node).getFinallyBlock();
            if (finallyBlock.isPresent() && finallyBlock.get() == child) {
                return _clause(NodeKind.FINALLY_CLAUSE, "finally", child);
            }
        }
        return of(child);
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public Optional<SyntaxNode> getExpression() {
        if (kind == NodeKind.EXPRESSION_STATEMENT && !clause) {
            return Optional.of(of(((ExpressionStmt) node).getExpression()));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return kind + " " + span;
    }
}
