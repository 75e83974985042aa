package com.blanklines.core;

import com.blanklines.api.tree.NodeKind;
import com.blanklines.api.tree.SyntaxNode;
import com.blanklines.rules.RuleId;

/**
 * Flags assignments and local declarations that touch other statements
 * without a blank line in between.
 * <p>
 * The checker keeps no state between calls, so one instance can serve any
 * number of threads as long as the sink copes with concurrent reports.
 */
public class BlockSeparationChecker {
    private final DiagnosticSink sink;

    public BlockSeparationChecker(DiagnosticSink sink) {
        this.sink = sink;
    }

    /**
     * Checks the first block directly under a code unit. Units without a block
     * (abstract or native signatures, expression lambdas) are skipped.
     */
    public void checkTopLevel(SyntaxNode unitNode) {
        for (SyntaxNode child : unitNode.getChildNodes()) {
            if (child.getKind() != NodeKind.BLOCK) {
                continue;
            }

            checkBlock(child);

            break;
        }
    }

    /**
     * Compares each direct child with its predecessor, descending into nested
     * blocks before the comparison.
     */
    public void checkBlock(SyntaxNode blockNode) {
        SyntaxNode previousNode = null;

        for (SyntaxNode childNode : blockNode.getChildNodes()) {
            AssignmentClass currentClass = classify(childNode);

            if (isContainer(childNode.getKind())) {
                checkBlock(childNode);
            }

            if (previousNode == null) {
                previousNode = childNode;

                continue;
            }

            AssignmentClass previousClass = classify(previousNode);

            if (childNode.getSpan().lineGapAfter(previousNode.getSpan()) == 1) {
                boolean needsBlankLineBefore = currentClass == AssignmentClass.ASSIGNMENT_LIKE
                        && previousClass != AssignmentClass.ASSIGNMENT_LIKE;
                boolean needsBlankLineAfter = previousClass == AssignmentClass.ASSIGNMENT_LIKE
                        && currentClass != AssignmentClass.ASSIGNMENT_LIKE;

                if (needsBlankLineBefore) {
                    sink.report(RuleId.BEFORE, previousNode.getSpan());
                } else if (needsBlankLineAfter) {
                    sink.report(RuleId.AFTER, previousNode.getSpan());
                }
            }

            previousNode = childNode;
        }
    }

    /**
     * Classifies a node, looking through expression statements at the wrapped expression.
     */
    public static AssignmentClass classify(SyntaxNode node) {
        NodeKind kind = node.getKind();

        if (kind == NodeKind.EXPRESSION_STATEMENT && node.getExpression().isPresent()) {
            kind = node.getExpression().get().getKind();
        }

        return classify(kind);
    }

    public static AssignmentClass classify(NodeKind kind) {
        switch (kind) {
            case SIMPLE_ASSIGNMENT:
            case LOCAL_VARIABLE_DECLARATION:
                return AssignmentClass.ASSIGNMENT_LIKE;
            default:
                return AssignmentClass.OTHER;
        }
    }

    /**
     * Whether nodes of this kind hold statements that need their own pass.
     */
    public static boolean isContainer(NodeKind kind) {
        switch (kind) {
            case BLOCK:
            case FOR_STATEMENT:
            case FOR_EACH_STATEMENT:
            case TRY_STATEMENT:
            case FINALLY_CLAUSE:
            case WHILE_STATEMENT:
            case IF_STATEMENT:
            case ELSE_CLAUSE:
            case SWITCH_STATEMENT:
            case SWITCH_SECTION:
                return true;
            default:
                return false;
        }
    }
}
