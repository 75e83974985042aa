package com.blanklines.core;

import com.blanklines.api.tree.NodeKind;
import com.blanklines.api.tree.SourceSpan;
import com.blanklines.rules.RuleId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static com.blanklines.core.TestNode.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BlockSeparationCheckerTest {

    private CollectingDiagnosticSink sink;
    private BlockSeparationChecker checker;

    @BeforeEach
    void setUp() {
        sink = new CollectingDiagnosticSink();
        checker = new BlockSeparationChecker(sink);
    }

    @Test
    void testEmptyAndSingleStatementBlocksReportNothing() {
        checker.checkBlock(block(1, 2));
        checker.checkBlock(block(1, 3, assignment(2)));
        checker.checkBlock(block(1, 3, call(2)));

        assertEquals(0, sink.size());
    }

    @Test
    void testAssignmentFollowedByCallReportsAfterRuleAtAssignment() {
        // { int x = 1; int y = 2; Foo(); }
        TestNode y = declaration(3);
        checker.checkBlock(block(1, 5, declaration(2), y, call(4)));

        assertEquals(List.of(new Diagnostic(RuleId.AFTER, y.getSpan())), sink.getDiagnostics());
    }

    @Test
    void testCallFollowedByAssignmentReportsBeforeRuleAtCall() {
        TestNode foo = call(2);
        checker.checkBlock(block(1, 4, foo, declaration(3)));

        assertEquals(List.of(new Diagnostic(RuleId.BEFORE, foo.getSpan())), sink.getDiagnostics());
    }

    @Test
    void testBlankLineBetweenStatementsSuppressesReport() {
        // { Foo(); <blank> int x = 1; <blank> Bar(); }
        checker.checkBlock(block(1, 7, call(2), declaration(4), call(6)));

        assertEquals(0, sink.size());
    }

    @Test
    void testStatementsOnSameLineAreNotCompared() {
        checker.checkBlock(block(1, 3, call(2), assignment(2), call(2)));

        assertEquals(0, sink.size());
    }

    @Test
    void testRunsOfSameClassReportNothing() {
        checker.checkBlock(block(1, 6, assignment(2), declaration(3), assignment(4), declaration(5)));
        checker.checkBlock(block(10, 14, call(11), call(12), statement(NodeKind.RETURN_STATEMENT, 13)));

        assertEquals(0, sink.size());
    }

    @Test
    void testAssignmentRunSurroundedByCallsReportsBothRules() {
        TestNode first = call(2);
        TestNode last = assignment(4);
        checker.checkBlock(block(1, 6, first, assignment(3), last, call(5)));

        assertEquals(List.of(
                new Diagnostic(RuleId.BEFORE, first.getSpan()),
                new Diagnostic(RuleId.AFTER, last.getSpan())), sink.getDiagnostics());
    }

    @Test
    void testTrailingAssignmentBeforeClosingBraceIsNotReported() {
        checker.checkBlock(block(1, 4, call(2)));
        checker.checkBlock(block(5, 8, assignment(6), assignment(7)));

        assertEquals(0, sink.size());
    }

    @Test
    void testGapIsMeasuredFromEndLineOfMultiLineStatement() {
        // foo(1,
        //     2);
        // int x = 1;
        TestNode multiLineCall = node(NodeKind.EXPRESSION_STATEMENT, 2, 3);
        checker.checkBlock(block(1, 5, multiLineCall, declaration(4)));

        assertEquals(List.of(new Diagnostic(RuleId.BEFORE, multiLineCall.getSpan())), sink.getDiagnostics());
    }

    @Test
    void testCompoundAssignmentIsNotAssignmentLike() {
        checker.checkBlock(block(1, 4, call(2), expressionStatement(NodeKind.COMPOUND_ASSIGNMENT, 3)));

        assertEquals(0, sink.size());
    }

    @Test
    void testExpressionStatementWithoutInnerExpressionUsesOwnKind() {
        checker.checkBlock(block(1, 4, statement(NodeKind.EXPRESSION_STATEMENT, 2), declaration(3)));

        assertEquals(1, sink.size());
        assertEquals(RuleId.BEFORE, sink.getDiagnostics().get(0).getRuleId());
    }

    @Test
    void testNestedBlockFindingsAreAttributedToInnerStatements() {
        TestNode innerCall = call(3);
        TestNode ifStatement = node(NodeKind.IF_STATEMENT, 2, 5,
                statement(NodeKind.OTHER, 2),
                block(2, 5, innerCall, assignment(4)));

        checker.checkBlock(block(1, 6, ifStatement));

        assertEquals(List.of(new Diagnostic(RuleId.BEFORE, innerCall.getSpan())), sink.getDiagnostics());
    }

    @Test
    void testNestedFindingsAreReportedBeforeOuterComparison() {
        // int x = 1;
        // while (...) { foo(); y = 1; }
        TestNode x = declaration(2);
        TestNode foo = call(4);
        TestNode loop = node(NodeKind.WHILE_STATEMENT, 3, 6,
                statement(NodeKind.OTHER, 3),
                block(3, 6, foo, assignment(5)));

        checker.checkBlock(block(1, 7, x, loop));

        assertEquals(List.of(
                new Diagnostic(RuleId.BEFORE, foo.getSpan()),
                new Diagnostic(RuleId.AFTER, x.getSpan())), sink.getDiagnostics());
    }

    @Test
    void testNonContainerStatementsAreNotEntered() {
        TestNode doStatement = node(NodeKind.DO_STATEMENT, 2, 5,
                block(2, 5, call(3), assignment(4)));
        TestNode catchClause = node(NodeKind.CATCH_CLAUSE, 6, 9,
                block(6, 9, call(7), assignment(8)));

        checker.checkBlock(block(1, 10, doStatement));
        checker.checkBlock(node(NodeKind.TRY_STATEMENT, 1, 10, block(1, 6), catchClause));

        assertEquals(0, sink.size());
    }

    @Test
    void testCheckTopLevelInspectsOnlyFirstBlockChild() {
        TestNode foo = call(3);
        TestNode unit = node(NodeKind.METHOD_DECLARATION, 1, 12,
                statement(NodeKind.OTHER, 1),
                block(2, 5, foo, assignment(4)),
                block(6, 9, call(7), assignment(8)));

        checker.checkTopLevel(unit);

        assertEquals(List.of(new Diagnostic(RuleId.BEFORE, foo.getSpan())), sink.getDiagnostics());
    }

    @Test
    void testCheckTopLevelWithoutBlockReportsNothing() {
        TestNode abstractMethod = node(NodeKind.METHOD_DECLARATION, 1, 1,
                statement(NodeKind.OTHER, 1));

        checker.checkTopLevel(abstractMethod);

        assertEquals(0, sink.size());
    }

    @Test
    void testDiagnosticsGoStraightToSink() {
        DiagnosticSink mockSink = mock(DiagnosticSink.class);
        TestNode foo = call(2);

        new BlockSeparationChecker(mockSink).checkBlock(block(1, 4, foo, assignment(3)));

        verify(mockSink).report(RuleId.BEFORE, foo.getSpan());
        verifyNoMoreInteractions(mockSink);
    }

    @ParameterizedTest
    @EnumSource(value = NodeKind.class, names = {
            "BLOCK", "FOR_STATEMENT", "FOR_EACH_STATEMENT", "TRY_STATEMENT", "FINALLY_CLAUSE",
            "WHILE_STATEMENT", "IF_STATEMENT", "ELSE_CLAUSE", "SWITCH_STATEMENT", "SWITCH_SECTION"})
    void testContainerKinds(NodeKind kind) {
        assertTrue(BlockSeparationChecker.isContainer(kind));
    }

    @ParameterizedTest
    @EnumSource(value = NodeKind.class, mode = EnumSource.Mode.EXCLUDE, names = {
            "BLOCK", "FOR_STATEMENT", "FOR_EACH_STATEMENT", "TRY_STATEMENT", "FINALLY_CLAUSE",
            "WHILE_STATEMENT", "IF_STATEMENT", "ELSE_CLAUSE", "SWITCH_STATEMENT", "SWITCH_SECTION"})
    void testLeafKinds(NodeKind kind) {
        assertFalse(BlockSeparationChecker.isContainer(kind));
    }

    @Test
    void testClassification() {
        assertEquals(AssignmentClass.ASSIGNMENT_LIKE, BlockSeparationChecker.classify(NodeKind.SIMPLE_ASSIGNMENT));
        assertEquals(AssignmentClass.ASSIGNMENT_LIKE, BlockSeparationChecker.classify(NodeKind.LOCAL_VARIABLE_DECLARATION));
        assertEquals(AssignmentClass.OTHER, BlockSeparationChecker.classify(NodeKind.VARIABLE_DECLARATION));
        assertEquals(AssignmentClass.OTHER, BlockSeparationChecker.classify(NodeKind.COMPOUND_ASSIGNMENT));
        assertEquals(AssignmentClass.OTHER, BlockSeparationChecker.classify(NodeKind.OTHER));
        assertEquals(AssignmentClass.ASSIGNMENT_LIKE, BlockSeparationChecker.classify(assignment(1)));
        assertEquals(AssignmentClass.OTHER, BlockSeparationChecker.classify(call(1)));
    }

    @Test
    void testLineGap() {
        SourceSpan previous = new SourceSpan(2, 5, 4, 9);

        assertEquals(0, new SourceSpan(4, 11, 4, 20).lineGapAfter(previous));
        assertEquals(1, new SourceSpan(5, 1, 5, 20).lineGapAfter(previous));
        assertEquals(2, new SourceSpan(6, 1, 6, 20).lineGapAfter(previous));
    }
}
