package com.blanklines.api.tree;

/**
 * Grammar productions a {@link SyntaxNode} can be tagged with.
 * Anything a tree provider does not recognise is reported as {@link #OTHER}.
 */
public enum NodeKind {
    // Code units
    COMPILATION_UNIT,
    METHOD_DECLARATION,
    CONSTRUCTOR_DECLARATION,
    COMPACT_CONSTRUCTOR_DECLARATION,
    INITIALIZER_DECLARATION,
    LAMBDA_EXPRESSION,

    // Statements
    BLOCK,
    EXPRESSION_STATEMENT,
    LOCAL_VARIABLE_DECLARATION,
    IF_STATEMENT,
    ELSE_CLAUSE,
    FOR_STATEMENT,
    FOR_EACH_STATEMENT,
    WHILE_STATEMENT,
    DO_STATEMENT,
    TRY_STATEMENT,
    CATCH_CLAUSE,
    FINALLY_CLAUSE,
    SWITCH_STATEMENT,
    SWITCH_SECTION,
    RETURN_STATEMENT,
    THROW_STATEMENT,
    BREAK_STATEMENT,
    CONTINUE_STATEMENT,
    SYNCHRONIZED_STATEMENT,
    LABELED_STATEMENT,
    LOCAL_CLASS_DECLARATION,
    EMPTY_STATEMENT,

    // Expressions
    SIMPLE_ASSIGNMENT,
    COMPOUND_ASSIGNMENT,
    VARIABLE_DECLARATION,
    METHOD_CALL,
    OBJECT_CREATION,
    UNARY_EXPRESSION,

    OTHER
}
