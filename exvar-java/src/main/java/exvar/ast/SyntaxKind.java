package exvar.ast;

public enum SyntaxKind {

    // declarations
    PROGRAM,
    CLASS_DECLARATION,
    FIELD_DECLARATION,
    METHOD_DECLARATION,
    CONSTRUCTOR_DECLARATION,
    PARAMETER,
    THIS_CONSTRUCTOR_INITIALIZER,
    BASE_CONSTRUCTOR_INITIALIZER,

    // statements
    BLOCK,
    LOCAL_DECLARATION_STATEMENT,
    VARIABLE_DECLARATOR,
    EXPRESSION_STATEMENT,
    IF_STATEMENT,
    WHILE_STATEMENT,
    DO_STATEMENT,
    FOR_STATEMENT,
    LOCK_STATEMENT,
    SWITCH_STATEMENT,
    SWITCH_SECTION,
    CASE_SWITCH_LABEL,
    CASE_PATTERN_SWITCH_LABEL,
    DEFAULT_SWITCH_LABEL,
    RETURN_STATEMENT,
    BREAK_STATEMENT,

    // expressions
    IDENTIFIER_NAME,
    NUMERIC_LITERAL,
    STRING_LITERAL,
    BOOL_LITERAL,
    NULL_LITERAL,
    THIS_EXPRESSION,
    PARENTHESIZED_EXPRESSION,
    UNARY_EXPRESSION,
    BINARY_EXPRESSION,
    ASSIGNMENT_EXPRESSION,
    IS_PATTERN_EXPRESSION,
    MEMBER_ACCESS_EXPRESSION,
    INVOCATION_EXPRESSION,
    ELEMENT_ACCESS_EXPRESSION,
    OBJECT_CREATION_EXPRESSION,
    ARGUMENT_LIST,
    BRACKETED_ARGUMENT_LIST,
    ARGUMENT,
    DECLARATION_EXPRESSION,
    PARENTHESIZED_LAMBDA_EXPRESSION,
    SIMPLE_LAMBDA_EXPRESSION,
    ANONYMOUS_METHOD_EXPRESSION,
    QUERY_EXPRESSION,

    // query clauses
    FROM_CLAUSE,
    QUERY_BODY,
    JOIN_CLAUSE,
    WHERE_CLAUSE,
    LET_CLAUSE,
    ORDER_BY_CLAUSE,
    SELECT_CLAUSE,
    GROUP_CLAUSE,
    QUERY_CONTINUATION,

    // patterns
    DECLARATION_PATTERN,
    TYPE_PATTERN,
    CONSTANT_PATTERN,
    RECURSIVE_PATTERN,

    // types
    PREDEFINED_TYPE,
    NAMED_TYPE,
    ARRAY_TYPE;

    public boolean isClosure() {
        return this == PARENTHESIZED_LAMBDA_EXPRESSION
                || this == SIMPLE_LAMBDA_EXPRESSION
                || this == ANONYMOUS_METHOD_EXPRESSION;
    }
}
