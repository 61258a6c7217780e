package exvar.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,

    // keywords
    CLASS,
    IF,
    ELSE,
    WHILE,
    DO,
    FOR,
    SWITCH,
    CASE,
    DEFAULT,
    LOCK,
    RETURN,
    BREAK,
    NEW,
    THIS,
    BASE,
    OUT,
    REF,
    IS,
    IN,
    DELEGATE,
    TRUE,
    FALSE,
    NULL,

    // types
    INT,
    DOUBLE,
    BOOL,
    STRING,
    OBJECT,
    VOID,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    ASSIGN,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    AND, OR, NOT,
    COALESCE,
    ARROW,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COLON, SEMICOLON, COMMA,
    DOT,

    EOF
}
