package exvar.lexer;

import exvar.ast.Pos;

public record Token(TokenType type, String lexeme, int line, int column) {

    public Pos pos() {
        return new Pos(line, column);
    }

    public boolean isContextual(String word) {
        return type == TokenType.IDENTIFIER && lexeme.equals(word);
    }
}
