package exvar.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<TokenType> typesNoEof(String src) {
        return lex(src).stream().filter(t -> t.type() != TokenType.EOF).map(Token::type).toList();
    }

    @Test
    void lex_all_single_char_tokens() {
        var ts = typesNoEof("(){}[]:;,+-*/%.");
        assertEquals(List.of(
                TokenType.LPAREN, TokenType.RPAREN,
                TokenType.LBRACE, TokenType.RBRACE,
                TokenType.LBRACKET, TokenType.RBRACKET,
                TokenType.COLON, TokenType.SEMICOLON, TokenType.COMMA,
                TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT,
                TokenType.DOT
        ), ts);
    }

    @Test
    void lex_keywords_and_types() {
        var ts = typesNoEof("class if else while do for switch case default lock return break new this base out ref is in delegate true false null int double bool string object void");
        assertEquals(List.of(
                TokenType.CLASS, TokenType.IF, TokenType.ELSE, TokenType.WHILE, TokenType.DO, TokenType.FOR,
                TokenType.SWITCH, TokenType.CASE, TokenType.DEFAULT, TokenType.LOCK, TokenType.RETURN,
                TokenType.BREAK, TokenType.NEW, TokenType.THIS, TokenType.BASE, TokenType.OUT, TokenType.REF,
                TokenType.IS, TokenType.IN, TokenType.DELEGATE, TokenType.TRUE, TokenType.FALSE, TokenType.NULL,
                TokenType.INT, TokenType.DOUBLE, TokenType.BOOL, TokenType.STRING, TokenType.OBJECT, TokenType.VOID
        ), ts);
    }

    @Test
    void lex_contextual_words_stay_identifiers() {
        var toks = lex("var when from join on equals select group by into let where orderby");
        assertTrue(toks.stream().filter(t -> t.type() != TokenType.EOF)
                .allMatch(t -> t.type() == TokenType.IDENTIFIER));
        assertTrue(toks.get(0).isContextual("var"));
        assertFalse(toks.get(0).isContextual("when"));
    }

    @Test
    void lex_identifier_vs_keyword() {
        assertEquals(List.of(TokenType.IN, TokenType.IDENTIFIER, TokenType.IDENTIFIER), typesNoEof("in in1 _out"));
    }

    @Test
    void lex_arrow_assign_and_equality() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ARROW, TokenType.IDENTIFIER), typesNoEof("x => y"));
        assertEquals(List.of(TokenType.ASSIGN, TokenType.EQ), typesNoEof("= =="));
    }

    @Test
    void lex_coalesce() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.COALESCE, TokenType.IDENTIFIER), typesNoEof("a ?? b"));
    }

    @Test
    void lex_numbers_int_and_float() {
        assertEquals(List.of(TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL), typesNoEof("0 3.14"));
        assertEquals("3.14", lex("3.14").get(0).lexeme());
        assertEquals(List.of(TokenType.INT_LITERAL, TokenType.DOT, TokenType.IDENTIFIER), typesNoEof("12.x"));
    }

    @Test
    void lex_string_literal_with_escapes() {
        var toks = lex("\"a\\\"b\\n\"");
        assertEquals(TokenType.STRING_LITERAL, toks.get(0).type());
        assertEquals("a\"b\n", toks.get(0).lexeme());
    }

    @Test
    void lex_comments_skipped() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER), typesNoEof("x//cmt\ny"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER), typesNoEof("x/* a\n b */y"));
    }

    @Test
    void lex_whitespace_and_positions() {
        var toks = lex("a\n  b /*\n*/ c");
        // после '\n' col=1, затем два пробела -> col=3
        assertEquals(1, toks.get(0).line());
        assertEquals(1, toks.get(0).column());
        assertEquals(2, toks.get(1).line());
        assertEquals(3, toks.get(1).column());
        assertEquals(3, toks.get(2).line());
        assertEquals(4, toks.get(2).column());
    }

    static Stream<String> opInputs() {
        return Stream.of(
                "a=b", "a==b", "a!=b", "a<b", "a<=b", "a>b", "a>=b", "a&&b", "a||b", "!a", "a??b", "a=>b"
        );
    }

    @ParameterizedTest
    @MethodSource("opInputs")
    void lex_operators(String input) {
        var toks = lex(input);
        assertTrue(toks.size() >= 3);
        assertEquals(TokenType.EOF, toks.get(toks.size() - 1).type());
    }

    @Test
    void lex_error_single_ampersand() {
        assertThrows(LexerException.class, () -> lex("&"));
    }

    @Test
    void lex_error_single_pipe_and_question() {
        assertThrows(LexerException.class, () -> lex("|"));
        assertThrows(LexerException.class, () -> lex("a ? b"));
    }

    @Test
    void lex_error_unexpected_char() {
        var ex = assertThrows(LexerException.class, () -> lex("a @"));
        assertTrue(ex.getMessage().startsWith("[1:"));
    }

    @Test
    void lex_error_unterminated_string_and_comment() {
        assertThrows(LexerException.class, () -> lex("\"abc"));
        assertThrows(LexerException.class, () -> lex("\"ab\nc\""));
        assertThrows(LexerException.class, () -> lex("/* never closed"));
    }
}
