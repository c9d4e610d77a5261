package org.pragmatica.exprjson.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<Token> lex(String input) {
        var tokens = Lexer.tokenize(input);
        assertInstanceOf(Token.Eof.class, tokens.get(tokens.size() - 1));
        return tokens.subList(0, tokens.size() - 1);
    }

    private static Token single(String input) {
        var tokens = lex(input);
        assertEquals(1, tokens.size(), () -> "tokens: " + tokens);
        return tokens.get(0);
    }

    // === Identifiers and Punctuation ===

    @Test
    void tokenize_simpleBinary_producesThreeTokens() {
        var tokens = lex("a + b");

        assertEquals(3, tokens.size());
        assertInstanceOf(Token.Ident.class, tokens.get(0));
        assertInstanceOf(Token.Punct.class, tokens.get(1));
        assertEquals("+", tokens.get(1).text());
        assertEquals("b", tokens.get(2).text());
    }

    @Test
    void tokenize_emptyInput_onlyEof() {
        var tokens = Lexer.tokenize("");

        assertEquals(1, tokens.size());
        assertInstanceOf(Token.Eof.class, tokens.get(0));
    }

    @Test
    void tokenize_multiCharPunctuation_longestMatch() {
        var tokens = lex("a <<= b ..= c :: d => e");

        assertEquals("<<=", tokens.get(1).text());
        assertEquals("..=", tokens.get(3).text());
        assertEquals("::", tokens.get(5).text());
        assertEquals("=>", tokens.get(7).text());
    }

    @Test
    void tokenize_rawIdentifier_keepsPrefixAndIsNotKeyword() {
        var token = (Token.Ident) single("r#type");

        assertTrue(token.raw());
        assertEquals("r#type", token.text());
        assertEquals("type", token.name());
        assertFalse(token.isReserved());
        assertFalse(token.is("type"));
    }

    @Test
    void tokenize_keyword_isReserved() {
        var token = (Token.Ident) single("match");

        assertTrue(token.isReserved());
        assertTrue(token.is("match"));
    }

    @Test
    void tokenize_lifetime_notCharLiteral() {
        var token = single("'outer");

        assertInstanceOf(Token.Lifetime.class, token);
        assertEquals("outer", ((Token.Lifetime) token).name());
    }

    // === Literals ===

    @Test
    void tokenize_literalKinds_detected() {
        assertEquals(Token.LiteralKind.STR, ((Token.Literal) single("\"hi\"")).kind());
        assertEquals(Token.LiteralKind.STR, ((Token.Literal) single("r#\"hi\"#")).kind());
        assertEquals(Token.LiteralKind.BYTE_STR, ((Token.Literal) single("b\"hi\"")).kind());
        assertEquals(Token.LiteralKind.BYTE_STR, ((Token.Literal) single("br\"hi\"")).kind());
        assertEquals(Token.LiteralKind.C_STR, ((Token.Literal) single("c\"hi\"")).kind());
        assertEquals(Token.LiteralKind.BYTE, ((Token.Literal) single("b'x'")).kind());
        assertEquals(Token.LiteralKind.CHAR, ((Token.Literal) single("'x'")).kind());
        assertEquals(Token.LiteralKind.INT, ((Token.Literal) single("42")).kind());
        assertEquals(Token.LiteralKind.FLOAT, ((Token.Literal) single("3.14")).kind());
    }

    @Test
    void tokenize_integerWithSuffix_splitsSuffix() {
        var token = (Token.Literal) single("0xff_u8");

        assertEquals(Token.LiteralKind.INT, token.kind());
        assertEquals("0xff_u8", token.text());
        assertEquals("u8", token.suffix());
        assertEquals("0xff_", token.body());
    }

    @Test
    void tokenize_integerWithFloatSuffix_isFloat() {
        var token = (Token.Literal) single("1f32");

        assertEquals(Token.LiteralKind.FLOAT, token.kind());
        assertEquals("f32", token.suffix());
    }

    @Test
    void tokenize_exponent_isFloat() {
        var token = (Token.Literal) single("1e10");

        assertEquals(Token.LiteralKind.FLOAT, token.kind());
        assertEquals("", token.suffix());
    }

    @Test
    void tokenize_rangeAfterInteger_notFloat() {
        var tokens = lex("1..2");

        assertEquals(3, tokens.size());
        assertEquals(Token.LiteralKind.INT, ((Token.Literal) tokens.get(0)).kind());
        assertEquals("..", tokens.get(1).text());
    }

    @Test
    void tokenize_methodOnInteger_notFloat() {
        var tokens = lex("1.max(2)");

        assertEquals("1", tokens.get(0).text());
        assertEquals(".", tokens.get(1).text());
        assertEquals("max", tokens.get(2).text());
    }

    @Test
    void tokenize_nestedTupleIndex_lexesFloat() {
        var tokens = lex("t.0.1");

        assertEquals(3, tokens.size());
        assertEquals("0.1", tokens.get(2).text());
        assertEquals(Token.LiteralKind.FLOAT, ((Token.Literal) tokens.get(2)).kind());
    }

    // === Comments and Whitespace ===

    @Test
    void tokenize_comments_skipped() {
        var tokens = lex("a /* outer /* nested */ still */ + // tail\n b");

        assertEquals(List.of("a", "+", "b"), tokens.stream().map(Token::text).toList());
    }

    @Test
    void tokenize_spans_trackLinesAndColumns() {
        var tokens = lex("a\n  b");
        var span = tokens.get(1).span();

        assertEquals(2, span.start().line());
        assertEquals(3, span.start().column());
        assertEquals(4, span.start().offset());
        assertEquals(1, span.length());
    }

    // === Errors ===

    @Test
    void tokenize_unterminatedString_errorToken() {
        var token = single("\"abc");

        assertInstanceOf(Token.Error.class, token);
        assertEquals("Unterminated double quote string", ((Token.Error) token).message());
    }

    @Test
    void tokenize_unterminatedBlockComment_errorToken() {
        var token = single("/* open");

        assertInstanceOf(Token.Error.class, token);
    }

    @Test
    void tokenize_invalidEscape_errorToken() {
        var token = single("\"\\q\"");

        assertInstanceOf(Token.Error.class, token);
        assertTrue(((Token.Error) token).message().startsWith("Invalid literal"));
    }

    @Test
    void tokenize_unknownCharacter_errorToken() {
        var token = single("§");

        assertInstanceOf(Token.Error.class, token);
        assertTrue(((Token.Error) token).message().contains("Unknown start of token"));
    }

    @Test
    void tokenize_mismatchedDelimiter_errorToken() {
        var tokens = lex("(a]");

        assertInstanceOf(Token.Error.class, tokens.get(2));
        assertTrue(((Token.Error) tokens.get(2)).message().startsWith("Mismatched closing delimiter"));
    }

    @Test
    void tokenize_unclosedDelimiter_errorBeforeEof() {
        var tokens = lex("[a");

        var last = tokens.get(tokens.size() - 1);
        assertInstanceOf(Token.Error.class, last);
        assertEquals("Unclosed delimiter '['", ((Token.Error) last).message());
    }

    @Test
    void tokenize_strayClose_errorToken() {
        assertInstanceOf(Token.Error.class, single(")"));
    }

    @Test
    void tokenize_oversizeInput_throws() {
        var input = "a".repeat(1_000_001);

        assertThrows(IllegalArgumentException.class, () -> Lexer.tokenize(input));
    }

    // === Token Streams ===

    @Test
    void tokenStream_of_dropsEofAndErrors() {
        var stream = TokenStream.of(Lexer.tokenize("a §"));

        assertEquals(1, stream.size());
        assertEquals("a", stream.tokens().get(0).text());
    }

    @Test
    void tokenStream_concat_keepsOrder() {
        var joined = TokenStream.lex("a b").concat(TokenStream.lex("c"));

        assertEquals(List.of("a", "b", "c"), joined.tokens().stream().map(Token::text).toList());
        assertTrue(TokenStream.EMPTY.isEmpty());
    }
}
