package org.pragmatica.exprjson.syntax;

import org.pragmatica.exprjson.tree.SourceLocation;
import org.pragmatica.exprjson.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lexer for Rust expression syntax.
 *
 * <p>Produces identifiers, lifetimes, literals, punctuation and delimiters. Whitespace and
 * comments (including doc comments) are skipped. Malformed input yields {@link Token.Error}
 * tokens instead of exceptions; the token list always ends with {@link Token.Eof}.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final List<String> MULTI_CHAR_PUNCTUATION = List.of(
        "<<=", ">>=", "...", "..=",
        "::", "->", "=>", "==", "!=", "<=", ">=", "&&", "||",
        "+=", "-=", "*=", "/=", "%=", "^=", "&=", "|=", "<<", ">>", "..");
    private static final String SINGLE_CHAR_PUNCTUATION = "+-*/%^!&|=<>@.,;:#$?~";
    private static final Pattern FLOAT_SUFFIX = Pattern.compile("f(16|32|64|128)");

    private final String input;
    private final Deque<Token.Open> openDelimiters = new ArrayDeque<>();
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
                "Expression input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (!isAtEnd()) {
            var commentError = skipWhitespaceAndComments();
            if (commentError != null) {
                tokens.add(commentError);
                break;
            }
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        if (!openDelimiters.isEmpty()) {
            var unclosed = openDelimiters.peek();
            tokens.add(new Token.Error(unclosed.span(), "Unclosed delimiter '" + unclosed.text() + "'"));
        }
        tokens.add(new Token.Eof(currentSpan()));
        return tokens;
    }

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();
        if (c == 'r' && peekAt(1) == '#' && isIdentifierStart(peekAt(2))) {
            return scanRawIdentifier(start);
        }
        if (c == 'b' && peekAt(1) == '\'') {
            return scanQuoted(start, 1, '\'', Token.LiteralKind.BYTE);
        }
        if (c == 'b' && peekAt(1) == '"') {
            return scanQuoted(start, 1, '"', Token.LiteralKind.BYTE_STR);
        }
        if (c == 'b' && peekAt(1) == 'r' && isRawQuoteStart(2)) {
            return scanRawString(start, 2, Token.LiteralKind.BYTE_STR);
        }
        if (c == 'c' && peekAt(1) == '"') {
            return scanQuoted(start, 1, '"', Token.LiteralKind.C_STR);
        }
        if (c == 'c' && peekAt(1) == 'r' && isRawQuoteStart(2)) {
            return scanRawString(start, 2, Token.LiteralKind.C_STR);
        }
        if (c == 'r' && isRawQuoteStart(1)) {
            return scanRawString(start, 1, Token.LiteralKind.STR);
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '\'') {
            return scanCharOrLifetime(start);
        }
        if (c == '"') {
            return scanQuoted(start, 0, '"', Token.LiteralKind.STR);
        }
        return scanDelimiterOrPunctuation(start);
    }

    private Token scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new Token.Ident(span(start), sb.toString(), false);
    }

    private Token scanRawIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(advance());
        sb.append(advance());
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new Token.Ident(span(start), sb.toString(), true);
    }

    private Token scanCharOrLifetime(SourceLocation start) {
        if (peekAt(1) == '\\') {
            return scanQuoted(start, 0, '\'', Token.LiteralKind.CHAR);
        }
        if (pos + 1 < input.length()) {
            int width = Character.charCount(input.codePointAt(pos + 1));
            if (peekAt(1 + width) == '\'') {
                return scanQuoted(start, 0, '\'', Token.LiteralKind.CHAR);
            }
        }
        if (isIdentifierStart(peekAt(1))) {
            var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
            sb.append(advance());
            while (!isAtEnd() && isIdentifierPart(peek())) {
                sb.append(advance());
            }
            return new Token.Lifetime(span(start), sb.toString());
        }
        advance();
        return new Token.Error(span(start), "Unterminated character literal");
    }

    private Token scanQuoted(SourceLocation start, int prefixLength, char quote, Token.LiteralKind kind) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        for (int i = 0; i <= prefixLength; i++) {
            sb.append(advance());
        }
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            return new Token.Error(span(start), quote == '"'
                                                ? "Unterminated double quote string"
                                                : "Unterminated character literal");
        }
        sb.append(advance());
        return literal(start, kind, sb, scanSuffix());
    }

    private Token scanRawString(SourceLocation start, int prefixLength, Token.LiteralKind kind) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        for (int i = 0; i < prefixLength; i++) {
            sb.append(advance());
        }
        int hashes = 0;
        while (!isAtEnd() && peek() == '#') {
            sb.append(advance());
            hashes++;
        }
        if (isAtEnd() || peek() != '"') {
            return new Token.Error(span(start), "Expected '\"' in raw string literal");
        }
        sb.append(advance());
        var terminator = "\"" + "#".repeat(hashes);
        while (!isAtEnd() && !input.startsWith(terminator, pos)) {
            sb.append(advance());
        }
        if (isAtEnd()) {
            return new Token.Error(span(start), "Unterminated raw string");
        }
        for (int i = 0; i < terminator.length(); i++) {
            sb.append(advance());
        }
        return literal(start, kind, sb, scanSuffix());
    }

    private Token scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        var kind = Token.LiteralKind.INT;
        if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'o' || peekAt(1) == 'b')) {
            boolean hex = peekAt(1) == 'x';
            sb.append(advance());
            sb.append(advance());
            while (!isAtEnd() && (peek() == '_' || (hex
                                                    ? isHexDigit(peek())
                                                    : isDigit(peek())))) {
                sb.append(advance());
            }
        } else {
            scanDecimalDigits(sb);
            if (!isAtEnd() && peek() == '.' && peekAt(1) != '.' && !isIdentifierStart(peekAt(1))) {
                kind = Token.LiteralKind.FLOAT;
                sb.append(advance());
                scanDecimalDigits(sb);
            }
            if (isExponentStart()) {
                kind = Token.LiteralKind.FLOAT;
                sb.append(advance());
                if (peek() == '+' || peek() == '-') {
                    sb.append(advance());
                }
                scanDecimalDigits(sb);
            }
        }
        var suffix = scanSuffix();
        if (kind == Token.LiteralKind.INT
            && LiteralText.radixOf(sb.toString()) == 10
            && FLOAT_SUFFIX.matcher(suffix).matches()) {
            kind = Token.LiteralKind.FLOAT;
        }
        return literal(start, kind, sb, suffix);
    }

    private void scanDecimalDigits(StringBuilder sb) {
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            sb.append(advance());
        }
    }

    private boolean isExponentStart() {
        if (isAtEnd() || (peek() != 'e' && peek() != 'E')) {
            return false;
        }
        char next = peekAt(1);
        if (next == '+' || next == '-') {
            next = peekAt(2);
        }
        return isDigit(next) || next == '_';
    }

    private String scanSuffix() {
        if (isAtEnd() || !isIdentifierStart(peek())) {
            return "";
        }
        var sb = new StringBuilder();
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private Token literal(SourceLocation start, Token.LiteralKind kind, StringBuilder body, String suffix) {
        var token = new Token.Literal(span(start), kind, body + suffix, suffix);
        try {
            validate(token);
        } catch (IllegalArgumentException e) {
            return new Token.Error(token.span(), "Invalid literal " + token.text() + ": " + e.getMessage());
        }
        return token;
    }

    private static void validate(Token.Literal literal) {
        var body = literal.body();
        switch (literal.kind()) {
            case STR -> LiteralText.decodeString(body);
            case BYTE_STR -> LiteralText.decodeByteString(body);
            case C_STR -> LiteralText.decodeCString(body);
            case BYTE -> LiteralText.decodeByte(body);
            case CHAR -> LiteralText.decodeChar(body);
            case INT -> LiteralText.integerDigits(body);
            case FLOAT -> LiteralText.floatDigits(body);
        }
    }

    private Token scanDelimiterOrPunctuation(SourceLocation start) {
        char c = peek();
        for (var delimiter : Token.Delimiter.values()) {
            if (c == delimiter.open()) {
                advance();
                var open = new Token.Open(span(start), delimiter);
                openDelimiters.push(open);
                return open;
            }
            if (c == delimiter.close()) {
                advance();
                var open = openDelimiters.poll();
                if (open == null) {
                    return new Token.Error(span(start), "Unexpected closing delimiter '" + c + "'");
                }
                if (open.delimiter() != delimiter) {
                    return new Token.Error(span(start),
                                           "Mismatched closing delimiter '" + c + "' for '" + open.text() + "' at "
                                           + open.span().start());
                }
                return new Token.Close(span(start), delimiter);
            }
        }
        for (var punct : MULTI_CHAR_PUNCTUATION) {
            if (input.startsWith(punct, pos)) {
                for (int i = 0; i < punct.length(); i++) {
                    advance();
                }
                return new Token.Punct(span(start), punct);
            }
        }
        advance();
        if (SINGLE_CHAR_PUNCTUATION.indexOf(c) >= 0) {
            return new Token.Punct(span(start), String.valueOf(c));
        }
        return new Token.Error(span(start), "Unknown start of token: " + c);
    }

    private Token skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekAt(1) == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekAt(1) == '*') {
                var start = currentLocation();
                if (!skipBlockComment()) {
                    return new Token.Error(span(start), "Unterminated block comment");
                }
            } else {
                break;
            }
        }
        return null;
    }

    // Block comments nest.
    private boolean skipBlockComment() {
        int depth = 0;
        while (!isAtEnd()) {
            if (peek() == '/' && peekAt(1) == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekAt(1) == '/') {
                advance();
                advance();
                depth--;
                if (depth == 0) {
                    return true;
                }
            } else {
                advance();
            }
        }
        return false;
    }

    private boolean isRawQuoteStart(int offset) {
        int i = offset;
        while (peekAt(i) == '#') {
            i++;
        }
        return peekAt(i) == '"';
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < input.length()
               ? input.charAt(index)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
