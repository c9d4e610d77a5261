package org.pragmatica.exprjson.parser;

import org.pragmatica.exprjson.error.ParseError;
import org.pragmatica.exprjson.syntax.Token;
import org.pragmatica.exprjson.syntax.TokenStream;
import org.pragmatica.exprjson.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mutable parsing context: token cursor, nesting depth and error construction.
 */
final class ParsingContext {

    private final List<Token> tokens;
    private final ParserConfig config;

    private int pos;
    private int depth;

    private ParsingContext(List<Token> tokens, ParserConfig config) {
        this.tokens = new ArrayList<>(tokens);
        this.config = config;
        this.pos = 0;
        this.depth = 0;
    }

    static ParsingContext create(List<Token> tokens, ParserConfig config) {
        return new ParsingContext(tokens, config);
    }

    // === Position Management ===

    int mark() {
        return pos;
    }

    void reset(int mark) {
        this.pos = mark;
    }

    boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    Token peek() {
        return peek(0);
    }

    Token peek(int ahead) {
        int index = Math.min(pos + ahead, tokens.size() - 1);
        return tokens.get(index);
    }

    Token advance() {
        var token = peek();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    /**
     * Tokens consumed since {@code mark}, as a view over the shared token list. Tokens before the
     * cursor never change, so the view stays valid for the rest of the parse.
     */
    TokenStream since(int mark) {
        return TokenStream.slice(tokens, mark, pos);
    }

    // === Token Tests ===

    boolean isPunct(String text) {
        return isPunct(0, text);
    }

    boolean isPunct(int ahead, String text) {
        return peek(ahead) instanceof Token.Punct punct && punct.text().equals(text);
    }

    boolean isKeyword(String keyword) {
        return isKeyword(0, keyword);
    }

    boolean isKeyword(int ahead, String keyword) {
        return peek(ahead) instanceof Token.Ident ident && ident.is(keyword);
    }

    boolean isOpen(Token.Delimiter delimiter) {
        return isOpen(0, delimiter);
    }

    boolean isOpen(int ahead, Token.Delimiter delimiter) {
        return peek(ahead) instanceof Token.Open open && open.delimiter() == delimiter;
    }

    boolean isClose(Token.Delimiter delimiter) {
        return peek() instanceof Token.Close close && close.delimiter() == delimiter;
    }

    boolean isClose() {
        return peek() instanceof Token.Close;
    }

    /**
     * Current token is punctuation starting with {@code prefix}, e.g. {@code >>=} for {@code >}.
     */
    boolean startsWithPunct(String prefix) {
        return peek() instanceof Token.Punct punct && punct.text().startsWith(prefix);
    }

    // === Consuming ===

    boolean eatPunct(String text) {
        if (isPunct(text)) {
            advance();
            return true;
        }
        return false;
    }

    boolean eatKeyword(String keyword) {
        if (isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    boolean eatClose(Token.Delimiter delimiter) {
        if (isClose(delimiter)) {
            advance();
            return true;
        }
        return false;
    }

    Token expectPunct(String text) {
        if (!isPunct(text)) {
            throw unexpected("'" + text + "'");
        }
        return advance();
    }

    Token expectKeyword(String keyword) {
        if (!isKeyword(keyword)) {
            throw unexpected("'" + keyword + "'");
        }
        return advance();
    }

    Token expectOpen(Token.Delimiter delimiter) {
        if (!isOpen(delimiter)) {
            throw unexpected("'" + delimiter.open() + "'");
        }
        return advance();
    }

    Token expectClose(Token.Delimiter delimiter) {
        if (!isClose(delimiter)) {
            throw unexpected("'" + delimiter.close() + "'");
        }
        return advance();
    }

    /**
     * Identifier usable as a name: raw, or not a reserved word.
     */
    Token.Ident expectName(String what) {
        if (peek() instanceof Token.Ident ident && !ident.isReserved()) {
            advance();
            return ident;
        }
        throw unexpected(what);
    }

    /**
     * Consume a whole delimited group, nested groups included. The lexer guarantees balance.
     */
    void skipDelimited() {
        if (!(peek() instanceof Token.Open)) {
            throw unexpected("'(', '[' or '{'");
        }
        int level = 0;
        do {
            var token = advance();
            if (token instanceof Token.Open) {
                level++;
            } else if (token instanceof Token.Close) {
                level--;
            }
        } while (level > 0 && !isAtEnd());
    }

    /**
     * Split the current punctuation token so that it starts with {@code head} as a token of its own.
     * Only tokens at and after the cursor move.
     * Used where the lexer joined characters the grammar reads separately: {@code >>} closing two
     * generic lists, {@code &&} as two references, {@code ||} as an empty closure parameter list.
     */
    void splitPunct(String head) {
        if (!(peek() instanceof Token.Punct punct)
            || !punct.text().startsWith(head)
            || punct.text().length() == head.length()) {
            return;
        }
        var spans = punct.span().splitAt(head.length());
        tokens.set(pos, new Token.Punct(spans[0], head));
        tokens.add(pos + 1, new Token.Punct(spans[1], punct.text().substring(head.length())));
    }

    // === Nesting ===

    void enter() {
        depth++;
        if (depth > config.maxNestingDepth()) {
            throw new ParseException(new ParseError.NestingTooDeep(peek().span(), config.maxNestingDepth()));
        }
    }

    void exit() {
        depth--;
    }

    /**
     * Current depth, to be passed back to {@link #unwind(int)} once a loop of left folds finishes.
     */
    int depth() {
        return depth;
    }

    void unwind(int depth) {
        this.depth = depth;
    }

    // === Errors ===

    ParseException unexpected(String expected) {
        var token = peek();
        if (token instanceof Token.Eof) {
            return new ParseException(new ParseError.UnexpectedEof(token.span(), expected));
        }
        return new ParseException(new ParseError.UnexpectedToken(token.span(), describe(token), expected));
    }

    ParseException invalid(String reason, SourceSpan span) {
        return new ParseException(new ParseError.InvalidSyntax(span, reason));
    }

    ParseException invalid(String reason, String help, SourceSpan span) {
        return new ParseException(new ParseError.InvalidSyntax(span, reason, Optional.of(help)));
    }

    static String describe(Token token) {
        if (token instanceof Token.Ident ident) {
            return ident.isReserved()
                   ? "keyword '" + ident.text() + "'"
                   : "identifier '" + ident.text() + "'";
        }
        if (token instanceof Token.Literal literal) {
            return "literal " + literal.text();
        }
        if (token instanceof Token.Lifetime lifetime) {
            return "lifetime " + lifetime.text();
        }
        if (token instanceof Token.Eof) {
            return "end of input";
        }
        return "'" + token.text() + "'";
    }
}
