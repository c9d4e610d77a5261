package org.pragmatica.exprjson.syntax;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Ordered tokens a syntax node was parsed from. End-of-input and error tokens never appear here.
 *
 * <p>Streams built by the parser are slices of one token list shared by the whole tree, so a node
 * costs the same whatever the length of its source.
 */
public record TokenStream(List<Token> tokens) {

    public static final TokenStream EMPTY = new TokenStream(List.of());

    public TokenStream {
        if (!(tokens instanceof Slice)) {
            tokens = List.copyOf(tokens);
        }
    }

    public static TokenStream of(List<Token> tokens) {
        var kept = new ArrayList<Token>(tokens.size());
        for (var token : tokens) {
            if (!(token instanceof Token.Eof) && !(token instanceof Token.Error)) {
                kept.add(token);
            }
        }
        return new TokenStream(kept);
    }

    /**
     * View of {@code source} from {@code from} (inclusive) to {@code to} (exclusive), without copying.
     * The caller guarantees that this range of {@code source} holds no end-of-input or error token and
     * is never modified afterwards.
     */
    public static TokenStream slice(List<Token> source, int from, int to) {
        Objects.checkFromToIndex(from, to, source.size());
        return new TokenStream(new Slice(source, from, to - from));
    }

    /**
     * Tokenize source text. Lexer errors are dropped, so use this for trusted text only.
     */
    public static TokenStream lex(String source) {
        return of(Lexer.tokenize(source));
    }

    public TokenStream concat(TokenStream other) {
        var joined = new ArrayList<Token>(tokens.size() + other.tokens.size());
        joined.addAll(tokens);
        joined.addAll(other.tokens);
        return new TokenStream(joined);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    private static final class Slice extends AbstractList<Token> implements RandomAccess {
        private final List<Token> source;
        private final int from;
        private final int size;

        private Slice(List<Token> source, int from, int size) {
            this.source = source;
            this.from = from;
            this.size = size;
        }

        @Override
        public Token get(int index) {
            Objects.checkIndex(index, size);
            return source.get(from + index);
        }

        @Override
        public int size() {
            return size;
        }
    }
}
