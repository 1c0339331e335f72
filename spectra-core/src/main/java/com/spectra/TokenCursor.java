package com.spectra;

import java.util.Iterator;

/**
 * One token of lookahead over a token sequence. A token can be peeked any number of
 * times before it is consumed; once consumed it is gone.
 */
public final class TokenCursor {
    private final Iterator<Token> tokens;
    private Token lookahead;
    private Token previous;

    public TokenCursor(Iterator<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * The next token without consuming it, or null at end of input.
     */
    public Token peek() {
        if (lookahead == null && tokens.hasNext()) {
            lookahead = tokens.next();
        }
        return lookahead;
    }

    /**
     * Consumes and returns the next token, or null at end of input.
     */
    public Token next() {
        Token token = peek();
        if (token != null) {
            previous = token;
            lookahead = null;
        }
        return token;
    }

    /**
     * The most recently consumed token, or null if nothing has been consumed yet.
     */
    public Token previous() {
        return previous;
    }

    public boolean atEnd() {
        return peek() == null;
    }

    public boolean check(RawToken raw) {
        Token token = peek();
        return token != null && token.is(raw);
    }
}
