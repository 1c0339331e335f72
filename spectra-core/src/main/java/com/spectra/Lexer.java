package com.spectra;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pull-based tokenizer. Scans code points left to right with one code point of
 * lookahead and reports locations as UTF-8 byte offsets.
 *
 * <p>The lexer never fails: characters it does not recognize come out as
 * {@link RawToken.UnexpectedChar} tokens and the parser decides what to do with them.
 * An instance is single-use and not thread-safe.</p>
 */
public class Lexer implements Iterator<Token> {
    private static final int EOF = -1;

    private final String source;
    private final int sourceLength;

    // char index of the code point after `next`
    private int readIndex = 0;
    // char index and byte offset of `current`
    private int position = 0;
    private int offset = 0;

    private int current;
    private int next;

    public Lexer(String source) {
        this.source = source;
        this.sourceLength = utf8Length(source);
        this.current = read();
        this.next = read();
    }

    /**
     * Drains a fresh lexer over {@code source} into a list.
     */
    public static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        Lexer lexer = new Lexer(source);
        while (lexer.hasNext()) {
            tokens.add(lexer.next());
        }
        return tokens;
    }

    /**
     * Length of the whole source in UTF-8 bytes.
     */
    public int sourceLength() {
        return sourceLength;
    }

    @Override
    public boolean hasNext() {
        skipWhitespace();
        return current != EOF;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("End of input");
        }

        return switch (current) {
            case '+' -> switch (next) {
                case '+' -> twoChars(Punctuation.PLUS_PLUS);
                case '=' -> twoChars(Punctuation.PLUS_EQ);
                default -> oneChar(Punctuation.PLUS);
            };
            case '-' -> switch (next) {
                case '-' -> twoChars(Punctuation.MINUS_MINUS);
                case '=' -> twoChars(Punctuation.MINUS_EQ);
                default -> oneChar(Punctuation.MINUS);
            };
            case '*' -> switch (next) {
                case '*' -> twoChars(Punctuation.STAR_STAR);
                case '=' -> twoChars(Punctuation.STAR_EQ);
                default -> oneChar(Punctuation.STAR);
            };
            case '/' -> next == '=' ? twoChars(Punctuation.SLASH_EQ) : oneChar(Punctuation.SLASH);
            case '=' -> oneChar(Punctuation.EQ);
            case '(' -> oneChar(Punctuation.OPEN_PAREN);
            case ')' -> oneChar(Punctuation.CLOSE_PAREN);
            case '[' -> oneChar(Punctuation.OPEN_BRACKET);
            case ']' -> oneChar(Punctuation.CLOSE_BRACKET);
            case '{' -> oneChar(Punctuation.OPEN_BRACE);
            case '}' -> oneChar(Punctuation.CLOSE_BRACE);
            case ';' -> oneChar(Punctuation.SEMICOLON);
            case ',' -> oneChar(Punctuation.COMMA);
            case '.' -> oneChar(Punctuation.DOT);
            case '"' -> scanString();
            case '\'' -> scanChar();
            default -> {
                if (isIdentifierStart(current)) {
                    yield scanIdentifierOrKeyword();
                } else if (isAsciiDigit(current)) {
                    yield scanNumber();
                }
                yield oneChar(new RawToken.UnexpectedChar(current));
            }
        };
    }

    // ========================================================================
    // Cursor
    // ========================================================================

    private int read() {
        if (readIndex >= source.length()) {
            return EOF;
        }
        int codePoint = source.codePointAt(readIndex);
        readIndex += Character.charCount(codePoint);
        return codePoint;
    }

    private void advance() {
        if (current == EOF) {
            return;
        }
        position += Character.charCount(current);
        offset += utf8Length(current);
        current = next;
        next = read();
    }

    private void skipWhitespace() {
        while (isWhitespace(current)) {
            advance();
        }
    }

    private Token oneChar(RawToken raw) {
        int start = offset;
        advance();
        return new Token(raw, new Location(start, offset));
    }

    private Token twoChars(RawToken raw) {
        int start = offset;
        advance();
        advance();
        return new Token(raw, new Location(start, offset));
    }

    // ========================================================================
    // Scanners
    // ========================================================================

    private Token scanIdentifierOrKeyword() {
        int start = offset;
        int startPosition = position;
        while (isIdentifierPart(current)) {
            advance();
        }
        String text = source.substring(startPosition, position);
        RawToken raw = RawToken.reserved(text).orElseGet(() -> new RawToken.Identifier(text));
        return new Token(raw, new Location(start, offset));
    }

    // Floating-point literals are not scanned: `1.5` is `1`, `.`, `5`.
    private Token scanNumber() {
        int start = offset;
        int startPosition = position;
        while (isAsciiDigit(current)) {
            advance();
        }
        String digits = source.substring(startPosition, position);
        RawToken raw;
        try {
            raw = new RawToken.IntegerLiteral(Long.parseUnsignedLong(digits));
        } catch (NumberFormatException e) {
            raw = new RawToken.OversizedInteger(digits);
        }
        return new Token(raw, new Location(start, offset));
    }

    // No escape sequences. An unterminated string runs to the end of input.
    private Token scanString() {
        int start = offset;
        advance(); // opening quote
        int contentStart = position;
        while (current != EOF && current != '"') {
            advance();
        }
        String value = source.substring(contentStart, position);
        if (current == '"') {
            advance();
        }
        return new Token(new RawToken.StringLiteral(value), new Location(start, offset));
    }

    private Token scanChar() {
        int start = offset;
        advance(); // opening quote
        if (current != EOF && current != '\'' && next == '\'') {
            int value = current;
            advance();
            advance();
            return new Token(new RawToken.CharLiteral(value), new Location(start, offset));
        }
        return new Token(new RawToken.UnexpectedChar('\''), new Location(start, offset));
    }

    // ========================================================================
    // Character classes
    // ========================================================================

    static boolean isWhitespace(int c) {
        return switch (c) {
            case '\t', '\n', 0x0B, '\f', '\r', ' ',
                 0x0085,         // NEXT LINE
                 0x200E, 0x200F, // bidi marks
                 0x2028, 0x2029  // line and paragraph separators
                -> true;
            default -> false;
        };
    }

    static boolean isIdentifierStart(int c) {
        return c == '_' || (c != EOF && Character.isUnicodeIdentifierStart(c));
    }

    static boolean isIdentifierPart(int c) {
        return c != EOF && Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
    }

    static boolean isAsciiDigit(int c) {
        return c >= '0' && c <= '9';
    }

    static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        } else if (codePoint < 0x800) {
            return 2;
        } else if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    static int utf8Length(CharSequence text) {
        int length = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = Character.codePointAt(text, i);
            length += utf8Length(codePoint);
            i += Character.charCount(codePoint);
        }
        return length;
    }
}
