package com.spectra;

import com.spectra.ast.BinaryExpression;
import com.spectra.ast.BlockStatement;
import com.spectra.ast.BreakStatement;
import com.spectra.ast.CallExpression;
import com.spectra.ast.ContinueStatement;
import com.spectra.ast.Expression;
import com.spectra.ast.ExpressionStatement;
import com.spectra.ast.FieldAccessExpression;
import com.spectra.ast.FunctionExpression;
import com.spectra.ast.Identifier;
import com.spectra.ast.IfStatement;
import com.spectra.ast.Literal;
import com.spectra.ast.Module;
import com.spectra.ast.PostfixExpression;
import com.spectra.ast.PrefixExpression;
import com.spectra.ast.RawLiteral;
import com.spectra.ast.ReturnStatement;
import com.spectra.ast.Statement;
import com.spectra.ast.StatementsBlock;
import com.spectra.ast.VarStatement;
import com.spectra.ast.WhileStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser with precedence climbing for expressions.
 *
 * <p>Pulls tokens from a {@link Lexer} through a one-token {@link TokenCursor}; nothing
 * is re-scanned and nothing is un-consumed. The first token that does not fit the grammar
 * aborts the parse with a {@link ParseException}.</p>
 *
 * <p>A parser owns its lexer and is good for exactly one parse.</p>
 */
public class Parser {
    private final TokenCursor tokens;
    private final int sourceLength;

    public Parser(String source) {
        this(new Lexer(source));
    }

    public Parser(Lexer lexer) {
        this.tokens = new TokenCursor(lexer);
        this.sourceLength = lexer.sourceLength();
    }

    public static Module parse(String source) {
        return new Parser(source).parse();
    }

    /**
     * Parses top-level statements until the token stream is exhausted.
     */
    public Module parse() {
        List<Statement> statements = new ArrayList<>();
        while (!tokens.atEnd()) {
            statements.add(parseStatement());
        }
        return new Module(new Location(0, sourceLength), statements);
    }

    // ========================================================================
    // Token consumption
    // ========================================================================

    /**
     * Consumes the next token, which must be {@code expected}.
     */
    public Token consume(RawToken expected) {
        Token got = tokens.next();
        if (got == null || !got.is(expected)) {
            throw new ParseException(expected.describe(), got);
        }
        return got;
    }

    public Identifier consumeIdentifier() {
        Token got = tokens.next();
        if (got != null && got.raw() instanceof RawToken.Identifier identifier) {
            return new Identifier(got.location(), identifier.name());
        }
        throw new ParseException("identifier", got);
    }

    // Location from the start of `startToken` through the last consumed token
    private Location spanFrom(Token startToken) {
        return Location.span(startToken.location(), tokens.previous().location());
    }

    // ========================================================================
    // Statements
    // ========================================================================

    public Statement parseStatement() {
        Token startToken = tokens.peek();
        if (startToken == null) {
            throw new ParseException("statement", null);
        }

        if (startToken.raw() == Punctuation.OPEN_BRACE) {
            return new BlockStatement(parseStatementsBlock());
        }

        if (startToken.raw() instanceof Keyword keyword) {
            switch (keyword) {
                case CONTINUE -> {
                    tokens.next();
                    consume(Punctuation.SEMICOLON);
                    return new ContinueStatement(spanFrom(startToken));
                }
                case BREAK -> {
                    tokens.next();
                    consume(Punctuation.SEMICOLON);
                    return new BreakStatement(spanFrom(startToken));
                }
                case RETURN -> {
                    tokens.next();
                    Expression value = parseExpression(Precedence.LOWEST);
                    consume(Punctuation.SEMICOLON);
                    return new ReturnStatement(spanFrom(startToken), value);
                }
                case VAR -> {
                    return parseVarStatement(startToken);
                }
                case IF -> {
                    return parseIfStatement(startToken);
                }
                case WHILE -> {
                    return parseWhileStatement(startToken);
                }
                case FUN, CLASS, ELSE -> {
                    // `fun` opens a function expression; the others fail as expressions
                }
            }
        }

        Expression expression = parseExpression(Precedence.LOWEST);
        Token semicolon = consume(Punctuation.SEMICOLON);
        return new ExpressionStatement(Location.span(expression.location(), semicolon.location()), expression);
    }

    private VarStatement parseVarStatement(Token startToken) {
        tokens.next(); // consume 'var'
        Identifier name = consumeIdentifier();
        consume(Punctuation.EQ);
        Expression initializer = parseExpression(Precedence.LOWEST);
        consume(Punctuation.SEMICOLON);
        return new VarStatement(spanFrom(startToken), name, initializer);
    }

    private IfStatement parseIfStatement(Token startToken) {
        tokens.next(); // consume 'if'
        consume(Punctuation.OPEN_PAREN);
        Expression condition = parseExpression(Precedence.LOWEST);
        consume(Punctuation.CLOSE_PAREN);
        StatementsBlock consequent = parseStatementsBlock();

        Statement alternate = null;
        if (tokens.check(Keyword.ELSE)) {
            tokens.next();
            Token elseStart = tokens.peek();
            if (elseStart != null && elseStart.is(Keyword.IF)) {
                alternate = parseIfStatement(elseStart);
            } else {
                alternate = new BlockStatement(parseStatementsBlock());
            }
        }

        return new IfStatement(spanFrom(startToken), condition, consequent, alternate);
    }

    private WhileStatement parseWhileStatement(Token startToken) {
        tokens.next(); // consume 'while'
        consume(Punctuation.OPEN_PAREN);
        Expression condition = parseExpression(Precedence.LOWEST);
        consume(Punctuation.CLOSE_PAREN);
        StatementsBlock body = parseStatementsBlock();
        return new WhileStatement(spanFrom(startToken), condition, body);
    }

    /**
     * {@code { statement* }}
     */
    public StatementsBlock parseStatementsBlock() {
        Token open = consume(Punctuation.OPEN_BRACE);

        List<Statement> statements = new ArrayList<>();
        while (!tokens.atEnd() && !tokens.check(Punctuation.CLOSE_BRACE)) {
            statements.add(parseStatement());
        }

        consume(Punctuation.CLOSE_BRACE);
        return new StatementsBlock(spanFrom(open), statements);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    /**
     * Precedence climbing: parses a primary expression, then keeps folding operators
     * for as long as they bind tighter than {@code minPrecedence}.
     *
     * <p>A folded node spans from the start of its left operand to the end of its
     * rightmost operand or closing token. Parentheses are never part of a span.</p>
     */
    public Expression parseExpression(Precedence minPrecedence) {
        Expression left = parsePrimaryExpression();

        while (true) {
            Token operator = tokens.peek();
            if (operator == null || !minPrecedence.isLowerThan(operator.precedence())) {
                break;
            }
            tokens.next();
            left = parseInfix(left, operator);
        }

        return left;
    }

    // Only punctuation has a precedence above LOWEST, so `operator` is always punctuation.
    private Expression parseInfix(Expression left, Token operator) {
        Punctuation punctuation = (Punctuation) operator.raw();
        return switch (punctuation) {
            // left-associative: the right side stops at the next operator of equal strength
            case PLUS, MINUS, STAR, SLASH -> parseBinary(left, operator, punctuation.precedence());
            // right-associative
            case STAR_STAR -> parseBinary(left, operator, Precedence.PRODUCT);
            case EQ, PLUS_EQ, MINUS_EQ, STAR_EQ, SLASH_EQ -> parseBinary(left, operator, Precedence.LOWEST);
            case PLUS_PLUS, MINUS_MINUS ->
                new PostfixExpression(Location.span(left.location(), operator.location()), left, operator);
            case DOT -> {
                Identifier field = consumeIdentifier();
                yield new FieldAccessExpression(Location.span(left.location(), field.location()), left, field);
            }
            case OPEN_PAREN -> {
                List<Expression> arguments = parseCommaSeparated(() -> parseExpression(Precedence.LOWEST));
                Token close = consume(Punctuation.CLOSE_PAREN);
                yield new CallExpression(Location.span(left.location(), close.location()), left, arguments);
            }
            case CLOSE_PAREN, OPEN_BRACKET, CLOSE_BRACKET, OPEN_BRACE, CLOSE_BRACE, SEMICOLON, COMMA ->
                throw new IllegalStateException(punctuation.describe() + " is not an infix operator");
        };
    }

    private BinaryExpression parseBinary(Expression left, Token operator, Precedence rightPrecedence) {
        Expression right = parseExpression(rightPrecedence);
        return new BinaryExpression(Location.span(left.location(), right.location()), left, right, operator);
    }

    /**
     * Items separated by commas up to (not including) a closing parenthesis.
     * A trailing comma is allowed; a missing comma ends the list.
     */
    private <T> List<T> parseCommaSeparated(ItemParser<T> item) {
        List<T> items = new ArrayList<>();
        while (!tokens.atEnd() && !tokens.check(Punctuation.CLOSE_PAREN)) {
            items.add(item.parse());
            if (tokens.check(Punctuation.COMMA)) {
                tokens.next();
            } else {
                break;
            }
        }
        return items;
    }

    @FunctionalInterface
    private interface ItemParser<T> {
        T parse();
    }

    private Expression parsePrimaryExpression() {
        Token token = tokens.next();
        if (token == null) {
            throw new ParseException("expression", null);
        }

        RawToken raw = token.raw();
        if (raw == Punctuation.OPEN_PAREN) {
            // the group keeps the location of what it encloses
            Expression inner = parseExpression(Precedence.LOWEST);
            consume(Punctuation.CLOSE_PAREN);
            return inner;
        }
        if (raw == Punctuation.MINUS || raw == Punctuation.PLUS
                || raw == Punctuation.PLUS_PLUS || raw == Punctuation.MINUS_MINUS) {
            // binds tighter than * and /, looser than **, calls and field access
            Expression operand = parseExpression(Precedence.PRODUCT);
            return new PrefixExpression(Location.span(token.location(), operand.location()), token, operand);
        }
        if (raw == Keyword.FUN) {
            return parseFunctionExpression(token);
        }
        if (raw instanceof RawToken.Identifier identifier) {
            return new Identifier(token.location(), identifier.name());
        }
        if (raw instanceof RawToken.IntegerLiteral literal) {
            return new Literal(token.location(), new RawLiteral.IntegerValue(literal.value()));
        }
        if (raw instanceof RawToken.BoolLiteral literal) {
            return new Literal(token.location(), new RawLiteral.BoolValue(literal.value()));
        }
        if (raw instanceof RawToken.StringLiteral literal) {
            return new Literal(token.location(), new RawLiteral.StringValue(literal.value()));
        }
        if (raw instanceof RawToken.CharLiteral literal) {
            return new Literal(token.location(), new RawLiteral.CharValue(literal.codePoint()));
        }
        if (raw instanceof RawToken.FloatLiteral literal) {
            return new Literal(token.location(), new RawLiteral.FloatValue(literal.value()));
        }

        throw new ParseException("expression", token);
    }

    /**
     * {@code fun (a, b) { ... }}, entered after the {@code fun} keyword.
     */
    private FunctionExpression parseFunctionExpression(Token funToken) {
        consume(Punctuation.OPEN_PAREN);
        List<Identifier> parameters = parseCommaSeparated(this::consumeIdentifier);
        consume(Punctuation.CLOSE_PAREN);
        StatementsBlock body = parseStatementsBlock();
        return new FunctionExpression(spanFrom(funToken), parameters, body);
    }
}
