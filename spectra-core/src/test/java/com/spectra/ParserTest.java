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
import com.spectra.ast.VarStatement;
import com.spectra.ast.WhileStatement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Expression expression(String source) {
        Module module = Parser.parse(source);
        assertEquals(1, module.statements().size(), "statements in " + source);
        ExpressionStatement statement = assertInstanceOf(ExpressionStatement.class, module.statements().get(0));
        return statement.expression();
    }

    private static Statement statement(String source) {
        Module module = Parser.parse(source);
        assertEquals(1, module.statements().size(), "statements in " + source);
        return module.statements().get(0);
    }

    private static ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> Parser.parse(source), source);
    }

    private static String symbol(Token operator) {
        return ((Punctuation) operator.raw()).symbol();
    }

    // S-expression rendering so tree shapes can be compared as strings
    private static String render(Expression expression) {
        if (expression instanceof Identifier identifier) {
            return identifier.name();
        } else if (expression instanceof Literal literal) {
            RawLiteral raw = literal.raw();
            if (raw instanceof RawLiteral.IntegerValue value) {
                return Long.toUnsignedString(value.value());
            } else if (raw instanceof RawLiteral.BoolValue value) {
                return Boolean.toString(value.value());
            } else if (raw instanceof RawLiteral.StringValue value) {
                return "\"" + value.value() + "\"";
            } else if (raw instanceof RawLiteral.CharValue value) {
                return "'" + Character.toString(value.codePoint()) + "'";
            }
            return raw.toString();
        } else if (expression instanceof BinaryExpression binary) {
            return "(" + symbol(binary.operator()) + " " + render(binary.left()) + " " + render(binary.right()) + ")";
        } else if (expression instanceof PrefixExpression prefix) {
            return "(prefix " + symbol(prefix.operator()) + " " + render(prefix.right()) + ")";
        } else if (expression instanceof PostfixExpression postfix) {
            return "(postfix " + symbol(postfix.operator()) + " " + render(postfix.left()) + ")";
        } else if (expression instanceof FieldAccessExpression access) {
            return "(. " + render(access.left()) + " " + access.field().name() + ")";
        } else if (expression instanceof CallExpression call) {
            String arguments = call.arguments().stream().map(a -> " " + render(a)).collect(Collectors.joining());
            return "(call " + render(call.callee()) + arguments + ")";
        } else if (expression instanceof FunctionExpression function) {
            String parameters = function.parameters().stream().map(Identifier::name).collect(Collectors.joining(" "));
            return "(fun (" + parameters + ") " + function.body().statements().size() + ")";
        }
        throw new AssertionError("Unhandled expression " + expression);
    }

    private static String rendered(String source) {
        return render(expression(source));
    }

    // ========================================================================
    // Precedence climbing
    // ========================================================================

    @Test
    @DisplayName("Equal-precedence operators fold to the left")
    void leftAssociativity() {
        assertEquals("(- (+ a b) c)", rendered("a + b - c;"));
        assertEquals("(/ (* a b) c)", rendered("a * b / c;"));
    }

    @Test
    @DisplayName("Higher-precedence operators bind tighter")
    void mixedPrecedence() {
        assertEquals("(+ a (* b c))", rendered("a + b * c;"));
        assertEquals("(+ (* a b) c)", rendered("a * b + c;"));
        assertEquals("(- (+ a (/ b c)) d)", rendered("a + b / c - d;"));
    }

    @Test
    void parenthesesOverridePrecedence() {
        assertEquals("(* (+ a b) c)", rendered("(a + b) * c;"));
    }

    @Test
    void powerIsRightAssociativeAndBindsTighterThanProduct() {
        assertEquals("(** a (** b c))", rendered("a ** b ** c;"));
        assertEquals("(* (** a b) c)", rendered("a ** b * c;"));
    }

    @Test
    void assignmentIsRightAssociativeAndBindsLoosest() {
        assertEquals("(= a (= b 1))", rendered("a = b = 1;"));
        assertEquals("(+= x (* y 2))", rendered("x += y * 2;"));
        assertEquals("(= (. a b) (call f))", rendered("a.b = f();"));
    }

    @Test
    void prefixOperators() {
        assertEquals("(* (prefix - a) b)", rendered("-a * b;"));
        assertEquals("(prefix - (** a b))", rendered("-a ** b;"));
        assertEquals("(prefix ++ (. a b))", rendered("++a.b;"));
        assertEquals("(+ (prefix + 1) (prefix - (prefix - 2)))", rendered("+1 + - -2;"));
    }

    @Test
    void postfixOperators() {
        assertEquals("(postfix ++ i)", rendered("i++;"));
        assertEquals("(postfix -- (. a b))", rendered("a.b--;"));
    }

    @Test
    void fieldAccessAndCalls() {
        assertEquals("(call (. (. a b) c) 1 x)", rendered("a.b.c(1, x);"));
        assertEquals("(call (call f a) b)", rendered("f(a)(b);"));
        assertEquals("(+ (call f) (. g h))", rendered("f() + g.h;"));
    }

    @Test
    void callArgumentsAllowTrailingComma() {
        assertEquals("(call f 1 2)", rendered("f(1, 2,);"));
    }

    @Test
    void callWithoutArguments() {
        CallExpression call = assertInstanceOf(CallExpression.class, expression("a();"));
        assertTrue(call.arguments().isEmpty());
        assertEquals(new Location(0, 3), call.location());
        assertEquals(new Identifier(new Location(0, 1), "a"), call.callee());
    }

    @Test
    void callArgumentsMustBeCommaSeparated() {
        ParseException e = parseError("f(1 2);");
        assertEquals("`)`", e.expected());
        assertEquals(Optional.of(new Token(new RawToken.IntegerLiteral(2), new Location(4, 5))), e.got());
    }

    // ========================================================================
    // Primary expressions
    // ========================================================================

    @Test
    void boolLiterals() {
        assertEquals(new Literal(new Location(0, 4), new RawLiteral.BoolValue(true)), expression("true;"));
        assertEquals(new Literal(new Location(0, 5), new RawLiteral.BoolValue(false)), expression("false;"));
    }

    @Test
    void otherLiterals() {
        assertEquals(new Literal(new Location(0, 2), new RawLiteral.IntegerValue(42)), expression("42;"));
        assertEquals(new Literal(new Location(0, 4), new RawLiteral.StringValue("hi")), expression("\"hi\";"));
        assertEquals(new Literal(new Location(0, 3), new RawLiteral.CharValue('c')), expression("'c';"));
    }

    @Test
    void functionLiteral() {
        VarStatement var = assertInstanceOf(VarStatement.class, statement("var add = fun(a, b) { return a + b; };"));
        FunctionExpression function = assertInstanceOf(FunctionExpression.class, var.initializer());

        assertEquals(List.of("a", "b"), function.parameters().stream().map(Identifier::name).toList());
        assertEquals(new Location(10, 37), function.location());
        assertEquals(new Location(20, 37), function.body().location());
        assertEquals(new Location(0, 38), var.location());

        ReturnStatement ret = assertInstanceOf(ReturnStatement.class, function.body().statements().get(0));
        assertEquals("(+ a b)", render(ret.value()));
    }

    @Test
    void functionLiteralWithoutParametersCanBeCalledImmediately() {
        assertEquals("(call (fun () 0))", rendered("fun() {}();"));
    }

    @Test
    void functionParametersMustBeIdentifiers() {
        ParseException e = parseError("fun(1) {};");
        assertEquals("identifier", e.expected());
        assertEquals(new RawToken.IntegerLiteral(1), e.got().orElseThrow().raw());

        assertEquals("`)`", parseError("fun(a b) {};").expected());
    }

    @Test
    void reservedKeywordIsNotAnExpression() {
        ParseException e = parseError("class;");
        assertEquals("expression", e.expected());
        assertEquals(Keyword.CLASS, e.got().orElseThrow().raw());
    }

    @Test
    @DisplayName("`1.5` is an integer followed by field access, which needs an identifier")
    void floatLiteralsAreNotSupported() {
        ParseException e = parseError("1.5;");
        assertEquals("identifier", e.expected());
        assertEquals(new RawToken.IntegerLiteral(5), e.got().orElseThrow().raw());
    }

    @Test
    void oversizedIntegerIsRejected() {
        ParseException e = parseError("99999999999999999999;");
        assertEquals("expression", e.expected());
        assertEquals(new RawToken.OversizedInteger("99999999999999999999"), e.got().orElseThrow().raw());
    }

    // ========================================================================
    // Locations
    // ========================================================================

    @Test
    @DisplayName("Without enclosing parentheses an expression spans its first through its last token")
    void expressionLocationsSpanTheirTokens() {
        for (String source : List.of("a + b * c", "f(x)(y)", "-a.b", "f((a))", "a.b((c))",
                "fun(a) { return a; }", "x = y += 1", "i++ + 2")) {
            List<Token> tokens = Lexer.tokenize(source);
            Expression expression = expression(source + ";");
            assertEquals(tokens.get(0).location().start(), expression.location().start(), source);
            assertEquals(tokens.get(tokens.size() - 1).location().end(), expression.location().end(), source);
        }
    }

    @Test
    @DisplayName("Parentheses are not part of any span")
    void parenthesesAreNotPartOfSpans() {
        assertEquals(new Location(1, 2), expression("(a);").location());
        assertEquals(new Location(1, 6), expression("(a + b);").location());
        assertEquals(new Location(2, 3), expression("((a));").location());

        BinaryExpression product = assertInstanceOf(BinaryExpression.class, expression("(a + b) * c;"));
        assertEquals(new Location(1, 11), product.location());
        assertEquals(new Location(1, 6), product.left().location());

        BinaryExpression sum = assertInstanceOf(BinaryExpression.class, expression("a + (b);"));
        assertEquals(new Location(0, 6), sum.location());
        assertEquals(new Location(5, 6), sum.right().location());

        assertEquals(new Location(0, 3), expression("-(a);").location());
    }

    @Test
    @DisplayName("A composite expression spans its leftmost child through its rightmost child or closing token")
    void compositeSpansFollowTheirChildren() {
        for (String source : List.of("(a + b) * c", "a + (b)", "a ** (b + c)", "f((a), (b + c))",
                "((a)).b++", "-(a) * (b)", "x = (y) = (1)", "(f)(g.h)(i)--")) {
            assertSpansFollowChildren(expression(source + ";"), source);
        }
    }

    private static void assertSpansFollowChildren(Expression expression, String source) {
        Location location = expression.location();
        if (expression instanceof BinaryExpression binary) {
            assertEquals(binary.left().location().start(), location.start(), source);
            assertEquals(binary.right().location().end(), location.end(), source);
            assertSpansFollowChildren(binary.left(), source);
            assertSpansFollowChildren(binary.right(), source);
        } else if (expression instanceof PrefixExpression prefix) {
            assertEquals(prefix.operator().location().start(), location.start(), source);
            assertEquals(prefix.right().location().end(), location.end(), source);
            assertSpansFollowChildren(prefix.right(), source);
        } else if (expression instanceof PostfixExpression postfix) {
            assertEquals(postfix.left().location().start(), location.start(), source);
            assertEquals(postfix.operator().location().end(), location.end(), source);
            assertSpansFollowChildren(postfix.left(), source);
        } else if (expression instanceof FieldAccessExpression access) {
            assertEquals(access.left().location().start(), location.start(), source);
            assertEquals(access.field().location().end(), location.end(), source);
            assertSpansFollowChildren(access.left(), source);
        } else if (expression instanceof CallExpression call) {
            assertEquals(call.callee().location().start(), location.start(), source);
            // ends at the closing parenthesis, past the last argument
            for (Expression argument : call.arguments()) {
                assertTrue(argument.location().end() < location.end(), source);
                assertSpansFollowChildren(argument, source);
            }
            assertSpansFollowChildren(call.callee(), source);
        }
    }

    @Test
    void moduleSpansTheWholeSource() {
        Module module = Parser.parse("a; b;  ");
        assertEquals(2, module.statements().size());
        assertEquals(new Location(0, 7), module.location());
        assertEquals(new Location(3, 5), module.statements().get(1).location());
    }

    @Test
    void emptyModule() {
        Module module = Parser.parse("   ");
        assertTrue(module.statements().isEmpty());
        assertEquals(new Location(0, 3), module.location());
    }

    // ========================================================================
    // Statements
    // ========================================================================

    @Test
    void varStatement() {
        VarStatement var = assertInstanceOf(VarStatement.class, statement("var x = 5;"));
        assertEquals(new Location(0, 10), var.location());
        assertEquals(new Identifier(new Location(4, 5), "x"), var.name());
        assertEquals(new Literal(new Location(8, 9), new RawLiteral.IntegerValue(5)), var.initializer());
    }

    @Test
    void varWithoutEqualsSign() {
        ParseException e = parseError("var x 5;");
        assertEquals("`=`", e.expected());
        assertEquals(Optional.of(new Token(new RawToken.IntegerLiteral(5), new Location(6, 7))), e.got());
        assertEquals("expected `=`, got 5", e.getMessage());
        assertEquals(new Location(6, 7), e.location());
    }

    @Test
    void varNeedsAName() {
        assertEquals("identifier", parseError("var = 1;").expected());
    }

    @Test
    void returnStatement() {
        ReturnStatement ret = assertInstanceOf(ReturnStatement.class, statement("return a * 2;"));
        assertEquals(new Location(0, 13), ret.location());
        assertEquals("(* a 2)", render(ret.value()));
    }

    @Test
    void returnRequiresAValue() {
        ParseException e = parseError("return;");
        assertEquals("expression", e.expected());
        assertEquals(Punctuation.SEMICOLON, e.got().orElseThrow().raw());
    }

    @Test
    void breakAndContinue() {
        assertEquals(new BreakStatement(new Location(0, 6)), statement("break;"));
        assertEquals(new ContinueStatement(new Location(0, 10)), statement("continue ;"));
        assertEquals("`;`", parseError("break").expected());
    }

    @Test
    void whileStatement() {
        WhileStatement loop = assertInstanceOf(WhileStatement.class, statement("while (x) { break; continue; }"));
        assertEquals("x", render(loop.condition()));
        assertEquals(2, loop.body().statements().size());
        assertEquals(new Location(0, 30), loop.location());
    }

    @Test
    void ifElseChain() {
        IfStatement first = assertInstanceOf(IfStatement.class,
            statement("if (a) { b; } else if (c) { d; } else { e; }"));
        assertEquals("a", render(first.condition()));
        assertEquals(1, first.consequent().statements().size());

        IfStatement second = assertInstanceOf(IfStatement.class, first.alternate());
        assertEquals(new Location(19, 44), second.location());
        BlockStatement last = assertInstanceOf(BlockStatement.class, second.alternate());
        assertEquals(new Location(38, 44), last.location());
        assertEquals(new Location(0, 44), first.location());
    }

    @Test
    void ifWithoutElse() {
        IfStatement statement = assertInstanceOf(IfStatement.class, statement("if (a) { }"));
        assertNull(statement.alternate());
        assertTrue(statement.consequent().statements().isEmpty());
    }

    @Test
    void nestedBlocks() {
        BlockStatement outer = assertInstanceOf(BlockStatement.class, statement("{ a; { b; } }"));
        assertEquals(new Location(0, 13), outer.location());
        assertInstanceOf(BlockStatement.class, outer.block().statements().get(1));
    }

    @Test
    void expressionStatementSpansThroughSemicolon() {
        ExpressionStatement statement = assertInstanceOf(ExpressionStatement.class, statement("(a);"));
        assertEquals(new Location(1, 4), statement.location());
        assertEquals(new Location(1, 2), statement.expression().location());
    }

    // ========================================================================
    // Errors
    // ========================================================================

    @Test
    void unclosedParenthesisAtEndOfInput() {
        ParseException grouped = parseError("(a");
        assertEquals("`)`", grouped.expected());
        assertEquals(Optional.empty(), grouped.got());
        assertNull(grouped.location());
        assertEquals("expected `)`, got end of input", grouped.getMessage());

        ParseException call = parseError("f(");
        assertEquals("`)`", call.expected());
        assertEquals(Optional.empty(), call.got());
    }

    @Test
    void loneParenthesisNeedsAnExpression() {
        ParseException e = parseError("(");
        assertEquals("expression", e.expected());
        assertEquals(Optional.empty(), e.got());
    }

    @Test
    void missingSemicolon() {
        ParseException e = parseError("a + b");
        assertEquals("`;`", e.expected());
        assertTrue(e.got().isEmpty());
    }

    @Test
    void missingClosingBrace() {
        ParseException e = parseError("{ a;");
        assertEquals("`}`", e.expected());
        assertTrue(e.got().isEmpty());
    }

    @Test
    @DisplayName("Unexpected characters reach the parser as tokens and fail there")
    void unexpectedCharacter() {
        ParseException e = parseError("a # b;");
        assertEquals("`;`", e.expected());
        assertEquals(new Token(new RawToken.UnexpectedChar('#'), new Location(2, 3)), e.got().orElseThrow());
        assertEquals("expected `;`, got invalid token `#`", e.getMessage());
    }

    @Test
    void firstErrorAbortsTheWholeParse() {
        ParseException e = parseError("a; var 1 = 2; b;");
        assertEquals("identifier", e.expected());
        assertEquals(new Location(7, 8), e.location());
    }

    @Test
    void statementParserReportsEndOfInput() {
        Parser parser = new Parser("");
        ParseException e = assertThrows(ParseException.class, parser::parseStatement);
        assertEquals("statement", e.expected());
    }

    @Test
    void expressionParserCanBeUsedDirectly() {
        Parser parser = new Parser("a + b * c");
        assertEquals("(+ a (* b c))", render(parser.parseExpression(Precedence.LOWEST)));

        Parser higher = new Parser("a + b * c");
        assertEquals("a", render(higher.parseExpression(Precedence.SUM)));
    }
}
