package com.spectra.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.spectra.ast.BinaryExpression;
import com.spectra.ast.BlockStatement;
import com.spectra.ast.BreakStatement;
import com.spectra.ast.CallExpression;
import com.spectra.ast.ContinueStatement;
import com.spectra.ast.ExpressionStatement;
import com.spectra.ast.FieldAccessExpression;
import com.spectra.ast.FunctionExpression;
import com.spectra.ast.Identifier;
import com.spectra.ast.IfStatement;
import com.spectra.ast.Literal;
import com.spectra.ast.Module;
import com.spectra.ast.PostfixExpression;
import com.spectra.ast.PrefixExpression;
import com.spectra.ast.ReturnStatement;
import com.spectra.ast.StatementsBlock;
import com.spectra.ast.VarStatement;
import com.spectra.ast.WhileStatement;

/**
 * Polymorphic type handling for AST nodes: every node is written with a {@code "type"}
 * property naming its class, and read back through that name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Module.class, name = "Module"),
    @JsonSubTypes.Type(value = StatementsBlock.class, name = "StatementsBlock"),

    // Statements
    @JsonSubTypes.Type(value = ExpressionStatement.class, name = "ExpressionStatement"),
    @JsonSubTypes.Type(value = ReturnStatement.class, name = "ReturnStatement"),
    @JsonSubTypes.Type(value = BreakStatement.class, name = "BreakStatement"),
    @JsonSubTypes.Type(value = ContinueStatement.class, name = "ContinueStatement"),
    @JsonSubTypes.Type(value = VarStatement.class, name = "VarStatement"),
    @JsonSubTypes.Type(value = BlockStatement.class, name = "BlockStatement"),
    @JsonSubTypes.Type(value = IfStatement.class, name = "IfStatement"),
    @JsonSubTypes.Type(value = WhileStatement.class, name = "WhileStatement"),

    // Expressions
    @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = BinaryExpression.class, name = "BinaryExpression"),
    @JsonSubTypes.Type(value = PostfixExpression.class, name = "PostfixExpression"),
    @JsonSubTypes.Type(value = PrefixExpression.class, name = "PrefixExpression"),
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = CallExpression.class, name = "CallExpression"),
    @JsonSubTypes.Type(value = FieldAccessExpression.class, name = "FieldAccessExpression"),
    @JsonSubTypes.Type(value = FunctionExpression.class, name = "FunctionExpression")
})
public abstract class NodeMixin {
}
