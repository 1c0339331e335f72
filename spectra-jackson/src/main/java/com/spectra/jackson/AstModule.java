package com.spectra.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.spectra.Token;
import com.spectra.ast.Expression;
import com.spectra.ast.IfStatement;
import com.spectra.ast.Module;
import com.spectra.ast.Node;
import com.spectra.ast.RawLiteral;
import com.spectra.ast.Statement;
import com.spectra.ast.StatementsBlock;
import com.spectra.jackson.mixins.NodeMixin;

/**
 * Jackson module that configures serialization/deserialization for the AST classes.
 *
 * This module handles:
 * - Polymorphic node types via the "type" property (NodeMixin)
 * - Tokens and literal payloads, which are not beans
 * - Null fields that must still be written
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.spectra", "spectra-jackson"));

        addSerializer(Token.class, new TokenSerializer());
        addDeserializer(Token.class, new TokenDeserializer());
        // Registered for the interface so every RawLiteral record is covered
        addSerializer(RawLiteral.class, new RawLiteralSerializer());
        addDeserializer(RawLiteral.class, new RawLiteralDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        // Deserialized directly as root or block types, not only through an interface
        context.setMixInAnnotations(Module.class, NodeMixin.class);
        context.setMixInAnnotations(StatementsBlock.class, NodeMixin.class);

        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
    }

    // IfStatement - alternate is written even when null
    private abstract static class IfStatementMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement alternate();
    }
}
