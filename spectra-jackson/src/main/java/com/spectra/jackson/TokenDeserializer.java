package com.spectra.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.spectra.Keyword;
import com.spectra.Location;
import com.spectra.Punctuation;
import com.spectra.RawToken;
import com.spectra.Token;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads the form written by {@link TokenSerializer}.
 */
public class TokenDeserializer extends StdDeserializer<Token> {

    public TokenDeserializer() {
        super(Token.class);
    }

    @Override
    public Token deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        JsonNode raw = node.get("raw");
        JsonNode location = node.get("location");
        if (raw == null || location == null) {
            return ctxt.reportInputMismatch(this, "Token requires 'raw' and 'location', got %s", node);
        }
        return new Token(readRaw(raw, ctxt), ctxt.readTreeAsValue(location, Location.class));
    }

    private RawToken readRaw(JsonNode raw, DeserializationContext ctxt) throws IOException {
        String kind = raw.path("kind").asText();
        JsonNode value = raw.path("value");

        switch (kind) {
            case "keyword": {
                Optional<Keyword> keyword = Keyword.fromSpelling(value.asText());
                if (keyword.isEmpty()) {
                    return ctxt.reportInputMismatch(this, "Unknown keyword %s", value);
                }
                return keyword.get();
            }
            case "punctuation": {
                Optional<Punctuation> punctuation = Punctuation.fromSymbol(value.asText());
                if (punctuation.isEmpty()) {
                    return ctxt.reportInputMismatch(this, "Unknown punctuation %s", value);
                }
                return punctuation.get();
            }
            case "identifier":
                return new RawToken.Identifier(value.asText());
            case "string":
                return new RawToken.StringLiteral(value.asText());
            case "char":
                return new RawToken.CharLiteral(RawLiteralDeserializer.readCodePoint(value, this, ctxt));
            case "integer":
                return new RawToken.IntegerLiteral(RawLiteralDeserializer.readUnsigned(value, this, ctxt));
            case "float":
                return new RawToken.FloatLiteral(value.asDouble());
            case "bool":
                return new RawToken.BoolLiteral(value.asBoolean());
            case "oversizedInteger":
                return new RawToken.OversizedInteger(value.asText());
            case "unexpectedChar":
                return new RawToken.UnexpectedChar(RawLiteralDeserializer.readCodePoint(value, this, ctxt));
            default:
                return ctxt.reportInputMismatch(this, "Unknown token kind '%s'", kind);
        }
    }
}
