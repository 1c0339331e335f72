package com.spectra.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.spectra.Keyword;
import com.spectra.Punctuation;
import com.spectra.RawToken;
import com.spectra.Token;

import java.io.IOException;

/**
 * Writes a token as {@code {"raw": {"kind": ..., "value": ...}, "location": {...}}}.
 */
public class TokenSerializer extends StdSerializer<Token> {

    public TokenSerializer() {
        super(Token.class);
    }

    @Override
    public void serialize(Token token, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName("raw");
        writeRaw(token.raw(), gen);
        gen.writeFieldName("location");
        provider.defaultSerializeValue(token.location(), gen);
        gen.writeEndObject();
    }

    private static void writeRaw(RawToken raw, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        if (raw instanceof Keyword keyword) {
            gen.writeStringField("kind", "keyword");
            gen.writeStringField("value", keyword.spelling());
        } else if (raw instanceof Punctuation punctuation) {
            gen.writeStringField("kind", "punctuation");
            gen.writeStringField("value", punctuation.symbol());
        } else if (raw instanceof RawToken.Identifier identifier) {
            gen.writeStringField("kind", "identifier");
            gen.writeStringField("value", identifier.name());
        } else if (raw instanceof RawToken.StringLiteral string) {
            gen.writeStringField("kind", "string");
            gen.writeStringField("value", string.value());
        } else if (raw instanceof RawToken.CharLiteral character) {
            gen.writeStringField("kind", "char");
            gen.writeStringField("value", Character.toString(character.codePoint()));
        } else if (raw instanceof RawToken.IntegerLiteral integer) {
            gen.writeStringField("kind", "integer");
            gen.writeFieldName("value");
            RawLiteralSerializer.writeUnsigned(gen, integer.value());
        } else if (raw instanceof RawToken.FloatLiteral number) {
            gen.writeStringField("kind", "float");
            gen.writeNumberField("value", number.value());
        } else if (raw instanceof RawToken.BoolLiteral bool) {
            gen.writeStringField("kind", "bool");
            gen.writeBooleanField("value", bool.value());
        } else if (raw instanceof RawToken.OversizedInteger oversized) {
            gen.writeStringField("kind", "oversizedInteger");
            gen.writeStringField("value", oversized.digits());
        } else if (raw instanceof RawToken.UnexpectedChar unexpected) {
            gen.writeStringField("kind", "unexpectedChar");
            gen.writeStringField("value", Character.toString(unexpected.codePoint()));
        }
        gen.writeEndObject();
    }
}
