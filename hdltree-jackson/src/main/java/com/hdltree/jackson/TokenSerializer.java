package com.hdltree.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.hdltree.Span;
import com.hdltree.Token;

import java.io.IOException;

/**
 * Writes a token as one flat array instead of a nested object, since every node carries
 * its keyword and punctuation tokens:
 * {@code [kind, lexeme, leading, start, end, line, column, endLine, endColumn]}.
 */
public class TokenSerializer extends JsonSerializer<Token> {
    @Override
    public void serialize(Token token, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        Span span = token.span();
        gen.writeStartArray();
        gen.writeString(token.type().name());
        gen.writeString(token.lexeme());
        gen.writeString(token.leading());
        gen.writeNumber(span.start());
        gen.writeNumber(span.end());
        gen.writeNumber(span.line());
        gen.writeNumber(span.column());
        gen.writeNumber(span.endLine());
        gen.writeNumber(span.endColumn());
        gen.writeEndArray();
    }
}
