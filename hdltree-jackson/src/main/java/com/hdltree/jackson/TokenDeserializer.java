package com.hdltree.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.hdltree.Span;
import com.hdltree.Token;
import com.hdltree.TokenType;

import java.io.IOException;

/**
 * Reads the array form written by {@link TokenSerializer}.
 */
public class TokenDeserializer extends JsonDeserializer<Token> {
    @Override
    public Token deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        if (node == null || !node.isArray() || node.size() != 9) {
            return (Token) ctxt.handleUnexpectedToken(Token.class, p);
        }
        TokenType type;
        try {
            type = TokenType.valueOf(node.get(0).asText());
        } catch (IllegalArgumentException e) {
            return (Token) ctxt.handleWeirdStringValue(Token.class, node.get(0).asText(), "unknown token kind");
        }
        Span span = new Span(node.get(3).asInt(), node.get(4).asInt(), node.get(5).asInt(),
            node.get(6).asInt(), node.get(7).asInt(), node.get(8).asInt());
        return new Token(type, node.get(1).asText(), node.get(2).asText(), span);
    }
}
