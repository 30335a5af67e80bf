package com.hdltree;

/**
 * A syntactically valid construct that the AST or the extractor does not model.
 *
 * @param kind   short name of the construct, e.g. {@code component_declaration}
 * @param span   where it appears
 * @param reason why it was dropped
 */
public record UnsupportedConstruct(String kind, Span span, String reason) {

    @Override
    public String toString() {
        return kind + " at " + span.position() + ": " + reason;
    }
}
