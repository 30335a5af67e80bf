package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SubprogramBody(
    Span span,
    List<Token> tokens,
    SubprogramSpecification specification,
    List<Declaration> declarations,
    List<SequentialStatement> statements,
    Identifier endName
) implements Declaration {
    @Override
    public String type() {
        return "SubprogramBody";
    }
}
