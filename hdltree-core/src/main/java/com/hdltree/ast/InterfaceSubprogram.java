package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record InterfaceSubprogram(
    Span span,
    List<Token> tokens,
    SubprogramSpecification specification,
    Name defaultName,
    boolean boxDefault
) implements InterfaceElement {
    @Override
    public String type() {
        return "InterfaceSubprogram";
    }
}
