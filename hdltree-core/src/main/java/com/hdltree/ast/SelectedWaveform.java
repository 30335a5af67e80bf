package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SelectedWaveform(
    Span span,
    List<Token> tokens,
    Waveform waveform,
    List<Expression> choices
) implements Node {
    @Override
    public String type() {
        return "SelectedWaveform";
    }
}
