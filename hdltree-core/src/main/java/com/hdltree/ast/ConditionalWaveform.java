package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record ConditionalWaveform(
    Span span,
    List<Token> tokens,
    Waveform waveform,
    Expression condition
) implements Node {
    @Override
    public String type() {
        return "ConditionalWaveform";
    }
}
