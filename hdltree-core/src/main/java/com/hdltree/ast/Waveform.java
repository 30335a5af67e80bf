package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record Waveform(
    Span span,
    List<Token> tokens,
    List<WaveformElement> elements,
    boolean unaffected
) implements Node {
    @Override
    public String type() {
        return "Waveform";
    }
}
