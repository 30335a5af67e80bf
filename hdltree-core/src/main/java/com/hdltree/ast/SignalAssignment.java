package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

public record SignalAssignment(
    Span span,
    List<Token> tokens,
    Identifier label,
    String kind,  // "simple" | "conditional" | "selected"
    boolean postponed,
    boolean guarded,
    Expression selector,
    boolean matching,
    Expression target,
    DelayMechanism delay,
    List<Node> waveforms  // Waveform, ConditionalWaveform or SelectedWaveform
) implements ConcurrentStatement, SequentialStatement {
    @Override
    public String type() {
        return "SignalAssignment";
    }
}
