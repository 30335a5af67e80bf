package com.hdltree.ast;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.List;

/**
 * Base interface for all VHDL AST nodes.
 *
 * Every node keeps the keyword and punctuation tokens it consumed directly; tokens of child
 * nodes live on the children. Together they account for every token of the source exactly once.
 */
public sealed interface Node permits
    ContextItem,
    LibraryUnit,
    Declaration,
    InterfaceElement,
    ConcurrentStatement,
    SequentialStatement,
    Expression,
    DiscreteRange,
    TypeDefinition,
    Constraint,
    DesignFile,
    DesignUnit,
    BlockConfiguration,
    ComponentConfiguration,
    BindingIndication,
    EntityAspect,
    GenericClause,
    PortClause,
    GenericMapAspect,
    PortMapAspect,
    AssociationElement,
    SubprogramSpecification,
    SubprogramHeader,
    Signature,
    SecondaryUnit,
    UnboundedRange,
    ElementDeclaration,
    Identifier,
    ElementAssociation,
    DelayMechanism,
    Waveform,
    WaveformElement,
    ConditionalWaveform,
    SelectedWaveform,
    GenerateBranch,
    GenerateBody,
    ConditionalValue,
    IfBranch,
    CaseAlternative {

    String type();
    Span span();
    List<Token> tokens();
}
