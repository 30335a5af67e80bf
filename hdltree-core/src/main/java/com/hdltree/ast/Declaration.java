package com.hdltree.ast;

/**
 * An item of a declarative part.
 */
public sealed interface Declaration extends Node permits
    UseClause,
    PackageDeclaration,
    PackageBody,
    PackageInstantiation,
    ConfigurationSpecification,
    SubprogramDeclaration,
    SubprogramBody,
    SubprogramInstantiation,
    TypeDeclaration,
    SubtypeDeclaration,
    ConstantDeclaration,
    SignalDeclaration,
    VariableDeclaration,
    FileDeclaration,
    AliasDeclaration,
    AttributeDeclaration,
    AttributeSpecification,
    ComponentDeclaration {
}
