package com.hdltree.ast;

/**
 * A primary or secondary design unit.
 */
public sealed interface LibraryUnit extends Node permits
    EntityDeclaration,
    ArchitectureBody,
    PackageDeclaration,
    PackageBody,
    PackageInstantiation,
    ContextDeclaration,
    ConfigurationDeclaration {
}
