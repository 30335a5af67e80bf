package com.hdltree.ast;

public sealed interface TypeDefinition extends Node permits
    EnumerationTypeDefinition,
    RangeTypeDefinition,
    PhysicalTypeDefinition,
    ArrayTypeDefinition,
    RecordTypeDefinition,
    AccessTypeDefinition,
    FileTypeDefinition,
    ProtectedTypeDeclaration,
    ProtectedTypeBody {
}
