package com.hdltree.ast;

/**
 * Names are expressions; declarations decide what they denote, and none are resolved here.
 */
public sealed interface Name extends Expression permits
    SimpleName,
    SelectedName,
    IndexedName,
    SliceName,
    AttributeName,
    ExternalName {
}
