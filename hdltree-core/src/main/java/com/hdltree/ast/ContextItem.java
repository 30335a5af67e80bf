package com.hdltree.ast;

/**
 * An item of a context clause.
 */
public sealed interface ContextItem extends Node permits
    LibraryClause,
    UseClause,
    ContextReference {
}
