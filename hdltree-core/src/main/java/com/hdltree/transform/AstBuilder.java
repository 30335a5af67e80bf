package com.hdltree.transform;

/**
 * Builds the AST value for one parse-tree node from its already-built children.
 */
@FunctionalInterface
interface AstBuilder {
    Object build(Children children);
}
