package com.hdltree.extract;

/**
 * @param indication full subtype indication text
 * @param baseType   the type mark alone
 */
public record SubtypeRecord(String name, String indication, String baseType) {
}
