package com.hdltree.extract;

/**
 * @param value null for a deferred constant
 */
public record ConstantRecord(String name, String type, String value) {
}
