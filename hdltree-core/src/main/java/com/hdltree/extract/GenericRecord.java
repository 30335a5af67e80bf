package com.hdltree.extract;

/**
 * One generic. {@code category} is {@code constant}, {@code type}, {@code subprogram} or
 * {@code package}; only constants have a type and default text.
 */
public record GenericRecord(String name, String category, String type, String defaultValue) {
}
