package com.hdltree.extract;

/**
 * @param category   {@code enumeration}, {@code range}, {@code physical}, {@code array},
 *                   {@code record}, {@code access}, {@code file}, {@code protected},
 *                   {@code protected_body} or {@code incomplete}
 * @param definition normalized definition text, null for an incomplete declaration
 */
public record TypeRecord(String name, String category, String definition) {
}
