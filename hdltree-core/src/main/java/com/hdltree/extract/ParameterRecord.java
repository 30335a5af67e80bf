package com.hdltree.extract;

/**
 * A subprogram parameter. {@code objectClass} is null when the class is implicit; {@code mode}
 * is always present and defaults to {@code in}.
 */
public record ParameterRecord(String name, String objectClass, String mode, String type, String defaultValue) {

    /**
     * {@code name : mode type := default}
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" : ");
        if (mode != null) {
            sb.append(mode).append(' ');
        }
        sb.append(type);
        if (defaultValue != null) {
            sb.append(" := ").append(defaultValue);
        }
        return sb.toString();
    }
}
