package com.hdltree.extract;

import java.util.Locale;

public record PortRecord(String name, Direction direction, String type, String defaultValue) {

    public enum Direction {
        IN, OUT, INOUT, BUFFER;

        /**
         * @param mode declared mode, or null for the implicit {@code in}
         */
        public static Direction of(String mode) {
            return mode == null ? IN : valueOf(mode.toUpperCase(Locale.ROOT));
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
