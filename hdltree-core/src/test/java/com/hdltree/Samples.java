package com.hdltree;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * VHDL sources shared by the tests, loaded from {@code src/test/resources/samples}.
 */
public final class Samples {

    public static final String DEMO_DEVICE = "demo_device_comp.vhd";
    public static final String DEMO_PACKAGE = "demo_pkg.vhd";

    private Samples() {
    }

    public static String load(String name) {
        try (InputStream in = Samples.class.getResourceAsStream("/samples/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No sample named " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
