package com.hdltree.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class HdlDialectTest {

    @Test
    @DisplayName("Dialect is recognized from the file extension, ignoring case")
    void testFromPath() {
        assertEquals(Optional.of(HdlDialect.VHDL), HdlDialect.fromPath(Path.of("rtl", "top.vhd")));
        assertEquals(Optional.of(HdlDialect.VHDL), HdlDialect.fromPath(Path.of("TOP.VHDL")));
        assertEquals(Optional.of(HdlDialect.VERILOG), HdlDialect.fromPath(Path.of("tb.sv")));
        assertEquals(Optional.of(HdlDialect.VERILOG), HdlDialect.fromPath(Path.of("core.v")));
    }

    @Test
    @DisplayName("Unknown or missing extensions have no dialect")
    void testUnknown() {
        assertTrue(HdlDialect.fromPath(Path.of("Makefile")).isEmpty());
        assertTrue(HdlDialect.fromPath(Path.of("notes.txt")).isEmpty());
        assertTrue(HdlDialect.fromPath(Path.of("/")).isEmpty());
    }
}
