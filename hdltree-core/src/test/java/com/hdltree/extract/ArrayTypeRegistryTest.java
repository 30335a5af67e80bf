package com.hdltree.extract;

import com.hdltree.Samples;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ArrayTypeRegistryTest {

    @Test
    @DisplayName("Standard vector types are known, with or without a library prefix")
    void testStandardTypes() {
        ArrayTypeRegistry registry = new ArrayTypeRegistry();
        assertTrue(registry.isArray("std_logic_vector"));
        assertTrue(registry.isArray("ieee.numeric_std.UNSIGNED"));
        assertFalse(registry.isArray("std_ulogic"));
        assertFalse(registry.isArray(null));
    }

    @Test
    @DisplayName("Constrained port types are classified by their type mark")
    void testConstrainedPortTypes() {
        DeclarationRecord entity = new VhdlDeclarationParser()
            .parseDeclarations(Samples.load(Samples.DEMO_DEVICE)).records().get(0);
        ArrayTypeRegistry registry = new ArrayTypeRegistry();

        assertTrue(registry.isArray(entity.port("Data_in").type()));
        assertTrue(registry.isArray(entity.port("Data_out").type()));
        assertFalse(registry.isArray(entity.port("Clock").type()));
        assertTrue(registry.isArray("ieee.numeric_std.signed (15 downto 0)"));
        assertFalse(registry.isArray("integer range 0 to 7"));
        assertTrue(registry.isArray("(resolved) std_ulogic_vector(3 downto 0)"));
        assertTrue(registry.isArray("resolved std_logic_vector"));
    }

    @Test
    @DisplayName("Array types and subtypes of arrays are learned from a package")
    void testRegister() {
        ArrayTypeRegistry registry = new ArrayTypeRegistry();
        registry.register(new VhdlDeclarationParser().parseDeclarations(Samples.load(Samples.DEMO_PACKAGE)));

        assertTrue(registry.isArray("word_array"));
        assertTrue(registry.isArray("byte"));
        assertTrue(registry.isArray("OCTET"));
        assertFalse(registry.isArray("state_t"));
        assertTrue(registry.arrayTypes().contains("word_array"));
    }

    @Test
    @DisplayName("Cyclic subtype chains terminate")
    void testSubtypeCycle() {
        DeclarationRecord pkg = new DeclarationRecord(DeclarationRecord.Kind.PACKAGE, "p", "work", false, null,
            List.of(), List.of(), List.of(),
            List.of(new SubtypeRecord("a", "b", "b"), new SubtypeRecord("b", "a", "a")),
            List.of(), List.of(), null);
        ArrayTypeRegistry registry = new ArrayTypeRegistry();
        registry.register(new ExtractionResult(List.of(pkg), List.of()));
        assertFalse(registry.isArray("a"));
        assertFalse(registry.isArray("b"));
    }

    @Test
    @DisplayName("Saved names load into a fresh registry")
    void testSaveAndLoad(@TempDir Path dir) {
        Path file = dir.resolve("arrays.txt");
        ArrayTypeRegistry registry = new ArrayTypeRegistry();
        registry.add("Bus_T");
        registry.save(file);

        ArrayTypeRegistry loaded = new ArrayTypeRegistry();
        assertFalse(loaded.isArray("bus_t"));
        loaded.load(file);
        assertTrue(loaded.isArray("BUS_T"));
        assertEquals(registry.arrayTypes(), loaded.arrayTypes());
    }
}
