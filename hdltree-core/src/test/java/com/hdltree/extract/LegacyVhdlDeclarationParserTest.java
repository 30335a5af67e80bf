package com.hdltree.extract;

import com.hdltree.Samples;
import com.hdltree.VhdlParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LegacyVhdlDeclarationParserTest {

    private final LegacyVhdlDeclarationParser legacy = new LegacyVhdlDeclarationParser();

    private static DeclarationRecord withoutSpan(DeclarationRecord r) {
        return new DeclarationRecord(r.kind(), r.name(), r.library(), r.body(), r.container(), r.generics(),
            r.ports(), r.types(), r.subtypes(), r.constants(), r.subprograms(), null);
    }

    @Test
    @DisplayName("Legacy parser is a named VHDL fallback")
    void testIdentity() {
        assertEquals("legacy", legacy.getName());
        assertEquals(HdlDialect.VHDL, legacy.dialect());
        assertTrue(legacy.isFallback());
    }

    @Test
    @DisplayName("demo_device_comp entity: 2 generics and 5 ports with normalized types")
    void testDemoDevice() {
        ExtractionResult result = legacy.parseDeclarations(Samples.load(Samples.DEMO_DEVICE));

        assertEquals(1, result.records().size());
        DeclarationRecord entity = result.records().get(0);
        assertEquals(DeclarationRecord.Kind.ENTITY, entity.kind());
        assertEquals("demo_device_comp", entity.name());
        assertEquals("work", entity.library());
        assertEquals(List.of(
            new GenericRecord("SIZE", "constant", "positive", null),
            new GenericRecord("RESET_ACTIVE_LEVEL", "constant", "std_ulogic", "'1'")), entity.generics());
        assertEquals(5, entity.ports().size());
        assertEquals(new PortRecord("Data_out", PortRecord.Direction.OUT,
            "std_ulogic_vector(SIZE-1 downto 0)", null), entity.ports().get(4));
        assertEquals(5, entity.span().line());
    }

    @Test
    @DisplayName("Entity records agree with the grammar based extraction")
    void testAgreesWithGrammar() {
        String source = Samples.load(Samples.DEMO_DEVICE);
        DeclarationRecord fromGrammar = new DeclarationExtractor().extract(new VhdlParser().parse(source))
            .records().get(0);
        DeclarationRecord fromLegacy = legacy.parseDeclarations(source).records().get(0);
        assertEquals(withoutSpan(fromGrammar), withoutSpan(fromLegacy));
    }

    @Test
    @DisplayName("Package declarations, the component and the body are found in source order")
    void testPackage() {
        ExtractionResult result = legacy.parseDeclarations(Samples.load(Samples.DEMO_PACKAGE));

        assertEquals(List.of(DeclarationRecord.Kind.PACKAGE, DeclarationRecord.Kind.COMPONENT,
                DeclarationRecord.Kind.PACKAGE),
            result.records().stream().map(DeclarationRecord::kind).collect(Collectors.toList()));

        DeclarationRecord pkg = result.records().get(0);
        assertEquals("mylib", pkg.library());
        assertFalse(pkg.body());
        assertEquals(List.of(new ConstantRecord("WIDTH", "natural", "8")), pkg.constants());
        assertEquals(List.of(
            new TypeRecord("state_t", "enumeration", "(IDLE, RUN, DONE)"),
            new TypeRecord("word_array", "array",
                "array (natural range <>) of std_ulogic_vector(WIDTH-1 downto 0)")), pkg.types());
        assertEquals(List.of(
            new SubtypeRecord("byte", "std_ulogic_vector(7 downto 0)", "std_ulogic_vector"),
            new SubtypeRecord("octet", "byte", "byte")), pkg.subtypes());
        assertEquals(List.of(
                "function parity(d : in std_ulogic_vector; odd : in boolean := false) return std_ulogic;",
                "procedure reset_all;"),
            pkg.subprograms().stream().map(SubprogramRecord::prototype).collect(Collectors.toList()));

        DeclarationRecord component = result.records().get(1);
        assertEquals("demo_device_comp", component.name());
        assertEquals("demo_pkg", component.container());
        assertEquals(List.of(new GenericRecord("SIZE", "constant", "positive", null)), component.generics());
        assertEquals(List.of("Clock", "Data_out"),
            component.ports().stream().map(PortRecord::name).collect(Collectors.toList()));

        DeclarationRecord body = result.records().get(2);
        assertTrue(body.body());
        assertEquals(List.of("parity", "reset_all"),
            body.subprograms().stream().map(SubprogramRecord::name).collect(Collectors.toList()));
        assertEquals("std_ulogic", body.subprograms().get(0).returnType());
    }

    @Test
    @DisplayName("Component instantiations and commented out headers are not declarations")
    void testInstantiationAndComments() {
        String source = """
            -- entity fake is port (x : in bit); end;
            architecture structural of top is
              component leaf
                port (a : in bit);
              end component;
            begin
              u1 : component leaf port map (a => '1');
            end architecture;
            """;
        ExtractionResult result = legacy.parseDeclarations(source);
        assertEquals(1, result.records().size());
        DeclarationRecord leaf = result.records().get(0);
        assertEquals(DeclarationRecord.Kind.COMPONENT, leaf.kind());
        assertEquals("leaf", leaf.name());
        assertEquals("structural", leaf.container());
        assertEquals(List.of(new PortRecord("a", PortRecord.Direction.IN, "bit", null)), leaf.ports());
    }

    @Test
    @DisplayName("Element resolved subtypes report the same base type as the grammar extraction")
    void testElementResolvedSubtype() {
        String source = """
            package bus_pkg is
              subtype rbus is (resolved) std_ulogic_vector;
            end package;
            """;
        SubtypeRecord expected = new SubtypeRecord("rbus", "(resolved) std_ulogic_vector", "std_ulogic_vector");
        assertEquals(List.of(expected), legacy.parseDeclarations(source).records().get(0).subtypes());
        assertEquals(List.of(expected), new DeclarationExtractor().extract(new VhdlParser().parse(source))
            .records().get(0).subtypes());
    }

    @Test
    @DisplayName("Linkage ports are skipped with a warning")
    void testLinkagePort() {
        String source = """
            entity analog is
              port (vdd : linkage bit; q, r : buffer bit);
            end;
            """;
        ExtractionResult result = legacy.parseDeclarations(source);
        DeclarationRecord entity = result.records().get(0);
        assertEquals(List.of("q", "r"),
            entity.ports().stream().map(PortRecord::name).collect(Collectors.toList()));
        assertEquals(PortRecord.Direction.BUFFER, entity.port("r").direction());
        assertEquals(1, result.warnings().size());
        assertEquals("linkage port", result.warnings().get(0).kind());
    }

    @Test
    @DisplayName("Text it cannot make sense of yields no records instead of an error")
    void testGarbage() {
        ExtractionResult result = legacy.parseDeclarations("this is ( not ( vhdl ;");
        assertTrue(result.records().isEmpty());
        assertTrue(result.warnings().isEmpty());
    }
}
