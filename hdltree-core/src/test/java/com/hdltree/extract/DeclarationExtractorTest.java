package com.hdltree.extract;

import com.hdltree.ParseResult;
import com.hdltree.Samples;
import com.hdltree.UnsupportedConstruct;
import com.hdltree.VhdlParser;
import com.hdltree.ast.DesignFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DeclarationExtractorTest {

    private final VhdlParser parser = new VhdlParser();
    private final DeclarationExtractor extractor = new DeclarationExtractor();

    private ExtractionResult extract(String source) {
        return extractor.extract(parser.parse(source));
    }

    @Test
    @DisplayName("demo_device_comp yields one entity record with 2 generics and 5 ports in order")
    void testDemoDeviceEntity() {
        ExtractionResult result = extract(Samples.load(Samples.DEMO_DEVICE));

        assertEquals(1, result.records().size());
        assertTrue(result.warnings().isEmpty());
        DeclarationRecord entity = result.records().get(0);
        assertEquals(DeclarationRecord.Kind.ENTITY, entity.kind());
        assertEquals("demo_device_comp", entity.name());
        assertEquals("work", entity.library());
        assertNull(entity.container());

        List<GenericRecord> generics = entity.generics();
        assertEquals(2, generics.size());
        assertEquals(new GenericRecord("SIZE", "constant", "positive", null), generics.get(0));
        assertEquals(new GenericRecord("RESET_ACTIVE_LEVEL", "constant", "std_ulogic", "'1'"), generics.get(1));

        List<PortRecord> ports = entity.ports();
        assertEquals(List.of("Clock", "Reset", "Enable", "Data_in", "Data_out"),
            ports.stream().map(PortRecord::name).collect(Collectors.toList()));
        assertEquals(new PortRecord("Clock", PortRecord.Direction.IN, "std_ulogic", null), ports.get(0));
        assertEquals(PortRecord.Direction.IN, ports.get(1).direction());
        assertEquals(PortRecord.Direction.IN, ports.get(2).direction());
        assertEquals(new PortRecord("Data_in", PortRecord.Direction.IN,
            "std_ulogic_vector(SIZE-1 downto 0)", null), ports.get(3));
        assertEquals(new PortRecord("Data_out", PortRecord.Direction.OUT,
            "std_ulogic_vector(SIZE-1 downto 0)", null), ports.get(4));
    }

    @Test
    @DisplayName("Lookups by name ignore case")
    void testCaseInsensitiveLookup() {
        ExtractionResult result = extract(Samples.load(Samples.DEMO_DEVICE));
        DeclarationRecord entity = result.find("DEMO_DEVICE_COMP");
        assertNotNull(entity);
        assertEquals("'1'", entity.generic("reset_active_level").defaultValue());
        assertEquals(PortRecord.Direction.OUT, entity.port("DATA_OUT").direction());
        assertNull(entity.port("missing"));
        assertNull(result.find("missing"));
    }

    @Test
    @DisplayName("Package contents and its components are extracted in source order")
    void testPackage() {
        ExtractionResult result = extract(Samples.load(Samples.DEMO_PACKAGE));

        assertEquals(List.of(DeclarationRecord.Kind.PACKAGE, DeclarationRecord.Kind.COMPONENT,
                DeclarationRecord.Kind.PACKAGE),
            result.records().stream().map(DeclarationRecord::kind).collect(Collectors.toList()));

        DeclarationRecord pkg = result.records().get(0);
        assertEquals("demo_pkg", pkg.name());
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

        List<SubprogramRecord> subprograms = pkg.subprograms();
        assertEquals(2, subprograms.size());
        SubprogramRecord parity = subprograms.get(0);
        assertTrue(parity.isFunction());
        assertEquals("std_ulogic", parity.returnType());
        assertEquals("function parity(d : in std_ulogic_vector; odd : in boolean := false) return std_ulogic;",
            parity.prototype());
        assertEquals("parity[std_ulogic_vector, boolean return std_ulogic]", parity.signature());
        assertEquals("procedure reset_all;", subprograms.get(1).prototype());

        DeclarationRecord component = result.records().get(1);
        assertEquals("demo_device_comp", component.name());
        assertEquals("demo_pkg", component.container());
        assertEquals("mylib", component.library());
        assertEquals(1, component.generics().size());
        assertEquals(2, component.ports().size());
        assertEquals("std_ulogic_vector(SIZE-1 downto 0)", component.port("Data_out").type());

        DeclarationRecord body = result.records().get(2);
        assertTrue(body.body());
        assertEquals(List.of("parity", "reset_all"),
            body.subprograms().stream().map(SubprogramRecord::name).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Components declared in an architecture name the architecture as container")
    void testArchitectureComponent() {
        String source = """
            entity top is
            end entity;

            architecture structural of top is
              component leaf
                port (a : in bit; y : out bit);
              end component leaf;
            begin
              u1: leaf port map (a => '1', y => open);
            end architecture;
            """;
        ExtractionResult result = extract(source);
        assertEquals(2, result.records().size());
        DeclarationRecord leaf = result.ofKind(DeclarationRecord.Kind.COMPONENT).get(0);
        assertEquals("leaf", leaf.name());
        assertEquals("structural", leaf.container());
        assertEquals(PortRecord.Direction.OUT, leaf.port("y").direction());
        assertTrue(result.ofKind(DeclarationRecord.Kind.ENTITY).get(0).ports().isEmpty());
    }

    @Test
    @DisplayName("Linkage ports are skipped with a warning")
    void testLinkagePort() {
        String source = """
            entity analog is
              port (vdd : linkage bit; q : buffer bit; io : inout bit := '0');
            end;
            """;
        ExtractionResult result = extract(source);
        DeclarationRecord entity = result.records().get(0);
        assertEquals(List.of("q", "io"),
            entity.ports().stream().map(PortRecord::name).collect(Collectors.toList()));
        assertEquals(PortRecord.Direction.BUFFER, entity.port("q").direction());
        assertEquals("'0'", entity.port("io").defaultValue());
        assertEquals("inout", entity.port("io").direction().toString());

        assertEquals(1, result.warnings().size());
        UnsupportedConstruct warning = result.warnings().get(0);
        assertEquals("linkage port", warning.kind());
    }

    @Test
    @DisplayName("Units without a record produce a warning")
    void testUnitWithoutRecord() {
        String source = """
            context project_ctx is
              library ieee;
            end context;
            """;
        ExtractionResult result = extract(source);
        assertTrue(result.records().isEmpty());
        assertEquals(1, result.warnings().size());
        assertEquals("ContextDeclaration", result.warnings().get(0).kind());
    }

    @Test
    @DisplayName("Constructs dropped by a lenient parse become extraction warnings")
    void testLenientWarningsCarriedOver() {
        String source = """
            component orphan is
              port (a : in bit);
            end component;

            entity kept is
              port (b : out bit);
            end;
            """;
        ParseResult parsed = parser.parseLenient(source);
        ExtractionResult result = extractor.extract(parsed);
        assertEquals(1, result.records().size());
        assertEquals("kept", result.records().get(0).name());
        assertEquals(1, result.warnings().size());
        assertEquals("ComponentDeclaration", result.warnings().get(0).kind());
    }

    @Test
    @DisplayName("Extraction does not depend on previous runs")
    void testRepeatedExtraction() {
        DesignFile file = parser.parse(Samples.load(Samples.DEMO_PACKAGE));
        assertEquals(extractor.extract(file), extractor.extract(file));
    }
}
