package com.hdltree.extract;

import com.hdltree.Samples;
import com.hdltree.VhdlParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DeclarationParserTest {

    @Test
    @DisplayName("The grammar parser is the primary VHDL parser")
    void testForDialect() {
        DeclarationParser parser = DeclarationParser.forDialect(HdlDialect.VHDL);
        assertEquals("grammar", parser.getName());
        assertInstanceOf(VhdlDeclarationParser.class, parser);
        assertFalse(parser.isFallback());
    }

    @Test
    @DisplayName("Parsers can be selected by name, ignoring case")
    void testNamed() {
        assertInstanceOf(LegacyVhdlDeclarationParser.class, DeclarationParser.named("LEGACY"));
        assertInstanceOf(VhdlDeclarationParser.class, DeclarationParser.named("grammar"));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> DeclarationParser.named("nope"));
        assertTrue(e.getMessage().contains("'nope'"));
    }

    @Test
    @DisplayName("A dialect without a parser on the classpath fails with a clear message")
    void testMissingDialect() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> DeclarationParser.forDialect(HdlDialect.VERILOG));
        assertTrue(e.getMessage().contains("VERILOG"));
    }

    @Test
    @DisplayName("Both VHDL parsers are registered")
    void testAvailable() {
        List<String> names = DeclarationParser.available().stream()
            .map(DeclarationParser::getName).sorted().collect(Collectors.toList());
        assertEquals(List.of("grammar", "legacy"), names);
    }

    @Test
    @DisplayName("Grammar parser output matches extracting from a strict parse")
    void testGrammarParser() {
        String source = Samples.load(Samples.DEMO_PACKAGE);
        ExtractionResult expected = new DeclarationExtractor().extract(new VhdlParser().parse(source));
        assertEquals(expected, new VhdlDeclarationParser().parseDeclarations(source));
    }

    @Test
    @DisplayName("Grammar parser reports a bare component as a warning instead of failing")
    void testGrammarParserLenient() {
        ExtractionResult result = new VhdlDeclarationParser().parseDeclarations("""
            component orphan
              port (a : in bit);
            end component;
            """);
        assertTrue(result.records().isEmpty());
        assertEquals(1, result.warnings().size());
        assertEquals("ComponentDeclaration", result.warnings().get(0).kind());
    }
}
