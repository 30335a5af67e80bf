package com.hdltree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorHandlingTest {

    private final VhdlParser parser = new VhdlParser();

    @Test
    @DisplayName("A stray 'end component;' is a syntax error pointing at the stray end")
    void testStrayEndComponent() {
        String source = """
            entity e is
            end entity e;
            end component;
            """;
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(source));
        int strayEnd = source.indexOf("end component");
        assertEquals(strayEnd, e.getSpan().start());
        assertEquals(3, e.getSpan().line());
        assertEquals(0, e.getSpan().column());
        assertNotNull(e.getToken());
        assertEquals(TokenType.END, e.getToken().type());
        assertTrue(e.getMessage().startsWith("Unexpected 'end'"), e.getMessage());
        assertFalse(e instanceof AmbiguityException);
    }

    @Test
    @DisplayName("A stray 'end component;' inside an architecture spans from its 'end'")
    void testStrayEndComponentInArchitecture() {
        String source = """
            architecture rtl of e is
            begin
              end component;
            """;
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(source));
        assertEquals(source.indexOf("end component"), e.getSpan().start());
        assertEquals(TokenType.COMPONENT, e.getToken().type());
    }

    @Test
    @DisplayName("A bare component declaration is an unsupported construct")
    void testBareComponent() {
        String source = """
            component demo_device_comp is
              generic (SIZE : positive);
              port (Clock : in std_ulogic);
            end component;
            """;
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
            () -> parser.parse(source));
        assertEquals("ComponentDeclaration", e.getConstruct().kind());
        assertEquals(0, e.getSpan().start());
        assertTrue(e.getMessage().contains("outside of any design unit"));
    }

    @Test
    @DisplayName("Lenient parsing drops the bare component and reports it")
    void testBareComponentLenient() {
        String source = """
            library ieee;
            component orphan
            end component;
            package p is
            end package;
            """;
        ParseResult result = parser.parseLenient(source);
        assertEquals(1, result.designFile().units().size());
        assertEquals(1, result.unsupported().size());
        assertEquals("ComponentDeclaration", result.unsupported().get(0).kind());
        assertEquals(2, result.unsupported().get(0).span().line());

        ParseResult configured = new VhdlParser(ParserOptions.DEFAULTS.withLenient(true)).parseResult(source);
        assertEquals(result.unsupported(), configured.unsupported());
    }

    @Test
    @DisplayName("Unexpected end of input names what was expected")
    void testUnexpectedEndOfInput() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("entity e is"));
        assertTrue(e.getMessage().startsWith("Unexpected end of input, expected"), e.getMessage());
        assertEquals(TokenType.EOF, e.getToken().type());
    }

    @Test
    @DisplayName("Lexical errors surface as LexException, a SourceException but not a ParseException")
    void testLexErrorThroughParser() {
        SourceException e = assertThrows(SourceException.class, () -> parser.parse("entity e is\nend \"open;"));
        assertInstanceOf(LexException.class, e);
        assertEquals(2, e.getSpan().line());
    }

    @Test
    @DisplayName("Nesting beyond the configured depth is rejected")
    void testDepthLimit() {
        String nested = "(".repeat(40) + "a" + ")".repeat(40);
        String source = "architecture rtl of e is\nbegin\n  y <= " + nested + ";\nend;\n";

        assertNotNull(parser.parse(source));

        VhdlParser shallow = new VhdlParser(ParserOptions.DEFAULTS.withMaxDepth(30));
        ParseException e = assertThrows(ParseException.class, () -> shallow.parse(source));
        assertTrue(e.getMessage().startsWith("Nesting deeper than 30 levels"), e.getMessage());
        assertNull(e.getToken());
        assertEquals(3, e.getSpan().line());
    }

    @Test
    @DisplayName("Parser options reject non-positive limits")
    void testOptionValidation() {
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.DEFAULTS.withMaxDepth(0));
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.DEFAULTS.withMaxDerivations(-1));
        assertEquals(10, ParserOptions.DEFAULTS.withMaxDepth(10).maxDepth());
        assertFalse(ParserOptions.DEFAULTS.lenient());
    }
}
