package com.hdltree.jackson;

import com.hdltree.VhdlParser;
import com.hdltree.ast.DesignFile;
import com.hdltree.ast.EntityDeclaration;
import com.hdltree.ast.Nodes;
import com.hdltree.extract.DeclarationParser;
import com.hdltree.extract.ExtractionResult;
import com.hdltree.json.AstJsonException;
import com.hdltree.json.AstJsonProvider;
import com.hdltree.render.Reconstructor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private static final String DEVICE = """
        library ieee;
        use ieee.std_logic_1164.all;

        -- counter with a load input
        entity counter is
          generic (WIDTH : positive := 8);
          port (
            clk  : in std_ulogic;
            load : in std_ulogic_vector(WIDTH-1 downto 0);
            q    : out std_ulogic_vector(WIDTH-1 downto 0)
          );
        end entity counter;

        architecture rtl of counter is
          signal count : unsigned(WIDTH-1 downto 0) := (others => '0');
        begin
          tick: process (clk) is
          begin
            if rising_edge(clk) then
              count <= count + 1 after 1 ns;
            end if;
          end process tick;

          q <= std_ulogic_vector(count) when load(0) = '0' else load;
        end architecture rtl;
        """;

    private static final String PACKAGE = """
        package util is
          function parity(d : std_ulogic_vector; odd : boolean := false) return std_ulogic;
          procedure reset_all;
        end package util;
        """;

    private final VhdlParser parser = new VhdlParser();
    private final AstJsonProvider provider = AstJsonProvider.getProvider();

    @Test
    @DisplayName("The Jackson provider is found through the ServiceLoader")
    void testProviderLookup() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    @DisplayName("A design file survives a JSON round trip unchanged")
    void testAstRoundTrip() {
        DesignFile file = parser.parse(DEVICE);
        String json = provider.getSerializer().serialize(file);
        DesignFile back = provider.getDeserializer().deserializeDesignFile(json);

        assertEquals(file, back);
        assertEquals(DEVICE, Reconstructor.render(back));
    }

    @Test
    @DisplayName("Every object names its node type and tokens are compact arrays")
    void testJsonShape() {
        String json = provider.getSerializer().serialize(parser.parse("entity e is\nend;\n"));
        assertTrue(json.startsWith("{\"type\":\"DesignFile\""), json);
        assertTrue(json.contains("\"type\":\"EntityDeclaration\""), json);
        assertTrue(json.contains("[\"ENTITY\",\"entity\",\"\",0,6,1,0,1,6]"), json);
        // optional end name is absent, not null
        assertFalse(json.contains("null"), json);
    }

    @Test
    @DisplayName("A single node can be read back as its own type")
    void testNodeRoundTrip() {
        EntityDeclaration entity = Nodes.find(parser.parse(DEVICE), EntityDeclaration.class).get(0);
        String json = provider.getSerializer().serializePretty(entity);
        assertEquals(entity, provider.getDeserializer().deserialize(json, EntityDeclaration.class));
    }

    @Test
    @DisplayName("Declaration JSON carries prototypes and reads back")
    void testDeclarations() {
        ExtractionResult result = DeclarationParser.named("grammar").parseDeclarations(PACKAGE);
        String json = provider.getSerializer().serialize(result);

        assertTrue(json.contains(
            "\"prototype\":\"function parity(d : in std_ulogic_vector; odd : in boolean := false) return std_ulogic;\""),
            json);
        assertTrue(json.contains("\"kind\":\"PACKAGE\""), json);
        assertTrue(json.contains("\"kind\":\"function\""), json);
        assertFalse(json.contains("\"function\":"), json);
        assertEquals(result, provider.getDeserializer().deserializeDeclarations(json));
    }

    @Test
    @DisplayName("Malformed JSON fails with AstJsonException")
    void testMalformedJson() {
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeDesignFile("{not json"));
        AstJsonException e = assertThrows(AstJsonException.class, () -> provider.getDeserializer()
            .deserializeDesignFile("{\"type\":\"DesignFile\",\"tokens\":[[\"BOGUS\",\"x\",\"\",0,1,1,0,1,1]],"
                + "\"units\":[]}"));
        assertTrue(e.getMessage().contains("DesignFile"));
    }
}
