package com.hdltree.grammar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.hdltree.TokenType.*;
import static com.hdltree.grammar.GrammarBuilder.opt;
import static com.hdltree.grammar.GrammarBuilder.star;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

    @Test
    @DisplayName("The VHDL grammar is built once and shared")
    void testSingleton() {
        assertSame(Grammar.vhdl(), Grammar.vhdl());
        assertEquals("design_file", Grammar.vhdl().name(Grammar.vhdl().startSymbol()));
    }

    @Test
    @DisplayName("Grammar views are read-only")
    void testImmutable() {
        Grammar grammar = Grammar.vhdl();
        assertThrows(UnsupportedOperationException.class, () -> grammar.productions().clear());
    }

    @Test
    @DisplayName("Tie-break annotations are attached to the right productions")
    void testAnnotations() {
        Grammar grammar = Grammar.vhdl();
        Production primaryName = find(grammar, "primary:name");
        assertTrue(primaryName.hasContextPreference());
        assertTrue(primaryName.isPreferredUnder(grammar.symbol("simple_expression")));
        assertFalse(find(grammar, "primary:call").hasContextPreference());

        assertEquals(1, find(grammar, "name_suffix:index").priority());
        assertEquals(0, find(grammar, "name_suffix:slice").priority());
        assertEquals(1, find(grammar, "choice:range").priority());
    }

    @Test
    @DisplayName("Inline and collapsing rules are flagged")
    void testRuleFlags() {
        Grammar grammar = Grammar.vhdl();
        assertTrue(grammar.isTransparent(grammar.symbol("declarative_item")));
        assertFalse(grammar.isTransparent(grammar.symbol("entity_declaration")));
        assertTrue(grammar.isCollapse(grammar.symbol("expression")));
        assertFalse(grammar.isCollapse(grammar.symbol("name")));
        assertTrue(grammar.isNullable(grammar.symbol("design_file")));
        assertFalse(grammar.isNullable(grammar.symbol("entity_declaration")));
    }

    @Test
    @DisplayName("Unknown rule lookups fail")
    void testUnknownRule() {
        assertFalse(Grammar.vhdl().hasRule("verilog_module"));
        assertThrows(IllegalArgumentException.class, () -> Grammar.vhdl().symbol("verilog_module"));
    }

    @Test
    @DisplayName("The builder rejects malformed grammars")
    void testBuilderValidation() {
        GrammarBuilder undefined = new GrammarBuilder();
        undefined.rule("start").alt("missing");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> undefined.build("start"));
        assertTrue(e.getMessage().contains("undefined rule missing"));

        GrammarBuilder duplicate = new GrammarBuilder();
        duplicate.rule("start").alt(IDENTIFIER);
        assertThrows(IllegalStateException.class, () -> duplicate.rule("start"));

        GrammarBuilder nullableRepeat = new GrammarBuilder();
        nullableRepeat.rule("start").alt(star(opt(IDENTIFIER)));
        e = assertThrows(IllegalStateException.class, () -> nullableRepeat.build("start"));
        assertTrue(e.getMessage().contains("nullable body"));

        GrammarBuilder noStart = new GrammarBuilder();
        noStart.rule("start").alt(IDENTIFIER);
        assertThrows(IllegalStateException.class, () -> noStart.build("other"));

        assertThrows(IllegalStateException.class, () -> new GrammarBuilder().rule("r").label("x"));
    }

    private static Production find(Grammar grammar, String id) {
        return grammar.productions().stream().filter(p -> p.id().equals(id)).findFirst()
            .orElseThrow(() -> new AssertionError("no production " + id));
    }
}
