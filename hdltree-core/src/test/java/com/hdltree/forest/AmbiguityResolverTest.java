package com.hdltree.forest;

import com.hdltree.AmbiguityException;
import com.hdltree.Lexer;
import com.hdltree.ParseException;
import com.hdltree.grammar.Grammar;
import com.hdltree.grammar.GrammarBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hdltree.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

public class AmbiguityResolverTest {

    private static ParseTree resolve(Grammar grammar, String source) {
        ParseForest forest = new EarleyParser(grammar).parse(Lexer.tokenize(source));
        return new AmbiguityResolver(100).resolve(forest);
    }

    private static ParseTree child(ParseTree tree, int index) {
        return (ParseTree) tree.children().get(index);
    }

    @Test
    @DisplayName("Higher priority wins")
    void testPriority() {
        GrammarBuilder g = new GrammarBuilder();
        g.rule("start").alt("item");
        g.rule("item")
            .alt(IDENTIFIER).label("plain")
            .alt(IDENTIFIER).label("preferred").priority(1);
        ParseTree tree = resolve(g.build("start"), "x");
        assertEquals("item:preferred", child(tree, 0).productionId());
    }

    @Test
    @DisplayName("Equal candidates are reported as an ambiguity naming both productions")
    void testUnresolvedTie() {
        GrammarBuilder g = new GrammarBuilder();
        g.rule("start").alt("item");
        g.rule("item")
            .alt(IDENTIFIER).label("left")
            .alt(IDENTIFIER).label("right");
        AmbiguityException e = assertThrows(AmbiguityException.class, () -> resolve(g.build("start"), "x"));
        assertEquals(List.of("item:left", "item:right"), e.getProductionIds());
        assertEquals(0, e.getSpan().start());
    }

    @Test
    @DisplayName("With equal priority the longer leading child wins")
    void testLongestSpan() {
        GrammarBuilder g = new GrammarBuilder();
        g.rule("start").alt("triple");
        g.rule("triple")
            .alt("pair", IDENTIFIER).label("pair_first")
            .alt(IDENTIFIER, "pair").label("pair_last");
        g.rule("pair").alt(IDENTIFIER, IDENTIFIER);
        ParseTree triple = child(resolve(g.build("start"), "a b c"), 0);
        assertEquals("triple:pair_first", triple.productionId());
        assertEquals(0, child(triple, 0).startToken());
        assertEquals(2, child(triple, 0).endToken());
    }

    @Test
    @DisplayName("Context preference decides when priority and spans tie")
    void testContextPreference() {
        GrammarBuilder g = new GrammarBuilder();
        g.rule("start").alt("wrapped").alt("bare");
        g.rule("wrapped").alt(LPAREN, "atom", RPAREN);
        g.rule("bare").alt(LBRACKET, "atom", RBRACKET);
        g.rule("atom")
            .alt(IDENTIFIER).label("inside").preferredUnder("wrapped")
            .alt(IDENTIFIER).label("outside");
        Grammar grammar = g.build("start");

        ParseTree wrapped = child(resolve(grammar, "(x)"), 0);
        assertEquals("atom:inside", child(wrapped, 1).productionId());

        // No ancestor prefers either reading
        assertThrows(AmbiguityException.class, () -> resolve(grammar, "[x]"));
    }

    @Test
    @DisplayName("The nearest preferring ancestor counts")
    void testNearestAncestor() {
        GrammarBuilder g = new GrammarBuilder();
        g.rule("start").alt("outer");
        g.rule("outer").alt(LPAREN, "inner", RPAREN);
        g.rule("inner").alt(LBRACKET, "atom", RBRACKET);
        g.rule("atom")
            .alt(IDENTIFIER).label("far").preferredUnder("outer")
            .alt(IDENTIFIER).label("near").preferredUnder("inner");
        ParseTree inner = child(child(resolve(g.build("start"), "([x])"), 0), 1);
        assertEquals("atom:near", child(inner, 1).productionId());
    }

    @Test
    @DisplayName("Too many derivations of one node fail fast")
    void testDerivationCap() {
        GrammarBuilder g = new GrammarBuilder();
        g.rule("start").alt("item");
        g.rule("item").alt(IDENTIFIER).label("a").alt(IDENTIFIER).label("b").alt(IDENTIFIER).label("c");
        ParseForest forest = new EarleyParser(g.build("start"), 2).parse(Lexer.tokenize("x"));
        AmbiguityException e = assertThrows(AmbiguityException.class,
            () -> forest.derivations(new ForestRef(forest.grammar().symbol("item"), 0, 1)));
        assertTrue(e.getMessage().startsWith("More than 2 derivations of item"), e.getMessage());
    }

    @Test
    @DisplayName("Inline rules splice their children into the parent")
    void testInlineRules() {
        GrammarBuilder g = new GrammarBuilder();
        g.rule("start").alt("list");
        g.rule("list").alt(GrammarBuilder.sepBy("element", COMMA));
        g.rule("element").inline().alt(IDENTIFIER).alt(DECIMAL_LITERAL);
        ParseTree list = child(resolve(g.build("start"), "a, 1, b"), 0);
        assertEquals(5, list.children().size());
        assertTrue(list.children().stream().noneMatch(c -> c instanceof ParseTree));
    }

    @Test
    @DisplayName("The resolver enforces its depth limit")
    void testDepthLimit() {
        GrammarBuilder g = new GrammarBuilder();
        g.rule("start").alt("nest");
        g.rule("nest").alt(LPAREN, "nest", RPAREN).alt(IDENTIFIER);
        ParseForest forest = new EarleyParser(g.build("start")).parse(Lexer.tokenize("((((x))))"));
        assertNotNull(new AmbiguityResolver(10).resolve(forest));
        ParseException e = assertThrows(ParseException.class, () -> new AmbiguityResolver(3).resolve(forest));
        assertTrue(e.getMessage().startsWith("Nesting deeper than 3 levels"));
    }

    @Test
    @DisplayName("Syntax errors name the expected tokens")
    void testSyntaxError() {
        GrammarBuilder g = new GrammarBuilder();
        g.rule("start").alt(LPAREN, IDENTIFIER, RPAREN);
        ParseException e = assertThrows(ParseException.class,
            () -> new EarleyParser(g.build("start")).parse(Lexer.tokenize("(x;")));
        assertTrue(e.getMessage().startsWith("Unexpected ';', expected ')'"), e.getMessage());
        assertEquals(SEMICOLON, e.getToken().type());
    }
}
