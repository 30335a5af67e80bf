package com.hdltree.render;

import com.hdltree.Lexer;
import com.hdltree.ReconstructionMismatchException;
import com.hdltree.Samples;
import com.hdltree.Span;
import com.hdltree.Token;
import com.hdltree.VhdlParser;
import com.hdltree.ast.DesignFile;
import com.hdltree.ast.EntityDeclaration;
import com.hdltree.ast.InterfaceObject;
import com.hdltree.ast.Node;
import com.hdltree.ast.Nodes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReconstructorTest {

    private final VhdlParser parser = new VhdlParser();

    @Test
    @DisplayName("Exact rendering reproduces the source byte for byte")
    void testExactRoundTrip() {
        for (String sample : List.of(Samples.DEMO_DEVICE, Samples.DEMO_PACKAGE)) {
            String source = Samples.load(sample);
            assertEquals(source, Reconstructor.render(parser.parse(source)), sample);
        }
    }

    @Test
    @DisplayName("Children and stored tokens lie inside their parent and never overlap each other")
    void testSpanNesting() {
        for (String sample : List.of(Samples.DEMO_DEVICE, Samples.DEMO_PACKAGE)) {
            String source = Samples.load(sample);
            DesignFile file = parser.parse(source);
            assertEquals(0, file.span().start(), sample);
            assertEquals(source.length(), file.span().end(), sample);

            Nodes.walk(file, node -> {
                List<Span> parts = new ArrayList<>();
                for (Node child : Nodes.children(node)) {
                    parts.add(child.span());
                }
                for (Token token : node.tokens()) {
                    parts.add(token.span());
                }
                parts.sort(Comparator.comparingInt(Span::start).thenComparingInt(Span::end));
                for (int i = 0; i < parts.size(); i++) {
                    Span part = parts.get(i);
                    assertTrue(node.span().contains(part), node.type() + " " + node.span() + " does not contain " + part);
                    if (i > 0) {
                        Span previous = parts.get(i - 1);
                        assertFalse(previous.overlaps(part), node.type() + ": " + previous + " overlaps " + part);
                        assertTrue(previous.end() <= part.start(), node.type() + ": " + previous + " before " + part);
                    }
                }
            });
        }
    }

    @Test
    @DisplayName("Leading and trailing comments survive exact rendering")
    void testCommentsKept() {
        String source = "-- file header\n\nentity e is /* inline */ end;\n-- trailer\n";
        assertEquals(source, Reconstructor.render(parser.parse(source)));
    }

    @Test
    @DisplayName("Every source token is stored exactly once, in order")
    void testTokenCoverage() {
        String source = Samples.load(Samples.DEMO_PACKAGE);
        List<Token> expected = Lexer.tokenize(source);
        assertEquals(expected, Reconstructor.tokens(parser.parse(source)));
    }

    @Test
    @DisplayName("Normalized rendering collapses separators but keeps the token stream")
    void testNormalized() {
        String source = "entity   e  is -- note\n\n\n  end ;";
        DesignFile file = parser.parse(source);
        assertEquals("entity e is\nend ;", Reconstructor.render(file, Reconstructor.Mode.NORMALIZED));
        Reconstructor.verify(source, file);
    }

    @Test
    @DisplayName("Sub-nodes render without the separator before their first token")
    void testNodeRendering() {
        DesignFile file = parser.parse(Samples.load(Samples.DEMO_DEVICE));
        EntityDeclaration entity = Nodes.find(file, EntityDeclaration.class).get(0);
        InterfaceObject dataOut = (InterfaceObject) entity.ports().elements().get(4);
        assertEquals("Data_out : out std_ulogic_vector(SIZE-1 downto 0)", Reconstructor.render(dataOut));
        assertEquals("std_ulogic_vector(SIZE-1 downto 0)", Reconstructor.text(dataOut.subtype()));
    }

    @Test
    @DisplayName("Text summaries put single spaces where the source had any separator")
    void testTextSummary() {
        DesignFile file = parser.parse("entity e is port (a : in bit_vector( 3\n  downto 0 ));\nend;");
        InterfaceObject port = Nodes.find(file, InterfaceObject.class).get(0);
        assertEquals("bit_vector( 3 downto 0 )", Reconstructor.text(port.subtype()));
    }

    @Test
    @DisplayName("Verification reports the first token that differs")
    void testVerifyMismatch() {
        DesignFile file = parser.parse("entity a is end;");
        ReconstructionMismatchException e = assertThrows(ReconstructionMismatchException.class,
            () -> Reconstructor.verify("entity b is end;", file));
        assertEquals(1, e.getTokenIndex());
        assertEquals("b", e.getExpected().lexeme());
        assertEquals("a", e.getActual().lexeme());
    }
}
