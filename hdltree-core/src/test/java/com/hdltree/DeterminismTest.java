package com.hdltree;

import com.hdltree.ast.ArchitectureBody;
import com.hdltree.ast.BinaryExpression;
import com.hdltree.ast.DesignFile;
import com.hdltree.ast.IndexedName;
import com.hdltree.ast.Nodes;
import com.hdltree.ast.SignalAssignment;
import com.hdltree.ast.SimpleName;
import com.hdltree.ast.Waveform;
import com.hdltree.forest.ParseTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class DeterminismTest {

    private static final String SOURCE = """
        architecture rtl of demo_device_comp is
        begin
          msb <= Data_out(SIZE-1);
        end;
        """;

    @Test
    @DisplayName("Data_out(SIZE-1) resolves to an indexed name, not a function call")
    void testIndexedNameWins() {
        DesignFile file = new VhdlParser().parse(SOURCE);
        SignalAssignment assignment = Nodes.find(file, SignalAssignment.class).get(0);
        Waveform waveform = (Waveform) assignment.waveforms().get(0);

        IndexedName indexed = assertInstanceOf(IndexedName.class, waveform.elements().get(0).value());
        assertEquals(new SimpleName(indexed.prefix().span(), indexed.prefix().tokens(), "Data_out"), indexed.prefix());
        assertEquals(1, indexed.indexes().size());
        BinaryExpression index = assertInstanceOf(BinaryExpression.class, indexed.indexes().get(0));
        assertEquals("-", index.operator());
    }

    @Test
    @DisplayName("Repeated parses choose identical trees")
    void testRepeatedRuns() {
        VhdlParser parser = new VhdlParser();
        String source = Samples.load(Samples.DEMO_DEVICE);
        DesignFile first = parser.parse(source);
        String firstTree = parser.parseTree(source).dump();
        for (int i = 0; i < 5; i++) {
            assertEquals(first, parser.parse(source));
            assertEquals(firstTree, parser.parseTree(source).dump());
        }
    }

    @Test
    @DisplayName("The chosen production ids do not depend on the parser instance")
    void testFreshParsersAgree() {
        ParseTree a = new VhdlParser().parseTree(SOURCE);
        ParseTree b = new VhdlParser().parseTree(SOURCE);
        assertEquals(a.dump(), b.dump());
        assertTrue(a.dump().contains("primary:name"));
        assertFalse(a.dump().contains("function_call"));
    }

    @Test
    @DisplayName("One parser can be shared between threads")
    void testConcurrentParses() throws Exception {
        VhdlParser parser = new VhdlParser();
        String source = Samples.load(Samples.DEMO_DEVICE);
        DesignFile expected = parser.parse(source);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<DesignFile>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> parser.parse(source)));
            }
            for (Future<DesignFile> future : futures) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, Nodes.find(expected, ArchitectureBody.class).size());
    }
}
