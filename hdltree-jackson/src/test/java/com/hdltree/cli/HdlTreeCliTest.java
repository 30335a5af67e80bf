package com.hdltree.cli;

import com.hdltree.VhdlParser;
import com.hdltree.ast.DesignFile;
import com.hdltree.jackson.HdlTreeJackson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class HdlTreeCliTest {

    private static final String ENTITY = """
        entity leaf is
          port (a : in bit; y : out bit);
        end entity leaf;
        """;

    private static final String PACKAGE = """
        package util is
          procedure reset_all;
        end package;
        """;

    private static final String STRAY_END = """
        entity e is
        end;
        end component;
        """;

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        HdlTreeCli.Config config = HdlTreeCli.Config.parse(args, new PrintStream(err, true, StandardCharsets.UTF_8));
        assertNotNull(config, err.toString(StandardCharsets.UTF_8));
        return new HdlTreeCli(config).run(new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.ISO_8859_1);
        return file;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Default output is the AST as JSON")
    void testAstOutput() throws Exception {
        Path file = write("leaf.vhd", ENTITY);
        assertEquals(0, run(file.toString()));
        DesignFile printed = HdlTreeJackson.createObjectMapper().readValue(stdout(), DesignFile.class);
        assertEquals(new VhdlParser().parse(ENTITY), printed);
    }

    @Test
    @DisplayName("Declarations are printed with the selected parser")
    void testDeclarations() throws Exception {
        Path file = write("util.vhd", PACKAGE);
        assertEquals(0, run("--output=declarations", "--parser=legacy", "--input=" + file));
        assertTrue(stdout().contains("\"prototype\" : \"procedure reset_all;\""), stdout());
    }

    @Test
    @DisplayName("Normalized text output")
    void testTextOutput() throws Exception {
        Path file = write("leaf.vhd", "entity   leaf  is -- note\n\n\n  end ;\n");
        assertEquals(0, run("--output=text", "--verify", file.toString()));
        assertEquals("entity leaf is\nend ;", stdout().strip());
    }

    @Test
    @DisplayName("Parse tree output names the productions")
    void testTreeOutput() throws Exception {
        Path file = write("leaf.vhd", ENTITY);
        assertEquals(0, run("--output=tree", file.toString()));
        assertTrue(stdout().contains("entity_declaration"), stdout());
    }

    @Test
    @DisplayName("Syntax errors are reported with file and position and fail the run")
    void testSyntaxError() throws Exception {
        Path good = write("a.vhd", ENTITY);
        Path bad = write("b.vhd", STRAY_END);
        assertEquals(1, run(good.toString(), bad.toString()));
        assertTrue(stderr().contains(bad + ":3:1: Unexpected 'end'"), stderr());
        assertTrue(stderr().contains("1 of 2 file(s) failed"), stderr());
        assertTrue(stdout().contains("==> " + good + " <=="), stdout());
    }

    @Test
    @DisplayName("Directories are walked for VHDL files, honoring excludes")
    void testDirectoryWalk() throws Exception {
        write("rtl/leaf.vhd", ENTITY);
        write("rtl/util.vhdl", PACKAGE);
        write("rtl/readme.txt", "not vhdl");
        write("rtl/old/broken.vhd", STRAY_END);

        assertEquals(0, run("--output=declarations", "--threads=2",
            "--exclude=" + dir.resolve("rtl/old"), dir.resolve("rtl").toString()));
        String output = stdout();
        assertTrue(output.contains("leaf.vhd <=="), output);
        assertTrue(output.contains("util.vhdl <=="), output);
        assertFalse(output.contains("readme.txt"), output);
        assertTrue(output.indexOf("leaf.vhd") < output.indexOf("util.vhdl"));
    }

    @Test
    @DisplayName("Missing inputs are warned about and skipped")
    void testMissingInput() throws Exception {
        assertEquals(0, run(dir.resolve("nothing.vhd").toString()));
        assertTrue(stderr().contains("input does not exist"), stderr());
    }

    @Test
    @DisplayName("Help is a valid request, not an argument error")
    void testHelp() {
        PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8);
        HdlTreeCli.Config config = HdlTreeCli.Config.parse(new String[] {"--help"}, errStream);
        assertNotNull(config);
        assertTrue(config.help());
        assertTrue(HdlTreeCli.Config.parse(new String[] {"a.vhd", "-h"}, errStream).help());
        assertFalse(HdlTreeCli.Config.parse(new String[] {"a.vhd"}, errStream).help());
        assertEquals("", stderr());
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void testInvalidArguments() {
        PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8);
        assertNull(HdlTreeCli.Config.parse(new String[0], errStream));
        assertNull(HdlTreeCli.Config.parse(new String[] {"--output=xml", "a.vhd"}, errStream));
        assertNull(HdlTreeCli.Config.parse(new String[] {"--threads=many", "a.vhd"}, errStream));
        assertNull(HdlTreeCli.Config.parse(new String[] {"--bogus", "a.vhd"}, errStream));
        String messages = stderr();
        assertTrue(messages.contains("No input files specified"));
        assertTrue(messages.contains("Invalid output: xml"));
        assertTrue(messages.contains("Invalid thread count: many"));
        assertTrue(messages.contains("Unknown option: --bogus"));

        HdlTreeCli.Config config = HdlTreeCli.Config.parse(new String[] {"--threads=0", "a.vhd"}, errStream);
        assertEquals(1, config.threads());
        assertEquals(HdlTreeCli.Output.AST, config.output());
        assertEquals("grammar", config.parser());
    }
}
