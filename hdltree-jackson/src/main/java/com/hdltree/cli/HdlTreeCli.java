package com.hdltree.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hdltree.ParserOptions;
import com.hdltree.SourceException;
import com.hdltree.VhdlParser;
import com.hdltree.ast.DesignFile;
import com.hdltree.extract.DeclarationParser;
import com.hdltree.extract.ExtractionResult;
import com.hdltree.extract.HdlDialect;
import com.hdltree.jackson.HdlTreeJackson;
import com.hdltree.render.Reconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Debugging tool: parses VHDL files and prints their AST, declarations, normalized text or
 * concrete parse tree.
 *
 * Usage:
 *   java -cp ... com.hdltree.cli.HdlTreeCli [options] <files-or-dirs...>
 *
 * Options:
 *   --input=PATH          File or directory to process (repeatable)
 *   --exclude=PATH        Skip files under this path (repeatable)
 *   --output=MODE         ast|declarations|text|tree (default: ast)
 *   --parser=NAME         grammar|legacy, used for declarations (default: grammar)
 *   --threads=N           Number of worker threads (default: available processors)
 *   --verify              Check that each AST renders back to the same tokens
 */
public class HdlTreeCli {

    private static final Logger logger = LoggerFactory.getLogger(HdlTreeCli.class);

    private static final ObjectMapper mapper = HdlTreeJackson.createObjectMapper();

    private final Config config;
    private final VhdlParser parser = new VhdlParser(ParserOptions.DEFAULTS);

    public static void main(String[] args) {
        Config config = Config.parse(args, System.err);
        if (config == null) {
            printUsage(System.err);
            System.exit(2);
        }
        if (config.help) {
            printUsage(System.out);
            System.exit(0);
        }
        try {
            System.exit(new HdlTreeCli(config).run(System.out, System.err));
        } catch (Exception e) {
            System.err.println("Fatal error: " + e.getMessage());
            logger.error("Fatal error", e);
            System.exit(1);
        }
    }

    public HdlTreeCli(Config config) {
        this.config = config;
    }

    /**
     * Processes every discovered file on a fixed thread pool and prints results in input order.
     *
     * @return 0 when every file succeeded, 1 otherwise
     */
    public int run(PrintStream out, PrintStream err) throws IOException, InterruptedException {
        List<Path> files = discoverFiles(err);
        logger.debug("Processing {} file(s) on {} thread(s)", files.size(), config.threads);

        ExecutorService executor = Executors.newFixedThreadPool(config.threads);
        List<Future<FileResult>> futures = new ArrayList<>();
        try {
            for (Path file : files) {
                futures.add(executor.submit(() -> processFile(file)));
            }
            int failed = 0;
            for (Future<FileResult> future : futures) {
                FileResult result;
                try {
                    result = future.get();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Worker failed unexpectedly", e.getCause());
                }
                if (result.error() != null) {
                    failed++;
                    err.println(result.error());
                } else {
                    if (files.size() > 1) {
                        out.println("==> " + result.path() + " <==");
                    }
                    out.println(result.output());
                }
            }
            if (failed > 0) {
                err.println(failed + " of " + files.size() + " file(s) failed");
            }
            return failed > 0 ? 1 : 0;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileResult processFile(Path file) {
        try {
            String source = Files.readString(file, StandardCharsets.ISO_8859_1);
            return new FileResult(file, render(file, source), null);
        } catch (SourceException e) {
            return new FileResult(file, null, file + ":" + e.getSpan().position() + ": " + e.getMessage());
        } catch (IOException e) {
            return new FileResult(file, null, file + ": cannot read: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.debug("Failed on {}", file, e);
            return new FileResult(file, null, file + ": " + e.getMessage());
        }
    }

    private String render(Path file, String source) throws IOException {
        HdlDialect dialect = HdlDialect.fromPath(file).orElse(HdlDialect.VHDL);
        if (config.output == Output.DECLARATIONS) {
            DeclarationParser declarations = dialect == HdlDialect.VHDL
                ? DeclarationParser.named(config.parser)
                : DeclarationParser.forDialect(dialect);
            ExtractionResult result = declarations.parseDeclarations(source);
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        }
        if (dialect != HdlDialect.VHDL) {
            throw new IllegalStateException("Only declarations are available for " + dialect);
        }
        if (config.output == Output.TREE) {
            return parser.parseTree(source).dump();
        }
        DesignFile designFile = parser.parse(source);
        if (config.verify) {
            Reconstructor.verify(source, designFile);
        }
        if (config.output == Output.TEXT) {
            return Reconstructor.render(designFile, Reconstructor.Mode.NORMALIZED);
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(designFile);
    }

    private List<Path> discoverFiles(PrintStream err) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : config.inputs) {
            if (!Files.exists(input)) {
                err.println("Warning: input does not exist: " + input);
                continue;
            }
            if (Files.isRegularFile(input)) {
                if (!isExcluded(input)) {
                    files.add(input);
                }
                continue;
            }
            try (Stream<Path> paths = Files.walk(input)) {
                files.addAll(paths.filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .filter(p -> !isExcluded(p))
                    .sorted()
                    .collect(Collectors.toList()));
            }
        }
        return files;
    }

    private boolean isSupported(Path path) {
        Optional<HdlDialect> dialect = HdlDialect.fromPath(path);
        if (dialect.isEmpty()) {
            return false;
        }
        if (dialect.get() == HdlDialect.VHDL) {
            return true;
        }
        return config.output == Output.DECLARATIONS && DeclarationParser.available().stream()
            .anyMatch(p -> p.dialect() == dialect.get());
    }

    private boolean isExcluded(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return config.excludes.stream().anyMatch(e -> normalized.startsWith(e.toAbsolutePath().normalize()));
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: HdlTreeCli [options] <files-or-dirs...>");
        out.println();
        out.println("Options:");
        out.println("  --input=PATH          File or directory to process (repeatable)");
        out.println("  --exclude=PATH        Skip files under this path (repeatable)");
        out.println("  --output=MODE         ast|declarations|text|tree (default: ast)");
        out.println("  --parser=NAME         grammar|legacy declaration parser (default: grammar)");
        out.println("  --threads=N           Number of worker threads (default: CPU count)");
        out.println("  --verify              Check exact reconstruction of every parsed file");
        out.println("  --help                Show this help");
        out.println();
        out.println("Examples:");
        out.println("  HdlTreeCli --output=declarations rtl/");
        out.println("  HdlTreeCli --output=tree --verify counter.vhd");
    }

    // ========== Inner classes ==========

    public enum Output {
        AST, DECLARATIONS, TEXT, TREE
    }

    private record FileResult(Path path, String output, String error) {}

    public static class Config {
        Output output = Output.AST;
        String parser = "grammar";
        int threads = Runtime.getRuntime().availableProcessors();
        boolean verify = false;
        boolean help = false;
        List<Path> inputs = new ArrayList<>();
        List<Path> excludes = new ArrayList<>();

        /**
         * @return the configuration, or null when the arguments are invalid; after {@code --help}
         *         a configuration with {@link #help()} set
         */
        public static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                    return config;
                } else if (arg.startsWith("--input=")) {
                    config.inputs.add(Path.of(arg.substring(8)));
                } else if (arg.startsWith("--exclude=")) {
                    config.excludes.add(Path.of(arg.substring(10)));
                } else if (arg.startsWith("--output=")) {
                    String output = arg.substring(9).toUpperCase(Locale.ROOT);
                    try {
                        config.output = Output.valueOf(output);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid output: " + arg.substring(9));
                        return null;
                    }
                } else if (arg.startsWith("--parser=")) {
                    config.parser = arg.substring(9);
                } else if (arg.startsWith("--threads=")) {
                    try {
                        config.threads = Math.max(1, Integer.parseInt(arg.substring(10)));
                    } catch (NumberFormatException e) {
                        err.println("Invalid thread count: " + arg.substring(10));
                        return null;
                    }
                } else if (arg.equals("--verify")) {
                    config.verify = true;
                } else if (!arg.startsWith("-")) {
                    config.inputs.add(Path.of(arg));
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.inputs.isEmpty()) {
                err.println("Error: No input files specified");
                return null;
            }

            return config;
        }

        public Output output() {
            return output;
        }

        public String parser() {
            return parser;
        }

        public int threads() {
            return threads;
        }

        public boolean verify() {
            return verify;
        }

        public boolean help() {
            return help;
        }

        public List<Path> inputs() {
            return inputs;
        }
    }
}
