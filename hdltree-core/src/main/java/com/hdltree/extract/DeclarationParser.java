package com.hdltree.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Turns source text of one dialect into declaration records.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * DeclarationParser parser = DeclarationParser.forDialect(HdlDialect.VHDL);
 * ExtractionResult result = parser.parseDeclarations(source);
 * }</pre>
 */
public interface DeclarationParser {

    /**
     * Returns the name of this parser (e.g., "grammar", "legacy").
     *
     * @return the parser name
     */
    String getName();

    HdlDialect dialect();

    /**
     * Fallback parsers are only returned when asked for by name.
     */
    default boolean isFallback() {
        return false;
    }

    /**
     * @throws com.hdltree.SourceException if the source cannot be parsed at all
     */
    ExtractionResult parseDeclarations(String source);

    /**
     * Gets the primary parser for a dialect.
     *
     * @throws IllegalStateException if no parser for the dialect is on the classpath
     */
    static DeclarationParser forDialect(HdlDialect dialect) {
        for (DeclarationParser parser : ServiceLoader.load(DeclarationParser.class)) {
            if (parser.dialect() == dialect && !parser.isFallback()) {
                return parser;
            }
        }
        throw new IllegalStateException(
            "No DeclarationParser found for " + dialect + ". " +
            "Add a parser for this dialect to the classpath."
        );
    }

    /**
     * Gets a parser by name.
     *
     * @throws IllegalStateException if no matching parser is found
     */
    static DeclarationParser named(String name) {
        for (DeclarationParser parser : ServiceLoader.load(DeclarationParser.class)) {
            if (parser.getName().equalsIgnoreCase(name)) {
                return parser;
            }
        }
        throw new IllegalStateException("No DeclarationParser found with name '" + name + "'.");
    }

    static List<DeclarationParser> available() {
        List<DeclarationParser> parsers = new ArrayList<>();
        ServiceLoader.load(DeclarationParser.class).forEach(parsers::add);
        return parsers;
    }
}
