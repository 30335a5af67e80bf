package com.hdltree.extract;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Names of types known to be arrays, so diagram tools can draw bus ports differently.
 *
 * Starts with the standard vector types and learns array type declarations and subtypes of
 * known arrays from extraction results. Names are compared case-insensitively. Not thread safe.
 */
public final class ArrayTypeRegistry {

    static final List<String> STANDARD = List.of(
        "std_ulogic_vector", "std_logic_vector", "signed", "unsigned", "bit_vector");

    private final Set<String> arrays = new TreeSet<>();

    public ArrayTypeRegistry() {
        addAll(STANDARD);
    }

    public boolean isArray(String typeName) {
        return typeName != null && arrays.contains(baseName(typeName));
    }

    public void add(String typeName) {
        arrays.add(baseName(typeName));
    }

    public void addAll(Collection<String> typeNames) {
        for (String name : typeNames) {
            add(name);
        }
    }

    /**
     * Records array types declared in {@code result}, then subtypes whose chain of base
     * types ends in a known array.
     */
    public void register(ExtractionResult result) {
        Map<String, String> subtypes = new HashMap<>();
        for (DeclarationRecord record : result.records()) {
            for (TypeRecord type : record.types()) {
                if ("array".equals(type.category())) {
                    add(type.name());
                }
            }
            for (SubtypeRecord subtype : record.subtypes()) {
                subtypes.put(baseName(subtype.name()), baseName(subtype.baseType()));
            }
        }
        for (Map.Entry<String, String> entry : subtypes.entrySet()) {
            String base = entry.getValue();
            Set<String> seen = new TreeSet<>();
            while (subtypes.containsKey(base) && seen.add(base)) {
                base = subtypes.get(base);
            }
            if (arrays.contains(base)) {
                arrays.add(entry.getKey());
            }
        }
    }

    /**
     * Known array names, sorted and lower case.
     */
    public Set<String> arrayTypes() {
        return Set.copyOf(arrays);
    }

    /**
     * Writes one type name per line.
     */
    public void save(Path path) {
        try {
            Files.write(path, arrays, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write array types to " + path, e);
        }
    }

    /**
     * Adds the names from a file written by {@link #save}. Blank lines are ignored.
     */
    public void load(Path path) {
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.ISO_8859_1)) {
                if (!line.isBlank()) {
                    add(line.strip());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read array types from " + path, e);
        }
    }

    /**
     * The type mark alone, lower case: {@code ieee.numeric_std.UNSIGNED(7 downto 0)} and
     * {@code resolved unsigned range 0 to 3} both become {@code unsigned}.
     */
    private static String baseName(String typeName) {
        String name = typeName.strip().toLowerCase(Locale.ROOT);
        if (name.startsWith("(")) {
            name = name.substring(name.indexOf(')') + 1).strip();
        }
        int paren = name.indexOf('(');
        if (paren >= 0) {
            name = name.substring(0, paren).strip();
        }
        int range = name.indexOf(" range ");
        if (range >= 0) {
            name = name.substring(0, range).strip();
        }
        // a resolution function name comes before the type mark
        name = name.substring(name.lastIndexOf(' ') + 1);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }
}
