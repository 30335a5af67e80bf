package com.hdltree.extract;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Source languages a {@link DeclarationParser} can handle, recognized by file extension.
 */
public enum HdlDialect {
    VHDL(Set.of("vhd", "vhdl", "vht")),
    VERILOG(Set.of("v", "vh", "verilog", "vlg", "vo", "vqm", "vt", "veo", "sv", "svh", "vlog"));

    private final Set<String> extensions;

    HdlDialect(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> extensions() {
        return extensions;
    }

    public static Optional<HdlDialect> fromPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (HdlDialect dialect : values()) {
            if (dialect.extensions.contains(extension)) {
                return Optional.of(dialect);
            }
        }
        return Optional.empty();
    }
}
