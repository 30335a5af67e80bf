package com.hdltree.extract;

import com.hdltree.UnsupportedConstruct;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Records in source order plus the constructs skipped while producing them.
 */
public record ExtractionResult(List<DeclarationRecord> records, List<UnsupportedConstruct> warnings) {

    public ExtractionResult {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }

    public List<DeclarationRecord> ofKind(DeclarationRecord.Kind kind) {
        return records.stream().filter(r -> r.kind() == kind).collect(Collectors.toList());
    }

    /**
     * First record with the given name, case-insensitively, or null.
     */
    public DeclarationRecord find(String name) {
        return records.stream().filter(r -> r.name().equalsIgnoreCase(name)).findFirst().orElse(null);
    }
}
