package com.hdltree.extract;

import com.hdltree.Span;

import java.util.List;

/**
 * Interface summary of one entity, component or package, with all type and value text
 * taken verbatim from the source.
 *
 * @param container for components, the package or architecture that declares them
 * @param body      true for a package body
 */
public record DeclarationRecord(
    Kind kind,
    String name,
    String library,
    boolean body,
    String container,
    List<GenericRecord> generics,
    List<PortRecord> ports,
    List<TypeRecord> types,
    List<SubtypeRecord> subtypes,
    List<ConstantRecord> constants,
    List<SubprogramRecord> subprograms,
    Span span
) {

    public enum Kind {
        ENTITY, COMPONENT, PACKAGE
    }

    public DeclarationRecord {
        generics = List.copyOf(generics);
        ports = List.copyOf(ports);
        types = List.copyOf(types);
        subtypes = List.copyOf(subtypes);
        constants = List.copyOf(constants);
        subprograms = List.copyOf(subprograms);
    }

    public GenericRecord generic(String name) {
        return generics.stream().filter(g -> g.name().equalsIgnoreCase(name)).findFirst().orElse(null);
    }

    public PortRecord port(String name) {
        return ports.stream().filter(p -> p.name().equalsIgnoreCase(name)).findFirst().orElse(null);
    }
}
