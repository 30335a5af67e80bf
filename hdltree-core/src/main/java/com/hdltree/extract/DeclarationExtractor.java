package com.hdltree.extract;

import com.hdltree.ParseResult;
import com.hdltree.UnsupportedConstruct;
import com.hdltree.ast.*;
import com.hdltree.render.Reconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds {@link DeclarationRecord}s from a design file: entities with their generics and
 * ports, components (after the unit that declares them), and packages with their types,
 * subtypes, constants and subprograms. Type and value text is the normalized source text,
 * never evaluated.
 *
 * Constructs the records cannot express are skipped with a warning instead of failing the
 * whole extraction. Each call builds fresh records; an extractor can be reused and shared.
 */
public final class DeclarationExtractor {

    private static final Logger logger = LoggerFactory.getLogger(DeclarationExtractor.class);

    static final String DEFAULT_LIBRARY = "work";

    private static final Set<String> STANDARD_LIBRARIES = Set.of("ieee", "std");

    public ExtractionResult extract(DesignFile file) {
        return new Run().extract(file);
    }

    /**
     * Extracts from a lenient parse, carrying its dropped constructs over as warnings.
     */
    public ExtractionResult extract(ParseResult result) {
        Run run = new Run();
        for (UnsupportedConstruct construct : result.unsupported()) {
            run.warn(construct);
        }
        return run.extract(result.designFile());
    }

    private static final class Run {
        private final List<DeclarationRecord> records = new ArrayList<>();
        private final List<UnsupportedConstruct> warnings = new ArrayList<>();

        ExtractionResult extract(DesignFile file) {
            for (DesignUnit unit : file.units()) {
                unit(unit, library(unit));
            }
            return new ExtractionResult(records, warnings);
        }

        private void unit(DesignUnit designUnit, String library) {
            LibraryUnit unit = designUnit.unit();
            if (unit instanceof EntityDeclaration entity) {
                records.add(new DeclarationRecord(DeclarationRecord.Kind.ENTITY, entity.name().text(), library,
                    false, null, generics(entity.generics()), ports(entity.ports()),
                    List.of(), List.of(), List.of(), List.of(), entity.span()));
                components(entity, entity.name().text(), library);
            } else if (unit instanceof ArchitectureBody architecture) {
                components(architecture, architecture.name().text(), library);
            } else if (unit instanceof PackageDeclaration pkg) {
                records.add(packageRecord(pkg.name().text(), library, false, pkg.declarations(), pkg));
                components(pkg, pkg.name().text(), library);
            } else if (unit instanceof PackageBody body) {
                records.add(packageRecord(body.name().text(), library, true, body.declarations(), body));
            } else {
                warn(new UnsupportedConstruct(unit.type(), unit.span(), "no declaration record for this unit"));
            }
        }

        private void components(Node container, String containerName, String library) {
            for (ComponentDeclaration component : Nodes.find(container, ComponentDeclaration.class)) {
                records.add(new DeclarationRecord(DeclarationRecord.Kind.COMPONENT, component.name().text(), library,
                    false, containerName, generics(component.generics()), ports(component.ports()),
                    List.of(), List.of(), List.of(), List.of(), component.span()));
            }
        }

        private DeclarationRecord packageRecord(String name, String library, boolean body,
                                                List<Declaration> declarations, Node unit) {
            List<TypeRecord> types = new ArrayList<>();
            List<SubtypeRecord> subtypes = new ArrayList<>();
            List<ConstantRecord> constants = new ArrayList<>();
            List<SubprogramRecord> subprograms = new ArrayList<>();
            for (Declaration declaration : declarations) {
                if (declaration instanceof TypeDeclaration type) {
                    types.add(new TypeRecord(type.name().text(), category(type.definition()),
                        type.definition() == null ? null : text(type.definition())));
                } else if (declaration instanceof SubtypeDeclaration subtype) {
                    subtypes.add(new SubtypeRecord(subtype.name().text(), text(subtype.subtype()),
                        text(subtype.subtype().typeMark())));
                } else if (declaration instanceof ConstantDeclaration constant) {
                    for (Identifier id : constant.names()) {
                        constants.add(new ConstantRecord(id.text(), text(constant.subtype()), text(constant.value())));
                    }
                } else if (declaration instanceof SubprogramDeclaration subprogram) {
                    subprograms.add(subprogram(subprogram.specification()));
                } else if (declaration instanceof SubprogramBody subprogram) {
                    subprograms.add(subprogram(subprogram.specification()));
                }
            }
            return new DeclarationRecord(DeclarationRecord.Kind.PACKAGE, name, library, body, null,
                List.of(), List.of(), types, subtypes, constants, subprograms, unit.span());
        }

        private List<GenericRecord> generics(GenericClause clause) {
            List<GenericRecord> generics = new ArrayList<>();
            if (clause == null) {
                return generics;
            }
            for (InterfaceElement element : clause.elements()) {
                if (element instanceof InterfaceObject object) {
                    for (Identifier id : object.names()) {
                        generics.add(new GenericRecord(id.text(), "constant", text(object.subtype()),
                            text(object.defaultValue())));
                    }
                } else if (element instanceof InterfaceType type) {
                    generics.add(new GenericRecord(type.name().text(), "type", null, null));
                } else if (element instanceof InterfaceSubprogram subprogram) {
                    generics.add(new GenericRecord(subprogram.specification().designator().text(), "subprogram",
                        null, null));
                } else if (element instanceof InterfacePackage pkg) {
                    generics.add(new GenericRecord(pkg.name().text(), "package", text(pkg.uninstantiated()), null));
                }
            }
            return generics;
        }

        private List<PortRecord> ports(PortClause clause) {
            List<PortRecord> ports = new ArrayList<>();
            if (clause == null) {
                return ports;
            }
            for (InterfaceElement element : clause.elements()) {
                if (!(element instanceof InterfaceObject object)) {
                    warn(new UnsupportedConstruct(element.type(), element.span(), "port is not an object"));
                    continue;
                }
                if ("linkage".equals(object.mode())) {
                    warn(new UnsupportedConstruct("linkage port", object.span(), "linkage ports have no direction"));
                    continue;
                }
                for (Identifier id : object.names()) {
                    ports.add(new PortRecord(id.text(), PortRecord.Direction.of(object.mode()),
                        text(object.subtype()), text(object.defaultValue())));
                }
            }
            return ports;
        }

        private SubprogramRecord subprogram(SubprogramSpecification spec) {
            List<ParameterRecord> parameters = new ArrayList<>();
            for (InterfaceElement element : spec.parameters()) {
                if (!(element instanceof InterfaceObject object)) {
                    warn(new UnsupportedConstruct(element.type(), element.span(), "parameter is not an object"));
                    continue;
                }
                for (Identifier id : object.names()) {
                    parameters.add(new ParameterRecord(id.text(), object.objectClass(),
                        object.mode() == null ? "in" : object.mode(), text(object.subtype()),
                        text(object.defaultValue())));
                }
            }
            return new SubprogramRecord(spec.kind(), spec.designator().text(), parameters, text(spec.returnType()));
        }

        void warn(UnsupportedConstruct construct) {
            logger.warn("Skipping {}", construct);
            warnings.add(construct);
        }
    }

    /**
     * The last non-standard library named in the unit's context clause, else {@code work}.
     */
    private static String library(DesignUnit unit) {
        String library = DEFAULT_LIBRARY;
        for (ContextItem item : unit.contextItems()) {
            if (item instanceof LibraryClause clause) {
                for (Identifier name : clause.names()) {
                    if (!STANDARD_LIBRARIES.contains(name.text().toLowerCase(Locale.ROOT))) {
                        library = name.text();
                    }
                }
            }
        }
        return library;
    }

    private static String category(TypeDefinition definition) {
        if (definition == null) {
            return "incomplete";
        }
        if (definition instanceof EnumerationTypeDefinition) {
            return "enumeration";
        } else if (definition instanceof RangeTypeDefinition) {
            return "range";
        } else if (definition instanceof PhysicalTypeDefinition) {
            return "physical";
        } else if (definition instanceof ArrayTypeDefinition) {
            return "array";
        } else if (definition instanceof RecordTypeDefinition) {
            return "record";
        } else if (definition instanceof AccessTypeDefinition) {
            return "access";
        } else if (definition instanceof FileTypeDefinition) {
            return "file";
        } else if (definition instanceof ProtectedTypeDeclaration) {
            return "protected";
        }
        return "protected_body";
    }

    private static String text(Node node) {
        return node == null ? null : Reconstructor.text(node);
    }
}
