package com.hdltree.transform;

import com.hdltree.Span;
import com.hdltree.Token;
import com.hdltree.UnsupportedConstruct;
import com.hdltree.ast.*;
import com.hdltree.render.Reconstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.hdltree.TokenType.*;

/**
 * AST builders for the VHDL grammar, keyed by rule name.
 *
 * Collapsing rules only need a builder for the alternatives that do not simply pass one
 * child through; transparent rules need none.
 */
final class VhdlAstBuilders {

    /** Left in place of a construct that lenient transformation dropped. */
    static final Object DROPPED = new Object();

    private VhdlAstBuilders() {
    }

    static Map<String, AstBuilder> create() {
        Map<String, AstBuilder> builders = new HashMap<>();
        designUnits(builders);
        interfaces(builders);
        declarations(builders);
        types(builders);
        concurrentStatements(builders);
        sequentialStatements(builders);
        expressions(builders);
        return Map.copyOf(builders);
    }

    // ========================================================================
    // Design units
    // ========================================================================

    private static void designUnits(Map<String, AstBuilder> b) {
        b.put("design_file", c -> {
            Token eof = c.token(EOF);
            Span span = eof == null ? c.span() : Span.cover(c.span(), eof.span());
            return new DesignFile(span, c.tokens(), c.nodes(DesignUnit.class));
        });
        b.put("design_unit", c -> new DesignUnit(c.span(), c.tokens(),
            c.nodes(ContextItem.class), c.node(LibraryUnit.class)));
        b.put("stray_declaration", c -> {
            Node declaration = (Node) c.all().get(c.all().size() - 1);
            c.unsupported(new UnsupportedConstruct(declaration.type(), declaration.span(),
                "declaration outside of any design unit"));
            return DROPPED;
        });

        b.put("library_clause", c -> new LibraryClause(c.span(), c.tokens(), c.nodes(Identifier.class)));
        b.put("use_clause", c -> new UseClause(c.span(), c.tokens(), c.nodes(Name.class)));
        b.put("context_reference", c -> new ContextReference(c.span(), c.tokens(), c.nodes(Name.class)));
        b.put("selected_name", c -> selectedChain(c.tokens()));

        b.put("entity_declaration", c -> new EntityDeclaration(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(GenericClause.class), c.node(PortClause.class),
            c.nodes(Declaration.class), c.nodes(ConcurrentStatement.class), c.endLabel()));
        b.put("architecture_body", c -> new ArchitectureBody(c.span(), c.tokens(),
            c.node(Identifier.class), c.nodeAfter(OF, Identifier.class),
            c.nodes(Declaration.class), c.nodes(ConcurrentStatement.class), c.endLabel()));
        b.put("package_declaration", c -> new PackageDeclaration(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(GenericClause.class), c.node(GenericMapAspect.class),
            c.nodes(Declaration.class), c.endLabel()));
        b.put("package_body", c -> new PackageBody(c.span(), c.tokens(),
            c.node(Identifier.class), c.nodes(Declaration.class), c.endLabel()));
        b.put("package_instantiation", c -> new PackageInstantiation(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(Name.class), c.node(GenericMapAspect.class)));
        b.put("context_declaration", c -> new ContextDeclaration(c.span(), c.tokens(),
            c.node(Identifier.class), c.nodes(ContextItem.class), c.endLabel()));

        b.put("configuration_declaration", c -> new ConfigurationDeclaration(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(Name.class), c.nodes(Declaration.class),
            c.node(BlockConfiguration.class), c.endLabel()));
        b.put("block_configuration", c -> {
            List<Node> items = new ArrayList<>();
            for (Object value : c.all()) {
                if (value instanceof BlockConfiguration || value instanceof ComponentConfiguration) {
                    items.add((Node) value);
                }
            }
            return new BlockConfiguration(c.span(), c.tokens(), c.node(Name.class),
                c.nodes(UseClause.class), List.copyOf(items));
        });
        b.put("component_configuration", c -> new ComponentConfiguration(c.span(), c.tokens(),
            c.nodesBefore(COLON, Identifier.class), c.keyword(OTHERS, ALL), c.nodeAfter(COLON, Name.class),
            c.node(BindingIndication.class), c.node(BlockConfiguration.class)));
        b.put("binding_indication", c -> new BindingIndication(c.span(), c.tokens(),
            c.node(EntityAspect.class), c.node(GenericMapAspect.class), c.node(PortMapAspect.class)));
        b.put("entity_aspect", c -> new EntityAspect(c.span(), c.tokens(),
            c.label(), c.node(Name.class), c.node(Identifier.class)));
    }

    // ========================================================================
    // Interfaces and associations
    // ========================================================================

    private static void interfaces(Map<String, AstBuilder> b) {
        b.put("generic_clause", c -> new GenericClause(c.span(), c.tokens(), c.nodes(InterfaceElement.class)));
        b.put("port_clause", c -> new PortClause(c.span(), c.tokens(), c.nodes(InterfaceElement.class)));
        b.put("interface_object", c -> new InterfaceObject(c.span(), c.tokens(),
            c.keyword(CONSTANT, SIGNAL, VARIABLE, FILE),
            c.nodesBefore(COLON, Identifier.class),
            c.keyword(IN, OUT, INOUT, BUFFER, LINKAGE),
            c.node(SubtypeIndication.class),
            c.has(BUS),
            c.nodeAfter(VAR_ASSIGN, Expression.class)));
        b.put("interface_type", c -> new InterfaceType(c.span(), c.tokens(), c.node(Identifier.class)));
        b.put("interface_subprogram", c -> new InterfaceSubprogram(c.span(), c.tokens(),
            c.node(SubprogramSpecification.class), c.nodeAfter(IS, Name.class), c.has(BOX)));
        b.put("interface_package", c -> new InterfacePackage(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(Name.class),
            c.has(BOX) ? "box" : c.has(DEFAULT) ? "default" : "associations",
            c.nodes(AssociationElement.class)));

        b.put("generic_map_aspect", c -> new GenericMapAspect(c.span(), c.tokens(), c.nodes(AssociationElement.class)));
        b.put("port_map_aspect", c -> new PortMapAspect(c.span(), c.tokens(), c.nodes(AssociationElement.class)));
        b.put("association_element", c -> {
            boolean named = c.has(ARROW);
            return new AssociationElement(c.span(), c.tokens(),
                named ? c.node(Name.class) : null,
                named ? c.nodeAfter(ARROW, Expression.class) : c.node(Expression.class),
                c.has(OPEN),
                c.has(INERTIAL));
        });
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private static void declarations(Map<String, AstBuilder> b) {
        b.put("identifier", VhdlAstBuilders::identifier);
        b.put("designator", VhdlAstBuilders::identifier);
        b.put("enumeration_literal", VhdlAstBuilders::identifier);

        b.put("subtype_declaration", c -> new SubtypeDeclaration(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(SubtypeIndication.class)));
        b.put("constant_declaration", c -> new ConstantDeclaration(c.span(), c.tokens(),
            c.nodesBefore(COLON, Identifier.class), c.node(SubtypeIndication.class),
            c.nodeAfter(VAR_ASSIGN, Expression.class)));
        b.put("signal_declaration", c -> new SignalDeclaration(c.span(), c.tokens(),
            c.nodesBefore(COLON, Identifier.class), c.node(SubtypeIndication.class),
            c.keyword(REGISTER, BUS), c.nodeAfter(VAR_ASSIGN, Expression.class)));
        b.put("variable_declaration", c -> new VariableDeclaration(c.span(), c.tokens(),
            c.has(SHARED), c.nodesBefore(COLON, Identifier.class), c.node(SubtypeIndication.class),
            c.nodeAfter(VAR_ASSIGN, Expression.class)));
        b.put("file_declaration", c -> new FileDeclaration(c.span(), c.tokens(),
            c.nodesBefore(COLON, Identifier.class), c.node(SubtypeIndication.class),
            c.nodeAfter(OPEN, Expression.class), c.nodeAfter(IS, Expression.class)));
        b.put("alias_declaration", c -> new AliasDeclaration(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(SubtypeIndication.class), c.nodeAfter(IS, Name.class),
            c.node(Signature.class)));
        b.put("attribute_declaration", c -> new AttributeDeclaration(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(Name.class)));
        b.put("attribute_specification", c -> new AttributeSpecification(c.span(), c.tokens(),
            c.node(Identifier.class),
            c.nodesAfter(OF, Identifier.class),
            c.nodes(Signature.class),
            c.keyword(OTHERS, ALL),
            c.tokenAfter(COLON).type().text(),
            c.nodeAfter(IS, Expression.class)));
        b.put("component_declaration", c -> new ComponentDeclaration(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(GenericClause.class), c.node(PortClause.class), c.endLabel()));
        b.put("configuration_specification", c -> new ConfigurationSpecification(c.span(), c.tokens(),
            c.nodesBefore(COLON, Identifier.class), c.keyword(OTHERS, ALL), c.nodeAfter(COLON, Name.class),
            c.node(BindingIndication.class)));

        b.put("subprogram_specification", c -> new SubprogramSpecification(c.span(), c.tokens(),
            c.label(),
            c.keyword(PURE, IMPURE),
            c.node(Identifier.class),
            c.node(SubprogramHeader.class),
            c.nodes(InterfaceElement.class),
            c.nodeAfter(RETURN, Name.class)));
        b.put("subprogram_header", c -> new SubprogramHeader(c.span(), c.tokens(),
            c.nodes(InterfaceElement.class), c.node(GenericMapAspect.class)));
        b.put("subprogram_declaration", c -> new SubprogramDeclaration(c.span(), c.tokens(),
            c.node(SubprogramSpecification.class)));
        b.put("subprogram_body", c -> new SubprogramBody(c.span(), c.tokens(),
            c.node(SubprogramSpecification.class), c.nodes(Declaration.class),
            c.nodes(SequentialStatement.class), c.endLabel()));
        b.put("subprogram_instantiation", c -> new SubprogramInstantiation(c.span(), c.tokens(),
            c.keyword(PROCEDURE, FUNCTION), c.node(Identifier.class), c.node(Name.class),
            c.node(Signature.class), c.node(GenericMapAspect.class)));
        b.put("signature", c -> new Signature(c.span(), c.tokens(),
            c.nodesBefore(RETURN, Name.class), c.nodeAfter(RETURN, Name.class)));
    }

    // ========================================================================
    // Types
    // ========================================================================

    private static void types(Map<String, AstBuilder> b) {
        b.put("type_declaration", c -> new TypeDeclaration(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(TypeDefinition.class)));
        b.put("enumeration_type_definition", c -> new EnumerationTypeDefinition(c.span(), c.tokens(),
            c.nodes(Identifier.class)));
        b.put("range_type_definition", c -> new RangeTypeDefinition(c.span(), c.tokens(),
            c.node(DiscreteRange.class)));
        b.put("physical_type_definition", c -> new PhysicalTypeDefinition(c.span(), c.tokens(),
            c.node(DiscreteRange.class), c.nodeAfter(UNITS, Identifier.class),
            c.nodes(SecondaryUnit.class), c.endLabel()));
        b.put("secondary_unit", c -> new SecondaryUnit(c.span(), c.tokens(),
            c.node(Identifier.class), c.node(Literal.class)));
        b.put("array_type_definition", c -> new ArrayTypeDefinition(c.span(), c.tokens(),
            c.nodesBefore(OF, Node.class), c.nodeAfter(OF, SubtypeIndication.class)));
        b.put("unbounded_range", c -> new UnboundedRange(c.span(), c.tokens(), c.node(Name.class)));
        b.put("record_type_definition", c -> new RecordTypeDefinition(c.span(), c.tokens(),
            c.nodes(ElementDeclaration.class), c.endLabel()));
        b.put("element_declaration", c -> new ElementDeclaration(c.span(), c.tokens(),
            c.nodes(Identifier.class), c.node(SubtypeIndication.class)));
        b.put("access_type_definition", c -> new AccessTypeDefinition(c.span(), c.tokens(),
            c.node(SubtypeIndication.class)));
        b.put("file_type_definition", c -> new FileTypeDefinition(c.span(), c.tokens(), c.node(Name.class)));
        b.put("protected_type_declaration", c -> new ProtectedTypeDeclaration(c.span(), c.tokens(),
            c.nodes(Declaration.class), c.endLabel()));
        b.put("protected_type_body", c -> new ProtectedTypeBody(c.span(), c.tokens(),
            c.nodes(Declaration.class), c.endLabel()));

        b.put("subtype_indication", c -> {
            List<Name> marks = c.nodes(Name.class);
            boolean element = c.is("element_resolved");
            boolean resolved = element || c.is("resolved");
            return new SubtypeIndication(c.span(), c.tokens(),
                resolved ? marks.get(0) : null,
                element,
                marks.get(resolved ? 1 : 0),
                c.nodes(Constraint.class));
        });
        b.put("range_constraint", c -> new RangeConstraint(c.span(), c.tokens(), c.node(DiscreteRange.class)));
        b.put("index_constraint", c -> new IndexConstraint(c.span(), c.tokens(),
            c.nodes(DiscreteRange.class), c.is("open")));
        b.put("type_mark", c -> selectedChain(c.tokens()));
        b.put("discrete_range", c -> c.node(DiscreteRange.class));
        b.put("range_spec", c -> {
            if (c.is("explicit")) {
                List<Expression> bounds = c.nodes(Expression.class);
                return new RangeExpression(c.span(), c.tokens(), bounds.get(0), c.keyword(TO, DOWNTO), bounds.get(1));
            }
            return new AttributeName(c.span(), c.tokens(), c.node(Name.class),
                c.tokenAfter(TICK).lexeme(), c.nodeAfter(LPAREN, Expression.class));
        });
    }

    // ========================================================================
    // Concurrent statements
    // ========================================================================

    private static void concurrentStatements(Map<String, AstBuilder> b) {
        b.put("process_statement", c -> new ProcessStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.has(POSTPONED), c.has(ALL), c.nodes(Name.class),
            c.nodes(Declaration.class), c.nodes(SequentialStatement.class), c.endLabel()));
        b.put("block_statement", c -> new BlockStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.node(Expression.class),
            c.node(GenericClause.class), c.node(GenericMapAspect.class),
            c.node(PortClause.class), c.node(PortMapAspect.class),
            c.nodes(Declaration.class), c.nodes(ConcurrentStatement.class), c.endLabel()));
        b.put("component_instantiation", c -> new ComponentInstantiation(c.span(), c.tokens(),
            c.leadingLabel(), c.label(), c.node(Name.class), c.nodeAfter(LPAREN, Identifier.class),
            c.node(GenericMapAspect.class), c.node(PortMapAspect.class)));

        b.put("generate_statement", c -> {
            boolean loop = c.is("for");
            return new GenerateStatement(c.span(), c.tokens(),
                c.leadingLabel(),
                c.label(),
                loop ? c.nodeAfter(FOR, Identifier.class) : null,
                loop ? c.nodeAfter(IN, DiscreteRange.class) : null,
                c.nodeAfter(CASE, Expression.class),
                c.node(GenerateBody.class),
                c.nodes(GenerateBranch.class),
                c.endLabel());
        });
        AstBuilder conditionBranch = c -> new GenerateBranch(c.span(), c.tokens(),
            c.leadingLabel(), c.node(Expression.class), List.of(), c.node(GenerateBody.class));
        b.put("if_generate_branch", conditionBranch);
        b.put("elsif_generate_branch", conditionBranch);
        b.put("else_generate_branch", c -> new GenerateBranch(c.span(), c.tokens(),
            c.leadingLabel(), null, List.of(), c.node(GenerateBody.class)));
        b.put("case_generate_branch", c -> new GenerateBranch(c.span(), c.tokens(),
            c.leadingLabel(), null, c.nodesBefore(ARROW, Expression.class), c.node(GenerateBody.class)));
        b.put("generate_body", c -> new GenerateBody(c.span(), c.tokens(),
            c.nodes(Declaration.class), c.nodes(ConcurrentStatement.class), c.endLabel()));

        b.put("signal_assignment", c -> {
            boolean selected = c.is("selected");
            List<Node> waveforms = new ArrayList<>();
            for (Object value : c.all()) {
                if (value instanceof Waveform || value instanceof ConditionalWaveform || value instanceof SelectedWaveform) {
                    waveforms.add((Node) value);
                }
            }
            return new SignalAssignment(c.span(), c.tokens(),
                c.leadingLabel(),
                c.label(),
                c.has(POSTPONED),
                c.has(GUARDED),
                selected ? c.nodeAfter(WITH, Expression.class) : null,
                c.has(QUESTION),
                selected ? c.nodeAfter(SELECT, Expression.class) : c.node(Expression.class),
                c.node(DelayMechanism.class),
                List.copyOf(waveforms));
        });
        b.put("delay_mechanism", c -> new DelayMechanism(c.span(), c.tokens(), c.label(), c.node(Expression.class)));
        b.put("waveform", c -> new Waveform(c.span(), c.tokens(), c.nodes(WaveformElement.class), c.has(UNAFFECTED)));
        b.put("waveform_element", c -> new WaveformElement(c.span(), c.tokens(),
            c.node(Expression.class), c.nodeAfter(AFTER, Expression.class)));
        b.put("conditional_waveform", c -> new ConditionalWaveform(c.span(), c.tokens(),
            c.node(Waveform.class), c.nodeAfter(WHEN, Expression.class)));
        b.put("selected_waveform", c -> new SelectedWaveform(c.span(), c.tokens(),
            c.node(Waveform.class), c.nodesAfter(WHEN, Expression.class)));

        b.put("assertion_statement", c -> new AssertionStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.has(POSTPONED), c.nodeAfter(ASSERT, Expression.class),
            c.nodeAfter(REPORT, Expression.class), c.nodeAfter(SEVERITY, Expression.class)));
        b.put("procedure_call_statement", c -> new ProcedureCall(c.span(), c.tokens(),
            c.leadingLabel(), c.has(POSTPONED), c.node(Name.class), c.nodes(AssociationElement.class)));
    }

    // ========================================================================
    // Sequential statements
    // ========================================================================

    private static void sequentialStatements(Map<String, AstBuilder> b) {
        b.put("wait_statement", c -> new WaitStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.listAfter(ON, Name.class),
            c.nodeAfter(UNTIL, Expression.class), c.nodeAfter(FOR, Expression.class)));
        b.put("report_statement", c -> new ReportStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.nodeAfter(REPORT, Expression.class), c.nodeAfter(SEVERITY, Expression.class)));
        b.put("variable_assignment", c -> new VariableAssignment(c.span(), c.tokens(),
            c.leadingLabel(), c.node(Expression.class), c.nodesAfter(VAR_ASSIGN, Node.class)));
        b.put("conditional_value", c -> new ConditionalValue(c.span(), c.tokens(),
            c.node(Expression.class), c.nodeAfter(WHEN, Expression.class)));

        b.put("if_statement", c -> new IfStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.nodes(IfBranch.class), c.endLabel()));
        AstBuilder conditionBranch = c -> new IfBranch(c.span(), c.tokens(),
            c.node(Expression.class), c.nodes(SequentialStatement.class));
        b.put("if_branch", conditionBranch);
        b.put("elsif_branch", conditionBranch);
        b.put("else_branch", c -> new IfBranch(c.span(), c.tokens(), null, c.nodes(SequentialStatement.class)));

        b.put("case_statement", c -> new CaseStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.has(QUESTION), c.nodeAfter(CASE, Expression.class),
            c.nodes(CaseAlternative.class), c.endLabel()));
        b.put("case_alternative", c -> new CaseAlternative(c.span(), c.tokens(),
            c.nodesBefore(ARROW, Expression.class), c.nodes(SequentialStatement.class)));
        b.put("loop_statement", c -> new LoopStatement(c.span(), c.tokens(),
            c.leadingLabel(),
            c.has(WHILE) ? "while" : c.has(FOR) ? "for" : "loop",
            c.nodeAfter(WHILE, Expression.class),
            c.nodeAfter(FOR, Identifier.class),
            c.nodeAfter(IN, DiscreteRange.class),
            c.nodes(SequentialStatement.class),
            c.endLabel()));
        b.put("next_statement", c -> new NextStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.nodeAfter(NEXT, Identifier.class), c.nodeAfter(WHEN, Expression.class)));
        b.put("exit_statement", c -> new ExitStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.nodeAfter(EXIT, Identifier.class), c.nodeAfter(WHEN, Expression.class)));
        b.put("return_statement", c -> new ReturnStatement(c.span(), c.tokens(),
            c.leadingLabel(), c.node(Expression.class)));
        b.put("null_statement", c -> new NullStatement(c.span(), c.tokens(), c.leadingLabel()));
    }

    // ========================================================================
    // Expressions and names
    // ========================================================================

    private static void expressions(Map<String, AstBuilder> b) {
        b.put("expression", c -> {
            if (c.is("condition")) {
                return new UnaryExpression(c.span(), c.tokens(), "??", c.node(Expression.class));
            }
            return binaryChain(c.all(), 1, (Expression) c.all().get(0));
        });
        b.put("relation", c -> binaryChain(c.all(), 1, (Expression) c.all().get(0)));
        b.put("shift_expression", c -> binaryChain(c.all(), 1, (Expression) c.all().get(0)));
        b.put("term", c -> binaryChain(c.all(), 1, (Expression) c.all().get(0)));
        b.put("simple_expression", c -> {
            List<Object> all = c.all();
            if (all.get(0) instanceof Token sign) {
                Expression operand = (Expression) all.get(1);
                Expression signed = new UnaryExpression(Span.cover(sign.span(), operand.span()),
                    List.of(sign), operator(sign), operand);
                return binaryChain(all, 2, signed);
            }
            return binaryChain(all, 1, (Expression) all.get(0));
        });
        b.put("factor", c -> {
            if (c.is("power")) {
                return binaryChain(c.all(), 1, (Expression) c.all().get(0));
            }
            Token operator = c.tokens().get(0);
            return new UnaryExpression(c.span(), c.tokens(), operator(operator), c.node(Expression.class));
        });
        b.put("primary", c -> {
            if (c.is("parenthesized")) {
                return new ParenthesizedExpression(c.span(), c.tokens(), c.node(Expression.class));
            }
            return c.node(Node.class);
        });

        b.put("name", VhdlAstBuilders::name);
        b.put("name_suffix", c -> {
            List<Token> tokens = c.tokens();
            String kind = c.label();
            boolean designated = kind.equals("selected") || kind.equals("attribute");
            return new NameSuffix(kind, c.span(), tokens,
                designated ? tokens.get(1).lexeme() : null,
                kind.equals("index") ? c.nodes(Expression.class) : List.of(),
                kind.equals("slice") ? c.node(DiscreteRange.class) : null);
        });
        b.put("function_call", c -> {
            if (c.is("operator")) {
                Token symbol = c.tokens().get(0);
                Name function = new SimpleName(symbol.span(), List.of(symbol), symbol.lexeme());
                return new FunctionCall(c.span(), c.tokens().subList(1, c.tokens().size()),
                    function, c.nodes(AssociationElement.class));
            }
            return new FunctionCall(c.span(), c.tokens(), c.node(Name.class), c.nodes(AssociationElement.class));
        });

        b.put("literal", c -> {
            List<Token> tokens = c.tokens();
            boolean physical = c.is("physical");
            return new Literal(c.span(), tokens, c.label(), tokens.get(0).lexeme(),
                physical ? tokens.get(1).lexeme() : null);
        });
        b.put("aggregate", c -> new Aggregate(c.span(), c.tokens(), c.nodes(ElementAssociation.class)));
        b.put("named_association", c -> new ElementAssociation(c.span(), c.tokens(),
            c.nodesBefore(ARROW, Expression.class), c.nodeAfter(ARROW, Expression.class)));
        b.put("positional_association", c -> new ElementAssociation(c.span(), c.tokens(),
            List.of(), c.node(Expression.class)));
        b.put("choice", c -> {
            if (c.is("others")) {
                return new Others(c.span(), c.tokens());
            }
            return c.node(Expression.class);
        });

        b.put("qualified_expression", c -> new QualifiedExpression(c.span(), c.tokens(),
            c.node(Name.class), c.nodeAfter(TICK, Expression.class)));
        b.put("allocator", c -> new Allocator(c.span(), c.tokens(), c.node(Node.class)));
        b.put("external_name", VhdlAstBuilders::externalName);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static Identifier identifier(Children c) {
        List<Token> tokens = c.tokens();
        return new Identifier(c.span(), tokens, tokens.get(0).lexeme());
    }

    /**
     * Left-associative fold of {@code operand (operator operand)*} starting at {@code from}.
     */
    private static Expression binaryChain(List<Object> values, int from, Expression first) {
        Expression result = first;
        for (int i = from; i + 1 < values.size(); i += 2) {
            Token operator = (Token) values.get(i);
            Expression right = (Expression) values.get(i + 1);
            result = new BinaryExpression(Span.cover(result.span(), right.span()), List.of(operator),
                result, operator(operator), right);
        }
        return result;
    }

    private static String operator(Token token) {
        return token.type().text();
    }

    /**
     * {@code a.b.c} from its tokens, as nested selected names over a simple name.
     */
    private static Name selectedChain(List<Token> tokens) {
        Token first = tokens.get(0);
        Name name = new SimpleName(first.span(), List.of(first), first.lexeme());
        for (int i = 1; i + 1 < tokens.size(); i += 2) {
            Token dot = tokens.get(i);
            Token suffix = tokens.get(i + 1);
            name = new SelectedName(Span.cover(name.span(), suffix.span()), List.of(dot, suffix), name, suffix.lexeme());
        }
        return name;
    }

    private static Name name(Children c) {
        List<Object> all = c.all();
        Token first = (Token) all.get(0);
        Name name = new SimpleName(first.span(), List.of(first), first.lexeme());
        for (int i = 1; i < all.size(); i++) {
            NameSuffix suffix = (NameSuffix) all.get(i);
            Span span = Span.cover(name.span(), suffix.span());
            switch (suffix.kind()) {
                case "selected" -> name = new SelectedName(span, suffix.tokens(), name, suffix.designator());
                case "index" -> name = new IndexedName(span, suffix.tokens(), name, suffix.indexes());
                case "slice" -> name = new SliceName(span, suffix.tokens(), name, suffix.range());
                case "attribute" -> name = new AttributeName(span, suffix.tokens(), name, suffix.designator(), null);
                default -> throw new IllegalStateException("Unknown name suffix " + suffix.kind());
            }
        }
        return name;
    }

    private static ExternalName externalName(Children c) {
        StringBuilder path = new StringBuilder();
        boolean inPath = false;
        for (Object value : c.all()) {
            if (value instanceof Token token) {
                if (token.is(COLON)) {
                    break;
                }
                if (inPath) {
                    path.append(token.lexeme());
                }
                if (token.is(CONSTANT) || token.is(SIGNAL) || token.is(VARIABLE)) {
                    inPath = true;
                }
            } else if (inPath && value instanceof Expression index) {
                path.append(Reconstructor.text(index));
            }
        }
        return new ExternalName(c.span(), c.tokens(), c.keyword(CONSTANT, SIGNAL, VARIABLE), path.toString(),
            c.nodesBefore(COLON, Expression.class), c.node(SubtypeIndication.class));
    }
}
