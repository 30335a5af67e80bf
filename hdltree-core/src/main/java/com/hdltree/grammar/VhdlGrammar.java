package com.hdltree.grammar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.hdltree.TokenType.*;
import static com.hdltree.grammar.GrammarBuilder.oneOf;
import static com.hdltree.grammar.GrammarBuilder.opt;
import static com.hdltree.grammar.GrammarBuilder.plus;
import static com.hdltree.grammar.GrammarBuilder.sepBy;
import static com.hdltree.grammar.GrammarBuilder.seq;
import static com.hdltree.grammar.GrammarBuilder.star;

/**
 * The VHDL-2008 syntax subset used for declaration extraction and round-tripping.
 *
 * Rule names double as the keys of the AST builders, so renaming a rule here means
 * renaming its builder too. Productions that can match the same tokens as a sibling carry
 * an explicit priority or context preference; everything else is written to be
 * unambiguous.
 */
final class VhdlGrammar {

    private static final Logger logger = LoggerFactory.getLogger(VhdlGrammar.class);

    private VhdlGrammar() {
    }

    static Grammar build() {
        long started = System.nanoTime();
        GrammarBuilder g = new GrammarBuilder();
        designUnits(g);
        interfaces(g);
        declarations(g);
        types(g);
        concurrentStatements(g);
        sequentialStatements(g);
        expressions(g);
        Grammar grammar = g.build("design_file");
        logger.info("Compiled VHDL grammar: {} symbols, {} productions in {} ms",
            grammar.symbolCount(), grammar.productions().size(), (System.nanoTime() - started) / 1_000_000);
        return grammar;
    }

    // ========================================================================
    // Design units
    // ========================================================================

    private static void designUnits(GrammarBuilder g) {
        g.rule("design_file")
            .alt(star(oneOf("design_unit", "stray_declaration")));
        g.rule("design_unit")
            .alt(star("context_item"), "library_unit");
        // Declarations outside any design unit; accepted only to be reported as unsupported
        g.rule("stray_declaration")
            .alt(star("context_item"), oneOf("component_declaration", "subprogram_declaration", "subprogram_body",
                "type_declaration", "subtype_declaration", "constant_declaration", "signal_declaration"));

        g.rule("context_item").inline()
            .alt("library_clause")
            .alt("use_clause")
            .alt("context_reference");
        g.rule("library_clause")
            .alt(LIBRARY, sepBy("identifier", COMMA), SEMICOLON);
        g.rule("use_clause")
            .alt(USE, sepBy("selected_name", COMMA), SEMICOLON);
        g.rule("context_reference")
            .alt(CONTEXT, sepBy("selected_name", COMMA), SEMICOLON);
        g.rule("selected_name")
            .alt(IDENTIFIER, plus(DOT, oneOf(IDENTIFIER, ALL, STRING_LITERAL, CHARACTER_LITERAL)));

        g.rule("library_unit").inline()
            .alt("entity_declaration")
            .alt("architecture_body")
            .alt("package_declaration")
            .alt("package_body")
            .alt("package_instantiation")
            .alt("configuration_declaration")
            .alt("context_declaration");

        g.rule("entity_declaration")
            .alt(ENTITY, "identifier", IS, opt("generic_clause"), opt("port_clause"), star("declarative_item"),
                opt(BEGIN, star("concurrent_statement")), END, opt(ENTITY), opt("identifier"), SEMICOLON);
        g.rule("architecture_body")
            .alt(ARCHITECTURE, "identifier", OF, "identifier", IS, star("declarative_item"),
                BEGIN, star("concurrent_statement"), END, opt(ARCHITECTURE), opt("identifier"), SEMICOLON);
        g.rule("package_declaration")
            .alt(PACKAGE, "identifier", IS, opt("generic_clause", opt("generic_map_aspect", SEMICOLON)),
                star("declarative_item"), END, opt(PACKAGE), opt("identifier"), SEMICOLON);
        g.rule("package_body")
            .alt(PACKAGE, BODY, "identifier", IS, star("declarative_item"),
                END, opt(PACKAGE, BODY), opt("identifier"), SEMICOLON);
        g.rule("package_instantiation")
            .alt(PACKAGE, "identifier", IS, NEW, "type_mark", opt("generic_map_aspect"), SEMICOLON);
        g.rule("context_declaration")
            .alt(CONTEXT, "identifier", IS, star("context_item"), END, opt(CONTEXT), opt("identifier"), SEMICOLON);

        g.rule("configuration_declaration")
            .alt(CONFIGURATION, "identifier", OF, "type_mark", IS, star(oneOf("use_clause", "attribute_specification")),
                "block_configuration", END, opt(CONFIGURATION), opt("identifier"), SEMICOLON);
        g.rule("block_configuration")
            .alt(FOR, "name", star("use_clause"), star(oneOf("block_configuration", "component_configuration")),
                END, FOR, SEMICOLON);
        g.rule("component_configuration")
            .alt(FOR, "component_specification", opt("binding_indication", SEMICOLON), opt("block_configuration"),
                END, FOR, SEMICOLON);
        g.rule("component_specification").inline()
            .alt(oneOf(sepBy("identifier", COMMA), OTHERS, ALL), COLON, "type_mark");
        g.rule("binding_indication")
            .alt(USE, "entity_aspect", opt("generic_map_aspect"), opt("port_map_aspect")).label("use")
            .alt("generic_map_aspect", opt("port_map_aspect")).label("generic_map")
            .alt("port_map_aspect").label("port_map");
        g.rule("entity_aspect")
            .alt(ENTITY, "type_mark", opt(LPAREN, "identifier", RPAREN)).label("entity")
            .alt(CONFIGURATION, "type_mark").label("configuration")
            .alt(OPEN).label("open");
    }

    // ========================================================================
    // Interface lists and association lists
    // ========================================================================

    private static void interfaces(GrammarBuilder g) {
        g.rule("generic_clause")
            .alt(GENERIC, LPAREN, "interface_list", RPAREN, SEMICOLON);
        g.rule("port_clause")
            .alt(PORT, LPAREN, "interface_list", RPAREN, SEMICOLON);
        g.rule("interface_list").inline()
            .alt(sepBy("interface_element", SEMICOLON));
        g.rule("interface_element").inline()
            .alt("interface_object")
            .alt("interface_type")
            .alt("interface_subprogram")
            .alt("interface_package");
        g.rule("interface_object")
            .alt(opt(oneOf(CONSTANT, SIGNAL, VARIABLE, FILE)), sepBy("identifier", COMMA), COLON, opt("mode"),
                "subtype_indication", opt(BUS), opt(VAR_ASSIGN, "expression"));
        g.rule("mode").inline()
            .alt(IN).alt(OUT).alt(INOUT).alt(BUFFER).alt(LINKAGE);
        g.rule("interface_type")
            .alt(TYPE, "identifier");
        g.rule("interface_subprogram")
            .alt("subprogram_specification", opt(IS, oneOf("name", BOX)));
        g.rule("interface_package")
            .alt(PACKAGE, "identifier", IS, NEW, "type_mark", GENERIC, MAP,
                LPAREN, oneOf(BOX, DEFAULT, "association_list"), RPAREN);

        g.rule("generic_map_aspect")
            .alt(GENERIC, MAP, LPAREN, "association_list", RPAREN);
        g.rule("port_map_aspect")
            .alt(PORT, MAP, LPAREN, "association_list", RPAREN);
        g.rule("association_list").inline()
            .alt(sepBy("association_element", COMMA));
        g.rule("association_element")
            .alt(opt("name", ARROW), "actual_part");
        g.rule("actual_part").inline()
            .alt("expression")
            .alt(OPEN)
            .alt(INERTIAL, "expression");
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private static void declarations(GrammarBuilder g) {
        g.rule("declarative_item").inline()
            .alt("type_declaration")
            .alt("subtype_declaration")
            .alt("constant_declaration")
            .alt("signal_declaration")
            .alt("variable_declaration")
            .alt("file_declaration")
            .alt("alias_declaration")
            .alt("attribute_declaration")
            .alt("attribute_specification")
            .alt("component_declaration")
            .alt("subprogram_declaration")
            .alt("subprogram_body")
            .alt("subprogram_instantiation")
            .alt("package_declaration")
            .alt("package_body")
            .alt("package_instantiation")
            .alt("use_clause")
            .alt("configuration_specification");

        g.rule("subtype_declaration")
            .alt(SUBTYPE, "identifier", IS, "subtype_indication", SEMICOLON);
        g.rule("constant_declaration")
            .alt(CONSTANT, sepBy("identifier", COMMA), COLON, "subtype_indication",
                opt(VAR_ASSIGN, "expression"), SEMICOLON);
        g.rule("signal_declaration")
            .alt(SIGNAL, sepBy("identifier", COMMA), COLON, "subtype_indication", opt(oneOf(REGISTER, BUS)),
                opt(VAR_ASSIGN, "expression"), SEMICOLON);
        g.rule("variable_declaration")
            .alt(opt(SHARED), VARIABLE, sepBy("identifier", COMMA), COLON, "subtype_indication",
                opt(VAR_ASSIGN, "expression"), SEMICOLON);
        g.rule("file_declaration")
            .alt(FILE, sepBy("identifier", COMMA), COLON, "subtype_indication",
                opt(opt(OPEN, "expression"), IS, "expression"), SEMICOLON);
        g.rule("alias_declaration")
            .alt(ALIAS, "designator", opt(COLON, "subtype_indication"), IS, "name", opt("signature"), SEMICOLON);
        g.rule("attribute_declaration")
            .alt(ATTRIBUTE, "identifier", COLON, "type_mark", SEMICOLON);
        g.rule("attribute_specification")
            .alt(ATTRIBUTE, "identifier", OF, "entity_name_list", COLON, "entity_class", IS, "expression", SEMICOLON);
        g.rule("entity_name_list").inline()
            .alt(sepBy(seq("designator", opt("signature")), COMMA))
            .alt(OTHERS)
            .alt(ALL);
        g.rule("entity_class").inline()
            .alt(ENTITY).alt(ARCHITECTURE).alt(CONFIGURATION).alt(PROCEDURE).alt(FUNCTION).alt(PACKAGE)
            .alt(TYPE).alt(SUBTYPE).alt(CONSTANT).alt(SIGNAL).alt(VARIABLE).alt(COMPONENT).alt(LABEL)
            .alt(LITERAL).alt(UNITS).alt(GROUP).alt(FILE).alt(PROPERTY).alt(SEQUENCE);
        g.rule("component_declaration")
            .alt(COMPONENT, "identifier", opt(IS), opt("generic_clause"), opt("port_clause"),
                END, COMPONENT, opt("identifier"), SEMICOLON);
        g.rule("configuration_specification")
            .alt(FOR, "component_specification", "binding_indication", SEMICOLON, opt(END, FOR, SEMICOLON));

        g.rule("subprogram_specification")
            .alt(PROCEDURE, "designator", opt("subprogram_header"),
                opt(opt(PARAMETER), LPAREN, "interface_list", RPAREN)).label("procedure")
            .alt(opt(oneOf(PURE, IMPURE)), FUNCTION, "designator", opt("subprogram_header"),
                opt(opt(PARAMETER), LPAREN, "interface_list", RPAREN), RETURN, "type_mark").label("function");
        g.rule("subprogram_header")
            .alt(GENERIC, LPAREN, "interface_list", RPAREN, opt("generic_map_aspect"));
        g.rule("subprogram_declaration")
            .alt("subprogram_specification", SEMICOLON);
        g.rule("subprogram_body")
            .alt("subprogram_specification", IS, star("declarative_item"), BEGIN, star("sequential_statement"),
                END, opt(oneOf(PROCEDURE, FUNCTION)), opt("designator"), SEMICOLON);
        g.rule("subprogram_instantiation")
            .alt(oneOf(PROCEDURE, FUNCTION), "designator", IS, NEW, "type_mark", opt("signature"),
                opt("generic_map_aspect"), SEMICOLON);
        g.rule("signature")
            .alt(LBRACKET, opt(sepBy("type_mark", COMMA)), opt(RETURN, "type_mark"), RBRACKET);

        g.rule("identifier")
            .alt(IDENTIFIER);
        g.rule("designator")
            .alt(IDENTIFIER).alt(STRING_LITERAL).alt(CHARACTER_LITERAL);
        g.rule("label").inline()
            .alt("identifier", COLON);
    }

    // ========================================================================
    // Types and subtype indications
    // ========================================================================

    private static void types(GrammarBuilder g) {
        g.rule("type_declaration")
            .alt(TYPE, "identifier", IS, "type_definition", SEMICOLON).label("full")
            .alt(TYPE, "identifier", SEMICOLON).label("incomplete");
        g.rule("type_definition").inline()
            .alt("enumeration_type_definition")
            .alt("range_type_definition")
            .alt("physical_type_definition")
            .alt("array_type_definition")
            .alt("record_type_definition")
            .alt("access_type_definition")
            .alt("file_type_definition")
            .alt("protected_type_declaration")
            .alt("protected_type_body");
        g.rule("enumeration_type_definition")
            .alt(LPAREN, sepBy("enumeration_literal", COMMA), RPAREN);
        g.rule("enumeration_literal")
            .alt(IDENTIFIER).alt(CHARACTER_LITERAL);
        g.rule("range_type_definition")
            .alt(RANGE, "range_spec");
        g.rule("physical_type_definition")
            .alt(RANGE, "range_spec", UNITS, "identifier", SEMICOLON, star("secondary_unit"),
                END, UNITS, opt("identifier"));
        g.rule("secondary_unit")
            .alt("identifier", EQ, "literal", SEMICOLON);
        g.rule("array_type_definition")
            .alt(ARRAY, LPAREN, sepBy(oneOf("unbounded_range", "discrete_range"), COMMA), RPAREN,
                OF, "subtype_indication");
        g.rule("unbounded_range")
            .alt("type_mark", RANGE, BOX);
        g.rule("record_type_definition")
            .alt(RECORD, plus("element_declaration"), END, RECORD, opt("identifier"));
        g.rule("element_declaration")
            .alt(sepBy("identifier", COMMA), COLON, "subtype_indication", SEMICOLON);
        g.rule("access_type_definition")
            .alt(ACCESS, "subtype_indication");
        g.rule("file_type_definition")
            .alt(FILE, OF, "type_mark");
        g.rule("protected_type_declaration")
            .alt(PROTECTED, star("declarative_item"), END, PROTECTED, opt("identifier"));
        g.rule("protected_type_body")
            .alt(PROTECTED, BODY, star("declarative_item"), END, PROTECTED, BODY, opt("identifier"));

        g.rule("subtype_indication")
            .alt("type_mark", opt("constraint")).label("plain")
            .alt("type_mark", "type_mark", opt("constraint")).label("resolved")
            .alt(LPAREN, "type_mark", RPAREN, "type_mark", opt("constraint")).label("element_resolved");
        g.rule("constraint").inline()
            .alt("range_constraint")
            .alt(plus("index_constraint"));
        g.rule("range_constraint")
            .alt(RANGE, "range_spec");
        g.rule("index_constraint")
            .alt(LPAREN, sepBy("discrete_range", COMMA), RPAREN).label("ranges")
            .alt(LPAREN, OPEN, RPAREN).label("open");
        g.rule("type_mark")
            .alt(IDENTIFIER, star(DOT, IDENTIFIER));
        g.rule("discrete_range").collapse()
            .alt("subtype_indication").label("subtype")
            .alt("range_spec").label("range");
        g.rule("range_spec")
            .alt("simple_expression", oneOf(TO, DOWNTO), "simple_expression").label("explicit")
            .alt("name", TICK, oneOf(RANGE, IDENTIFIER), opt(LPAREN, "expression", RPAREN)).label("attribute");
    }

    // ========================================================================
    // Concurrent statements
    // ========================================================================

    private static void concurrentStatements(GrammarBuilder g) {
        g.rule("concurrent_statement").inline()
            .alt("process_statement")
            .alt("block_statement")
            .alt("signal_assignment")
            .alt("assertion_statement")
            .alt("procedure_call_statement")
            // "u1: comp;" is also a procedure call; the instantiation reading wins
            .alt("component_instantiation").priority(1)
            .alt("generate_statement");

        g.rule("process_statement")
            .alt(opt("label"), opt(POSTPONED), PROCESS, opt(LPAREN, oneOf(ALL, sepBy("name", COMMA)), RPAREN),
                opt(IS), star("declarative_item"), BEGIN, star("sequential_statement"),
                END, opt(POSTPONED), PROCESS, opt("identifier"), SEMICOLON);
        g.rule("block_statement")
            .alt("label", BLOCK, opt(LPAREN, "expression", RPAREN), opt(IS),
                opt("generic_clause", opt("generic_map_aspect", SEMICOLON)),
                opt("port_clause", opt("port_map_aspect", SEMICOLON)),
                star("declarative_item"), BEGIN, star("concurrent_statement"), END, BLOCK, opt("identifier"), SEMICOLON);

        g.rule("component_instantiation")
            .alt("label", opt(COMPONENT), "type_mark",
                opt("generic_map_aspect"), opt("port_map_aspect"), SEMICOLON).label("component")
            .alt("label", ENTITY, "type_mark", opt(LPAREN, "identifier", RPAREN),
                opt("generic_map_aspect"), opt("port_map_aspect"), SEMICOLON).label("entity")
            .alt("label", CONFIGURATION, "type_mark",
                opt("generic_map_aspect"), opt("port_map_aspect"), SEMICOLON).label("configuration");

        g.rule("generate_statement")
            .alt("label", FOR, "identifier", IN, "discrete_range", GENERATE, "generate_body",
                END, GENERATE, opt("identifier"), SEMICOLON).label("for")
            .alt("label", "if_generate_branch", star("elsif_generate_branch"), opt("else_generate_branch"),
                END, GENERATE, opt("identifier"), SEMICOLON).label("if")
            .alt("label", CASE, "expression", GENERATE, plus("case_generate_branch"),
                END, GENERATE, opt("identifier"), SEMICOLON).label("case");
        g.rule("if_generate_branch")
            .alt(IF, opt("label"), "expression", GENERATE, "generate_body");
        g.rule("elsif_generate_branch")
            .alt(ELSIF, opt("label"), "expression", GENERATE, "generate_body");
        g.rule("else_generate_branch")
            .alt(ELSE, opt("label"), GENERATE, "generate_body");
        g.rule("case_generate_branch")
            .alt(WHEN, opt("label"), "choices", ARROW, "generate_body");
        g.rule("generate_body")
            .alt(opt(star("declarative_item"), BEGIN), star("concurrent_statement"),
                opt(END, opt("identifier"), SEMICOLON));

        // Shared by the concurrent and sequential statement parts
        g.rule("signal_assignment")
            .alt(opt("label"), opt(POSTPONED), "target", LE, opt(GUARDED), opt("delay_mechanism"),
                "waveform", SEMICOLON).label("simple")
            .alt(opt("label"), opt(POSTPONED), "target", LE, opt(GUARDED), opt("delay_mechanism"),
                "conditional_waveform", star(ELSE, "conditional_waveform"), opt(ELSE, "waveform"), SEMICOLON)
            .label("conditional")
            .alt(opt("label"), opt(POSTPONED), WITH, "expression", SELECT, opt(QUESTION), "target", LE, opt(GUARDED),
                opt("delay_mechanism"), sepBy("selected_waveform", COMMA), SEMICOLON).label("selected");
        g.rule("target").inline()
            .alt("name")
            .alt("aggregate");
        g.rule("delay_mechanism")
            .alt(TRANSPORT).label("transport")
            .alt(opt(REJECT, "expression"), INERTIAL).label("inertial");
        g.rule("waveform")
            .alt(sepBy("waveform_element", COMMA)).label("elements")
            .alt(UNAFFECTED).label("unaffected");
        g.rule("waveform_element")
            .alt("expression", opt(AFTER, "expression"));
        g.rule("conditional_waveform")
            .alt("waveform", WHEN, "expression");
        g.rule("selected_waveform")
            .alt("waveform", WHEN, "choices");

        g.rule("assertion_statement")
            .alt(opt("label"), opt(POSTPONED), ASSERT, "expression", opt(REPORT, "expression"),
                opt(SEVERITY, "expression"), SEMICOLON);
        g.rule("procedure_call_statement")
            .alt(opt("label"), opt(POSTPONED), "name", opt(LPAREN, "association_list", RPAREN), SEMICOLON);
    }

    // ========================================================================
    // Sequential statements
    // ========================================================================

    private static void sequentialStatements(GrammarBuilder g) {
        g.rule("sequential_statement").inline()
            .alt("wait_statement")
            .alt("assertion_statement")
            .alt("report_statement")
            .alt("signal_assignment")
            .alt("variable_assignment")
            .alt("procedure_call_statement")
            .alt("if_statement")
            .alt("case_statement")
            .alt("loop_statement")
            .alt("next_statement")
            .alt("exit_statement")
            .alt("return_statement")
            .alt("null_statement");

        g.rule("wait_statement")
            .alt(opt("label"), WAIT, opt(ON, sepBy("name", COMMA)), opt(UNTIL, "expression"),
                opt(FOR, "expression"), SEMICOLON);
        g.rule("report_statement")
            .alt(opt("label"), REPORT, "expression", opt(SEVERITY, "expression"), SEMICOLON);
        g.rule("variable_assignment")
            .alt(opt("label"), "target", VAR_ASSIGN, "expression", SEMICOLON).label("simple")
            .alt(opt("label"), "target", VAR_ASSIGN, "conditional_value", star(ELSE, "conditional_value"),
                opt(ELSE, "expression"), SEMICOLON).label("conditional");
        g.rule("conditional_value")
            .alt("expression", WHEN, "expression");
        g.rule("if_statement")
            .alt(opt("label"), "if_branch", star("elsif_branch"), opt("else_branch"), END, IF, opt("identifier"), SEMICOLON);
        g.rule("if_branch")
            .alt(IF, "expression", THEN, star("sequential_statement"));
        g.rule("elsif_branch")
            .alt(ELSIF, "expression", THEN, star("sequential_statement"));
        g.rule("else_branch")
            .alt(ELSE, star("sequential_statement"));
        g.rule("case_statement")
            .alt(opt("label"), CASE, opt(QUESTION), "expression", IS, plus("case_alternative"),
                END, CASE, opt(QUESTION), opt("identifier"), SEMICOLON);
        g.rule("case_alternative")
            .alt(WHEN, "choices", ARROW, star("sequential_statement"));
        g.rule("loop_statement")
            .alt(opt("label"), opt(oneOf(seq(WHILE, "expression"), seq(FOR, "identifier", IN, "discrete_range"))),
                LOOP, star("sequential_statement"), END, LOOP, opt("identifier"), SEMICOLON);
        g.rule("next_statement")
            .alt(opt("label"), NEXT, opt("identifier"), opt(WHEN, "expression"), SEMICOLON);
        g.rule("exit_statement")
            .alt(opt("label"), EXIT, opt("identifier"), opt(WHEN, "expression"), SEMICOLON);
        g.rule("return_statement")
            .alt(opt("label"), RETURN, opt("expression"), SEMICOLON);
        g.rule("null_statement")
            .alt(opt("label"), NULL, SEMICOLON);
    }

    // ========================================================================
    // Expressions and names
    // ========================================================================

    private static void expressions(GrammarBuilder g) {
        g.rule("expression").collapse()
            .alt(CONDITION, "primary").label("condition")
            .alt("relation", star(oneOf(AND, OR, XOR, NAND, NOR, XNOR), "relation")).label("logical");
        g.rule("relation").collapse()
            .alt("shift_expression", opt(oneOf(EQ, NE, LT, LE, GT, GE,
                MATCH_EQ, MATCH_NE, MATCH_LT, MATCH_LE, MATCH_GT, MATCH_GE), "shift_expression"));
        g.rule("shift_expression").collapse()
            .alt("simple_expression", opt(oneOf(SLL, SRL, SLA, SRA, ROL, ROR), "simple_expression"));
        g.rule("simple_expression").collapse()
            .alt(opt(oneOf(PLUS, MINUS)), "term", star(oneOf(PLUS, MINUS, AMPERSAND), "term"));
        g.rule("term").collapse()
            .alt("factor", star(oneOf(STAR, SLASH, MOD, REM), "factor"));
        g.rule("factor").collapse()
            .alt("primary", opt(DOUBLE_STAR, "primary")).label("power")
            .alt(ABS, "primary").label("abs")
            .alt(NOT, "primary").label("not")
            .alt(oneOf(AND, OR, XOR, NAND, NOR, XNOR), "primary").label("reduction");

        g.rule("primary").collapse()
            // Without declarations "f(x)" cannot be told apart from an indexed name;
            // inside an expression the name reading is taken
            .alt("name").label("name").preferredUnder("simple_expression")
            .alt("function_call").label("call")
            .alt("literal").label("literal")
            .alt("aggregate").label("aggregate")
            .alt(LPAREN, "expression", RPAREN).label("parenthesized")
            .alt("qualified_expression").label("qualified")
            .alt("allocator").label("allocator")
            .alt("external_name").label("external");

        g.rule("name")
            .alt(IDENTIFIER, star("name_suffix"));
        g.rule("name_suffix")
            .alt(DOT, oneOf(IDENTIFIER, ALL, STRING_LITERAL, CHARACTER_LITERAL)).label("selected")
            .alt(LPAREN, sepBy("expression", COMMA), RPAREN).label("index").priority(1)
            .alt(LPAREN, "discrete_range", RPAREN).label("slice")
            .alt(TICK, oneOf(IDENTIFIER, RANGE, SUBTYPE)).label("attribute");
        g.rule("function_call")
            .alt("name", LPAREN, "association_list", RPAREN).label("named")
            .alt(STRING_LITERAL, LPAREN, "association_list", RPAREN).label("operator");

        g.rule("literal")
            .alt(DECIMAL_LITERAL).label("decimal")
            .alt(BASED_LITERAL).label("based")
            .alt(oneOf(DECIMAL_LITERAL, BASED_LITERAL), IDENTIFIER).label("physical")
            .alt(CHARACTER_LITERAL).label("character")
            .alt(STRING_LITERAL).label("string")
            .alt(BIT_STRING_LITERAL).label("bit_string")
            .alt(NULL).label("null");

        g.rule("aggregate")
            .alt(LPAREN, "element_association", plus(COMMA, "element_association"), RPAREN).label("multiple")
            .alt(LPAREN, "named_association", RPAREN).label("single");
        g.rule("element_association").inline()
            .alt("named_association")
            .alt("positional_association");
        g.rule("named_association")
            .alt("choices", ARROW, "expression");
        g.rule("positional_association")
            .alt("expression");
        g.rule("choices").inline()
            .alt(sepBy("choice", BAR));
        g.rule("choice").collapse()
            .alt("simple_expression").label("expression")
            .alt("range_spec").label("range").priority(1)
            .alt(OTHERS).label("others");

        g.rule("qualified_expression")
            .alt("type_mark", TICK, oneOf(seq(LPAREN, "expression", RPAREN), "aggregate"));
        g.rule("allocator")
            .alt(NEW, oneOf("subtype_indication", "qualified_expression"));
        g.rule("external_name")
            .alt(DOUBLE_LT, oneOf(CONSTANT, SIGNAL, VARIABLE), "external_path", COLON, "subtype_indication", DOUBLE_GT);
        g.rule("external_path").inline()
            .alt(AT, sepBy(IDENTIFIER, DOT))
            .alt(DOT, sepBy("path_element", DOT))
            .alt(plus(CARET, DOT), sepBy("path_element", DOT))
            .alt(sepBy("path_element", DOT));
        g.rule("path_element").inline()
            .alt(IDENTIFIER, opt(LPAREN, "expression", RPAREN));
    }
}
