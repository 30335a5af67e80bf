package com.hdltree;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Token kinds produced by the {@link Lexer}.
 *
 * Reserved words carry their spelling so keyword lookup is a single map probe on the
 * lower-cased identifier text. Delimiters carry their symbol for error messages.
 */
public enum TokenType {
    // Literals and names
    IDENTIFIER(null),
    DECIMAL_LITERAL(null),
    BASED_LITERAL(null),
    CHARACTER_LITERAL(null),
    STRING_LITERAL(null),
    BIT_STRING_LITERAL(null),

    // Delimiters
    AMPERSAND("&"),
    TICK("'"),
    LPAREN("("),
    RPAREN(")"),
    STAR("*"),
    PLUS("+"),
    COMMA(","),
    MINUS("-"),
    DOT("."),
    SLASH("/"),
    COLON(":"),
    SEMICOLON(";"),
    LT("<"),
    EQ("="),
    GT(">"),
    BAR("|"),
    LBRACKET("["),
    RBRACKET("]"),
    QUESTION("?"),
    AT("@"),
    CARET("^"),
    ARROW("=>"),
    DOUBLE_STAR("**"),
    VAR_ASSIGN(":="),
    NE("/="),
    GE(">="),
    LE("<="),
    BOX("<>"),
    CONDITION("??"),
    MATCH_EQ("?="),
    MATCH_NE("?/="),
    MATCH_LT("?<"),
    MATCH_LE("?<="),
    MATCH_GT("?>"),
    MATCH_GE("?>="),
    DOUBLE_LT("<<"),
    DOUBLE_GT(">>"),

    // Reserved words (VHDL-2008, including the PSL words the standard reserves)
    ABS("abs"),
    ACCESS("access"),
    AFTER("after"),
    ALIAS("alias"),
    ALL("all"),
    AND("and"),
    ARCHITECTURE("architecture"),
    ARRAY("array"),
    ASSERT("assert"),
    ASSUME("assume"),
    ASSUME_GUARANTEE("assume_guarantee"),
    ATTRIBUTE("attribute"),
    BEGIN("begin"),
    BLOCK("block"),
    BODY("body"),
    BUFFER("buffer"),
    BUS("bus"),
    CASE("case"),
    COMPONENT("component"),
    CONFIGURATION("configuration"),
    CONSTANT("constant"),
    CONTEXT("context"),
    COVER("cover"),
    DEFAULT("default"),
    DISCONNECT("disconnect"),
    DOWNTO("downto"),
    ELSE("else"),
    ELSIF("elsif"),
    END("end"),
    ENTITY("entity"),
    EXIT("exit"),
    FAIRNESS("fairness"),
    FILE("file"),
    FOR("for"),
    FORCE("force"),
    FUNCTION("function"),
    GENERATE("generate"),
    GENERIC("generic"),
    GROUP("group"),
    GUARDED("guarded"),
    IF("if"),
    IMPURE("impure"),
    IN("in"),
    INERTIAL("inertial"),
    INOUT("inout"),
    IS("is"),
    LABEL("label"),
    LIBRARY("library"),
    LINKAGE("linkage"),
    LITERAL("literal"),
    LOOP("loop"),
    MAP("map"),
    MOD("mod"),
    NAND("nand"),
    NEW("new"),
    NEXT("next"),
    NOR("nor"),
    NOT("not"),
    NULL("null"),
    OF("of"),
    ON("on"),
    OPEN("open"),
    OR("or"),
    OTHERS("others"),
    OUT("out"),
    PACKAGE("package"),
    PARAMETER("parameter"),
    PORT("port"),
    POSTPONED("postponed"),
    PROCEDURE("procedure"),
    PROCESS("process"),
    PROPERTY("property"),
    PROTECTED("protected"),
    PURE("pure"),
    RANGE("range"),
    RECORD("record"),
    REGISTER("register"),
    REJECT("reject"),
    RELEASE("release"),
    REM("rem"),
    REPORT("report"),
    RESTRICT("restrict"),
    RESTRICT_GUARANTEE("restrict_guarantee"),
    RETURN("return"),
    ROL("rol"),
    ROR("ror"),
    SELECT("select"),
    SEQUENCE("sequence"),
    SEVERITY("severity"),
    SHARED("shared"),
    SIGNAL("signal"),
    SLA("sla"),
    SLL("sll"),
    SRA("sra"),
    SRL("srl"),
    STRONG("strong"),
    SUBTYPE("subtype"),
    THEN("then"),
    TO("to"),
    TRANSPORT("transport"),
    TYPE("type"),
    UNAFFECTED("unaffected"),
    UNITS("units"),
    UNTIL("until"),
    USE("use"),
    VARIABLE("variable"),
    VMODE("vmode"),
    VPROP("vprop"),
    VUNIT("vunit"),
    WAIT("wait"),
    WHEN("when"),
    WHILE("while"),
    WITH("with"),
    XNOR("xnor"),
    XOR("xor"),

    EOF(null);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.isKeyword()) {
                KEYWORDS.put(type.text, type);
            }
        }
    }

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    /**
     * The fixed spelling of a delimiter or reserved word, or null for literal kinds.
     */
    public String text() {
        return text;
    }

    public boolean isKeyword() {
        return text != null && Character.isLetter(text.charAt(0));
    }

    /**
     * Looks up a reserved word regardless of case.
     *
     * @return the keyword type, or null if the word is an ordinary identifier
     */
    public static TokenType keyword(String word) {
        return KEYWORDS.get(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Human readable form used in diagnostics.
     */
    public String describe() {
        if (text != null) {
            return "'" + text + "'";
        }
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
