package com.hdltree.extract;

import com.hdltree.LineMap;
import com.hdltree.Span;
import com.hdltree.UnsupportedConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern based declaration scanner in the manner of the old {@code hdlparse} tool.
 *
 * It never fails on syntax it does not understand: it looks for entity, component and
 * package headers, interface lists, and package level types, subtypes, constants and
 * subprograms, and ignores everything else. Only selected by name.
 */
public final class LegacyVhdlDeclarationParser implements DeclarationParser {

    private static final Logger logger = LoggerFactory.getLogger(LegacyVhdlDeclarationParser.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern LIBRARY = Pattern.compile("\\blibrary\\s+([\\w\\s,]+?)\\s*;", FLAGS);
    private static final Pattern ENTITY = Pattern.compile("\\bentity\\s+(\\w+)\\s+is\\b", FLAGS);
    private static final Pattern PACKAGE = Pattern.compile("\\bpackage\\s+(body\\s+)?(\\w+)\\s+is\\b(?!\\s+new\\b)", FLAGS);
    private static final Pattern ARCHITECTURE = Pattern.compile("\\barchitecture\\s+(\\w+)\\s+of\\b", FLAGS);
    private static final Pattern COMPONENT = Pattern.compile("(?<!\\bend\\s{1,16})\\bcomponent\\s+(\\w+)(\\s+is\\b)?", FLAGS);
    private static final Pattern HEADER_END = Pattern.compile("\\b(begin|end)\\b", FLAGS);
    private static final Pattern END = Pattern.compile("\\bend\\b", FLAGS);
    private static final Pattern GENERIC = Pattern.compile("\\bgeneric\\s*\\(", FLAGS);
    private static final Pattern PORT = Pattern.compile("\\bport\\s*\\(", FLAGS);
    private static final Pattern TYPE = Pattern.compile("\\btype\\s+(\\w+)\\s*(is\\b|;)", FLAGS);
    private static final Pattern SUBTYPE = Pattern.compile("\\bsubtype\\s+(\\w+)\\s+is\\b", FLAGS);
    private static final Pattern CONSTANT = Pattern.compile("\\bconstant\\s+([\\w\\s,]+?)\\s*:(?!=)", FLAGS);
    private static final Pattern SUBPROGRAM = Pattern.compile(
        "(?<!\\bend\\s{1,16})\\b(?:(?:pure|impure)\\s+)?(function|procedure)\\s+(\\w+|\"[^\"]+\")", FLAGS);
    private static final Pattern RETURN = Pattern.compile("\\s*return\\s+([\\w.]+)", FLAGS);
    private static final Pattern MODE = Pattern.compile("^(in|out|inout|buffer|linkage)\\b\\s*", FLAGS);
    private static final Pattern OBJECT_CLASS = Pattern.compile("^(constant|signal|variable|file)\\b\\s*", FLAGS);

    private static final Set<String> STANDARD_LIBRARIES = Set.of("ieee", "std");

    @Override
    public String getName() {
        return "legacy";
    }

    @Override
    public HdlDialect dialect() {
        return HdlDialect.VHDL;
    }

    @Override
    public boolean isFallback() {
        return true;
    }

    @Override
    public ExtractionResult parseDeclarations(String source) {
        return new Scan(source).run();
    }

    private record Found(int offset, DeclarationRecord record) {}

    private static final class Scan {
        private final String text;
        private final LineMap lines;
        private final List<Found> found = new ArrayList<>();
        private final List<UnsupportedConstruct> warnings = new ArrayList<>();

        Scan(String source) {
            this.text = blankComments(source);
            this.lines = new LineMap(source);
        }

        ExtractionResult run() {
            entities();
            packages();
            components();
            found.sort(Comparator.comparingInt(Found::offset));
            List<DeclarationRecord> records = new ArrayList<>();
            for (Found f : found) {
                records.add(f.record());
            }
            logger.debug("Legacy scan found {} declaration(s)", records.size());
            return new ExtractionResult(records, warnings);
        }

        private void entities() {
            Matcher m = ENTITY.matcher(text);
            while (m.find()) {
                int limit = findTopLevel(HEADER_END, m.end());
                found.add(new Found(m.start(), new DeclarationRecord(DeclarationRecord.Kind.ENTITY, m.group(1),
                    library(m.start()), false, null, generics(m.end(), limit), ports(m.end(), limit),
                    List.of(), List.of(), List.of(), List.of(), span(m.start(), limit))));
            }
        }

        private void components() {
            Matcher m = COMPONENT.matcher(text);
            while (m.find()) {
                if (isInstantiation(m)) {
                    continue;
                }
                int limit = findTopLevel(END, m.end());
                found.add(new Found(m.start(), new DeclarationRecord(DeclarationRecord.Kind.COMPONENT, m.group(1),
                    library(m.start()), false, container(m.start()), generics(m.end(), limit), ports(m.end(), limit),
                    List.of(), List.of(), List.of(), List.of(), span(m.start(), limit))));
            }
        }

        /**
         * {@code u1 : component foo port map (...)} is a use, not a declaration.
         */
        private boolean isInstantiation(Matcher m) {
            int before = m.start() - 1;
            while (before >= 0 && Character.isWhitespace(text.charAt(before))) {
                before--;
            }
            return before >= 0 && text.charAt(before) == ':';
        }

        private void packages() {
            Matcher m = PACKAGE.matcher(text);
            while (m.find()) {
                boolean body = m.group(1) != null;
                String name = m.group(2);
                int end = packageEnd(m.end(), name);
                List<TypeRecord> types = new ArrayList<>();
                List<SubtypeRecord> subtypes = new ArrayList<>();
                List<ConstantRecord> constants = new ArrayList<>();
                List<SubprogramRecord> subprograms = new ArrayList<>();
                types(m.end(), end, types);
                subtypes(m.end(), end, subtypes);
                constants(m.end(), end, constants);
                subprograms(m.end(), end, subprograms);
                found.add(new Found(m.start(), new DeclarationRecord(DeclarationRecord.Kind.PACKAGE, name,
                    library(m.start()), body, null, List.of(), List.of(), types, subtypes, constants, subprograms,
                    span(m.start(), end))));
            }
        }

        private int packageEnd(int from, String name) {
            Pattern end = Pattern.compile("\\bend\\s*(package\\b|" + Pattern.quote(name) + "\\b|;)", FLAGS);
            Matcher m = end.matcher(text);
            return m.find(from) ? m.start() : text.length();
        }

        private void types(int from, int to, List<TypeRecord> types) {
            Matcher m = TYPE.matcher(text).region(from, to);
            while (m.find()) {
                if (depth(from, m.start()) != 0) {
                    continue;
                }
                if (m.group(2).equals(";")) {
                    types.add(new TypeRecord(m.group(1), "incomplete", null));
                    continue;
                }
                String definition = definition(m.end(), to);
                types.add(new TypeRecord(m.group(1), category(definition), definition));
            }
        }

        /**
         * Text after {@code is} up to the terminating semicolon, spanning {@code end record},
         * {@code end units} and {@code end protected} for the multi-line definitions.
         */
        private String definition(int from, int to) {
            String head = text.substring(from, Math.min(to, from + 64)).strip().toLowerCase(Locale.ROOT);
            int end;
            if (head.startsWith("record") || head.startsWith("protected")) {
                Matcher m = Pattern.compile("\\bend\\s+(record|protected)\\b", FLAGS).matcher(text).region(from, to);
                end = m.find() ? m.end() : to;
            } else {
                int semicolon = findTopLevelChar(';', from, to);
                Matcher units = Pattern.compile("\\bunits\\b", FLAGS).matcher(text).region(from, semicolon);
                if (units.find()) {
                    Matcher m = Pattern.compile("\\bend\\s+units\\b", FLAGS).matcher(text).region(from, to);
                    end = m.find() ? m.end() : semicolon;
                } else {
                    end = semicolon;
                }
            }
            return normalize(text.substring(from, end));
        }

        private void subtypes(int from, int to, List<SubtypeRecord> subtypes) {
            Matcher m = SUBTYPE.matcher(text).region(from, to);
            while (m.find()) {
                if (depth(from, m.start()) != 0) {
                    continue;
                }
                String indication = normalize(text.substring(m.end(), findTopLevelChar(';', m.end(), to)));
                subtypes.add(new SubtypeRecord(m.group(1), indication, baseType(indication)));
            }
        }

        private void constants(int from, int to, List<ConstantRecord> constants) {
            Matcher m = CONSTANT.matcher(text).region(from, to);
            while (m.find()) {
                if (depth(from, m.start()) != 0) {
                    continue;
                }
                String rest = text.substring(m.end(), findTopLevelChar(';', m.end(), to));
                String[] typeAndValue = splitDefault(rest);
                for (String name : m.group(1).split(",")) {
                    constants.add(new ConstantRecord(name.strip(), typeAndValue[0], typeAndValue[1]));
                }
            }
        }

        private void subprograms(int from, int to, List<SubprogramRecord> subprograms) {
            Matcher m = SUBPROGRAM.matcher(text).region(from, to);
            while (m.find()) {
                if (depth(from, m.start()) != 0) {
                    continue;
                }
                String kind = m.group(1).toLowerCase(Locale.ROOT);
                int i = skipWhitespace(m.end());
                List<ParameterRecord> parameters = new ArrayList<>();
                if (i < to && text.charAt(i) == '(') {
                    int close = matchParen(i);
                    for (String element : splitTopLevel(text.substring(i + 1, close), ';')) {
                        parameters.addAll(parameters(element));
                    }
                    i = close + 1;
                }
                String returnType = null;
                if (kind.equals("function")) {
                    Matcher r = RETURN.matcher(text).region(i, to);
                    if (r.lookingAt()) {
                        returnType = r.group(1);
                    }
                }
                subprograms.add(new SubprogramRecord(kind, m.group(2), parameters, returnType));
            }
        }

        private List<ParameterRecord> parameters(String element) {
            List<ParameterRecord> parameters = new ArrayList<>();
            String[] parts = splitNames(element);
            if (parts == null) {
                return parameters;
            }
            String objectClass = null;
            String names = parts[0];
            Matcher c = OBJECT_CLASS.matcher(names);
            if (c.lookingAt()) {
                objectClass = c.group(1).toLowerCase(Locale.ROOT);
                names = names.substring(c.end());
            }
            String rest = parts[1];
            String mode = "in";
            Matcher md = MODE.matcher(rest);
            if (md.lookingAt()) {
                mode = md.group(1).toLowerCase(Locale.ROOT);
                rest = rest.substring(md.end());
            }
            String[] typeAndValue = splitDefault(rest);
            for (String name : names.split(",")) {
                parameters.add(new ParameterRecord(name.strip(), objectClass, mode, typeAndValue[0], typeAndValue[1]));
            }
            return parameters;
        }

        private List<GenericRecord> generics(int from, int limit) {
            List<GenericRecord> generics = new ArrayList<>();
            String list = clause(GENERIC, from, limit);
            if (list == null) {
                return generics;
            }
            for (String element : splitTopLevel(list, ';')) {
                String trimmed = normalize(element);
                String lower = trimmed.toLowerCase(Locale.ROOT);
                if (lower.startsWith("type ")) {
                    generics.add(new GenericRecord(trimmed.substring(5).strip(), "type", null, null));
                } else if (lower.startsWith("package ")) {
                    String[] words = trimmed.split("\\s+");
                    generics.add(new GenericRecord(words[1], "package", words.length > 4 ? words[4] : null, null));
                } else if (lower.matches("^(pure |impure )?(function|procedure) .*")) {
                    Matcher m = SUBPROGRAM.matcher(trimmed);
                    if (m.find()) {
                        generics.add(new GenericRecord(m.group(2), "subprogram", null, null));
                    }
                } else {
                    String[] parts = splitNames(trimmed);
                    if (parts == null) {
                        continue;
                    }
                    String names = OBJECT_CLASS.matcher(parts[0]).replaceFirst("");
                    String rest = MODE.matcher(parts[1]).replaceFirst("");
                    String[] typeAndValue = splitDefault(rest);
                    for (String name : names.split(",")) {
                        generics.add(new GenericRecord(name.strip(), "constant", typeAndValue[0], typeAndValue[1]));
                    }
                }
            }
            return generics;
        }

        private List<PortRecord> ports(int from, int limit) {
            List<PortRecord> ports = new ArrayList<>();
            int at = clauseStart(PORT, from, limit);
            if (at < 0) {
                return ports;
            }
            String list = text.substring(at + 1, matchParen(at));
            for (String element : splitTopLevel(list, ';')) {
                String[] parts = splitNames(element);
                if (parts == null) {
                    continue;
                }
                String names = OBJECT_CLASS.matcher(parts[0]).replaceFirst("");
                String rest = parts[1];
                String mode = null;
                Matcher md = MODE.matcher(rest);
                if (md.lookingAt()) {
                    mode = md.group(1).toLowerCase(Locale.ROOT);
                    rest = rest.substring(md.end());
                }
                if ("linkage".equals(mode)) {
                    warnings.add(new UnsupportedConstruct("linkage port", span(at, at + 1), "linkage ports have no direction"));
                    logger.warn("Skipping linkage port {}", names.strip());
                    continue;
                }
                String[] typeAndValue = splitDefault(rest);
                for (String name : names.split(",")) {
                    ports.add(new PortRecord(name.strip(), PortRecord.Direction.of(mode), typeAndValue[0], typeAndValue[1]));
                }
            }
            return ports;
        }

        private String clause(Pattern keyword, int from, int limit) {
            int at = clauseStart(keyword, from, limit);
            return at < 0 ? null : text.substring(at + 1, matchParen(at));
        }

        /**
         * Offset of the opening parenthesis of the first top-level {@code keyword (} in range, or -1.
         */
        private int clauseStart(Pattern keyword, int from, int limit) {
            Matcher m = keyword.matcher(text).region(from, limit);
            while (m.find()) {
                if (depth(from, m.start()) == 0) {
                    return m.end() - 1;
                }
            }
            return -1;
        }

        private String container(int offset) {
            String container = null;
            int best = -1;
            for (Pattern p : List.of(PACKAGE, ARCHITECTURE)) {
                Matcher m = p.matcher(text);
                while (m.find() && m.start() < offset) {
                    if (m.start() > best) {
                        best = m.start();
                        container = m.group(p == PACKAGE ? 2 : 1);
                    }
                }
            }
            return container;
        }

        private String library(int offset) {
            String library = DeclarationExtractor.DEFAULT_LIBRARY;
            Matcher m = LIBRARY.matcher(text);
            while (m.find() && m.start() < offset) {
                for (String name : m.group(1).split(",")) {
                    String lib = name.strip();
                    if (!STANDARD_LIBRARIES.contains(lib.toLowerCase(Locale.ROOT))) {
                        library = lib;
                    }
                }
            }
            return library;
        }

        private int findTopLevel(Pattern p, int from) {
            Matcher m = p.matcher(text);
            int start = from;
            while (m.find(start)) {
                if (depth(from, m.start()) == 0) {
                    return m.start();
                }
                start = m.end();
            }
            return text.length();
        }

        private int findTopLevelChar(char c, int from, int to) {
            int depth = 0;
            for (int i = from; i < to; i++) {
                char ch = text.charAt(i);
                if (ch == '(') {
                    depth++;
                } else if (ch == ')') {
                    depth--;
                } else if (ch == c && depth == 0) {
                    return i;
                }
            }
            return to;
        }

        private int depth(int from, int to) {
            int depth = 0;
            for (int i = from; i < to; i++) {
                char ch = text.charAt(i);
                if (ch == '(') {
                    depth++;
                } else if (ch == ')') {
                    depth--;
                }
            }
            return depth;
        }

        private int matchParen(int open) {
            int depth = 0;
            for (int i = open; i < text.length(); i++) {
                char ch = text.charAt(i);
                if (ch == '(') {
                    depth++;
                } else if (ch == ')' && --depth == 0) {
                    return i;
                }
            }
            return text.length();
        }

        private int skipWhitespace(int i) {
            while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            return i;
        }

        private Span span(int start, int end) {
            return lines.span(start, Math.min(end, text.length()));
        }
    }

    /**
     * Splits {@code names : rest} at the first colon that does not start {@code :=}.
     */
    private static String[] splitNames(String element) {
        for (int i = 0; i < element.length(); i++) {
            if (element.charAt(i) == ':' && (i + 1 >= element.length() || element.charAt(i + 1) != '=')) {
                String names = element.substring(0, i).strip();
                return names.isEmpty() ? null : new String[] {names, element.substring(i + 1).strip()};
            }
        }
        return null;
    }

    /**
     * Splits {@code type := default} at a top-level {@code :=}; the default is null when absent.
     */
    private static String[] splitDefault(String text) {
        int depth = 0;
        for (int i = 0; i + 1 < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            } else if (ch == ':' && text.charAt(i + 1) == '=' && depth == 0) {
                return new String[] {normalize(text.substring(0, i)), normalize(text.substring(i + 2))};
            }
        }
        return new String[] {normalize(text), null};
    }

    private static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            } else if (ch == separator && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        parts.removeIf(String::isBlank);
        return parts;
    }

    private static String category(String definition) {
        String lower = definition.toLowerCase(Locale.ROOT);
        if (lower.startsWith("(")) {
            return "enumeration";
        } else if (lower.startsWith("array")) {
            return "array";
        } else if (lower.startsWith("record")) {
            return "record";
        } else if (lower.startsWith("access")) {
            return "access";
        } else if (lower.startsWith("file")) {
            return "file";
        } else if (lower.startsWith("protected body")) {
            return "protected_body";
        } else if (lower.startsWith("protected")) {
            return "protected";
        } else if (lower.contains(" units ")) {
            return "physical";
        }
        return "range";
    }

    /**
     * Type mark of a subtype indication: the last word before any constraint, skipping a
     * resolution function or a parenthesized element resolution.
     */
    private static String baseType(String indication) {
        if (indication.startsWith("(")) {
            indication = indication.substring(indication.indexOf(')') + 1).strip();
        }
        int paren = indication.indexOf('(');
        String head = (paren < 0 ? indication : indication.substring(0, paren)).strip();
        int range = head.toLowerCase(Locale.ROOT).indexOf(" range ");
        if (range >= 0) {
            head = head.substring(0, range).strip();
        }
        String[] words = head.split("\\s+");
        return words[words.length - 1];
    }

    private static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ").replaceAll("\\(\\s+", "(").replaceAll("\\s+\\)", ")")
            .replace(",", ", ").replaceAll(",\\s+", ", ");
    }

    /**
     * Replaces comments with spaces so offsets still match the source.
     */
    private static String blankComments(String source) {
        StringBuilder sb = new StringBuilder(source);
        boolean inString = false;
        for (int i = 0; i < sb.length(); i++) {
            char ch = sb.charAt(i);
            if (ch == '"') {
                inString = !inString;
            } else if (!inString && ch == '-' && i + 1 < sb.length() && sb.charAt(i + 1) == '-') {
                while (i < sb.length() && sb.charAt(i) != '\n' && sb.charAt(i) != '\r') {
                    sb.setCharAt(i++, ' ');
                }
            } else if (!inString && ch == '/' && i + 1 < sb.length() && sb.charAt(i + 1) == '*') {
                while (i < sb.length() && !(sb.charAt(i) == '*' && i + 1 < sb.length() && sb.charAt(i + 1) == '/')) {
                    if (sb.charAt(i) != '\n') {
                        sb.setCharAt(i, ' ');
                    }
                    i++;
                }
                if (i + 1 < sb.length()) {
                    sb.setCharAt(i, ' ');
                    sb.setCharAt(++i, ' ');
                }
            } else if (ch == '\n') {
                inString = false;
            }
        }
        return sb.toString();
    }
}
