package com.hdltree;

import com.hdltree.ast.DesignFile;
import com.hdltree.forest.AmbiguityResolver;
import com.hdltree.forest.EarleyParser;
import com.hdltree.forest.ParseForest;
import com.hdltree.forest.ParseTree;
import com.hdltree.grammar.Grammar;
import com.hdltree.transform.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point: VHDL source text to typed AST.
 *
 * Instances hold no per-parse state and share the compiled grammar, so one parser may be
 * used from several threads at once.
 */
public final class VhdlParser {

    private static final Logger logger = LoggerFactory.getLogger(VhdlParser.class);

    private final Grammar grammar;
    private final ParserOptions options;

    public VhdlParser() {
        this(ParserOptions.DEFAULTS);
    }

    public VhdlParser(ParserOptions options) {
        this.grammar = Grammar.vhdl();
        this.options = options;
    }

    public ParserOptions options() {
        return options;
    }

    /**
     * Parses strictly: any unsupported construct aborts the parse.
     *
     * @throws LexException                 on characters outside the lexical grammar
     * @throws ParseException               on a syntax error, an unresolvable ambiguity or excessive nesting
     * @throws UnsupportedConstructException on a valid construct outside the supported subset
     */
    public DesignFile parse(String source) {
        return run(source, false).designFile();
    }

    /**
     * Parses and drops unsupported constructs, reporting them in the result. Lexical and
     * syntax errors still abort.
     */
    public ParseResult parseLenient(String source) {
        return run(source, true);
    }

    /**
     * Parses with the lenient flag from this parser's options.
     */
    public ParseResult parseResult(String source) {
        return run(source, options.lenient());
    }

    /**
     * The parse forest, before any ambiguity is resolved.
     */
    public ParseForest parseForest(String source) {
        return new EarleyParser(grammar, options.maxDerivations()).parse(Lexer.tokenize(source));
    }

    /**
     * The canonical concrete tree chosen from the forest.
     */
    public ParseTree parseTree(String source) {
        return new AmbiguityResolver(options.maxDepth()).resolve(parseForest(source));
    }

    private ParseResult run(String source, boolean lenient) {
        long started = System.nanoTime();
        List<Token> tokens = Lexer.tokenize(source);
        ParseForest forest = new EarleyParser(grammar, options.maxDerivations()).parse(tokens);
        ParseTree tree = new AmbiguityResolver(options.maxDepth()).resolve(forest);
        ParseResult result = new TreeTransformer(grammar, options.maxDepth(), lenient).transform(tree, forest.eof());
        if (logger.isDebugEnabled()) {
            logger.debug("Parsed {} tokens in {} ms", tokens.size(), (System.nanoTime() - started) / 1_000_000);
        }
        return result;
    }
}
