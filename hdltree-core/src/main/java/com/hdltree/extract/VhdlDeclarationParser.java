package com.hdltree.extract;

import com.hdltree.ParserOptions;
import com.hdltree.VhdlParser;

/**
 * Grammar based VHDL declarations: a lenient parse followed by {@link DeclarationExtractor}.
 */
public final class VhdlDeclarationParser implements DeclarationParser {

    private final VhdlParser parser;
    private final DeclarationExtractor extractor = new DeclarationExtractor();

    public VhdlDeclarationParser() {
        this(ParserOptions.DEFAULTS);
    }

    public VhdlDeclarationParser(ParserOptions options) {
        this.parser = new VhdlParser(options);
    }

    @Override
    public String getName() {
        return "grammar";
    }

    @Override
    public HdlDialect dialect() {
        return HdlDialect.VHDL;
    }

    @Override
    public ExtractionResult parseDeclarations(String source) {
        return extractor.extract(parser.parseLenient(source));
    }
}
