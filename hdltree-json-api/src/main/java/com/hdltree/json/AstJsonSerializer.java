package com.hdltree.json;

import com.hdltree.ast.Node;
import com.hdltree.extract.ExtractionResult;

/**
 * Interface for serializing AST nodes and extracted declarations to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes an AST node to a JSON string. Each object carries a {@code type}
     * property naming its node variant.
     *
     * @param node the AST node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes declaration records and warnings.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(ExtractionResult result) throws AstJsonException;

    String serializePretty(ExtractionResult result) throws AstJsonException;
}
