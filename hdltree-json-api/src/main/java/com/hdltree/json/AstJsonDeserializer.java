package com.hdltree.json;

import com.hdltree.ast.DesignFile;
import com.hdltree.ast.Node;
import com.hdltree.extract.ExtractionResult;

/**
 * Interface for deserializing AST nodes from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a DesignFile (root AST node).
     *
     * @param json the JSON string to deserialize
     * @return the deserialized DesignFile
     * @throws AstJsonException if deserialization fails
     */
    DesignFile deserializeDesignFile(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific AST node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;

    ExtractionResult deserializeDeclarations(String json) throws AstJsonException;
}
