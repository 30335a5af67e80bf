package com.hdltree.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.hdltree.Token;
import com.hdltree.ast.Node;
import com.hdltree.extract.SubprogramRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization/deserialization for the AST classes.
 *
 * This module handles:
 * - Polymorphic type handling: every node type in the sealed {@link Node} hierarchy is
 *   registered under its simple class name, written as the "type" property
 * - Compact token arrays (see {@link TokenSerializer})
 * - The derived prototype of extracted subprograms
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.hdltree", "hdltree-jackson"));
        addSerializer(Token.class, new TokenSerializer());
        addDeserializer(Token.class, new TokenDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixins on every type of the hierarchy, interfaces included; mixin inheritance
        // from interfaces is not applied consistently to record fields of interface type
        for (Class<?> type : nodeTypes()) {
            context.setMixInAnnotations(type, NodeMixin.class);
            if (type.isRecord()) {
                context.registerSubtypes(new NamedType(type, type.getSimpleName()));
            }
        }

        context.setMixInAnnotations(SubprogramRecord.class, SubprogramRecordMixin.class);
    }

    /**
     * All interfaces and records reachable from {@link Node} through permitted subclasses.
     */
    static List<Class<?>> nodeTypes() {
        Set<Class<?>> seen = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        pending.push(Node.class);
        while (!pending.isEmpty()) {
            Class<?> type = pending.pop();
            if (!seen.add(type)) {
                continue;
            }
            Class<?>[] permitted = type.getPermittedSubclasses();
            if (permitted != null) {
                for (Class<?> sub : permitted) {
                    pending.push(sub);
                }
            }
        }
        return new ArrayList<>(seen);
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    private abstract static class NodeMixin {
    }

    // prototype is derived, written for readers of the JSON and ignored when read back
    private abstract static class SubprogramRecordMixin {
        @JsonIgnore
        abstract boolean isFunction();

        @JsonProperty(value = "prototype", access = JsonProperty.Access.READ_ONLY)
        abstract String prototype();
    }
}
