package com.hdltree.ast;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Generic traversal over AST records.
 */
public final class Nodes {

    private Nodes() {
    }

    /** Accessors of the record components that can hold nodes, per node class. */
    private static final ClassValue<List<Method>> CHILD_ACCESSORS = new ClassValue<>() {
        @Override
        protected List<Method> computeValue(Class<?> type) {
            List<Method> accessors = new ArrayList<>();
            for (RecordComponent component : type.getRecordComponents()) {
                Class<?> t = component.getType();
                if (Node.class.isAssignableFrom(t) || List.class.isAssignableFrom(t) && !component.getName().equals("tokens")) {
                    accessors.add(component.getAccessor());
                }
            }
            return List.copyOf(accessors);
        }
    };

    /**
     * Direct child nodes in source order.
     */
    public static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        for (Method accessor : CHILD_ACCESSORS.get(node.getClass())) {
            Object value = invoke(accessor, node);
            if (value instanceof Node child) {
                children.add(child);
            } else if (value instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof Node child) {
                        children.add(child);
                    }
                }
            }
        }
        children.sort(Comparator.comparingInt(n -> n.span().start()));
        return children;
    }

    /**
     * Visits {@code root} and all its descendants in pre-order, without recursion.
     */
    public static void walk(Node root, Consumer<Node> visitor) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            visitor.accept(node);
            List<Node> children = children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * All descendants of {@code root} (itself included) of the given type, in source order.
     */
    public static <T extends Node> List<T> find(Node root, Class<T> type) {
        List<T> found = new ArrayList<>();
        walk(root, node -> {
            if (type.isInstance(node)) {
                found.add(type.cast(node));
            }
        });
        return found;
    }

    private static Object invoke(Method accessor, Node node) {
        try {
            return accessor.invoke(node);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read " + accessor.getName() + " of " + node.type(), e);
        }
    }
}
