package io.htmltpl.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;

/**
 * Name-to-value bindings visible to expressions during one render.
 *
 * <p>Backed by a private deep copy of a Jackson {@link ObjectNode}; nothing in this class mutates
 * it, so a scope may be read from several threads. The engine never retains a scope beyond the
 * call it was passed to.
 */
public final class Scope {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Scope EMPTY = new Scope(JsonNodeFactory.instance.objectNode());

    private final ObjectNode root;

    private Scope(ObjectNode root) {
        this.root = root;
    }

    /** Returns a scope with no bindings. */
    public static Scope empty() {
        return EMPTY;
    }

    /**
     * Builds a scope from arbitrary render data.
     *
     * <ul>
     *   <li>{@code null} → the empty scope
     *   <li>a {@code Scope} → itself
     *   <li>a JSON object node → a copy of it
     *   <li>a {@code Map} or a bean → converted with Jackson {@code valueToTree}
     * </ul>
     *
     * @param data the render data
     * @return the scope
     * @throws IllegalArgumentException if {@code data} does not convert to a JSON object
     */
    public static Scope of(Object data) {
        if (data == null) {
            return EMPTY;
        }
        if (data instanceof Scope scope) {
            return scope;
        }
        JsonNode node = data instanceof JsonNode json ? json : MAPPER.valueToTree(data);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException(
                    "Render data must be an object of name/value bindings, got: " + node.getNodeType());
        }
        return new Scope(((ObjectNode) node).deepCopy());
    }

    /** Convenience for {@code Scope.of(Map.of(...))}. */
    public static Scope of(Map<String, ?> bindings) {
        return of((Object) bindings);
    }

    /**
     * Looks up a top-level binding.
     *
     * @param name the binding name
     * @return the bound value (possibly a JSON {@code null} node), or {@code null} if unbound
     */
    public JsonNode lookup(String name) {
        return root.get(name);
    }

    /** Returns {@code true} if {@code name} is bound, even to JSON {@code null}. */
    public boolean has(String name) {
        return root.has(name);
    }

    /** Returns the binding names in insertion order. */
    public Iterator<String> names() {
        return root.fieldNames();
    }

    /**
     * Returns the backing object node. Callers must treat it as read-only; expression engines use
     * it as their evaluation input.
     */
    public JsonNode root() {
        return root;
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Scope other && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "Scope" + root;
    }
}
