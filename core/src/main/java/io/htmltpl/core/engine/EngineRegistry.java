package io.htmltpl.core.engine;

import io.htmltpl.core.engine.jslt.JsltExpressionEngine;
import io.htmltpl.core.engine.path.PathExpressionEngine;
import io.htmltpl.core.spi.ExpressionEngine;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of placeholder expression engines, keyed by engine id. Thread-safe: registration and
 * lookup can happen concurrently.
 */
public final class EngineRegistry {

    private final Map<String, ExpressionEngine> engines = new ConcurrentHashMap<>();

    /** Returns a registry holding the built-in {@code path} and {@code jslt} engines. */
    public static EngineRegistry withBuiltins() {
        EngineRegistry registry = new EngineRegistry();
        registry.register(new PathExpressionEngine());
        registry.register(new JsltExpressionEngine());
        return registry;
    }

    /**
     * Registers an engine. An engine already registered under the same id is replaced.
     *
     * @param engine the engine to register
     * @throws NullPointerException if engine is null
     * @throws IllegalArgumentException if engine.id() is null or empty
     */
    public void register(ExpressionEngine engine) {
        if (engine == null) {
            throw new NullPointerException("engine must not be null");
        }
        String id = engine.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("engine id must not be null or empty");
        }
        engines.put(id, engine);
    }

    public Optional<ExpressionEngine> getEngine(String engineId) {
        return Optional.ofNullable(engineId == null ? null : engines.get(engineId));
    }

    /**
     * Looks up an engine by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no engine is registered with the given id
     */
    public ExpressionEngine requireEngine(String engineId) {
        return getEngine(engineId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No expression engine registered for id: '" + engineId + "' (known: " + ids() + ")"));
    }

    /** Registered ids, sorted. */
    public Set<String> ids() {
        return new TreeSet<>(engines.keySet());
    }

    public int size() {
        return engines.size();
    }

    public boolean hasEngine(String engineId) {
        return engineId != null && engines.containsKey(engineId);
    }
}
