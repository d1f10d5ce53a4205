package org.mmlc.compiler.frontend.ast;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of the operators visible in a module, keyed by name and arity.
 */
public final class OperatorTable {

    private static final OperatorTable EMPTY = new OperatorTable(Map.of());

    private final Map<String, OperatorDef> byKey;

    private OperatorTable(Map<String, OperatorDef> byKey) {
        this.byKey = Collections.unmodifiableMap(new LinkedHashMap<>(byKey));
    }

    /**
     * @return A table without operators.
     */
    public static OperatorTable empty() {
        return EMPTY;
    }

    /**
     * @param definitions The operators, later entries replace earlier ones with the same key.
     * @return A table holding the given operators.
     */
    public static OperatorTable of(Collection<OperatorDef> definitions) {
        Map<String, OperatorDef> map = new LinkedHashMap<>();
        for (OperatorDef def : definitions) {
            map.put(key(def.name(), def.arity()), def);
        }
        return new OperatorTable(map);
    }

    private static String key(String name, int arity) {
        return name + "/" + arity;
    }

    /**
     * @param name The operator name.
     * @param arity The arity.
     * @return The definition, if present.
     */
    public Optional<OperatorDef> lookup(String name, int arity) {
        return Optional.ofNullable(byKey.get(key(name, arity)));
    }

    /**
     * @param name The operator name.
     * @return The binary variant, if present.
     */
    public Optional<OperatorDef> binary(String name) {
        return lookup(name, 2);
    }

    /**
     * @param name The operator name.
     * @return The prefix variant, if present.
     */
    public Optional<OperatorDef> prefix(String name) {
        return lookup(name, 1);
    }

    /**
     * @param name The operator name.
     * @return {@code true} if any variant exists.
     */
    public boolean contains(String name) {
        return binary(name).isPresent() || prefix(name).isPresent();
    }

    /**
     * @return All definitions in registration order.
     */
    public Collection<OperatorDef> all() {
        return byKey.values();
    }

    public boolean isEmpty() {
        return byKey.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OperatorTable other && byKey.equals(other.byKey);
    }

    @Override
    public int hashCode() {
        return byKey.hashCode();
    }

    @Override
    public String toString() {
        return "OperatorTable" + byKey.keySet();
    }
}
