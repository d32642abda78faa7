package org.boogpp.compiler.config;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed table of external functions, keyed by their source-level qualified name.
 * It is supplied as configuration, never discovered, and is immutable once built.
 */
public final class ExternalSignatureTable {

    private final Map<String, ExternalFunction> byName;

    /**
     * @param functions The external functions.
     * @throws IllegalArgumentException if two entries share a name.
     */
    public ExternalSignatureTable(Collection<ExternalFunction> functions) {
        Map<String, ExternalFunction> map = new LinkedHashMap<>();
        for (ExternalFunction function : functions) {
            if (map.put(function.name(), function) != null) {
                throw new IllegalArgumentException("Duplicate external function: " + function.name());
            }
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    /**
     * @return A table without any entries.
     */
    public static ExternalSignatureTable empty() {
        return new ExternalSignatureTable(List.of());
    }

    /**
     * @param qualifiedName The source-level name.
     * @return The external function, if declared.
     */
    public Optional<ExternalFunction> lookup(String qualifiedName) {
        return Optional.ofNullable(byName.get(qualifiedName));
    }

    /**
     * @param symbol The ABI symbol.
     * @return The external function emitted under that symbol, if any.
     */
    public Optional<ExternalFunction> bySymbol(String symbol) {
        return byName.values().stream().filter(f -> f.symbol().equals(symbol)).findFirst();
    }

    /**
     * @param modulePath A dotted module path such as {@code windows.process}.
     * @return true if at least one function is declared in that module or below it.
     */
    public boolean hasModule(String modulePath) {
        String prefix = modulePath + ".";
        return byName.keySet().stream().anyMatch(name -> name.startsWith(prefix));
    }

    /**
     * @return All entries, in configuration order.
     */
    public Collection<ExternalFunction> all() {
        return byName.values();
    }
}
