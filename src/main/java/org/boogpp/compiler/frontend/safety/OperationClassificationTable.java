package org.boogpp.compiler.frontend.safety;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The static, read-only table classifying operations for the safety checker.
 * <p>
 * Keys are operation identifiers. A key ending in {@code .*} classifies every operation below
 * that prefix; an exact key takes precedence over a wildcard, and the longest wildcard wins.
 * Operations the table does not mention are {@link OperationClass#ALLOWED}.
 * Instances are immutable and may be shared between concurrent compilations.
 */
public final class OperationClassificationTable {

    private final Map<String, OperationClass> entries;

    /**
     * @param entries Operation identifier (or {@code prefix.*}) to classification.
     */
    public OperationClassificationTable(Map<String, OperationClass> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * @param operation The operation identifier.
     * @return The classification of the operation.
     */
    public OperationClass classify(String operation) {
        OperationClass exact = entries.get(operation);
        if (exact != null) {
            return exact;
        }
        OperationClass best = OperationClass.ALLOWED;
        int bestLength = -1;
        for (Map.Entry<String, OperationClass> entry : entries.entrySet()) {
            String key = entry.getKey();
            if (!key.endsWith(".*")) {
                continue;
            }
            String prefix = key.substring(0, key.length() - 1);
            if (operation.startsWith(prefix) && prefix.length() > bestLength) {
                best = entry.getValue();
                bestLength = prefix.length();
            }
        }
        return best;
    }

    /**
     * @return All entries, in configuration order.
     */
    public Map<String, OperationClass> entries() {
        return entries;
    }
}
