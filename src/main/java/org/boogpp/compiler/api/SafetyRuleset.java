package org.boogpp.compiler.api;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explicit allow and block rules for the CUSTOM safety mode.
 * <p>
 * Entries are operation identifiers such as {@code registry.write}. By default an entry matches
 * exactly one operation. An entry ending in {@code .*} is a prefix wildcard: {@code processes.*}
 * matches {@code processes.list} and {@code processes.kill.tree}, but not {@code processes} itself.
 * If an operation matches both sets the block entry wins.
 *
 * @param allowed The operations explicitly allowed.
 * @param blocked The operations explicitly blocked.
 */
public record SafetyRuleset(Set<String> allowed, Set<String> blocked) {

    /** A ruleset without any entries. */
    public static final SafetyRuleset EMPTY = new SafetyRuleset(Set.of(), Set.of());

    /**
     * The outcome of consulting the ruleset for one operation.
     */
    public enum Decision {
        /** The operation matches a block entry. */
        BLOCK,
        /** The operation matches an allow entry and no block entry. */
        ALLOW,
        /** The ruleset does not mention the operation. */
        UNSPECIFIED
    }

    public SafetyRuleset {
        allowed = Set.copyOf(allowed);
        blocked = Set.copyOf(blocked);
    }

    /**
     * Builds a ruleset from comma-separated lists, as written in a {@code @safety_level} decorator.
     * @param allowCsv The allowed operations, may be null.
     * @param blockCsv The blocked operations, may be null.
     * @return The ruleset.
     */
    public static SafetyRuleset parse(String allowCsv, String blockCsv) {
        return new SafetyRuleset(split(allowCsv), split(blockCsv));
    }

    private static Set<String> split(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Decides an operation against this ruleset.
     * @param operation The operation identifier.
     * @return The decision; block entries take precedence.
     */
    public Decision decide(String operation) {
        if (matchesAny(blocked, operation)) {
            return Decision.BLOCK;
        }
        if (matchesAny(allowed, operation)) {
            return Decision.ALLOW;
        }
        return Decision.UNSPECIFIED;
    }

    /**
     * @param operation The operation identifier.
     * @return true if any entry of either set matches the operation.
     */
    public boolean mentions(String operation) {
        return decide(operation) != Decision.UNSPECIFIED;
    }

    private static boolean matchesAny(Set<String> entries, String operation) {
        for (String entry : entries) {
            if (entry.endsWith(".*")) {
                String prefix = entry.substring(0, entry.length() - 1);
                if (operation.startsWith(prefix) && operation.length() > prefix.length()) {
                    return true;
                }
            } else if (entry.equals(operation)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "(allow=" + allowed + ", block=" + blocked + ")";
    }
}
