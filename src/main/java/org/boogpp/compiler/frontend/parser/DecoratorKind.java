package org.boogpp.compiler.frontend.parser;

import org.boogpp.compiler.frontend.parser.ast.DecoratorArgument;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The closed set of decorators the language understands, each with the options it accepts.
 * Decorators are compile-time configuration only; their arguments must be constants.
 */
public enum DecoratorKind {
    SAFETY_LEVEL("safety_level", true,
            Option.oneOf("mode", "SAFE", "UNSAFE", "CUSTOM"),
            Option.of("allow", DecoratorArgument.Kind.STRING),
            Option.of("block", DecoratorArgument.Kind.STRING)),
    UNSAFE("unsafe", false),
    RESILIENT("resilient", false,
            Option.of("max_attempts", DecoratorArgument.Kind.INTEGER),
            Option.of("timeout", DecoratorArgument.Kind.INTEGER),
            Option.oneOf("backoff", "none", "linear", "exponential")),
    HOOK("hook", false,
            Option.oneOf("event",
                    "PROCESS_CREATION", "PROCESS_TERMINATION",
                    "FILE_WRITE", "FILE_READ", "FILE_DELETE",
                    "REGISTRY_WRITE", "REGISTRY_READ",
                    "NETWORK_CONNECTION", "DRIVER_LOAD")),
    DRIVER_ENTRY("driver_entry", false);

    /**
     * An option a decorator accepts.
     *
     * @param name    The option name.
     * @param kind    The required value kind, for options without an enumerated value set.
     * @param choices The permitted values; empty if any value of {@code kind} is allowed.
     */
    public record Option(String name, DecoratorArgument.Kind kind, Set<String> choices) {

        static Option of(String name, DecoratorArgument.Kind kind) {
            return new Option(name, kind, Set.of());
        }

        static Option oneOf(String name, String... choices) {
            return new Option(name, DecoratorArgument.Kind.SYMBOL, Set.of(choices));
        }

        /**
         * Enumerated options take a bare symbol or a string naming one of the choices.
         * @param argument The written argument.
         * @return true if the value is acceptable for this option.
         */
        public boolean accepts(DecoratorArgument argument) {
            if (!choices.isEmpty()) {
                boolean textual = argument.kind() == DecoratorArgument.Kind.SYMBOL
                        || argument.kind() == DecoratorArgument.Kind.STRING;
                return textual && choices.contains(argument.asText());
            }
            return argument.kind() == kind;
        }
    }

    private final String decoratorName;
    private final boolean moduleLevel;
    private final Map<String, Option> options = new LinkedHashMap<>();

    DecoratorKind(String decoratorName, boolean moduleLevel, Option... options) {
        this.decoratorName = decoratorName;
        this.moduleLevel = moduleLevel;
        for (Option option : options) {
            this.options.put(option.name(), option);
        }
    }

    /**
     * @param name The name written after '@'.
     * @return The matching kind, if the name is known.
     */
    public static Optional<DecoratorKind> fromName(String name) {
        return Arrays.stream(values()).filter(k -> k.decoratorName.equals(name)).findFirst();
    }

    /**
     * @return The name as written in the source.
     */
    public String decoratorName() {
        return decoratorName;
    }

    /**
     * @return true if the decorator configures the whole module rather than one function.
     */
    public boolean isModuleLevel() {
        return moduleLevel;
    }

    /**
     * @param name The option name.
     * @return The option definition, if this decorator recognizes it.
     */
    public Optional<Option> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    /**
     * @return The option definitions in declaration order.
     */
    public List<Option> options() {
        return List.copyOf(options.values());
    }
}
