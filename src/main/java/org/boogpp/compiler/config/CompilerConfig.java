package org.boogpp.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.boogpp.compiler.api.SafetyMode;
import org.boogpp.compiler.api.SafetyRuleset;
import org.boogpp.compiler.frontend.safety.OperationClass;
import org.boogpp.compiler.frontend.safety.OperationClassificationTable;
import org.boogpp.compiler.frontend.semantics.TypeResolver;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The compiler's configuration: default safety mode, the operation classification table,
 * the runtime/OS ABI signature table and the runtime hooks the generator calls.
 * <p>
 * Everything is read and validated once; the resulting object is immutable and may be shared
 * by concurrent compilations.
 */
public final class CompilerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerConfig.class);
    private static final String CONFIG_FILE_NAME = "boogpp.conf";
    private static final String ENV_PREFIX = "BOOGPP_";

    private static final String DEFAULT_MODE_PATH = "boogpp.safety.default-mode";
    private static final String CUSTOM_ALLOW_PATH = "boogpp.safety.custom.allow";
    private static final String CUSTOM_BLOCK_PATH = "boogpp.safety.custom.block";
    private static final String OPERATIONS_PATH = "boogpp.safety.operations";
    private static final String RUNTIME_PATH = "boogpp.runtime";
    private static final String EXTERNALS_PATH = "boogpp.runtime.externals";

    private final Config config;
    private final SafetyMode defaultMode;
    private final OperationClassificationTable classifications;
    private final ExternalSignatureTable externals;
    private final RuntimeSymbols runtime;

    private CompilerConfig(Config config) {
        this.config = config;
        this.defaultMode = readDefaultMode(config);
        this.classifications = readClassifications(config);
        this.externals = readExternals(config);
        this.runtime = readRuntime(config.getConfig(RUNTIME_PATH));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment variables prefixed {@code BOOGPP_}
     * 2. Java system properties (e.g. {@code -Dboogpp.safety.default-mode=UNSAFE})
     * 3. Configuration file ({@code boogpp.conf} in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return The validated configuration.
     * @throws ConfigException if a value is missing or malformed.
     */
    public static CompilerConfig load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with an explicit configuration file at the third precedence level.
     *
     * @param configFile The configuration file; skipped if it does not exist.
     * @return The validated configuration.
     * @throws ConfigException if a value is missing or malformed.
     */
    public static CompilerConfig load(File configFile) {
        final Config envConfig = ConfigFactory.parseMap(environmentOverrides(System.getenv()), "environment");
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combined = envConfig
                .withFallback(cliConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig);
        return new CompilerConfig(combined.resolve());
    }

    /**
     * @return The configuration defined by reference.conf alone.
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * Builds the configuration from an already assembled Typesafe config, e.g. one parsed from a
     * string in tests. Missing keys fall back to reference.conf.
     *
     * @param config The configuration tree.
     * @return The validated configuration.
     */
    public static CompilerConfig fromConfig(Config config) {
        return new CompilerConfig(config.withFallback(ConfigFactory.parseResources("reference.conf")).resolve());
    }

    /**
     * Maps {@code BOOGPP_SAFETY_DEFAULT__MODE} to {@code boogpp.safety.default-mode}:
     * a single underscore separates path segments, a double underscore stands for a dash.
     */
    static Map<String, String> environmentOverrides(Map<String, String> environment) {
        Map<String, String> overrides = new HashMap<>();
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String name = entry.getKey();
            if (!name.startsWith(ENV_PREFIX)) {
                continue;
            }
            String path = name.toLowerCase(Locale.ROOT)
                    .replace("__", "-")
                    .replace('_', '.');
            overrides.put(path, entry.getValue());
        }
        return overrides;
    }

    private static SafetyMode readDefaultMode(Config config) {
        String name = config.getString(DEFAULT_MODE_PATH);
        SafetyMode mode;
        try {
            mode = SafetyMode.of(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(DEFAULT_MODE_PATH, "expected SAFE, UNSAFE or CUSTOM but was '" + name + "'");
        }
        if (mode.kind() == SafetyMode.Kind.CUSTOM) {
            List<String> allow = config.hasPath(CUSTOM_ALLOW_PATH) ? config.getStringList(CUSTOM_ALLOW_PATH) : List.of();
            List<String> block = config.hasPath(CUSTOM_BLOCK_PATH) ? config.getStringList(CUSTOM_BLOCK_PATH) : List.of();
            mode = SafetyMode.custom(new SafetyRuleset(new LinkedHashSet<>(allow), new LinkedHashSet<>(block)));
        }
        return mode;
    }

    private static OperationClassificationTable readClassifications(Config config) {
        Map<String, OperationClass> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : config.getObject(OPERATIONS_PATH).entrySet()) {
            String value = String.valueOf(entry.getValue().unwrapped());
            try {
                entries.put(entry.getKey(), OperationClass.valueOf(value.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(OPERATIONS_PATH + ".\"" + entry.getKey() + "\"",
                        "expected BLOCKED, LOGGED or ALLOWED but was '" + value + "'");
            }
        }
        return new OperationClassificationTable(entries);
    }

    private static ExternalSignatureTable readExternals(Config config) {
        List<ExternalFunction> functions = new ArrayList<>();
        for (Config entry : config.getConfigList(EXTERNALS_PATH)) {
            String name = entry.getString("name");
            List<Type> parameters = new ArrayList<>();
            for (String parameter : entry.getStringList("params")) {
                parameters.add(parseType(name, parameter));
            }
            Type returnType = parseType(name, entry.getString("returns"));
            functions.add(new ExternalFunction(name, entry.getString("symbol"), parameters, returnType));
        }
        try {
            return new ExternalSignatureTable(functions);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(EXTERNALS_PATH, e.getMessage());
        }
    }

    private static RuntimeSymbols readRuntime(Config runtime) {
        return new RuntimeSymbols(
                runtime.getString("audit-log"),
                runtime.getString("bounds-check"),
                runtime.getString("string-concat"),
                runtime.getString("string-equals"),
                runtime.getString("string-length"));
    }

    private static Type parseType(String function, String text) {
        return TypeResolver.parse(text).orElseThrow(() -> new ConfigException.BadValue(EXTERNALS_PATH,
                "unparsable type '" + text + "' in signature of '" + function + "'"));
    }

    /**
     * @return The mode used when neither the source nor the caller chooses one.
     */
    public SafetyMode defaultMode() {
        return defaultMode;
    }

    /**
     * @return The operation classification table.
     */
    public OperationClassificationTable classifications() {
        return classifications;
    }

    /**
     * @return The runtime/OS ABI signature table.
     */
    public ExternalSignatureTable externals() {
        return externals;
    }

    /**
     * @return The runtime hooks called by generated code.
     */
    public RuntimeSymbols runtime() {
        return runtime;
    }

    /**
     * @return The underlying configuration tree, for settings outside the compiler core (e.g. logging).
     */
    public Config raw() {
        return config;
    }
}
