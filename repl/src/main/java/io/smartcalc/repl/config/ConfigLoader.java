package io.smartcalc.repl.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link ReplConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Config file resolution:
 * <ul>
 * <li>{@code --config /path/to/config.yaml}: loads from that path; a missing file is an error</li>
 * <li>otherwise {@code smart-calc.yaml} in the current directory, if it exists</li>
 * <li>otherwise the defaults of {@link ReplConfig.Builder}</li>
 * </ul>
 *
 * <p>
 * Environment variables ({@code CALC_PROMPT}, {@code CALC_EXIT_MESSAGE}, {@code LOG_FORMAT},
 * {@code LOG_LEVEL}) take precedence over YAML values. A variable is "set" if and only if it is
 * defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "smart-calc.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Resolves and loads the configuration for the given command line, reading overrides from
     * {@link System#getenv}.
     */
    public static ReplConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Resolves and loads the configuration for the given command line.
     *
     * @param args      command-line arguments
     * @param envLookup environment variable lookup; {@code null} means undefined
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if an explicit config file is missing or unreadable
     */
    public static ReplConfig load(String[] args, Function<String, String> envLookup) {
        Path explicit = explicitConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path defaultPath = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(defaultPath)) {
            return load(defaultPath, envLookup);
        }
        ReplConfig.Builder builder = ReplConfig.builder();
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    /**
     * Loads a {@link ReplConfig} from the given YAML file, applying overrides from the supplied
     * lookup function.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ReplConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }

        ReplConfig.Builder builder = ReplConfig.builder();

        JsonNode session = root.path("session");
        if (session.has("prompt")) builder.prompt(session.get("prompt").asText());
        if (session.has("exit-message")) builder.exitMessage(session.get("exit-message").asText());
        if (session.has("help-text")) builder.helpText(session.get("help-text").asText().stripTrailing());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    /**
     * Returns the path following {@code --config}, or {@code null} if the flag is absent.
     *
     * @throws IllegalArgumentException if {@code --config} is the last argument
     */
    static Path explicitConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    private static void applyEnvOverrides(ReplConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "CALC_PROMPT", builder::prompt);
        envString(envLookup, "CALC_EXIT_MESSAGE", builder::exitMessage);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
    }

    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        String value = envLookup.apply(name);
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }
}
