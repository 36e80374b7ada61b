package com.notredis.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server command line and the configuration sources it names.
 *
 * Usage: notredis [config-file] [--key value ...] [-]
 *
 * Values are read from the config file, then from standard input when the last
 * argument is "-", then from --key value options. Later sources win.
 */
public final class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "redis.conf";
    private static final String STDIN_ARGUMENT = "-";
    private static final String OPTION_PREFIX = "--";
    private static final String EMPTY_VALUE = "\"\"";

    private final Path configFile;
    private final boolean explicitConfigFile;
    private final boolean readStdin;
    private final Map<String, String> overrides;
    private final boolean helpRequested;
    private final boolean versionRequested;

    private ServerConfig(Path configFile, boolean explicitConfigFile, boolean readStdin,
            Map<String, String> overrides, boolean helpRequested, boolean versionRequested) {
        this.configFile = configFile;
        this.explicitConfigFile = explicitConfigFile;
        this.readStdin = readStdin;
        this.overrides = Collections.unmodifiableMap(overrides);
        this.helpRequested = helpRequested;
        this.versionRequested = versionRequested;
    }

    /**
     * Parse the server command line.
     *
     * @param args the process arguments
     * @return the parsed command line
     */
    public static ServerConfig parse(String... args) {
        List<String> remaining = new ArrayList<>(Arrays.asList(args));

        boolean help = remaining.contains("--help") || remaining.contains("-h");
        boolean version = remaining.contains("--version") || remaining.contains("-v");
        if (help || version) {
            return new ServerConfig(Path.of(DEFAULT_CONFIG_FILE), false, false,
                    new LinkedHashMap<>(), help, version);
        }

        Path file = Path.of(DEFAULT_CONFIG_FILE);
        boolean explicit = false;
        if (!remaining.isEmpty() && !remaining.get(0).startsWith("-")) {
            file = Path.of(remaining.remove(0));
            explicit = true;
        }

        boolean stdin = false;
        if (!remaining.isEmpty() && STDIN_ARGUMENT.equals(remaining.get(remaining.size() - 1))) {
            remaining.remove(remaining.size() - 1);
            stdin = true;
        }

        Map<String, String> overrides = new LinkedHashMap<>();
        String pendingKey = null;
        for (String arg : remaining) {
            if (arg.startsWith(OPTION_PREFIX)) {
                if (pendingKey != null) {
                    logger.warn("Option --{} has no value, ignored", pendingKey);
                }
                pendingKey = arg.substring(OPTION_PREFIX.length());
                if (pendingKey.isEmpty()) {
                    logger.warn("Empty option name, ignored");
                    pendingKey = null;
                }
            } else if (pendingKey != null) {
                overrides.put(pendingKey, arg);
                pendingKey = null;
            } else {
                logger.warn("Invalid argument: {}", arg);
            }
        }
        if (pendingKey != null) {
            logger.warn("Option --{} has no value, ignored", pendingKey);
        }

        return new ServerConfig(file, explicit, stdin, overrides, false, false);
    }

    /**
     * Read every configured source into a new table.
     *
     * @param stdin stream read when "-" was given
     * @return the populated configuration table
     * @throws IOException if an explicitly named config file is missing or unreadable
     */
    public ConfigTable load(InputStream stdin) throws IOException {
        Map<String, String> values = new HashMap<>();

        if (Files.isRegularFile(configFile)) {
            try (BufferedReader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
                readLines(reader, values);
            }
            logger.info("Loaded configuration from {}", configFile.toAbsolutePath());
        } else if (explicitConfigFile) {
            throw new NoSuchFileException(configFile.toString(), null, "config file not found");
        } else {
            logger.warn("No config file specified, using the default config. "
                    + "To specify one use: notredis /path/to/redis.conf");
        }

        if (readStdin) {
            // Standard input belongs to the process; it is not closed here
            BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            readLines(reader, values);
            logger.info("Loaded configuration from standard input");
        }

        values.putAll(overrides);
        return new ConfigTable(values);
    }

    /**
     * Read "key value" lines. Blank lines and lines starting with '#' are skipped,
     * and a value of "" stands for the empty string.
     *
     * @param reader the lines to read
     * @param target map receiving the values
     * @throws IOException if reading fails
     */
    static void readLines(BufferedReader reader, Map<String, String> target) throws IOException {
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int split = indexOfWhitespace(trimmed);
            if (split < 0) {
                logger.warn("Config line {} has no value, ignored: {}", lineNumber, trimmed);
                continue;
            }
            String key = trimmed.substring(0, split);
            String value = trimmed.substring(split + 1).trim();
            if (EMPTY_VALUE.equals(value)) {
                value = "";
            }
            target.put(key, value);
        }
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    public Path getConfigFile() {
        return configFile;
    }

    public boolean isExplicitConfigFile() {
        return explicitConfigFile;
    }

    public boolean isReadStdin() {
        return readStdin;
    }

    public Map<String, String> getOverrides() {
        return overrides;
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }

    public boolean isVersionRequested() {
        return versionRequested;
    }
}
