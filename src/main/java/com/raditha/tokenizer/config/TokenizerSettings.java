package com.raditha.tokenizer.config;

import com.raditha.tokenizer.exception.ConfigurationException;
import com.raditha.tokenizer.model.FileFormat;
import com.raditha.tokenizer.model.TokenStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads tokenizer configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > tokenizer.yml > defaults
 * <pre>
 * tokenizer:
 *   columns: [ssn, email]
 *   token_method: sequential
 *   token_map_file: token_map.csv
 *   delimiter: ","
 *   encoding: UTF-8
 * </pre>
 */
public class TokenizerSettings {

    private static final Logger logger = LoggerFactory.getLogger(TokenizerSettings.class);

    public static final String CONFIG_KEY = "tokenizer";
    public static final String DEFAULT_CONFIG_FILE = "tokenizer.yml";

    private final Map<String, Object> yamlConfig;

    private TokenizerSettings(Map<String, Object> yamlConfig) {
        this.yamlConfig = yamlConfig;
    }

    /**
     * Settings with nothing from YAML; every value comes from the CLI or the defaults.
     */
    public static TokenizerSettings empty() {
        return new TokenizerSettings(Map.of());
    }

    /**
     * Read the {@code tokenizer} section of a YAML file.
     *
     * @throws ConfigurationException if the file is not valid YAML
     * @throws IOException            if the file cannot be read
     */
    public static TokenizerSettings load(Path configFile) throws IOException {
        Object root;
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            root = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration file " + configFile + ": " + e.getMessage(), e);
        }
        if (!(root instanceof Map<?, ?> rootMap)) {
            logger.debug("Configuration file {} is empty", configFile);
            return empty();
        }
        Object section = rootMap.get(CONFIG_KEY);
        if (section == null) {
            logger.debug("Configuration file {} has no '{}' section", configFile, CONFIG_KEY);
            return empty();
        }
        if (!(section instanceof Map)) {
            throw new ConfigurationException("'" + CONFIG_KEY + "' in " + configFile + " must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        logger.debug("Loaded configuration from {}", configFile);
        return new TokenizerSettings(config);
    }

    /**
     * Use {@code configFile} when given, otherwise {@value #DEFAULT_CONFIG_FILE} in
     * the working directory if it exists.
     *
     * @throws ConfigurationException if an explicitly named file does not exist
     */
    public static TokenizerSettings resolve(Path configFile) throws IOException {
        if (configFile != null) {
            if (!Files.isRegularFile(configFile)) {
                throw new ConfigurationException("Config file not found: " + configFile);
            }
            return load(configFile);
        }
        Path defaultFile = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(defaultFile)) {
            return load(defaultFile);
        }
        return empty();
    }

    /**
     * Build the run configuration, applying CLI overrides where provided.
     *
     * @param columnsCLI     CLI columns (null or empty = use YAML)
     * @param tokenMethodCLI CLI token method (null = use YAML/default)
     * @param mappingFileCLI CLI token map path (null = use YAML/default)
     * @param delimiterCLI   CLI delimiter (null = use YAML/default)
     * @param encodingCLI    CLI encoding (null = use YAML/default)
     * @return complete configuration
     * @throws ConfigurationException if any value is invalid
     */
    public TokenizerConfig loadConfig(List<String> columnsCLI, String tokenMethodCLI, String mappingFileCLI,
                                      String delimiterCLI, String encodingCLI) {
        TokenizerConfig defaults = TokenizerConfig.defaults();

        List<String> columns = columnsCLI != null && !columnsCLI.isEmpty()
                ? columnsCLI
                : getListString("columns");

        String method = tokenMethodCLI != null ? tokenMethodCLI : getString("token_method", null);
        TokenStrategy strategy = method != null ? TokenStrategy.fromString(method) : defaults.strategy();

        String mappingFile = mappingFileCLI != null
                ? mappingFileCLI
                : getString("token_map_file", TokenizerConfig.DEFAULT_MAPPING_FILE);

        char delimiter = parseDelimiter(delimiterCLI != null
                ? delimiterCLI
                : getString("delimiter", String.valueOf(defaults.format().delimiter())));
        Charset charset = parseCharset(encodingCLI != null
                ? encodingCLI
                : getString("encoding", defaults.format().charset().name()));

        FileFormat format;
        try {
            format = new FileFormat(delimiter, charset);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        return new TokenizerConfig(columns, strategy, Path.of(mappingFile), format);
    }

    static char parseDelimiter(String value) {
        if (value == null || value.isEmpty()) {
            throw new ConfigurationException("Delimiter cannot be empty");
        }
        if (value.equals("\\t") || value.equalsIgnoreCase("tab")) {
            return '\t';
        }
        if (value.length() != 1) {
            throw new ConfigurationException("Delimiter must be a single character, got: " + value);
        }
        return value.charAt(0);
    }

    static Charset parseCharset(String value) {
        try {
            return Charset.forName(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported encoding: " + value, e);
        }
    }

    private String getString(String key, String defaultValue) {
        Object value = yamlConfig.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value.toString();
    }

    private List<String> getListString(String key) {
        Object value = yamlConfig.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        } else if (value != null) {
            result.add(value.toString());
        }
        return result;
    }
}
