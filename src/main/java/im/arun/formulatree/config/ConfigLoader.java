package im.arun.formulatree.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String RESOURCE_NAME = "formula-tree.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final FormulaConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private FormulaConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), FormulaConfig.class);
                }
                logger.warn("Config file {} not found, falling back to {}", configPath, RESOURCE_NAME);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, FormulaConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", RESOURCE_NAME);
            return new FormulaConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new FormulaConfig();
        }
    }

    public FormulaConfig load() {
        return load(null);
    }

    /**
     * Defaults merged with user overrides. Keys may be camelCase or snake_case.
     */
    public FormulaConfig load(Map<String, Object> userOptions) {
        FormulaConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "max_nesting_depth":
                case "maxNestingDepth":
                    if (value instanceof Integer) config.setMaxNestingDepth((Integer) value);
                    break;
                case "synthetic_variable_prefix":
                case "syntheticVariablePrefix":
                    if (value instanceof String) config.setSyntheticVariablePrefix((String) value);
                    break;
                case "synthetic_group_prefix":
                case "syntheticGroupPrefix":
                    if (value instanceof String) config.setSyntheticGroupPrefix((String) value);
                    break;
                case "equality_variable_prefix":
                case "equalityVariablePrefix":
                    if (value instanceof String) config.setEqualityVariablePrefix((String) value);
                    break;
                case "equality_binding":
                case "equalityBinding":
                    config.setEqualityBinding(parseBoolean(value));
                    break;
                case "variable_css_class":
                case "variableCssClass":
                    if (value instanceof String) config.setVariableCssClass((String) value);
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private FormulaConfig copyConfig(FormulaConfig source) {
        FormulaConfig copy = new FormulaConfig();
        copy.setMaxNestingDepth(source.getMaxNestingDepth());
        copy.setSyntheticVariablePrefix(source.getSyntheticVariablePrefix());
        copy.setSyntheticGroupPrefix(source.getSyntheticGroupPrefix());
        copy.setEqualityVariablePrefix(source.getEqualityVariablePrefix());
        copy.setEqualityBinding(source.isEqualityBinding());
        copy.setVariableCssClass(source.getVariableCssClass());
        return copy;
    }
}
