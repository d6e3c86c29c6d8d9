package com.visualcompiler.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link CompilerConfig} from YAML files.
 *
 * <p>A missing, unreadable or malformed file never fails the caller: a warning is logged
 * and {@link CompilerConfig#defaults()} is returned instead.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CompilerConfig config = ConfigLoader.load(Path.of("visual-compiler.yaml"));
 * CodeGenerator generator = new CodeGenerator(TargetLanguage.JAVA, config.toGeneratorConfig());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "visual-compiler.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code visual-compiler.yaml}, may be null
     * @return loaded configuration, or defaults if unavailable
     */
    public static CompilerConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CompilerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CompilerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CompilerConfig config = YAML_MAPPER.readValue(configPath.toFile(), CompilerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CompilerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CompilerConfig.defaults();
        }
    }
}
