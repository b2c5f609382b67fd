package io.propagationcontroller.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;

import static io.propagationcontroller.config.Constants.*;

/**
 * Configuration for the propagation controller.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * An external file can be supplied through the PROPAGATION_CONFIG_FILE environment variable;
 * otherwise application.yml is read from the classpath.
 */
@Slf4j
@Getter
public class PropagationControllerConfig {
    
    private final String schedulerName;
    private final String unitRanking;
    private final boolean countEmptyKeyUnit;
    private final String controllerId;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "PROPAGATION_CONFIG_FILE";

    public PropagationControllerConfig() {
        this(System.getenv(EXTERNAL_CONFIG_ENV_VAR));
    }
    
    PropagationControllerConfig(String externalConfigPath) {
        ConfigModel config = loadYamlConfig(externalConfigPath);
        
        this.schedulerName = parseSchedulerName(config);
        this.unitRanking = parseUnitRanking(config);
        this.countEmptyKeyUnit = parseCountEmptyKeyUnit(config);
        this.controllerId = parseControllerId(config);
        
        log.info("Loaded propagation controller config - scheduler: {}, unit ranking: {}, count empty-key unit: {}", 
                schedulerName, unitRanking, countEmptyKeyUnit);
    }

    private ConfigModel loadYamlConfig(String externalConfigPath) {
        LoaderOptions loaderOptions = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, loaderOptions);
        // application.yml also carries Spring Boot keys (server, management, logging)
        constructor.getPropertyUtils().setSkipMissingProperties(true);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. External config file path
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. Classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Parse
        try {
            ConfigModel config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }
    
    private String parseSchedulerName(ConfigModel config) {
        if (config.getPlacement() != null && config.getPlacement().getScheduler_name() != null
            && !config.getPlacement().getScheduler_name().isBlank()) {
            return config.getPlacement().getScheduler_name().trim();
        }
        return DEFAULT_SCHEDULER_NAME;
    }
    
    private String parseUnitRanking(ConfigModel config) {
        if (config.getPlacement() == null || config.getPlacement().getUnit_ranking() == null) {
            return DEFAULT_UNIT_RANKING;
        }
        String ranking = config.getPlacement().getUnit_ranking().trim().toLowerCase();
        if (UNIT_RANKING_LEXICOGRAPHIC.equals(ranking) || UNIT_RANKING_CLUSTER_COUNT.equals(ranking)) {
            return ranking;
        }
        log.warn("Unknown unit ranking '{}', using default '{}'", ranking, DEFAULT_UNIT_RANKING);
        return DEFAULT_UNIT_RANKING;
    }
    
    private boolean parseCountEmptyKeyUnit(ConfigModel config) {
        if (config.getPlacement() != null && config.getPlacement().getCount_empty_key_unit() != null) {
            return config.getPlacement().getCount_empty_key_unit();
        }
        return DEFAULT_COUNT_EMPTY_KEY_UNIT;
    }
    
    private String parseControllerId(ConfigModel config) {
        if (config.getController() != null && config.getController().getId() != null
            && !config.getController().getId().isBlank()) {
            return config.getController().getId();
        }
        return DEFAULT_CONTROLLER_ID;
    }
    
    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Placement placement;
        private Controller controller;
    }
    
    @Data
    public static class Placement {
        private String scheduler_name;
        private String unit_ranking;
        private Boolean count_empty_key_unit;
    }
    
    @Data
    public static class Controller {
        private String id;
    }
}
