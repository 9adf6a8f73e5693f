package com.schemagov.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class GovernanceConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(GovernanceConfigLoader.class);

    private final ObjectMapper mapper;

    public GovernanceConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public GovernanceConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("config.missing path={} using built-in defaults", configPath);
            return new GovernanceConfig();
        }
        try {
            if (Files.size(configPath) == 0) {
                return new GovernanceConfig();
            }
            GovernanceConfig config = mapper.readValue(configPath.toFile(), GovernanceConfig.class);
            log.info("config.loaded path={} reviewPolicies={} teams={}",
                    configPath,
                    config.getSchemaGovernance().getReviewPolicies().keySet(),
                    config.getTeams().keySet());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read governance configuration " + configPath + ": " + e.getMessage(), e);
        }
    }
}
