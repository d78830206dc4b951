package com.idp.sa.token.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.idp.sa.token.ConfigException;
import com.idp.sa.token.ServiceAccountTokenConfig;

/**
 * Reads a YAML token configuration file. Durations use ISO-8601 notation, e.g. {@code expiresIn: PT15M}.
 */
public final class ConfigLoader {
    private static final ObjectMapper YAML = YAMLMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private ConfigLoader() {}

    public static ServiceAccountTokenConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("config", "config path is required");
        }
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("config", "no such file " + path);
        }
        ServiceAccountTokenConfig config;
        try {
            config = YAML.readValue(path.toFile(), ServiceAccountTokenConfig.class);
        } catch (IOException e) {
            throw new ConfigException("config", "failed to parse config file " + path, e);
        }
        if (config == null) {
            throw new ConfigException("config", "config file " + path + " is empty");
        }
        return config;
    }
}
