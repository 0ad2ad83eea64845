/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Resolves a {@link ProxyConfig} from cascading layers. Lowest precedence first:
 * built-in defaults, the YAML config file, {@code AMQPROXY_*} environment variables and
 * finally the command line.
 */
public class ConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    static final Set<String> LOG_LEVELS = Set.of("trace", "debug", "info", "warn", "error", "off");

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    /**
     * Parses a YAML document into a layer.
     *
     * @param yaml the document
     * @return the layer; an empty document yields {@link ConfigLayer#EMPTY}
     * @throws ConfigException if the document is not valid
     */
    public ConfigLayer parseYaml(String yaml) {
        return parse(yaml, "Invalid config file: ");
    }

    /**
     * Reads the config file at {@code path}.
     *
     * @throws ConfigException if the file is missing or not valid
     */
    public ConfigLayer readFile(Path path) {
        String yaml;
        try {
            yaml = Files.readString(path, StandardCharsets.UTF_8);
        }
        catch (NoSuchFileException e) {
            throw new ConfigException("Config file not found: " + path, e);
        }
        catch (IOException e) {
            throw new ConfigException("Failed to read config file " + path + ": " + e.getMessage(), e);
        }
        ConfigLayer layer = parse(yaml, "Invalid config file " + path + ": ");
        LOGGER.debug("Loaded config file {}", path);
        return layer;
    }

    private ConfigLayer parse(String yaml, String errorPrefix) {
        // jackson refuses a document without content
        if (yaml.isBlank()) {
            return ConfigLayer.EMPTY;
        }
        try {
            ConfigLayer layer = mapper.readValue(yaml, ConfigLayer.class);
            return layer == null ? ConfigLayer.EMPTY : layer;
        }
        catch (JsonProcessingException e) {
            throw new ConfigException(errorPrefix + e.getOriginalMessage(), e);
        }
    }

    /**
     * Loads and resolves configuration.
     *
     * @param configFile optional YAML file
     * @param env the process environment
     * @param commandLine values given on the command line
     * @return the resolved configuration
     * @throws ConfigException if a value is missing or invalid
     */
    public ProxyConfig load(@Nullable Path configFile, Map<String, String> env, ConfigLayer commandLine) {
        ConfigLayer merged = ConfigLayer.EMPTY;
        if (configFile != null) {
            merged = merged.overlay(readFile(configFile));
        }
        merged = merged.overlay(ConfigLayer.fromEnvironment(env)).overlay(commandLine);
        return resolve(merged);
    }

    /**
     * Applies defaults to a merged layer and validates the result.
     */
    public ProxyConfig resolve(ConfigLayer layer) {
        if (layer.upstream() == null || layer.upstream().isBlank()) {
            throw new ConfigException("Upstream AMQP url is required");
        }
        UpstreamUrl upstream = UpstreamUrl.parse(layer.upstream());

        ProxyConfig.Builder builder = ProxyConfig.builder(upstream);
        if (layer.listenAddress() != null) {
            if (layer.listenAddress().isBlank()) {
                throw new ConfigException("listenAddress must not be blank");
            }
            builder.listenAddress(layer.listenAddress().trim());
        }
        if (layer.listenPort() != null) {
            builder.listenPort(port("listenPort", layer.listenPort()));
        }
        if (layer.httpPort() != null) {
            int httpPort = layer.httpPort();
            // negative disables the admin endpoint
            builder.httpPort(httpPort < 0 ? -1 : port("httpPort", httpPort));
        }
        if (layer.idleConnectionTimeout() != null) {
            builder.idleConnectionTimeout(seconds("idleConnectionTimeout", layer.idleConnectionTimeout()));
        }
        if (layer.termTimeout() != null && layer.termTimeout() >= 0) {
            builder.termTimeout(Duration.ofSeconds(layer.termTimeout()));
        }
        if (layer.termClientCloseTimeout() != null) {
            builder.termClientCloseTimeout(seconds("termClientCloseTimeout", layer.termClientCloseTimeout()));
        }
        builder.logLevel(logLevel(layer));
        if (layer.frameMax() != null) {
            int frameMax = layer.frameMax();
            if (frameMax < 4096) {
                throw new ConfigException("frameMax must be at least 4096 but was " + frameMax);
            }
            builder.frameMax(frameMax);
        }
        if (layer.channelMax() != null) {
            int channelMax = layer.channelMax();
            if (channelMax < 1 || channelMax > 65535) {
                throw new ConfigException("channelMax must be between 1 and 65535 but was " + channelMax);
            }
            builder.channelMax(channelMax);
        }
        if (layer.heartbeat() != null) {
            int heartbeat = layer.heartbeat();
            if (heartbeat < 0 || heartbeat > 65535) {
                throw new ConfigException("heartbeat must be between 0 and 65535 but was " + heartbeat);
            }
            builder.heartbeat(Duration.ofSeconds(heartbeat));
        }
        if (layer.channelCloseTimeout() != null) {
            builder.channelCloseTimeout(positiveSeconds("channelCloseTimeout", layer.channelCloseTimeout()));
        }
        if (layer.idleSweepInterval() != null) {
            builder.idleSweepInterval(positiveSeconds("idleSweepInterval", layer.idleSweepInterval()));
        }
        return builder.build();
    }

    private static String logLevel(ConfigLayer layer) {
        if (Boolean.TRUE.equals(layer.debug())) {
            return "debug";
        }
        String level = layer.normalisedLogLevel();
        if (level == null) {
            return ProxyConfig.DEFAULT_LOG_LEVEL;
        }
        // accept the long spellings too
        level = switch (level) {
            case "warning" -> "warn";
            case "none" -> "off";
            case "fatal" -> "error";
            default -> level;
        };
        if (!LOG_LEVELS.contains(level)) {
            throw new ConfigException("logLevel must be one of " + LOG_LEVELS + " but was '" + layer.logLevel() + "'");
        }
        return level.toLowerCase(Locale.ROOT);
    }

    private static int port(String key, int value) {
        if (value < 0 || value > 65535) {
            throw new ConfigException(key + " must be between 0 and 65535 but was " + value);
        }
        return value;
    }

    private static Duration seconds(String key, int value) {
        if (value < 0) {
            throw new ConfigException(key + " must not be negative but was " + value);
        }
        return Duration.ofSeconds(value);
    }

    private static Duration positiveSeconds(String key, int value) {
        if (value <= 0) {
            throw new ConfigException(key + " must be positive but was " + value);
        }
        return Duration.ofSeconds(value);
    }
}
