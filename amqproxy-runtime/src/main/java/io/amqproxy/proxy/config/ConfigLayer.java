/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.config;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One source of configuration values: the config file, the environment or the command line.
 * Every value is optional; a {@code null} means "not set at this layer".
 *
 * <p>Timeouts and intervals are in seconds, matching the command line options.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = false)
public record ConfigLayer(@JsonProperty("listenAddress") @Nullable String listenAddress,
                          @JsonProperty("listenPort") @Nullable Integer listenPort,
                          @JsonProperty("httpPort") @Nullable Integer httpPort,
                          @JsonProperty("upstream") @Nullable String upstream,
                          @JsonProperty("idleConnectionTimeout") @Nullable Integer idleConnectionTimeout,
                          @JsonProperty("termTimeout") @Nullable Integer termTimeout,
                          @JsonProperty("termClientCloseTimeout") @Nullable Integer termClientCloseTimeout,
                          @JsonProperty("logLevel") @Nullable String logLevel,
                          @JsonProperty("debug") @Nullable Boolean debug,
                          @JsonProperty("frameMax") @Nullable Integer frameMax,
                          @JsonProperty("channelMax") @Nullable Integer channelMax,
                          @JsonProperty("heartbeat") @Nullable Integer heartbeat,
                          @JsonProperty("channelCloseTimeout") @Nullable Integer channelCloseTimeout,
                          @JsonProperty("idleSweepInterval") @Nullable Integer idleSweepInterval) {

    public static final String ENV_PREFIX = "AMQPROXY_";

    public static final ConfigLayer EMPTY = new ConfigLayer(null, null, null, null, null, null, null, null, null, null, null, null, null, null);

    /**
     * Returns a layer where every value set in {@code top} replaces the value of this layer.
     */
    public ConfigLayer overlay(ConfigLayer top) {
        return new ConfigLayer(
                pick(top.listenAddress, listenAddress),
                pick(top.listenPort, listenPort),
                pick(top.httpPort, httpPort),
                pick(top.upstream, upstream),
                pick(top.idleConnectionTimeout, idleConnectionTimeout),
                pick(top.termTimeout, termTimeout),
                pick(top.termClientCloseTimeout, termClientCloseTimeout),
                pick(top.logLevel, logLevel),
                pick(top.debug, debug),
                pick(top.frameMax, frameMax),
                pick(top.channelMax, channelMax),
                pick(top.heartbeat, heartbeat),
                pick(top.channelCloseTimeout, channelCloseTimeout),
                pick(top.idleSweepInterval, idleSweepInterval));
    }

    /**
     * Reads {@code AMQPROXY_*} variables, e.g. {@code AMQPROXY_LISTEN_PORT} or
     * {@code AMQPROXY_UPSTREAM}.
     *
     * @param env the environment
     * @return the layer
     * @throws ConfigException if a numeric variable does not parse
     */
    public static ConfigLayer fromEnvironment(Map<String, String> env) {
        return new ConfigLayer(
                env.get(ENV_PREFIX + "LISTEN_ADDRESS"),
                envValue(env, "LISTEN_PORT", ConfigLayer::parseInt),
                envValue(env, "HTTP_PORT", ConfigLayer::parseInt),
                env.get(ENV_PREFIX + "UPSTREAM"),
                envValue(env, "IDLE_CONNECTION_TIMEOUT", ConfigLayer::parseInt),
                envValue(env, "TERM_TIMEOUT", ConfigLayer::parseInt),
                envValue(env, "TERM_CLIENT_CLOSE_TIMEOUT", ConfigLayer::parseInt),
                env.get(ENV_PREFIX + "LOG_LEVEL"),
                envValue(env, "DEBUG", v -> Boolean.parseBoolean(v.trim())),
                envValue(env, "FRAME_MAX", ConfigLayer::parseInt),
                envValue(env, "CHANNEL_MAX", ConfigLayer::parseInt),
                envValue(env, "HEARTBEAT", ConfigLayer::parseInt),
                envValue(env, "CHANNEL_CLOSE_TIMEOUT", ConfigLayer::parseInt),
                envValue(env, "IDLE_SWEEP_INTERVAL", ConfigLayer::parseInt));
    }

    @Nullable
    private static <T> T envValue(Map<String, String> env, String suffix, Function<String, T> parser) {
        String name = ENV_PREFIX + suffix;
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parser.apply(value);
        }
        catch (NumberFormatException e) {
            throw new ConfigException("Environment variable " + name + " is not a number: '" + value + "'", e);
        }
    }

    private static Integer parseInt(String value) {
        return Integer.valueOf(value.trim());
    }

    @Nullable
    private static <T> T pick(@Nullable T top, @Nullable T bottom) {
        return top != null ? top : bottom;
    }

    @Nullable
    String normalisedLogLevel() {
        return logLevel == null ? null : logLevel.trim().toLowerCase(Locale.ROOT);
    }
}
