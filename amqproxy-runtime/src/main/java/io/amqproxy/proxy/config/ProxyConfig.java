/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully resolved and validated proxy configuration.
 *
 * @param listenAddress address the client listener binds
 * @param listenPort client listener port, 0 for an ephemeral port
 * @param httpPort admin HTTP port, negative to disable the endpoint
 * @param upstream the broker
 * @param idleConnectionTimeout how long a released upstream connection may stay unused in the pool
 * @param termTimeout how long to wait, after close has been sent to clients at shutdown, before aborting; empty waits forever
 * @param termClientCloseTimeout grace period at shutdown for clients to close on their own before the proxy closes them
 * @param logLevel root log level
 * @param frameMax largest frame payload accepted and announced to clients
 * @param channelMax channel-max announced to clients
 * @param heartbeat heartbeat interval announced to clients, zero lets the client decide
 * @param channelCloseTimeout how long a finished session waits for the broker to confirm its channel closes
 * @param idleSweepInterval how often the pool looks for expired idle connections
 */
public record ProxyConfig(String listenAddress,
                          int listenPort,
                          int httpPort,
                          UpstreamUrl upstream,
                          Duration idleConnectionTimeout,
                          Optional<Duration> termTimeout,
                          Duration termClientCloseTimeout,
                          String logLevel,
                          int frameMax,
                          int channelMax,
                          Duration heartbeat,
                          Duration channelCloseTimeout,
                          Duration idleSweepInterval) {

    public static final String DEFAULT_LISTEN_ADDRESS = "localhost";
    public static final int DEFAULT_LISTEN_PORT = 5673;
    public static final int DEFAULT_HTTP_PORT = 15673;
    public static final Duration DEFAULT_IDLE_CONNECTION_TIMEOUT = Duration.ofSeconds(5);
    public static final String DEFAULT_LOG_LEVEL = "info";
    public static final int DEFAULT_FRAME_MAX = 131072;
    public static final int DEFAULT_CHANNEL_MAX = 2047;
    public static final Duration DEFAULT_CHANNEL_CLOSE_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_IDLE_SWEEP_INTERVAL = Duration.ofSeconds(1);

    public ProxyConfig {
        Objects.requireNonNull(listenAddress);
        Objects.requireNonNull(upstream);
        Objects.requireNonNull(idleConnectionTimeout);
        Objects.requireNonNull(termTimeout);
        Objects.requireNonNull(termClientCloseTimeout);
        Objects.requireNonNull(logLevel);
        Objects.requireNonNull(heartbeat);
        Objects.requireNonNull(channelCloseTimeout);
        Objects.requireNonNull(idleSweepInterval);
    }

    public boolean isHttpEnabled() {
        return httpPort >= 0;
    }

    public static Builder builder(UpstreamUrl upstream) {
        return new Builder(upstream);
    }

    public Builder toBuilder() {
        return new Builder(upstream)
                .listenAddress(listenAddress)
                .listenPort(listenPort)
                .httpPort(httpPort)
                .idleConnectionTimeout(idleConnectionTimeout)
                .termTimeout(termTimeout.orElse(null))
                .termClientCloseTimeout(termClientCloseTimeout)
                .logLevel(logLevel)
                .frameMax(frameMax)
                .channelMax(channelMax)
                .heartbeat(heartbeat)
                .channelCloseTimeout(channelCloseTimeout)
                .idleSweepInterval(idleSweepInterval);
    }

    public static final class Builder {
        private final UpstreamUrl upstream;
        private String listenAddress = DEFAULT_LISTEN_ADDRESS;
        private int listenPort = DEFAULT_LISTEN_PORT;
        private int httpPort = DEFAULT_HTTP_PORT;
        private Duration idleConnectionTimeout = DEFAULT_IDLE_CONNECTION_TIMEOUT;
        private Duration termTimeout;
        private Duration termClientCloseTimeout = Duration.ZERO;
        private String logLevel = DEFAULT_LOG_LEVEL;
        private int frameMax = DEFAULT_FRAME_MAX;
        private int channelMax = DEFAULT_CHANNEL_MAX;
        private Duration heartbeat = Duration.ZERO;
        private Duration channelCloseTimeout = DEFAULT_CHANNEL_CLOSE_TIMEOUT;
        private Duration idleSweepInterval = DEFAULT_IDLE_SWEEP_INTERVAL;

        private Builder(UpstreamUrl upstream) {
            this.upstream = Objects.requireNonNull(upstream);
        }

        public Builder listenAddress(String listenAddress) {
            this.listenAddress = listenAddress;
            return this;
        }

        public Builder listenPort(int listenPort) {
            this.listenPort = listenPort;
            return this;
        }

        public Builder httpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public Builder idleConnectionTimeout(Duration idleConnectionTimeout) {
            this.idleConnectionTimeout = idleConnectionTimeout;
            return this;
        }

        /**
         * @param termTimeout the hard shutdown timeout, or null to wait forever
         */
        public Builder termTimeout(Duration termTimeout) {
            this.termTimeout = termTimeout;
            return this;
        }

        public Builder termClientCloseTimeout(Duration termClientCloseTimeout) {
            this.termClientCloseTimeout = termClientCloseTimeout;
            return this;
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder frameMax(int frameMax) {
            this.frameMax = frameMax;
            return this;
        }

        public Builder channelMax(int channelMax) {
            this.channelMax = channelMax;
            return this;
        }

        public Builder heartbeat(Duration heartbeat) {
            this.heartbeat = heartbeat;
            return this;
        }

        public Builder channelCloseTimeout(Duration channelCloseTimeout) {
            this.channelCloseTimeout = channelCloseTimeout;
            return this;
        }

        public Builder idleSweepInterval(Duration idleSweepInterval) {
            this.idleSweepInterval = idleSweepInterval;
            return this;
        }

        public ProxyConfig build() {
            return new ProxyConfig(listenAddress, listenPort, httpPort, upstream, idleConnectionTimeout,
                    Optional.ofNullable(termTimeout), termClientCloseTimeout, logLevel, frameMax, channelMax,
                    heartbeat, channelCloseTimeout, idleSweepInterval);
        }
    }
}
