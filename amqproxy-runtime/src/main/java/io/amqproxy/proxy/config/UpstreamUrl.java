/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

import io.amqproxy.proxy.service.HostPort;

/**
 * The broker the proxy connects to. Only scheme, host and port are taken from the URL; the
 * virtual host and credentials come from each client's own handshake.
 *
 * @param hostPort broker address
 * @param tls whether the upstream connection is wrapped in TLS ({@code amqps})
 */
public record UpstreamUrl(HostPort hostPort, boolean tls) {

    public static final int AMQP_PORT = 5672;
    public static final int AMQPS_PORT = 5671;

    public UpstreamUrl {
        Objects.requireNonNull(hostPort);
    }

    /**
     * @param url {@code amqp://host[:port]} or {@code amqps://host[:port]}
     * @return the parsed url
     * @throws ConfigException if the url is malformed, has no host or an unknown scheme
     */
    public static UpstreamUrl parse(String url) {
        URI uri;
        try {
            uri = new URI(url.trim());
        }
        catch (URISyntaxException e) {
            throw new ConfigException("Invalid upstream URL '" + url + "': " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        boolean tls;
        int defaultPort;
        if ("amqp".equalsIgnoreCase(scheme)) {
            tls = false;
            defaultPort = AMQP_PORT;
        }
        else if ("amqps".equalsIgnoreCase(scheme)) {
            tls = true;
            defaultPort = AMQPS_PORT;
        }
        else {
            throw new ConfigException("Not a valid upstream AMQP URL '" + url + "', should be on the format of amqps://hostname");
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new ConfigException("Invalid upstream URL '" + url + "': no host");
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port = uri.getPort() == -1 ? defaultPort : uri.getPort();
        return new UpstreamUrl(new HostPort(host, port), tls);
    }

    @Override
    public String toString() {
        return (tls ? "amqps://" : "amqp://") + hostPort;
    }
}
