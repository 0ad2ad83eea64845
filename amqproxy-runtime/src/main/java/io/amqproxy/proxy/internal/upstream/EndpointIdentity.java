/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import java.util.Objects;

import io.amqproxy.proxy.service.HostPort;

/**
 * Key under which pooled upstream connections are grouped. Two identities are equal only when
 * every field matches, so a connection is never handed to a client that authenticated as
 * someone else or asked for another virtual host.
 *
 * @param hostPort broker address
 * @param tls whether the connection uses TLS
 * @param virtualHost virtual host from the client's connection.open
 * @param username user from the client's connection.start-ok
 * @param password password from the client's connection.start-ok
 */
public record EndpointIdentity(HostPort hostPort,
                               boolean tls,
                               String virtualHost,
                               String username,
                               String password) {

    public EndpointIdentity {
        Objects.requireNonNull(hostPort);
        Objects.requireNonNull(virtualHost);
        Objects.requireNonNull(username);
        Objects.requireNonNull(password);
    }

    @Override
    public String toString() {
        return (tls ? "amqps://" : "amqp://") + username + "@" + hostPort + "/" + virtualHost;
    }
}
