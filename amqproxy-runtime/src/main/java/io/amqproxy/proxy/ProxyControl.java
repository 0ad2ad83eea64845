/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy;

/**
 * Operations the shutdown coordinator and the admin endpoint perform on a running proxy.
 */
public interface ProxyControl {

    /**
     * @return client sessions that are handshaking, open or closing
     */
    int liveClientConnections();

    /**
     * Closes the client listener. Sessions already accepted are not affected.
     */
    void stopAcceptingClients();

    /**
     * Sends connection.close to every live client session.
     */
    void disconnectClients();
}
