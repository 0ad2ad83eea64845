/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import javax.net.ssl.SSLEngine;

import org.junit.jupiter.api.Test;

import io.netty.buffer.ByteBufAllocator;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;

import io.amqproxy.proxy.service.HostPort;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UpstreamConnectionTest {

    @Test
    void tlsHandlerVerifiesBrokerHostname() throws Exception {
        SslHandler handler = UpstreamConnection.newSslHandler(SslContextBuilder.forClient().build(), ByteBufAllocator.DEFAULT,
                new HostPort("broker.example.com", 5671));
        try {
            SSLEngine engine = handler.engine();
            assertTrue(engine.getUseClientMode());
            assertEquals("HTTPS", engine.getSSLParameters().getEndpointIdentificationAlgorithm());
            assertEquals("broker.example.com", engine.getPeerHost());
            assertEquals(5671, engine.getPeerPort());
        }
        finally {
            handler.engine().closeOutbound();
        }
    }
}
