/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import io.amqproxy.proxy.frame.AmqpMethod;
import io.amqproxy.proxy.frame.Frame;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Receives upstream events while holding a lease. Callbacks arrive on the upstream
 * connection's event loop, which need not be the lessee's own.
 */
public interface UpstreamListener {

    /**
     * A frame arrived on a non-zero channel. The listener owns the frame and must release it.
     */
    void onUpstreamFrame(Frame frame);

    /**
     * The current read from the broker socket is complete; a good moment to flush.
     */
    void onUpstreamReadComplete();

    /**
     * The broker socket's outbound buffer crossed a water mark.
     */
    void onUpstreamWritabilityChanged(boolean writable);

    /**
     * The broker sent connection.blocked or connection.unblocked.
     */
    void onUpstreamFlowControl(AmqpMethod method);

    /**
     * The connection is gone. It has already been removed from the pool.
     *
     * @param brokerClose the broker's connection.close, or null when the transport failed
     * @param cause what happened
     */
    void onUpstreamClosed(@Nullable AmqpMethod.ConnectionClose brokerClose, Throwable cause);
}
