/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import java.util.BitSet;
import java.util.OptionalInt;

/**
 * Hands out channel ids on one upstream connection.
 *
 * <p>Ids are allocated monotonically starting at 1 and wrap around after the negotiated
 * channel-max, skipping ids that are still leased. Keeping ids moving forward instead of
 * reusing the lowest free one means a late frame for a channel that was just closed is never
 * mistaken for traffic on a freshly opened one.</p>
 *
 * <p>All methods are thread safe; a session allocates from its own event loop while the
 * connection may be read on another.</p>
 */
public class ChannelIdAllocator {

    static final int UNLIMITED_CHANNEL_MAX = 65535;

    private final int channelMax;
    private final BitSet leased;
    private int last;
    private int leasedCount;

    /**
     * @param channelMax the highest usable channel id; 0 means no limit other than the 16 bit id space
     */
    public ChannelIdAllocator(int channelMax) {
        if (channelMax < 0 || channelMax > UNLIMITED_CHANNEL_MAX) {
            throw new IllegalArgumentException("channelMax out of range: " + channelMax);
        }
        this.channelMax = channelMax == 0 ? UNLIMITED_CHANNEL_MAX : channelMax;
        this.leased = new BitSet(this.channelMax + 1);
    }

    public int channelMax() {
        return channelMax;
    }

    /**
     * @return the allocated id, or empty when every id up to channel-max is leased
     */
    public synchronized OptionalInt allocate() {
        if (leasedCount >= channelMax) {
            return OptionalInt.empty();
        }
        int candidate = last;
        for (int i = 0; i < channelMax; i++) {
            candidate = candidate >= channelMax ? 1 : candidate + 1;
            if (!leased.get(candidate)) {
                leased.set(candidate);
                leasedCount++;
                last = candidate;
                return OptionalInt.of(candidate);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * @return true if the id was leased
     */
    public synchronized boolean release(int channelId) {
        if (channelId < 1 || channelId > channelMax || !leased.get(channelId)) {
            return false;
        }
        leased.clear(channelId);
        leasedCount--;
        return true;
    }

    public synchronized boolean isLeased(int channelId) {
        return channelId >= 1 && channelId <= channelMax && leased.get(channelId);
    }

    public synchronized int leasedCount() {
        return leasedCount;
    }
}
