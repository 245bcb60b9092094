package dev.dapbridge.transport;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out strictly increasing {@code seq} values for outbound messages, starting at 1.
 */
public final class SequenceAllocator {

    private final AtomicInteger next = new AtomicInteger(1);

    public int next() {
        return next.getAndIncrement();
    }

    public int peek() {
        return next.get();
    }
}
