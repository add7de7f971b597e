package com.project.provenance.eth;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process block clock that only moves when told to.
 */
public class ManualBlockClock implements BlockClock {

    private final AtomicLong height;

    public ManualBlockClock() {
        this(0);
    }

    public ManualBlockClock(long startHeight) {
        if (startHeight < 0) {
            throw new IllegalArgumentException("startHeight must not be negative");
        }
        this.height = new AtomicLong(startHeight);
    }

    @Override
    public long currentHeight() {
        return height.get();
    }

    public long advance() {
        return height.incrementAndGet();
    }

    public long advanceBy(long blocks) {
        if (blocks < 0) {
            throw new IllegalArgumentException("block clock cannot move backwards: " + blocks);
        }
        return height.addAndGet(blocks);
    }
}
