/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import org.HdrHistogram.WriterReaderPhaser;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts events, and reports them as a per-second rate over the interval since the previous
 * {@link #getValue()} (or since construction). Each {@link #getValue()} call starts a new interval.
 * <p>
 * Counting is wait free. Counts are added into an active accumulator inside a {@link WriterReaderPhaser}
 * writer critical section; reading swaps the active and inactive accumulators and flips the phaser before
 * draining, so no count is lost between the read and the reset.
 */
class RatePerfCounter extends PerfCounter {
    /**
     * Shortest interval used as a rate divisor. Reads closer together than this are treated as this far apart.
     */
    static final long MIN_RATE_INTERVAL_NSEC = 1000000L; // 1 msec

    private final TimeServices timeServices;

    private volatile AtomicLong activeAccumulator = new AtomicLong(0);
    private AtomicLong inactiveAccumulator = new AtomicLong(0);

    private final WriterReaderPhaser recordingPhaser = new WriterReaderPhaser();

    private long intervalStartTime;

    RatePerfCounter(final String section, final String name, final TimeServices timeServices) {
        super(section, name, PerfCounterType.RATE);
        this.timeServices = timeServices;
        this.intervalStartTime = timeServices.nanoTime();
    }

    @Override
    public void increment() {
        add(1);
    }

    @Override
    public void decrement() {
        add(-1);
    }

    @Override
    public void add(long delta) {
        long criticalValueAtEnter = recordingPhaser.writerCriticalSectionEnter();
        try {
            activeAccumulator.addAndGet(delta);
        } finally {
            recordingPhaser.writerCriticalSectionExit(criticalValueAtEnter);
        }
    }

    /**
     * Get the event rate since the previous call, and start a new interval.
     * @return events per second
     */
    @Override
    public synchronized double getValue() {
        try {
            recordingPhaser.readerLock();
            final AtomicLong sampledAccumulator = activeAccumulator;
            activeAccumulator = inactiveAccumulator;
            inactiveAccumulator = sampledAccumulator;
            long now = timeServices.nanoTime();

            // Make sure no in-flight add is still updating the sampled accumulator:
            recordingPhaser.flipPhase();

            long count = sampledAccumulator.getAndSet(0);
            long interval = Math.max(now - intervalStartTime, MIN_RATE_INTERVAL_NSEC);
            intervalStartTime = now;
            return count * 1000000000.0 / interval;
        } finally {
            recordingPhaser.readerUnlock();
        }
    }
}
