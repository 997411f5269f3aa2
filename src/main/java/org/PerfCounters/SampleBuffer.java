/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A fixed capacity circular buffer of recorded sample values. Recording is wait free: each
 * {@link #record} claims a slot with a single atomic increment of a write cursor and stores into it,
 * overwriting the oldest sample once the buffer is full. The buffer therefore holds the last
 * min(recorded count, capacity) samples.
 * <p>
 * Snapshots are not synchronized with recorders. A sample being recorded while a snapshot is taken
 * may or may not appear in it.
 */
public class SampleBuffer {
    protected final long samples[];
    protected final int capacity;
    protected final AtomicLong writeCursor = new AtomicLong(0);

    /**
     *
     * @param capacity number of samples retained by the buffer
     */
    public SampleBuffer(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.samples = new long[capacity];
    }

    /**
     * Record a sample value. Values are treated as unsigned 64 bit quantities.
     * @param value the sample value
     */
    public void record(long value) {
        long cursorAtWrite = writeCursor.getAndIncrement();
        samples[(int) (cursorAtWrite % capacity)] = value;
    }

    /**
     * Copy the currently retained samples into {@code target}, which must be at least
     * {@link #getCapacity()} long.
     *
     * @param target array into which samples are copied, starting at index 0
     * @return the number of samples copied
     */
    public int snapshotInto(long[] target) {
        if (target.length < capacity) {
            throw new IllegalArgumentException("target length " + target.length +
                    " is smaller than buffer capacity " + capacity);
        }
        int count = (int) Math.min(writeCursor.get(), capacity);
        System.arraycopy(samples, 0, target, 0, count);
        return count;
    }

    /**
     * @return the total number of samples ever recorded, including overwritten ones
     */
    public long getTotalRecorded() {
        return writeCursor.get();
    }

    public int getCapacity() {
        return capacity;
    }
}
