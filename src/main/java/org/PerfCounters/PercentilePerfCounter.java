/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

/**
 * Tracks percentiles of recorded sample values. Samples are recorded with {@link #set} into a
 * {@link SampleBuffer}, and a {@link QuantileEngine} periodically recomputes the percentiles reported
 * by {@link #getPercentile}.
 */
class PercentilePerfCounter extends PerfCounter {
    private final SampleBuffer sampleBuffer;
    private final QuantileEngine quantileEngine;

    /**
     * @param scheduledExecutor executor to run recomputations on. If null, the shared executor of
     *                          {@code timeServices} is used.
     */
    PercentilePerfCounter(final String section, final String name,
                          final int sampleBufferCapacity,
                          final TimeServices timeServices,
                          final TimeServices.ScheduledExecutor scheduledExecutor,
                          final long recomputeIntervalNsec,
                          final boolean verbose) {
        super(section, name, PerfCounterType.NUMBER_PERCENTILES);
        this.sampleBuffer = new SampleBuffer(sampleBufferCapacity);
        TimeServices.ScheduledExecutor executor =
                (scheduledExecutor != null) ? scheduledExecutor : timeServices.getSharedScheduledExecutor();
        this.quantileEngine = new QuantileEngine(getFullName(), sampleBuffer, timeServices, executor,
                recomputeIntervalNsec, verbose);
    }

    @Override
    public void set(long value) {
        sampleBuffer.record(value);
    }

    @Override
    public double getPercentile(PercentileType type) {
        if (type == null) {
            throw new IllegalArgumentException("percentile type must not be null for counter " + getFullName());
        }
        return quantileEngine.getResults().getValue(type);
    }

    @Override
    public void close() {
        quantileEngine.close();
    }

    SampleBuffer getSampleBuffer() {
        return sampleBuffer;
    }

    QuantileEngine getQuantileEngine() {
        return quantileEngine;
    }
}
