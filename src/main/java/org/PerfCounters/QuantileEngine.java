/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * A QuantileEngine periodically computes the tracked percentiles ({@link PercentileType}) of the samples
 * held in a {@link SampleBuffer}, and publishes them as an immutable {@link PercentileResults}.
 * <p>
 * Each recomputation snapshots the buffer into a scratch array, computes the rank of every tracked
 * percentile against the snapshot size, and resolves all of them with a single {@link MultiSelect} pass.
 * The new results replace the previous ones with a single volatile write, so readers of
 * {@link #getResults()} never block and never see a partially built table. Between recomputations the
 * results are stale by at most the recompute interval.
 * <p>
 * Recomputations run on the supplied {@link TimeServices.ScheduledExecutor}. The next one is only scheduled
 * after the current one completes, so recomputations never overlap. {@link #close()} cancels the pending
 * recomputation, waits for one in progress to finish, and prevents any further scheduling.
 * <p>
 * A failure to schedule the next recomputation, or a failure during a recomputation, stops the engine:
 * it is reported on System.err, kept (see {@link #getFailure()}), and nothing is rescheduled.
 */
public class QuantileEngine {

    public enum State {
        /** Waiting for the next scheduled recomputation */
        IDLE,
        /** A recomputation is in progress */
        COMPUTING,
        /** Closed or failed. No further recomputation will happen. */
        STOPPED
    }

    private static final PercentileType[] trackedPercentiles = PercentileType.values();

    private final String name;
    private final SampleBuffer sampleBuffer;
    private final long scratch[];
    private final TimeServices timeServices;
    private final TimeServices.ScheduledExecutor scheduledExecutor;
    private final long recomputeIntervalNsec;
    private final boolean verbose;

    private volatile PercentileResults results = PercentileResults.EMPTY;
    private volatile State state = State.IDLE;
    private volatile boolean closeRequested = false;
    private volatile TimeServices.ScheduledTask pendingRecompute;
    private volatile RuntimeException failure;

    private final Runnable scheduledRecompute = new Runnable() {
        @Override
        public void run() {
            onScheduledRecompute();
        }
    };

    /**
     * Create a QuantileEngine and schedule its first recomputation.
     *
     * @param name                  name used when reporting
     * @param sampleBuffer          the buffer whose samples are tracked
     * @param timeServices          time source for result timestamps
     * @param scheduledExecutor     executor on which recomputations are run
     * @param recomputeIntervalNsec interval between recomputations, in nanoseconds
     * @param verbose               report recomputations on System.out
     * @throws RejectedExecutionException if the first recomputation cannot be scheduled
     */
    public QuantileEngine(final String name,
                          final SampleBuffer sampleBuffer,
                          final TimeServices timeServices,
                          final TimeServices.ScheduledExecutor scheduledExecutor,
                          final long recomputeIntervalNsec,
                          final boolean verbose) {
        if (recomputeIntervalNsec <= 0) {
            throw new IllegalArgumentException("recomputeIntervalNsec must be positive, was " + recomputeIntervalNsec);
        }
        this.name = name;
        this.sampleBuffer = sampleBuffer;
        this.scratch = new long[sampleBuffer.getCapacity()];
        this.timeServices = timeServices;
        this.scheduledExecutor = scheduledExecutor;
        this.recomputeIntervalNsec = recomputeIntervalNsec;
        this.verbose = verbose;

        synchronized (this) {
            pendingRecompute = scheduledExecutor.schedule(scheduledRecompute, recomputeIntervalNsec, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * Recompute the percentiles now, on the calling thread. Waits for any recomputation already in progress.
     * Does nothing once the engine is stopped.
     *
     * @return the latest results
     */
    public synchronized PercentileResults recompute() {
        if (state == State.STOPPED) {
            return results;
        }
        state = State.COMPUTING;
        try {
            computeResults();
        } finally {
            if (state == State.COMPUTING) {
                state = State.IDLE;
            }
        }
        return results;
    }

    /**
     * @return the results of the latest recomputation, or {@link PercentileResults#EMPTY} if no recomputation
     * has seen any samples
     */
    public PercentileResults getResults() {
        return results;
    }

    public State getState() {
        return state;
    }

    /**
     * @return the failure that stopped this engine, or null
     */
    public RuntimeException getFailure() {
        return failure;
    }

    public long getRecomputeIntervalNsec() {
        return recomputeIntervalNsec;
    }

    TimeServices.ScheduledExecutor getScheduledExecutor() {
        return scheduledExecutor;
    }

    /**
     * Stop this engine. Cancels the pending recomputation, and waits for a recomputation in progress to
     * complete. No recomputation will be scheduled afterwards.
     */
    public void close() {
        closeRequested = true;
        TimeServices.ScheduledTask recomputeToCancel = pendingRecompute;
        if (recomputeToCancel != null) {
            recomputeToCancel.cancel();
        }
        synchronized (this) {
            if (pendingRecompute != null) {
                pendingRecompute.cancel();
                pendingRecompute = null;
            }
            state = State.STOPPED;
        }
        if (verbose) {
            System.out.println("QuantileEngine " + name + ": stopped");
        }
    }

    private void computeResults() {
        long startTime = timeServices.nanoTime();
        int sampleCount = sampleBuffer.snapshotInto(scratch);
        if (sampleCount == 0) {
            return;
        }

        int ranks[] = new int[trackedPercentiles.length];
        for (int i = 0; i < trackedPercentiles.length; i++) {
            ranks[i] = trackedPercentiles[i].rankOf(sampleCount);
        }
        long values[] = MultiSelect.select(scratch, sampleCount, ranks);

        long now = timeServices.nanoTime();
        results = new PercentileResults(values, sampleCount, now);

        if (verbose) {
            System.out.println("QuantileEngine " + name + ": computed " + results + " in " +
                    (now - startTime) + " nsec");
        }
    }

    private synchronized void onScheduledRecompute() {
        if (closeRequested || (state == State.STOPPED)) {
            return;
        }
        pendingRecompute = null;
        try {
            recompute();
        } catch (RuntimeException ex) {
            stopOnFailure("recomputation failed", ex);
            throw ex;
        }
        // close() may have been called while computing; it is waiting for us, and expects no new tick:
        if (closeRequested) {
            return;
        }
        try {
            pendingRecompute = scheduledExecutor.schedule(scheduledRecompute, recomputeIntervalNsec, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException ex) {
            stopOnFailure("could not schedule next recomputation", ex);
        }
    }

    private void stopOnFailure(final String reason, final RuntimeException ex) {
        failure = ex;
        state = State.STOPPED;
        System.err.println("QuantileEngine " + name + ": " + reason + ", stopping: " + ex);
    }
}
