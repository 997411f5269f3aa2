/*
 * package-info.java
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

/**
 * <h3>A performance counter package</h3>
 * <p>
 * The PerfCounters package provides the counters a server uses to expose its behavior to operators and
 * monitoring tools: cumulative totals, per-second rates, and latency percentiles. Counters are updated from
 * hot code paths, so recording is always a single wait-free step, and any aggregation work is moved out of
 * the recording path.
 * <p>
 * <h3>Counter types</h3>
 * {@link org.PerfCounters.SimplePerfCounter} is the entry point. Each counter is created with a
 * {@link org.PerfCounters.PerfCounterType}, which selects the strategy behind the common
 * {@link org.PerfCounters.PerfCounter} operations:
 * <li>NUMBER counters keep a running total.</li>
 * <li>RATE counters report events per second over the interval since they were last read.</li>
 * <li>NUMBER_PERCENTILES counters report the p50, p90, p95, p99 and p99.9 of recently recorded samples.</li>
 * Operations a counter type does not support are programming errors, and throw
 * {@link java.lang.UnsupportedOperationException}.
 * <p>
 * <h3>Percentiles</h3>
 * Percentile counters record samples into a fixed capacity {@link org.PerfCounters.SampleBuffer}, which
 * keeps the most recent samples and overwrites older ones. A {@link org.PerfCounters.QuantileEngine}
 * periodically snapshots the buffer and computes all tracked percentiles in one linear time
 * {@link org.PerfCounters.MultiSelect} pass, publishing an immutable
 * {@link org.PerfCounters.PercentileResults}. Reading a percentile never computes anything; it reports
 * the latest published results.
 * <p>
 * Snapshots are not synchronized with recorders, and the reported percentiles are as of the latest
 * recomputation. Percentiles are exact for the samples captured by a snapshot, and approximate with
 * respect to the live sample stream.
 * <p>
 * <h3>Time and configuration</h3>
 * Recomputation scheduling and rate intervals use an injected {@link org.PerfCounters.TimeServices}
 * instance, which can run on manual time for testing. The recompute interval is read from a
 * {@link org.PerfCounters.Configuration} when a counter is created.
 * <h3>Example usage</h3>
 * <br><pre><code>
 * SimplePerfCounter readLatency = SimplePerfCounter.Builder.create("replica", "read.latency.nsec")
 *         .type(PerfCounterType.NUMBER_PERCENTILES)
 *         .build();
 * ...
 * long startTime = System.nanoTime();
 * doRead();
 * readLatency.set(System.nanoTime() - startTime);
 * ...
 * double p99 = readLatency.getPercentile(PercentileType.P99);
 * </code></pre>
 */

package org.PerfCounters;
