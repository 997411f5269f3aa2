/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import java.util.concurrent.TimeUnit;

/**
 * SimplePerfCounter is the entry point for creating performance counters. The counting strategy is chosen
 * at construction from the declared {@link PerfCounterType}, and all operations are delegated to it:
 * <ul>
 * <li>{@link PerfCounterType#NUMBER}: supports {@link #increment}, {@link #decrement}, {@link #add}, and
 * {@link #getValue}, which reports the running total.</li>
 * <li>{@link PerfCounterType#RATE}: supports {@link #increment}, {@link #decrement}, {@link #add}, and
 * {@link #getValue}, which reports events per second since the previous {@link #getValue} call, and starts a
 * new interval.</li>
 * <li>{@link PerfCounterType#NUMBER_PERCENTILES}: supports {@link #set}, which records a sample, and
 * {@link #getPercentile}, which reports the percentiles of the most recent samples as of the latest periodic
 * recomputation (or -1.0 before any are available).</li>
 * </ul>
 * Calling an operation the counter's type does not support throws an {@link UnsupportedOperationException}.
 * <p>
 * Percentile counters keep the latest {@link #DEFAULT_SAMPLE_BUFFER_CAPACITY} samples (by default), and
 * recompute their percentiles at the interval (in seconds) configured under the
 * {@value #CONFIG_KEY_COMPUTATION_INTERVAL} key of the {@value #CONFIG_SECTION} configuration section
 * (30 seconds by default).
 * <p>
 * SimplePerfCounter objects can be instantiated either directly via the provided constructors, or by
 * using the fluent API builder supported by {@link SimplePerfCounter.Builder}. Percentile counters should be
 * {@link #close() closed} when no longer used.
 */
public class SimplePerfCounter extends PerfCounter {
    public static final String CONFIG_SECTION = "components.simple_perf_counter";
    public static final String CONFIG_KEY_COMPUTATION_INTERVAL = "counter_computation_interval_seconds";
    public static final int DEFAULT_COMPUTATION_INTERVAL_SECONDS = 30;
    public static final int DEFAULT_SAMPLE_BUFFER_CAPACITY = 50000;

    private static volatile TimeServices defaultTimeServices;

    private final PerfCounter counterImpl;

    /**
     * Get the TimeServices used by counters that were not given one. Unless set with
     * {@link #setDefaultTimeServices}, it is created on first use from the system properties (see
     * {@link TimeServices#fromSystemProperties()}). Percentile counters without an executor of their own
     * share its {@link TimeServices#getSharedScheduledExecutor() shared executor}.
     * @return the default TimeServices
     */
    static public TimeServices getDefaultTimeServices() {
        // Lazy Initialization: Avoid double-checked locking race by using a local variable reading from a volatile:
        TimeServices timeServices = defaultTimeServices;
        if (timeServices == null) {
            synchronized (SimplePerfCounter.class) {
                timeServices = defaultTimeServices;
                if (timeServices == null) {
                    defaultTimeServices = timeServices = TimeServices.fromSystemProperties();
                }
            }
        }
        return timeServices;
    }

    /**
     * Set the TimeServices used by counters subsequently created without one. Counters already created keep
     * the TimeServices they were created with.
     * @param timeServices the new default TimeServices
     */
    static public void setDefaultTimeServices(TimeServices timeServices) {
        if (timeServices == null) {
            throw new IllegalArgumentException("default timeServices must not be null");
        }
        defaultTimeServices = timeServices;
    }

    /**
     * Create a SimplePerfCounter with default settings:<br>
     * <ul>
     * <li>configuration read from the JVM system properties</li>
     * <li>the {@link #getDefaultTimeServices() default time services}</li>
     * <li>percentile counters run recomputations on the default time services' shared executor</li>
     * <li>a sample buffer capacity of {@link #DEFAULT_SAMPLE_BUFFER_CAPACITY}</li>
     * <li>verbose output if the PerfCounters.verbose system property is "true"</li>
     * </ul>
     *
     * @param section the section the counter belongs to
     * @param name    the counter name
     * @param type    the counter type
     */
    public SimplePerfCounter(final String section, final String name, final PerfCounterType type) {
        this(section, name, type,
                PropertiesConfiguration.fromSystemProperties(),
                getDefaultTimeServices(),
                null,
                DEFAULT_SAMPLE_BUFFER_CAPACITY,
                Boolean.getBoolean("PerfCounters.verbose"));
    }

    /**
     *
     * @param section              the section the counter belongs to
     * @param name                 the counter name
     * @param type                 the counter type
     * @param configuration        configuration consulted for the percentile recompute interval
     * @param timeServices         time services used for rate intervals and percentile recomputation
     * @param scheduledExecutor    executor to run percentile recomputations on, or null for the shared executor of timeServices
     * @param sampleBufferCapacity number of most recent samples retained by percentile counters
     * @param verbose              report percentile recomputations on System.out
     */
    public SimplePerfCounter(final String section,
                             final String name,
                             final PerfCounterType type,
                             final Configuration configuration,
                             final TimeServices timeServices,
                             final TimeServices.ScheduledExecutor scheduledExecutor,
                             final int sampleBufferCapacity,
                             final boolean verbose) {
        super(section, name, type);
        if (configuration == null) {
            throw new IllegalArgumentException("configuration must not be null for counter " + getFullName());
        }
        if (timeServices == null) {
            throw new IllegalArgumentException("timeServices must not be null for counter " + getFullName());
        }

        switch (type) {
            case NUMBER:
                counterImpl = new NumberPerfCounter(section, name);
                break;
            case RATE:
                counterImpl = new RatePerfCounter(section, name, timeServices);
                break;
            default:
                int intervalSeconds = configuration.getIntValue(CONFIG_SECTION, CONFIG_KEY_COMPUTATION_INTERVAL,
                        DEFAULT_COMPUTATION_INTERVAL_SECONDS);
                if (intervalSeconds <= 0) {
                    throw new IllegalArgumentException(CONFIG_SECTION + "." + CONFIG_KEY_COMPUTATION_INTERVAL +
                            " must be positive, was " + intervalSeconds);
                }
                counterImpl = new PercentilePerfCounter(section, name, sampleBufferCapacity, timeServices,
                        scheduledExecutor, TimeUnit.SECONDS.toNanos(intervalSeconds), verbose);
        }
    }

    @Override
    public void increment() {
        counterImpl.increment();
    }

    @Override
    public void decrement() {
        counterImpl.decrement();
    }

    @Override
    public void add(long delta) {
        counterImpl.add(delta);
    }

    @Override
    public void set(long value) {
        counterImpl.set(value);
    }

    @Override
    public double getValue() {
        return counterImpl.getValue();
    }

    @Override
    public double getPercentile(PercentileType type) {
        return counterImpl.getPercentile(type);
    }

    /**
     * Stop operation of this counter. Percentile counters cancel their pending recomputation.
     */
    @Override
    public void close() {
        counterImpl.close();
    }

    PerfCounter getCounterImpl() {
        return counterImpl;
    }

    /**
     * A fluent API builder class for creating SimplePerfCounter objects.
     * <br>Uses the following defaults:
     * <ul>
     * <li>type:                  {@link PerfCounterType#NUMBER} </li>
     * <li>configuration:         JVM system properties </li>
     * <li>timeServices:          {@link SimplePerfCounter#getDefaultTimeServices()} </li>
     * <li>scheduledExecutor:     (the shared executor of timeServices) </li>
     * <li>sampleBufferCapacity:  50000 </li>
     * <li>verbose:               false </li>
     * </ul>
     */
    public static class Builder {
        private String section;
        private String name;
        private PerfCounterType type = PerfCounterType.NUMBER;
        private Configuration configuration = null;
        private TimeServices timeServices = null;
        private TimeServices.ScheduledExecutor scheduledExecutor = null;
        private int sampleBufferCapacity = DEFAULT_SAMPLE_BUFFER_CAPACITY;
        private boolean verbose = false;

        public static Builder create(String section, String name) {
            return new Builder().section(section).name(name);
        }

        public Builder() {

        }

        public Builder section(String section) {
            this.section = section;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(PerfCounterType type) {
            this.type = type;
            return this;
        }

        public Builder configuration(Configuration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder timeServices(TimeServices timeServices) {
            this.timeServices = timeServices;
            return this;
        }

        public Builder scheduledExecutor(TimeServices.ScheduledExecutor scheduledExecutor) {
            this.scheduledExecutor = scheduledExecutor;
            return this;
        }

        public Builder sampleBufferCapacity(int sampleBufferCapacity) {
            this.sampleBufferCapacity = sampleBufferCapacity;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public SimplePerfCounter build() {
            return new SimplePerfCounter(section, name, type,
                    (configuration != null) ? configuration : PropertiesConfiguration.fromSystemProperties(),
                    (timeServices != null) ? timeServices : getDefaultTimeServices(),
                    scheduledExecutor,
                    sampleBufferCapacity,
                    verbose);
        }
    }
}
