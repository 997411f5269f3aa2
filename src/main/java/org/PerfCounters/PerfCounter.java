/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import java.io.Closeable;

/**
 * The common capability set of performance counters. Every counter type supports only a subset of these
 * operations (see {@link PerfCounterType}); the remaining ones are programming errors, and fail
 * immediately with an {@link UnsupportedOperationException}.
 * <p>
 * Subclasses override the operations they support.
 */
public abstract class PerfCounter implements Closeable {
    private final String section;
    private final String name;
    private final PerfCounterType type;

    protected PerfCounter(final String section, final String name, final PerfCounterType type) {
        if ((section == null) || (name == null) || (type == null)) {
            throw new IllegalArgumentException("section, name and type must all be provided");
        }
        this.section = section;
        this.name = name;
        this.type = type;
    }

    public void increment() {
        throw unsupported("increment");
    }

    public void decrement() {
        throw unsupported("decrement");
    }

    public void add(long delta) {
        throw unsupported("add");
    }

    /**
     * Record a sample value
     * @param value the sample value, treated as unsigned
     */
    public void set(long value) {
        throw unsupported("set");
    }

    public double getValue() {
        throw unsupported("getValue");
    }

    /**
     * @param type the percentile to report
     * @return the value at the given percentile as of the latest recomputation, or -1.0 if none is available
     */
    public double getPercentile(PercentileType type) {
        throw unsupported("getPercentile");
    }

    /**
     * Release any resources held by this counter. The default does nothing.
     */
    @Override
    public void close() {
    }

    public String getSection() {
        return section;
    }

    public String getName() {
        return name;
    }

    public String getFullName() {
        return section + "." + name;
    }

    public PerfCounterType getType() {
        return type;
    }

    protected final UnsupportedOperationException unsupported(final String operation) {
        return new UnsupportedOperationException(operation + "() is not supported by " + type +
                " counter " + getFullName());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getFullName() + ", " + type + "}";
    }
}
