/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

/**
 * An immutable table of percentile values, as computed by one {@link QuantileEngine} recomputation.
 * Readers may hold on to an instance for as long as they like.
 */
public final class PercentileResults {
    /**
     * Results for which no sample has been seen. Reports -1.0 for every percentile.
     */
    public static final PercentileResults EMPTY = new PercentileResults(new long[0], 0, 0);

    static final double NO_DATA = -1.0;

    private final long values[];
    private final int sampleCount;
    private final long computedAtNanoTime;

    /**
     * @param values             value per {@link PercentileType}, indexed by ordinal
     * @param sampleCount        number of samples the values were computed from
     * @param computedAtNanoTime time (in nanoTime units) at which the values were computed
     */
    PercentileResults(final long[] values, final int sampleCount, final long computedAtNanoTime) {
        this.values = values;
        this.sampleCount = sampleCount;
        this.computedAtNanoTime = computedAtNanoTime;
    }

    /**
     * @param type the percentile to report
     * @return the value at the given percentile, or -1.0 if there were no samples
     */
    public double getValue(final PercentileType type) {
        if (type == null) {
            throw new IllegalArgumentException("percentile type must not be null");
        }
        if (sampleCount == 0) {
            return NO_DATA;
        }
        return unsignedToDouble(values[type.ordinal()]);
    }

    public boolean hasData() {
        return sampleCount > 0;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public long getComputedAtNanoTime() {
        return computedAtNanoTime;
    }

    static double unsignedToDouble(final long value) {
        if (value >= 0) {
            return (double) value;
        }
        // Halve (keeping the low bit for rounding), convert, and double back up:
        return ((double) ((value >>> 1) | (value & 1))) * 2.0;
    }

    @Override
    public String toString() {
        if (sampleCount == 0) {
            return "PercentileResults{no data}";
        }
        StringBuilder builder = new StringBuilder("PercentileResults{samples=").append(sampleCount);
        for (PercentileType type : PercentileType.values()) {
            builder.append(", ").append(type).append('=').append(Long.toUnsignedString(values[type.ordinal()]));
        }
        return builder.append('}').toString();
    }
}
