/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

/**
 * The percentiles tracked by percentile counters
 */
public enum PercentileType {
    P50(0.5),
    P90(0.90),
    P95(0.95),
    P99(0.99),
    P999(0.999);

    private final double quantile;

    PercentileType(final double quantile) {
        this.quantile = quantile;
    }

    public double getQuantile() {
        return quantile;
    }

    /**
     * The 1-indexed rank of this percentile among {@code sampleCount} samples: floor(sampleCount * quantile) + 1,
     * clamped to sampleCount.
     *
     * @param sampleCount number of samples, must be positive
     * @return the rank of this percentile
     */
    public int rankOf(final int sampleCount) {
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("sampleCount must be positive, was " + sampleCount);
        }
        int rank = (int) (sampleCount * quantile) + 1;
        return Math.min(rank, sampleCount);
    }
}
