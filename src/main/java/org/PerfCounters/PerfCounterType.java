/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

/**
 * The counting strategies a {@link SimplePerfCounter} can be created with
 */
public enum PerfCounterType {
    /** A cumulative total */
    NUMBER,
    /** Events per second since the previous read */
    RATE,
    /** Percentiles of recently recorded sample values */
    NUMBER_PERCENTILES
}
