/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A cumulative total.
 */
class NumberPerfCounter extends PerfCounter {
    private final AtomicLong total = new AtomicLong(0);

    NumberPerfCounter(final String section, final String name) {
        super(section, name, PerfCounterType.NUMBER);
    }

    @Override
    public void increment() {
        total.incrementAndGet();
    }

    @Override
    public void decrement() {
        total.decrementAndGet();
    }

    @Override
    public void add(long delta) {
        total.addAndGet(delta);
    }

    @Override
    public double getValue() {
        return (double) total.get();
    }
}
