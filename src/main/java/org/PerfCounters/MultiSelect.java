/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Multiple order statistic selection. Given an array of values and a set of ranks, MultiSelect finds the
 * value that would be at each rank if the array were sorted, without sorting it. All requested ranks are
 * resolved in a single pass that shares partitioning work between them, in linear time.
 * <p>
 * Selection is driven by a work queue of partition tasks. Each task pairs a sub-array with the contiguous
 * range of still unresolved ranks that fall within it. A task is processed by choosing a pivot using the
 * median-of-medians procedure (which bounds the worst case to linear time regardless of input order),
 * partitioning the sub-array three ways around the pivot, resolving any ranks that land on the run of
 * pivot-equal values, and queueing the lower and upper partitions with their ranks.
 * <p>
 * Values are treated as unsigned 64 bit quantities. Ranks are 1-indexed.
 */
public final class MultiSelect {
    static final int GROUP_SIZE = 5;

    private final long values[];
    // Ranks relative to the partition of the task that currently owns them. Ascending.
    private final int pendingRanks[];
    private final long answers[];
    private final ArrayDeque<PartitionTask> tasks = new ArrayDeque<PartitionTask>();

    private MultiSelect(final long[] values, final int[] sortedDistinctRanks) {
        this.values = values;
        this.pendingRanks = sortedDistinctRanks;
        this.answers = new long[sortedDistinctRanks.length];
    }

    /**
     * Find the values at the given ranks of the first {@code length} entries of {@code values}. The array
     * contents are reordered in the process.
     *
     * @param values the values to select from. Entries in [0, length) are reordered.
     * @param length the number of entries of {@code values} to select from
     * @param ranks  1-indexed ranks, in any order, possibly repeated. Each must be in [1, length].
     * @return the value at each requested rank, in the order the ranks were given
     */
    public static long[] select(final long[] values, final int length, final int... ranks) {
        if ((length < 0) || (length > values.length)) {
            throw new IllegalArgumentException("length " + length + " is outside of [0, " + values.length + "]");
        }
        for (int rank : ranks) {
            if ((rank < 1) || (rank > length)) {
                throw new IllegalArgumentException("rank " + rank + " is outside of [1, " + length + "]");
            }
        }
        if (ranks.length == 0) {
            return new long[0];
        }

        int sortedRanks[] = ranks.clone();
        Arrays.sort(sortedRanks);
        int distinctCount = 1;
        for (int i = 1; i < sortedRanks.length; i++) {
            if (sortedRanks[i] != sortedRanks[distinctCount - 1]) {
                sortedRanks[distinctCount++] = sortedRanks[i];
            }
        }
        int distinctRanks[] = Arrays.copyOf(sortedRanks, distinctCount);

        long distinctAnswers[] = new MultiSelect(values, distinctRanks.clone()).run(length);

        long result[] = new long[ranks.length];
        for (int i = 0; i < ranks.length; i++) {
            result[i] = distinctAnswers[Arrays.binarySearch(distinctRanks, ranks[i])];
        }
        return result;
    }

    private long[] run(final int length) {
        tasks.add(new PartitionTask(0, length - 1, 0, pendingRanks.length - 1));
        PartitionTask task;
        while ((task = tasks.poll()) != null) {
            process(task);
        }
        return answers;
    }

    private void process(final PartitionTask task) {
        final int left = task.left;
        final int right = task.right;

        if (left > right) {
            throw new IllegalStateException("ranks " + describeRanks(task) +
                    " were assigned to an empty partition ending at index " + right);
        }

        if (left == right) {
            for (int q = task.qleft; q <= task.qright; q++) {
                if (pendingRanks[q] != 1) {
                    throw new IllegalStateException("rank " + pendingRanks[q] +
                            " does not fit the single element partition at index " + left);
                }
                answers[q] = values[left];
            }
            return;
        }

        final long pivot = medianOfMedians(values, left, right);

        // [left, lessEnd) < pivot, [lessEnd, greaterStart) == pivot, [greaterStart, right] > pivot
        int lessEnd = left;
        int scan = left;
        int greaterStart = right + 1;
        while (scan < greaterStart) {
            int comparison = Long.compareUnsigned(values[scan], pivot);
            if (comparison < 0) {
                swap(values, lessEnd++, scan++);
            } else if (comparison > 0) {
                swap(values, scan, --greaterStart);
            } else {
                scan++;
            }
        }

        final int lowestEqualRank = lessEnd - left + 1;
        final int highestEqualRank = greaterStart - left;

        int q = task.qleft;
        while ((q <= task.qright) && (pendingRanks[q] < lowestEqualRank)) {
            q++;
        }
        final int firstEqual = q;
        while ((q <= task.qright) && (pendingRanks[q] <= highestEqualRank)) {
            answers[q++] = pivot;
        }
        final int firstAbove = q;
        for (; q <= task.qright; q++) {
            pendingRanks[q] -= highestEqualRank;
        }

        if (firstEqual > task.qleft) {
            tasks.add(new PartitionTask(left, lessEnd - 1, task.qleft, firstEqual - 1));
        }
        if (firstAbove <= task.qright) {
            tasks.add(new PartitionTask(greaterStart, right, firstAbove, task.qright));
        }
    }

    /**
     * Median-of-medians pivot for values[left..right]: the median of the medians of groups of
     * {@link #GROUP_SIZE}, itself found by selection. Groups are sorted in place.
     */
    static long medianOfMedians(final long[] values, final int left, final int right) {
        int length = right - left + 1;
        if (length <= GROUP_SIZE) {
            insertionSort(values, left, right);
            return values[left + (length - 1) / 2];
        }

        long medians[] = new long[(length + GROUP_SIZE - 1) / GROUP_SIZE];
        int count = 0;
        for (int groupStart = left; groupStart <= right; groupStart += GROUP_SIZE) {
            int groupEnd = Math.min(groupStart + GROUP_SIZE - 1, right);
            insertionSort(values, groupStart, groupEnd);
            medians[count++] = values[groupStart + (groupEnd - groupStart) / 2];
        }

        return new MultiSelect(medians, new int[] {(count + 1) / 2}).run(count)[0];
    }

    static void insertionSort(final long[] values, final int left, final int right) {
        for (int i = left + 1; i <= right; i++) {
            long value = values[i];
            int j;
            for (j = i - 1; (j >= left) && (Long.compareUnsigned(values[j], value) > 0); j--) {
                values[j + 1] = values[j];
            }
            values[j + 1] = value;
        }
    }

    private static void swap(final long[] values, final int i, final int j) {
        long temp = values[i];
        values[i] = values[j];
        values[j] = temp;
    }

    private String describeRanks(final PartitionTask task) {
        return Arrays.toString(Arrays.copyOfRange(pendingRanks, task.qleft, task.qright + 1));
    }

    /**
     * Pending selection work: the sub-array [left, right], and the range [qleft, qright] of pending
     * ranks to resolve within it.
     */
    private static final class PartitionTask {
        final int left;
        final int right;
        final int qleft;
        final int qright;

        PartitionTask(final int left, final int right, final int qleft, final int qright) {
            this.left = left;
            this.right = right;
            this.qleft = qleft;
            this.qright = qright;
        }
    }
}
