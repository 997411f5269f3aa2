/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JUnit test for {@link QuantileEngine}
 */
public class QuantileEngineTest {

    static final long SEC = 1000000000L; // SEC in nsec units

    @Test
    public void testNoSamplesReportsNoData() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        QuantileEngine engine = new QuantileEngine("test", new SampleBuffer(100), timeServices, executor,
                30 * SEC, false);
        try {
            PercentileResults results = engine.recompute();
            Assert.assertSame(PercentileResults.EMPTY, results);
            for (PercentileType type : PercentileType.values()) {
                Assert.assertEquals(-1.0, results.getValue(type), 0.0);
            }
        } finally {
            engine.close();
            executor.shutdown();
        }
    }

    @Test
    public void testPercentilesMatchFullSort() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        SampleBuffer buffer = new SampleBuffer(50000);
        QuantileEngine engine = new QuantileEngine("test", buffer, timeServices, executor, 30 * SEC, true);
        try {
            Random random = new Random(17);
            long recorded[] = new long[12345];
            for (int i = 0; i < recorded.length; i++) {
                recorded[i] = (random.nextLong() & Long.MAX_VALUE) % 1000000000L;
                buffer.record(recorded[i]);
            }

            PercentileResults results = engine.recompute();
            Assert.assertEquals(recorded.length, results.getSampleCount());
            assertMatchesReference(recorded, results);
        } finally {
            engine.close();
            executor.shutdown();
        }
    }

    @Test
    public void testPercentilesReflectOnlyRetainedSamples() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        int capacity = 1000;
        SampleBuffer buffer = new SampleBuffer(capacity);
        QuantileEngine engine = new QuantileEngine("test", buffer, timeServices, executor, 30 * SEC, false);
        try {
            Random random = new Random(23);
            long recorded[] = new long[capacity + 537];
            for (int i = 0; i < recorded.length; i++) {
                // Early samples are all larger than later ones, so a leak of an evicted sample would show:
                recorded[i] = (i < 537) ? 1000000L + i : random.nextInt(1000);
                buffer.record(recorded[i]);
            }

            PercentileResults results = engine.recompute();
            Assert.assertEquals(capacity, results.getSampleCount());
            assertMatchesReference(Arrays.copyOfRange(recorded, recorded.length - capacity, recorded.length), results);
            Assert.assertTrue(results.getValue(PercentileType.P999) < 1000.0);
        } finally {
            engine.close();
            executor.shutdown();
        }
    }

    @Test
    public void testScheduledRecomputation() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        SampleBuffer buffer = new SampleBuffer(100);
        QuantileEngine engine = new QuantileEngine("test", buffer, timeServices, executor, 30 * SEC, false);
        try {
            for (long value = 1; value <= 10; value++) {
                buffer.record(value);
            }
            Assert.assertEquals(QuantileEngine.State.IDLE, engine.getState());

            timeServices.moveTimeForwardSec(29);
            Assert.assertSame("no recomputation before the interval elapses",
                    PercentileResults.EMPTY, engine.getResults());

            timeServices.moveTimeForwardSec(1);
            PercentileResults firstResults = engine.getResults();
            Assert.assertEquals(10, firstResults.getSampleCount());
            Assert.assertEquals(6.0, firstResults.getValue(PercentileType.P50), 0.0);
            Assert.assertEquals(30 * SEC, firstResults.getComputedAtNanoTime());
            Assert.assertEquals(QuantileEngine.State.IDLE, engine.getState());
            Assert.assertEquals("next recomputation is scheduled", 1, executor.getPendingTaskCount());

            for (long value = 11; value <= 20; value++) {
                buffer.record(value);
            }
            timeServices.moveTimeForwardSec(10);
            Assert.assertSame("results are stale between recomputations", firstResults, engine.getResults());

            timeServices.moveTimeForwardSec(20);
            Assert.assertEquals(20, engine.getResults().getSampleCount());
            Assert.assertEquals(11.0, engine.getResults().getValue(PercentileType.P50), 0.0);
        } finally {
            engine.close();
            executor.shutdown();
        }
    }

    @Test
    public void testNoSamplesKeepsPreviousResults() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        SampleBuffer buffer = new SampleBuffer(100);
        QuantileEngine engine = new QuantileEngine("test", buffer, timeServices, executor, SEC, false);
        try {
            timeServices.moveTimeForwardSec(1);
            timeServices.moveTimeForwardSec(1);
            Assert.assertSame(PercentileResults.EMPTY, engine.getResults());
            Assert.assertEquals(1, executor.getPendingTaskCount());
        } finally {
            engine.close();
            executor.shutdown();
        }
    }

    @Test
    public void testCloseCancelsPendingRecomputation() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        SampleBuffer buffer = new SampleBuffer(100);
        QuantileEngine engine = new QuantileEngine("test", buffer, timeServices, executor, SEC, true);
        buffer.record(5);

        engine.close();
        Assert.assertEquals(QuantileEngine.State.STOPPED, engine.getState());
        Assert.assertEquals(0, executor.getPendingTaskCount());

        timeServices.moveTimeForwardSec(5);
        Assert.assertSame(PercentileResults.EMPTY, engine.getResults());
        Assert.assertSame("a stopped engine does not recompute", PercentileResults.EMPTY, engine.recompute());
        Assert.assertNull(engine.getFailure());
        executor.shutdown();
    }

    @Test
    public void testCloseDuringRecomputationDoesNotReschedule() throws Exception {
        final TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        final CountDownLatch snapshotEntered = new CountDownLatch(1);
        final CountDownLatch snapshotRelease = new CountDownLatch(1);
        SampleBuffer buffer = new SampleBuffer(100) {
            @Override
            public int snapshotInto(long[] target) {
                snapshotEntered.countDown();
                try {
                    snapshotRelease.await();
                } catch (InterruptedException ex) {
                    throw new IllegalStateException(ex);
                }
                return super.snapshotInto(target);
            }
        };
        final QuantileEngine engine = new QuantileEngine("test", buffer, timeServices, executor, SEC, true);
        buffer.record(5);

        ExecutorService tickExecutor = Executors.newSingleThreadExecutor();
        try {
            Future<Void> tick = tickExecutor.submit(new Callable<Void>() {
                @Override
                public Void call() throws Exception {
                    timeServices.moveTimeForwardSec(1);
                    return null;
                }
            });
            Assert.assertTrue("recomputation did not start", snapshotEntered.await(10, TimeUnit.SECONDS));

            Thread closer = new Thread(new Runnable() {
                @Override
                public void run() {
                    engine.close();
                }
            });
            closer.start();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while ((closer.getState() != Thread.State.BLOCKED) && (System.nanoTime() < deadline)) {
                Thread.sleep(1);
            }
            Assert.assertEquals("close() should wait for the running recomputation",
                    Thread.State.BLOCKED, closer.getState());

            // Any attempt to schedule another tick from here on is rejected, and would be kept as a failure:
            executor.shutdown();
            snapshotRelease.countDown();

            tick.get(10, TimeUnit.SECONDS);
            closer.join(TimeUnit.SECONDS.toMillis(10));
            Assert.assertFalse(closer.isAlive());
        } finally {
            snapshotRelease.countDown();
            tickExecutor.shutdownNow();
        }

        Assert.assertNull("no tick should be scheduled after close()", engine.getFailure());
        Assert.assertEquals(QuantileEngine.State.STOPPED, engine.getState());
        Assert.assertEquals(1, engine.getResults().getSampleCount());
        Assert.assertEquals(5.0, engine.getResults().getValue(PercentileType.P50), 0.0);
    }

    @Test
    public void testRejectedRescheduleStopsEngine() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        final TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        SampleBuffer buffer = new SampleBuffer(100) {
            @Override
            public int snapshotInto(long[] target) {
                executor.shutdown();
                return super.snapshotInto(target);
            }
        };
        buffer.record(3);
        QuantileEngine engine = new QuantileEngine("test", buffer, timeServices, executor, SEC, false);

        timeServices.moveTimeForwardSec(1);

        Assert.assertEquals("the recomputation in progress still publishes",
                3.0, engine.getResults().getValue(PercentileType.P50), 0.0);
        Assert.assertEquals(QuantileEngine.State.STOPPED, engine.getState());
        Assert.assertTrue(engine.getFailure() instanceof RejectedExecutionException);
        engine.close();
    }

    @Test
    public void testFailingRecomputationStopsEngine() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        SampleBuffer buffer = new SampleBuffer(100) {
            @Override
            public int snapshotInto(long[] target) {
                throw new IllegalStateException("broken buffer");
            }
        };
        QuantileEngine engine = new QuantileEngine("test", buffer, timeServices, executor, SEC, false);
        try {
            timeServices.moveTimeForwardSec(1);
            Assert.fail("the recomputation failure should propagate to the executor");
        } catch (IllegalStateException expected) {
            Assert.assertEquals("broken buffer", expected.getMessage());
        }
        Assert.assertEquals(QuantileEngine.State.STOPPED, engine.getState());
        Assert.assertSame(IllegalStateException.class, engine.getFailure().getClass());
        Assert.assertEquals("nothing is rescheduled", 0, executor.getPendingTaskCount());
        executor.shutdown();
    }

    @Test(expected = RejectedExecutionException.class)
    public void testConstructionFailsWithShutDownExecutor() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        executor.shutdown();
        new QuantileEngine("test", new SampleBuffer(100), timeServices, executor, SEC, false);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIntervalMustBePositive() throws Exception {
        TimeServices timeServices = new TimeServices(false);
        new QuantileEngine("test", new SampleBuffer(100), timeServices, timeServices.newScheduledExecutor("test"),
                0, false);
    }

    @Test
    public void testConcurrentRecordersAndRecomputation() throws Exception {
        final int threadCount = 8;
        final int recordsPerThread = 20000;
        final int capacity = 50000;

        TimeServices timeServices = new TimeServices(false);
        TimeServices.ScheduledExecutor executor = timeServices.newScheduledExecutor("test");
        final SampleBuffer buffer = new SampleBuffer(capacity);
        final QuantileEngine engine = new QuantileEngine("test", buffer, timeServices, executor, 30 * SEC, false);

        final AtomicBoolean recording = new AtomicBoolean(true);
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount + 1);
        try {
            Future<?> recomputer = executorService.submit(new Runnable() {
                @Override
                public void run() {
                    while (recording.get()) {
                        assertOrdered(engine.recompute());
                    }
                }
            });

            List<Future<?>> recorders = new ArrayList<Future<?>>();
            for (int t = 0; t < threadCount; t++) {
                final long threadBase = t * 100000L;
                recorders.add(executorService.submit(new Runnable() {
                    @Override
                    public void run() {
                        for (int i = 1; i <= recordsPerThread; i++) {
                            buffer.record(threadBase + i);
                        }
                    }
                }));
            }
            for (Future<?> recorder : recorders) {
                recorder.get(30, TimeUnit.SECONDS);
            }
            recording.set(false);
            recomputer.get(30, TimeUnit.SECONDS);
        } finally {
            executorService.shutdownNow();
        }

        PercentileResults results = engine.recompute();
        Assert.assertEquals(capacity, results.getSampleCount());
        assertOrdered(results);
        for (PercentileType type : PercentileType.values()) {
            double value = results.getValue(type);
            long recordIndex = ((long) value) % 100000L;
            Assert.assertTrue(type + " = " + value + " was never recorded",
                    (recordIndex >= 1) && (recordIndex <= recordsPerThread) && (value < threadCount * 100000L));
        }
        engine.close();
        executor.shutdown();
    }

    static void assertOrdered(PercentileResults results) {
        if (!results.hasData()) {
            return;
        }
        PercentileType types[] = PercentileType.values();
        for (int i = 1; i < types.length; i++) {
            Assert.assertTrue(types[i - 1] + " should not exceed " + types[i],
                    results.getValue(types[i - 1]) <= results.getValue(types[i]));
        }
    }

    static void assertMatchesReference(long[] samples, PercentileResults results) {
        long sorted[] = samples.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        for (PercentileType type : PercentileType.values()) {
            int rank = Math.min((int) (n * type.getQuantile()) + 1, n);
            Assert.assertEquals(type.toString(), (double) sorted[rank - 1], results.getValue(type), 0.0);
        }
    }
}
