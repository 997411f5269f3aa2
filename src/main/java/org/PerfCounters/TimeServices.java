/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.PerfCounters;

import java.util.Comparator;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provide time-related services: the current time, and an executor that runs commands after a delay.
 * A TimeServices instance either uses actual time services in the JDK (i.e. System.nanoTime() and a
 * {@link ScheduledThreadPoolExecutor}), or manual time. With manual time, the notion of time only moves
 * in response to calls to {@link #setCurrentTime} (or the moveTimeForward variants), and scheduled
 * commands that become due are run on the thread that moved time forward.
 * <p>
 * TimeServices instances are passed to the counters that need them. If the system property
 * PerfCounters.useActualTime is set to "false", {@link #fromSystemProperties()} will provide a
 * manual time instance.
 */
public class TimeServices {
    final boolean useActualTime;

    private volatile long currentTime;

    private final CopyOnWriteArrayList<ScheduledExecutor> manualExecutors =
            new CopyOnWriteArrayList<ScheduledExecutor>();

    private volatile ScheduledExecutor sharedScheduledExecutor;

    private static final AtomicInteger executorThreadCount = new AtomicInteger();

    /**
     * Create a TimeServices instance
     * @param useActualTime true to use the JDK's time services, false to use manual time starting at 0
     */
    public TimeServices(final boolean useActualTime) {
        this.useActualTime = useActualTime;
    }

    /**
     * Create a TimeServices instance using actual time, unless the PerfCounters.useActualTime
     * system property is set to "false"
     * @return a TimeServices instance
     */
    public static TimeServices fromSystemProperties() {
        String useActualTimeProperty = System.getProperty("PerfCounters.useActualTime", "true");
        return new TimeServices(!useActualTimeProperty.equals("false"));
    }

    public boolean usesActualTime() {
        return useActualTime;
    }

    public long nanoTime() {
        if (useActualTime) {
            return System.nanoTime();
        }
        return currentTime;
    }

    public void moveTimeForward(long timeDeltaNsec) throws InterruptedException {
        setCurrentTime(nanoTime() + timeDeltaNsec);
    }

    public void moveTimeForwardMsec(long timeDeltaMsec) throws InterruptedException {
        moveTimeForward(timeDeltaMsec * 1000000L);
    }

    public void moveTimeForwardSec(long timeDeltaSec) throws InterruptedException {
        moveTimeForward(timeDeltaSec * 1000000000L);
    }

    /**
     * Move time forward to {@code newCurrentTime}. With actual time, this sleeps until that time. With
     * manual time, time is moved and any scheduled commands that became due are run before returning.
     *
     * @param newCurrentTime the time (in nanoTime units) to move to
     * @throws InterruptedException if interrupted while sleeping
     */
    public void setCurrentTime(long newCurrentTime) throws InterruptedException {
        if (newCurrentTime < nanoTime()) {
            throw new IllegalStateException("Can't set current time to the past.");
        }
        if (useActualTime) {
            while (newCurrentTime > nanoTime()) {
                TimeUnit.NANOSECONDS.sleep(newCurrentTime - nanoTime());
            }
            return;
        }
        currentTime = newCurrentTime;
        for (ScheduledExecutor executor : manualExecutors) {
            executor.runDueTasks();
        }
    }

    /**
     * Create a new executor that runs commands according to this instance's notion of time.
     * With actual time, the executor owns a single daemon thread.
     * @param name name used for the executor thread
     * @return a new ScheduledExecutor
     */
    public ScheduledExecutor newScheduledExecutor(String name) {
        ScheduledExecutor executor = new ScheduledExecutor(name);
        if (!useActualTime) {
            manualExecutors.add(executor);
        }
        return executor;
    }

    /**
     * Get the executor shared by all users of this TimeServices instance that were not given an executor
     * of their own. Created on first use. Users must not shut it down.
     * @return the shared ScheduledExecutor
     */
    public ScheduledExecutor getSharedScheduledExecutor() {
        // Lazy Initialization: Avoid double-checked locking race by using a local variable reading from a volatile:
        ScheduledExecutor executor = sharedScheduledExecutor;
        if (executor == null) {
            synchronized (this) {
                executor = sharedScheduledExecutor;
                if (executor == null) {
                    sharedScheduledExecutor = executor = newScheduledExecutor("PerfCountersScheduledExecutor");
                }
            }
        }
        return executor;
    }

    /**
     * A handle to a command scheduled on a {@link ScheduledExecutor}
     */
    public interface ScheduledTask {
        /**
         * Cancel the command. Once cancel() returns, the command will not be started. A command that is
         * already running is allowed to finish.
         */
        void cancel();

        boolean isCancelled();
    }

    public class ScheduledExecutor {
        private final ScheduledThreadPoolExecutor actualExecutor;

        final PriorityBlockingQueue<RunnableTaskEntry> taskEntries;

        private volatile boolean shutdown = false;

        ScheduledExecutor(final String name) {
            if (useActualTime) {
                actualExecutor = new ScheduledThreadPoolExecutor(1, new ThreadFactory() {
                    @Override
                    public Thread newThread(Runnable runnable) {
                        Thread thread = new Thread(runnable, name + "_" + executorThreadCount.incrementAndGet());
                        thread.setDaemon(true);
                        return thread;
                    }
                });
                actualExecutor.setRemoveOnCancelPolicy(true);
                taskEntries = null;
            } else {
                actualExecutor = null;
                taskEntries = new PriorityBlockingQueue<RunnableTaskEntry>(16, compareRunnableTaskEntryByStartTime);
            }
        }

        /**
         * Schedule a one-shot command to run after {@code delay}
         * @param command the command to run
         * @param delay delay before the command is run
         * @param unit the time unit of the delay
         * @return a handle that can be used to cancel the command
         * @throws RejectedExecutionException if this executor has been shut down
         */
        public ScheduledTask schedule(Runnable command, long delay, TimeUnit unit) {
            if (shutdown) {
                throw new RejectedExecutionException("ScheduledExecutor has been shut down");
            }
            if (useActualTime) {
                final ScheduledFuture<?> future = actualExecutor.schedule(command, delay, unit);
                return new ScheduledTask() {
                    @Override
                    public void cancel() {
                        future.cancel(false);
                    }

                    @Override
                    public boolean isCancelled() {
                        return future.isCancelled();
                    }
                };
            }

            long startTimeNsec = currentTime + TimeUnit.NANOSECONDS.convert(delay, unit);
            RunnableTaskEntry entry = new RunnableTaskEntry(command, startTimeNsec);
            taskEntries.add(entry);
            return entry;
        }

        public void shutdown() {
            shutdown = true;
            if (useActualTime) {
                actualExecutor.shutdownNow();
                return;
            }
            taskEntries.clear();
            manualExecutors.remove(this);
        }

        public boolean isShutdown() {
            return shutdown;
        }

        /**
         * @return the number of scheduled commands that have not yet run and have not been cancelled
         */
        public int getPendingTaskCount() {
            if (useActualTime) {
                return actualExecutor.getQueue().size();
            }
            int count = 0;
            for (RunnableTaskEntry entry : taskEntries) {
                if (!entry.isCancelled()) {
                    count++;
                }
            }
            return count;
        }

        synchronized void runDueTasks() {
            for (RunnableTaskEntry entry = taskEntries.peek();
                 ((entry != null) && (entry.getStartTime() <= currentTime) && !shutdown);
                 entry = taskEntries.peek()) {
                taskEntries.remove(entry);
                if (!entry.isCancelled()) {
                    entry.getCommand().run();
                }
            }
        }
    }

    private static class RunnableTaskEntry implements ScheduledTask {
        final long startTime;
        final Runnable command;
        volatile boolean cancelled;

        RunnableTaskEntry(Runnable command, long startTimeNsec) {
            this.command = command;
            this.startTime = startTimeNsec;
        }

        public long getStartTime() {
            return startTime;
        }

        public Runnable getCommand() {
            return command;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }

    private static CompareRunnableTaskEntryByStartTime compareRunnableTaskEntryByStartTime = new CompareRunnableTaskEntryByStartTime();

    static class CompareRunnableTaskEntryByStartTime implements Comparator<RunnableTaskEntry> {
        public int compare(RunnableTaskEntry r1, RunnableTaskEntry r2) {
            long t1 = r1.startTime;
            long t2 = r2.startTime;
            return (t1 > t2) ? 1 : ((t1 < t2) ? -1 : 0);
        }
    }
}
