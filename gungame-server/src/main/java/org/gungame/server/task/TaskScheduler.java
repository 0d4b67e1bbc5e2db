package org.gungame.server.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the server's periodic tasks on one daemon thread.
 *
 * <p>A task that throws is logged and runs again on its next tick; one bad
 * tick never cancels the schedule.</p>
 */
public class TaskScheduler implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r ->
    {
        Thread t = new Thread(r, "game-tasks");
        t.setDaemon(true);
        return t;
    });

    /**
     * Schedules a task at a fixed rate, first run after one period.
     *
     * @param name   name used in log messages
     * @param task   the task
     * @param period time between runs
     * @return handle that can cancel the task
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, Duration period)
    {
        Objects.requireNonNull(task, "task");
        long periodMs = period.toMillis();
        LOG.debug("Scheduling {} every {} ms", name, periodMs);
        return executor.scheduleAtFixedRate(() -> runSafely(name, task), periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private static void runSafely(String name, Runnable task)
    {
        try
        {
            task.run();
        }
        catch (Exception e)
        {
            LOG.error("Task {} failed", name, e);
        }
    }

    @Override
    public void close()
    {
        executor.shutdownNow();
        try
        {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS))
            {
                LOG.warn("Periodic tasks did not stop within 1s");
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }
}
