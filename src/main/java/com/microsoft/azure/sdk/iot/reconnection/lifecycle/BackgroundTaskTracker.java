// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.lifecycle;

import com.microsoft.azure.sdk.iot.reconnection.transport.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fire-and-forget tasks on a worker pool while keeping track of them. A task never fails its caller: its
 * failure is logged and counted, a cancellation is logged at debug level.
 */
public final class BackgroundTaskTracker
{
    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskTracker.class);

    private final ExecutorService executor;
    private final Set<CompletableFuture<Void>> runningTasks = ConcurrentHashMap.newKeySet();
    private final AtomicInteger failedTaskCount = new AtomicInteger();

    public BackgroundTaskTracker(ExecutorService executor)
    {
        if (executor == null)
        {
            throw new IllegalArgumentException("executor cannot be null");
        }

        this.executor = executor;
    }

    /**
     * @param taskName the name of the task, for logging
     * @param task the task to run
     * @return a future completed once the task has ended, whatever its outcome
     */
    public CompletableFuture<Void> submit(String taskName, OperationResult.ThrowingOperation task)
    {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        this.runningTasks.add(completion);

        try
        {
            this.executor.execute(() ->
            {
                try
                {
                    this.run(taskName, task);
                }
                finally
                {
                    this.runningTasks.remove(completion);
                    completion.complete(null);
                }
            });
        }
        catch (RejectedExecutionException e)
        {
            log.warn("Background task {} was not started, the worker pool is shut down", taskName);
            this.runningTasks.remove(completion);
            completion.complete(null);
        }

        return completion;
    }

    private void run(String taskName, OperationResult.ThrowingOperation task)
    {
        try
        {
            task.run();
        }
        catch (CancellationException e)
        {
            log.debug("Background task {} was cancelled", taskName);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            log.debug("Background task {} was interrupted", taskName);
        }
        catch (Exception e)
        {
            this.failedTaskCount.incrementAndGet();
            log.error("Background task {} failed", taskName, e);
        }
    }

    /**
     * Waits for the running tasks, including the ones they start while being waited for.
     *
     * @param timeout the maximum time to wait
     * @param unit the unit of the timeout
     * @return true if no task is running anymore
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException
    {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (!this.runningTasks.isEmpty())
        {
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0)
            {
                return false;
            }

            CompletableFuture<?>[] tasks = this.runningTasks.toArray(new CompletableFuture<?>[0]);
            try
            {
                CompletableFuture.allOf(tasks).get(remainingNanos, TimeUnit.NANOSECONDS);
            }
            catch (TimeoutException e)
            {
                return this.runningTasks.isEmpty();
            }
            catch (ExecutionException e)
            {
                // completions are never exceptional
                throw new IllegalStateException(e);
            }
        }

        return true;
    }

    public int getRunningTaskCount()
    {
        return this.runningTasks.size();
    }

    public int getFailedTaskCount()
    {
        return this.failedTaskCount.get();
    }
}
