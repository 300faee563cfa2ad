// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.lifecycle;

import org.junit.After;
import org.junit.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BackgroundTaskTrackerTest
{
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @After
    public void tearDown()
    {
        this.executor.shutdownNow();
    }

    @Test
    public void failuresAreCountedAndDoNotReachTheCaller() throws Exception
    {
        BackgroundTaskTracker tracker = new BackgroundTaskTracker(this.executor);

        tracker.submit("failing", () -> { throw new IllegalStateException("bug"); }).get(5, TimeUnit.SECONDS);

        assertEquals(1, tracker.getFailedTaskCount());
    }

    @Test
    public void cancellationIsNotAFailure() throws Exception
    {
        BackgroundTaskTracker tracker = new BackgroundTaskTracker(this.executor);

        tracker.submit("cancelled", () -> { throw new CancellationException(); }).get(5, TimeUnit.SECONDS);

        assertEquals(0, tracker.getFailedTaskCount());
    }

    @Test(timeout = 10000)
    public void awaitCompletionWaitsForTasksStartedByOtherTasks() throws Exception
    {
        BackgroundTaskTracker tracker = new BackgroundTaskTracker(this.executor);
        AtomicBoolean nestedTaskRan = new AtomicBoolean();

        tracker.submit("outer", () ->
        {
            Thread.sleep(50);
            tracker.submit("nested", () ->
            {
                Thread.sleep(100);
                nestedTaskRan.set(true);
            });
        });

        assertTrue(tracker.awaitCompletion(5, TimeUnit.SECONDS));
        assertTrue(nestedTaskRan.get());
        assertEquals(0, tracker.getRunningTaskCount());
    }

    @Test(timeout = 10000)
    public void awaitCompletionTimesOutOnAStuckTask() throws Exception
    {
        BackgroundTaskTracker tracker = new BackgroundTaskTracker(this.executor);
        CountDownLatch release = new CountDownLatch(1);

        tracker.submit("stuck", release::await);

        assertFalse(tracker.awaitCompletion(50, TimeUnit.MILLISECONDS));
        assertEquals(1, tracker.getRunningTaskCount());

        release.countDown();
        assertTrue(tracker.awaitCompletion(5, TimeUnit.SECONDS));
    }

    @Test
    public void taskSubmittedToAShutDownPoolIsDroppedQuietly() throws Exception
    {
        ExecutorService shutDownExecutor = Executors.newSingleThreadExecutor();
        shutDownExecutor.shutdown();
        BackgroundTaskTracker tracker = new BackgroundTaskTracker(shutDownExecutor);

        assertTrue(tracker.submit("late", () -> { }).isDone());
        assertTrue(tracker.awaitCompletion(1, TimeUnit.SECONDS));
    }
}
