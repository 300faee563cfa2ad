// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A cancellation signal that is passed explicitly to every blocking or sleeping operation. Once cancelled it stays
 * cancelled; a token created with a time limit cancels itself when the limit elapses.
 */
public final class CancellationToken
{
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final long deadlineNanos;

    private CancellationToken(long deadlineNanos)
    {
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * @return a new token that is only cancelled by an explicit call to {@link #cancel()}
     */
    public static CancellationToken create()
    {
        return new CancellationToken(NO_DEADLINE);
    }

    /**
     * @param timeout how long until the token cancels itself
     * @return a new token that is cancelled explicitly or once the timeout elapses, whichever comes first
     */
    public static CancellationToken withTimeout(Duration timeout)
    {
        if (timeout == null || timeout.isNegative())
        {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }

        return new CancellationToken(System.nanoTime() + timeout.toNanos());
    }

    public void cancel()
    {
        this.cancelled.countDown();
    }

    public boolean isCancellationRequested()
    {
        if (this.cancelled.getCount() == 0)
        {
            return true;
        }

        if (this.deadlineNanos != NO_DEADLINE && System.nanoTime() - this.deadlineNanos >= 0)
        {
            this.cancel();
            return true;
        }

        return false;
    }

    /**
     * @throws CancellationException if this token has been cancelled
     */
    public void throwIfCancellationRequested()
    {
        if (this.isCancellationRequested())
        {
            throw new CancellationException("The operation was cancelled");
        }
    }

    /**
     * Sleeps for the given duration unless this token is cancelled first. An interrupted sleep counts as a
     * cancellation of the current operation; the interrupt flag is restored.
     *
     * @param delayMillis how long to sleep for
     * @throws CancellationException if the token was cancelled before or during the sleep, or the thread was
     * interrupted
     */
    public void delay(long delayMillis)
    {
        this.throwIfCancellationRequested();

        try
        {
            if (this.awaitCancellation(delayMillis, TimeUnit.MILLISECONDS))
            {
                throw new CancellationException("The operation was cancelled while waiting");
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            CancellationException cancellationException = new CancellationException("Interrupted while waiting");
            cancellationException.initCause(e);
            throw cancellationException;
        }
    }

    /**
     * Blocks until this token is cancelled or the timeout elapses.
     *
     * @param timeout the maximum time to wait
     * @param unit the unit of the timeout
     * @return true if the token is cancelled
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException
    {
        long remainingNanos = unit.toNanos(timeout);
        long end = System.nanoTime() + remainingNanos;

        while (!this.isCancellationRequested())
        {
            long waitNanos = remainingNanos;
            if (this.deadlineNanos != NO_DEADLINE)
            {
                waitNanos = Math.min(waitNanos, Math.max(0, this.deadlineNanos - System.nanoTime()));
            }

            if (waitNanos <= 0 && remainingNanos <= 0)
            {
                return false;
            }

            if (this.cancelled.await(waitNanos, TimeUnit.NANOSECONDS))
            {
                return true;
            }

            remainingNanos = end - System.nanoTime();
            if (remainingNanos <= 0)
            {
                return this.isCancellationRequested();
            }
        }

        return true;
    }
}
