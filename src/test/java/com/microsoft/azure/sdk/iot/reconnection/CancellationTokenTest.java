// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CancellationTokenTest
{
    @Test
    public void tokenStaysCancelledOnceCancelled()
    {
        CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancellationRequested());

        token.cancel();
        token.cancel();

        assertTrue(token.isCancellationRequested());
    }

    @Test(expected = CancellationException.class)
    public void throwIfCancellationRequestedThrowsOnceCancelled()
    {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        token.throwIfCancellationRequested();
    }

    @Test(timeout = 10000)
    public void tokenWithTimeoutCancelsItself() throws InterruptedException
    {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(50));

        assertTrue(token.awaitCancellation(5, TimeUnit.SECONDS));
        assertTrue(token.isCancellationRequested());
    }

    @Test
    public void awaitCancellationTimesOutOnAnActiveToken() throws InterruptedException
    {
        assertFalse(CancellationToken.create().awaitCancellation(20, TimeUnit.MILLISECONDS));
    }

    @Test
    public void delayReturnsAfterTheDelayOnAnActiveToken()
    {
        long start = System.nanoTime();

        CancellationToken.create().delay(50);

        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50));
    }

    @Test(timeout = 10000, expected = CancellationException.class)
    public void delayEndsEarlyWhenCancelled()
    {
        CancellationToken token = CancellationToken.create();
        new Thread(() ->
        {
            try
            {
                Thread.sleep(50);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }

            token.cancel();
        }).start();

        token.delay(60 * 1000);
    }

    @Test
    public void interruptedDelayIsACancellation()
    {
        Thread.currentThread().interrupt();
        try
        {
            CancellationToken.create().delay(1000);
            fail("expected a CancellationException");
        }
        catch (CancellationException e)
        {
            assertTrue(Thread.interrupted());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeTimeoutIsRejected()
    {
        CancellationToken.withTimeout(Duration.ofMillis(-1));
    }
}
