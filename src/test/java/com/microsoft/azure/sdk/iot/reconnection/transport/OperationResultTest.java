// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.CancellationException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class OperationResultTest
{
    @Test
    public void completedOperationIsASuccess()
    {
        OperationResult result = OperationResult.from(() -> { });

        assertEquals(OperationResult.Status.SUCCESS, result.getStatus());
        assertNull(result.getFailure());
    }

    @Test
    public void clientAndIoExceptionsAreTransientFailures()
    {
        TransportException transportException = new TransportException("not retryable but still a client exception");
        IOException ioException = new IOException("broken pipe");

        OperationResult transportResult = OperationResult.from(() -> { throw transportException; });
        OperationResult ioResult = OperationResult.from(() -> { throw ioException; });

        assertEquals(OperationResult.Status.TRANSIENT_FAILURE, transportResult.getStatus());
        assertSame(transportException, transportResult.getFailure());
        assertEquals(OperationResult.Status.TRANSIENT_FAILURE, ioResult.getStatus());
    }

    @Test
    public void otherExceptionsAreFatalFailures()
    {
        OperationResult result = OperationResult.from(() -> { throw new IllegalArgumentException("bad argument"); });

        assertEquals(OperationResult.Status.FATAL_FAILURE, result.getStatus());
        assertTrue(result.getFailure() instanceof IllegalArgumentException);
    }

    @Test(expected = CancellationException.class)
    public void cancellationIsRethrown()
    {
        OperationResult.from(() -> { throw new CancellationException(); });
    }

    @Test
    public void interruptionBecomesACancellationAndKeepsTheInterruptFlag()
    {
        try
        {
            OperationResult.from(() -> { throw new InterruptedException(); });
            fail("expected a CancellationException");
        }
        catch (CancellationException e)
        {
            assertTrue(e.getCause() instanceof InterruptedException);
            assertTrue(Thread.interrupted());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void failureResultsRequireAFailure()
    {
        OperationResult.transientFailure(null);
    }
}
