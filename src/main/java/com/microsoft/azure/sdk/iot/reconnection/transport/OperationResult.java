// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import com.microsoft.azure.sdk.iot.reconnection.exceptions.DeviceClientException;

import java.io.IOException;
import java.util.concurrent.CancellationException;

/**
 * The tagged outcome of a single attempt of a retried operation.
 */
public final class OperationResult
{
    public enum Status
    {
        SUCCESS,

        /** The attempt failed in a way that may be retried. The {@link RetryPolicy} makes the final call. */
        TRANSIENT_FAILURE,

        /** The attempt failed and must not be retried. */
        FATAL_FAILURE
    }

    /**
     * An operation that signals failure by throwing.
     */
    @FunctionalInterface
    public interface ThrowingOperation
    {
        void run() throws Exception;
    }

    private static final OperationResult SUCCESS_RESULT = new OperationResult(Status.SUCCESS, null);

    private final Status status;
    private final Throwable failure;

    private OperationResult(Status status, Throwable failure)
    {
        this.status = status;
        this.failure = failure;
    }

    public static OperationResult success()
    {
        return SUCCESS_RESULT;
    }

    public static OperationResult transientFailure(Throwable failure)
    {
        if (failure == null)
        {
            throw new IllegalArgumentException("failure cannot be null");
        }

        return new OperationResult(Status.TRANSIENT_FAILURE, failure);
    }

    public static OperationResult fatalFailure(Throwable failure)
    {
        if (failure == null)
        {
            throw new IllegalArgumentException("failure cannot be null");
        }

        return new OperationResult(Status.FATAL_FAILURE, failure);
    }

    /**
     * Runs the provided operation once and captures its outcome. Client and I/O exceptions are reported as
     * transient failures, any other exception as a fatal one.
     *
     * @param operation the operation to run
     * @return the outcome of the operation
     * @throws CancellationException if the operation was cancelled or the thread was interrupted
     */
    public static OperationResult from(ThrowingOperation operation)
    {
        try
        {
            operation.run();
            return success();
        }
        catch (CancellationException e)
        {
            throw e;
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            CancellationException cancellationException = new CancellationException("Interrupted while running the operation");
            cancellationException.initCause(e);
            throw cancellationException;
        }
        catch (DeviceClientException | IOException e)
        {
            return transientFailure(e);
        }
        catch (Exception e)
        {
            return fatalFailure(e);
        }
    }

    public Status getStatus()
    {
        return this.status;
    }

    /**
     * @return the failure of the attempt, or null if it succeeded
     */
    public Throwable getFailure()
    {
        return this.failure;
    }

    @Override
    public String toString()
    {
        return this.failure == null ? this.status.name() : this.status + " (" + this.failure + ")";
    }
}
