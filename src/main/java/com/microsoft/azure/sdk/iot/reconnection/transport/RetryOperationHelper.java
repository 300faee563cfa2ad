// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import com.microsoft.azure.sdk.iot.reconnection.CancellationToken;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Runs an operation until it succeeds, fails fatally, the {@link RetryPolicy} gives up, or the cancellation token
 * is cancelled.
 *
 * <p>Before each attempt the readiness check is consulted. An attempt that is not ready is skipped; the policy is then
 * asked about a retryable "client is reconnecting" failure without the skip counting towards the number of failed
 * attempts.</p>
 */
public class RetryOperationHelper
{
    private static final Logger log = LoggerFactory.getLogger(RetryOperationHelper.class);

    private final RetryPolicy retryPolicy;

    public RetryOperationHelper(RetryPolicy retryPolicy)
    {
        if (retryPolicy == null)
        {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }

        this.retryPolicy = retryPolicy;
    }

    /**
     * Retries an operation that signals failure by throwing. See {@link OperationResult#from(OperationResult.ThrowingOperation)}
     * for how thrown exceptions are classified.
     *
     * @param operationName the name of the operation, for logging
     * @param operation the operation to run
     * @param shouldExecuteOperation the readiness check consulted before each attempt
     * @param cancellationToken the token that aborts the retries
     * @throws TransportException if the operation failed fatally or the retry policy gave up
     * @throws CancellationException if the token was cancelled
     */
    public void retryTransientExceptions(
            String operationName,
            OperationResult.ThrowingOperation operation,
            BooleanSupplier shouldExecuteOperation,
            CancellationToken cancellationToken) throws TransportException
    {
        this.run(operationName, () -> OperationResult.from(operation), shouldExecuteOperation, cancellationToken);
    }

    /**
     * Retries an operation that reports its own outcome.
     *
     * @param operationName the name of the operation, for logging
     * @param operation the operation to run
     * @param shouldExecuteOperation the readiness check consulted before each attempt
     * @param cancellationToken the token that aborts the retries
     * @throws TransportException if the operation failed fatally or the retry policy gave up
     * @throws CancellationException if the token was cancelled
     */
    public void run(
            String operationName,
            RetryableOperation operation,
            BooleanSupplier shouldExecuteOperation,
            CancellationToken cancellationToken) throws TransportException
    {
        if (operation == null || shouldExecuteOperation == null || cancellationToken == null)
        {
            throw new IllegalArgumentException("operation, readiness check and cancellation token cannot be null");
        }

        int failedAttempts = 0;
        int iteration = 0;
        while (true)
        {
            cancellationToken.throwIfCancellationRequested();
            iteration++;

            Throwable lastFailure;
            if (shouldExecuteOperation.getAsBoolean())
            {
                log.debug("{}: attempt {} started", operationName, iteration);
                OperationResult result = operation.execute();

                if (result.getStatus() == OperationResult.Status.SUCCESS)
                {
                    log.debug("{}: attempt {} succeeded", operationName, iteration);
                    return;
                }

                if (result.getStatus() == OperationResult.Status.FATAL_FAILURE)
                {
                    log.warn("{}: attempt {} failed with a non-retryable error", operationName, iteration, result.getFailure());
                    throw asTransportException(operationName + " failed", result.getFailure());
                }

                lastFailure = result.getFailure();
                failedAttempts++;
                log.warn("{}: attempt {} failed: {}", operationName, iteration, lastFailure.toString());
            }
            else
            {
                lastFailure = TransportException.retryable("The client is reconnecting, " + operationName + " is not ready to run", null);
                log.warn("{}: attempt {} skipped, the client is not ready", operationName, iteration);
            }

            RetryDecision retryDecision = this.retryPolicy.getRetryDecision(failedAttempts, lastFailure);
            if (!retryDecision.shouldRetry())
            {
                log.warn("{}: abandoned after {} failed attempts", operationName, failedAttempts);
                throw new TransportException(operationName + " abandoned after " + failedAttempts + " failed attempts", lastFailure);
            }

            log.debug("{}: next attempt in {} milliseconds", operationName, retryDecision.getDuration());
            cancellationToken.delay(retryDecision.getDuration());
        }
    }

    private static TransportException asTransportException(String message, Throwable failure)
    {
        if (failure instanceof TransportException)
        {
            return (TransportException) failure;
        }

        return new TransportException(message, failure);
    }
}
