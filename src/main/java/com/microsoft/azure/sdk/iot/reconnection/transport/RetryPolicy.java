// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

/**
 * Decides whether a failed operation should be retried and after which delay. Implementations are called
 * concurrently from several operations and must be thread safe.
 */
public interface RetryPolicy
{
    /**
     * @param currentRetryCount the number of failed attempts so far
     * @param lastException the failure of the latest attempt
     * @return the retry decision
     */
    RetryDecision getRetryDecision(int currentRetryCount, Throwable lastException);
}
