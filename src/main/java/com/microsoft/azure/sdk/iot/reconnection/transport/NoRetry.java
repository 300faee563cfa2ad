// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

/**
 * A policy that never retries.
 */
public final class NoRetry implements RetryPolicy
{
    @Override
    public RetryDecision getRetryDecision(int currentRetryCount, Throwable lastException)
    {
        return new RetryDecision(false, 0);
    }
}
