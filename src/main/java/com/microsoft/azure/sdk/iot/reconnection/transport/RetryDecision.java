// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

/**
 * Outcome of a {@link RetryPolicy} evaluation: whether to retry, and how long to wait first.
 */
public final class RetryDecision
{
    private final boolean shouldRetry;
    private final long duration;

    /**
     * @param shouldRetry true if the operation should be retried
     * @param duration the time to wait before the next attempt, in milliseconds
     */
    public RetryDecision(boolean shouldRetry, long duration)
    {
        if (duration < 0)
        {
            throw new IllegalArgumentException("duration cannot be negative");
        }

        this.shouldRetry = shouldRetry;
        this.duration = duration;
    }

    public boolean shouldRetry()
    {
        return this.shouldRetry;
    }

    /**
     * @return the time to wait before the next attempt, in milliseconds
     */
    public long getDuration()
    {
        return this.duration;
    }

    @Override
    public String toString()
    {
        return "RetryDecision{shouldRetry=" + this.shouldRetry + ", duration=" + this.duration + "ms}";
    }
}
