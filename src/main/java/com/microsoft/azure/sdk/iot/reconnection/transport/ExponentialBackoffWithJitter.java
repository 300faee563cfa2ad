// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/**
 * Retries transient failures with an exponentially growing, jittered delay:
 * {@code |2^min(attempt, maxExponent) + jitter|} milliseconds, jitter being uniform in [-1000, 1000).
 *
 * <p>A failure is transient when its cause chain holds a network level exception, a retryable
 * {@link TransportException}, or an instance of one of the exception types the caller asked to always retry.</p>
 */
public final class ExponentialBackoffWithJitter implements RetryPolicy
{
    private static final Logger log = LoggerFactory.getLogger(ExponentialBackoffWithJitter.class);

    public static final int DEFAULT_MAX_EXPONENT = 20;
    public static final int MAX_EXPONENT_LIMIT = 30;
    static final int MAX_JITTER_MILLIS = 1000;

    private final int maxRetries;
    private final int maxExponent;
    private final Set<Class<? extends Throwable>> exceptionsToBeRetried;

    private final Object randomLock = new Object();
    private final Random random;

    public ExponentialBackoffWithJitter()
    {
        this(Integer.MAX_VALUE, DEFAULT_MAX_EXPONENT, Collections.emptySet());
    }

    /**
     * @param exceptionsToBeRetried exception types retried regardless of their retryable flag
     */
    public ExponentialBackoffWithJitter(Set<Class<? extends Throwable>> exceptionsToBeRetried)
    {
        this(Integer.MAX_VALUE, DEFAULT_MAX_EXPONENT, exceptionsToBeRetried);
    }

    /**
     * @param maxRetries the highest attempt number that may still be retried
     * @param maxExponent the exponent clamp, between 0 and {@value #MAX_EXPONENT_LIMIT}
     * @param exceptionsToBeRetried exception types retried regardless of their retryable flag
     */
    public ExponentialBackoffWithJitter(int maxRetries, int maxExponent, Set<Class<? extends Throwable>> exceptionsToBeRetried)
    {
        this(maxRetries, maxExponent, exceptionsToBeRetried, new Random());
    }

    ExponentialBackoffWithJitter(int maxRetries, int maxExponent, Set<Class<? extends Throwable>> exceptionsToBeRetried, Random random)
    {
        if (maxRetries < 0)
        {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }

        if (maxExponent < 0 || maxExponent > MAX_EXPONENT_LIMIT)
        {
            throw new IllegalArgumentException("maxExponent must be between 0 and " + MAX_EXPONENT_LIMIT);
        }

        if (exceptionsToBeRetried == null)
        {
            throw new IllegalArgumentException("exceptionsToBeRetried cannot be null");
        }

        this.maxRetries = maxRetries;
        this.maxExponent = maxExponent;
        this.exceptionsToBeRetried = Collections.unmodifiableSet(new HashSet<>(exceptionsToBeRetried));
        this.random = random;
    }

    @Override
    public RetryDecision getRetryDecision(int currentRetryCount, Throwable lastException)
    {
        if (currentRetryCount < 0)
        {
            throw new IllegalArgumentException("currentRetryCount cannot be negative");
        }

        if (currentRetryCount > this.maxRetries)
        {
            log.debug("Retry attempt {} exceeds the maximum of {} retries, giving up", currentRetryCount, this.maxRetries);
            return new RetryDecision(false, 0);
        }

        if (!this.isTransient(lastException))
        {
            log.debug("Retry attempt {} will not be made, failure is not transient: {}", currentRetryCount, String.valueOf(lastException));
            return new RetryDecision(false, 0);
        }

        long delay = this.computeDelayMillis(currentRetryCount);
        log.debug("Retry attempt {} will be made in {} milliseconds, last failure: {}", currentRetryCount, delay, String.valueOf(lastException));
        return new RetryDecision(true, delay);
    }

    long computeDelayMillis(int currentRetryCount)
    {
        int jitter;
        synchronized (this.randomLock)
        {
            jitter = this.random.nextInt(2 * MAX_JITTER_MILLIS) - MAX_JITTER_MILLIS;
        }

        long exponential = 1L << Math.min(currentRetryCount, this.maxExponent);

        // jitter can outweigh the exponential term on early attempts
        return Math.abs(exponential + jitter);
    }

    /**
     * @return the longest delay this policy can return, in milliseconds
     */
    public long getMaxDelayMillis()
    {
        return (1L << this.maxExponent) + MAX_JITTER_MILLIS;
    }

    boolean isTransient(Throwable lastException)
    {
        if (lastException == null)
        {
            return false;
        }

        for (Throwable cause : ExceptionUtils.getThrowableList(lastException))
        {
            if (cause instanceof TransportException && ((TransportException) cause).isRetryable())
            {
                return true;
            }

            if (isNetworkException(cause))
            {
                return true;
            }

            for (Class<? extends Throwable> retriedType : this.exceptionsToBeRetried)
            {
                if (retriedType.isInstance(cause))
                {
                    return true;
                }
            }
        }

        return false;
    }

    private static boolean isNetworkException(Throwable throwable)
    {
        return throwable instanceof SocketException
                || throwable instanceof SocketTimeoutException
                || throwable instanceof UnknownHostException;
    }
}
