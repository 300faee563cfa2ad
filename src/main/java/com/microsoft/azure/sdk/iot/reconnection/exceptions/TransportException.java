// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.exceptions;

/**
 * Thrown when an operation over the transport layer fails. The retryable flag tells retry policies whether
 * repeating the same operation may succeed.
 */
public class TransportException extends DeviceClientException
{
    private boolean isRetryable = false;

    public TransportException()
    {
        super();
    }

    public TransportException(String message)
    {
        super(message);
    }

    public TransportException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public TransportException(Throwable cause)
    {
        super(cause);
    }

    public boolean isRetryable()
    {
        return this.isRetryable;
    }

    public void setRetryable(boolean isRetryable)
    {
        this.isRetryable = isRetryable;
    }

    /**
     * @param message the exception message
     * @param cause the cause, may be null
     * @return a transport exception already flagged as retryable
     */
    public static TransportException retryable(String message, Throwable cause)
    {
        TransportException transportException = new TransportException(message, cause);
        transportException.setRetryable(true);
        return transportException;
    }
}
