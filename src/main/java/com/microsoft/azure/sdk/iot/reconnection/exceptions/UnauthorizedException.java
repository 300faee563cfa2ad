// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.exceptions;

/**
 * The service rejected the credentials used to authenticate the connection. Never retryable on its own: the
 * credential has to change before the same operation can succeed.
 */
public class UnauthorizedException extends TransportException
{
    public UnauthorizedException(String message)
    {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
