// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.exceptions;

/**
 * Base class for all checked exceptions thrown by the device client.
 */
public class DeviceClientException extends Exception
{
    public DeviceClientException()
    {
        super();
    }

    public DeviceClientException(String message)
    {
        super(message);
    }

    public DeviceClientException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public DeviceClientException(Throwable cause)
    {
        super(cause);
    }
}
