// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.exceptions;

/**
 * The device identity was deleted or disabled on the hub.
 */
public class DeviceDisabledException extends TransportException
{
    public DeviceDisabledException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
