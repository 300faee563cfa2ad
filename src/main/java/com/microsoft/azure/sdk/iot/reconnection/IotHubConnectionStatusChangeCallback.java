// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

/**
 * Callback interface for connection status changes.
 */
public interface IotHubConnectionStatusChangeCallback
{
    /**
     * Invoked on a transport thread every time the connection status changes. Implementations must return quickly
     * and must not throw; in particular they should not open or close the client on the calling thread.
     *
     * @param statusInfo the new connection status
     * @param callbackContext the context registered together with this callback. May be null.
     */
    void execute(ConnectionStatusInfo statusInfo, Object callbackContext);
}
