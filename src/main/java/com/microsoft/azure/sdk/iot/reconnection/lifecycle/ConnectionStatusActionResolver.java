// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.lifecycle;

import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatus;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatusChangeReason;

/**
 * Maps a connection status and its reason to the action the lifecycle manager takes.
 */
public final class ConnectionStatusActionResolver
{
    private final boolean reinitializeOnCommunicationError;

    public ConnectionStatusActionResolver()
    {
        this(true);
    }

    /**
     * @param reinitializeOnCommunicationError whether a disconnection caused by an unclassified communication error
     * is recovered by replacing the client. If false it is treated as unexpected.
     */
    public ConnectionStatusActionResolver(boolean reinitializeOnCommunicationError)
    {
        this.reinitializeOnCommunicationError = reinitializeOnCommunicationError;
    }

    public ConnectionAction resolve(IotHubConnectionStatus status, IotHubConnectionStatusChangeReason reason)
    {
        if (status == null || reason == null)
        {
            throw new IllegalArgumentException("status and reason cannot be null");
        }

        switch (status)
        {
            case CONNECTED:
                return ConnectionAction.RECONCILE_TWIN;

            case DISCONNECTED_RETRYING:
            case DISABLED:
                return ConnectionAction.NONE;

            case DISCONNECTED:
                return this.resolveDisconnected(reason);

            default:
                return ConnectionAction.UNEXPECTED;
        }
    }

    private ConnectionAction resolveDisconnected(IotHubConnectionStatusChangeReason reason)
    {
        switch (reason)
        {
            case BAD_CREDENTIAL:
                return ConnectionAction.DISCARD_CREDENTIAL_AND_REINITIALIZE;

            case DEVICE_DISABLED:
                return ConnectionAction.FATAL;

            case RETRY_EXPIRED:
                return ConnectionAction.REINITIALIZE;

            case COMMUNICATION_ERROR:
                return this.reinitializeOnCommunicationError ? ConnectionAction.REINITIALIZE : ConnectionAction.UNEXPECTED;

            default:
                return ConnectionAction.UNEXPECTED;
        }
    }
}
