// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifies a listener of a connection loss from a new thread, so that the protocol library's callback thread is not
 * blocked by the reconnection that follows.
 */
public final class ReconnectionNotifier
{
    private static final Logger log = LoggerFactory.getLogger(ReconnectionNotifier.class);

    private static final String THREAD_NAME = "azure-iot-sdk-ReconnectionTask";

    private ReconnectionNotifier()
    {
    }

    public static void notifyDisconnectAsync(final Throwable connectionLossCause, final IotHubListener listener, final String connectionId)
    {
        Thread thread = new Thread(() ->
        {
            try
            {
                listener.onConnectionLost(connectionLossCause, connectionId);
            }
            catch (RuntimeException e)
            {
                log.error("Handling the loss of connection {} failed", connectionId, e);
            }
        }, THREAD_NAME);

        thread.setDaemon(true);
        thread.start();
    }
}
