// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import com.microsoft.azure.sdk.iot.reconnection.twin.DesiredProperties;

/**
 * Callbacks from a protocol level connection to the transport layer.
 */
public interface IotHubListener
{
    /**
     * Called when a cloud to device message arrives, or when a message could not be received.
     *
     * @param transportMessage the received message, or null if receiving failed
     * @param e the receive failure, or null if the message was received
     */
    void onMessageReceived(IotHubTransportMessage transportMessage, Throwable e);

    /**
     * Called when a desired properties patch arrives.
     *
     * @param desiredProperties the patch, tagged with the twin version it produced
     */
    void onDesiredPropertiesUpdated(DesiredProperties desiredProperties);

    /**
     * Called when a connection is lost.
     *
     * @param e the cause of the connection loss
     * @param connectionId the id of the connection that was lost
     */
    void onConnectionLost(Throwable e, String connectionId);

    /**
     * Called when a connection is established.
     *
     * @param connectionId the id of the connection that was established
     */
    void onConnectionEstablished(String connectionId);
}
