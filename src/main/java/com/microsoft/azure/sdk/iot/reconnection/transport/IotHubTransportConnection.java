// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import com.microsoft.azure.sdk.iot.reconnection.IotHubMessageResult;
import com.microsoft.azure.sdk.iot.reconnection.Message;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.twin.ReportedProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.TwinProperties;

/**
 * A protocol level connection to an IoT Hub. Every successful {@link #open()} starts a new connection with a new
 * connection id.
 */
public interface IotHubTransportConnection
{
    void open() throws TransportException;

    void close() throws TransportException;

    void setListener(IotHubListener listener);

    /**
     * Sends a telemetry message and waits for the service to acknowledge it.
     */
    void sendMessage(Message message) throws TransportException;

    /**
     * Settles a received cloud to device message.
     *
     * @return true if the settlement was sent to the service
     */
    boolean sendMessageResult(IotHubTransportMessage message, IotHubMessageResult result) throws TransportException;

    TwinProperties getTwin() throws TransportException;

    void updateReportedProperties(ReportedProperties reportedProperties) throws TransportException;

    /**
     * Starts the delivery of desired property patches to the listener.
     */
    void subscribeToDesiredProperties() throws TransportException;

    String getConnectionId();
}
