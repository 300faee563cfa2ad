// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.twin.DesiredPropertyUpdateCallback;
import com.microsoft.azure.sdk.iot.reconnection.twin.ReportedProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.TwinProperties;

/**
 * A client connected to an IoT Hub on behalf of one device identity.
 *
 * <p>Message and desired property subscriptions belong to a client instance and are lost when the client is replaced
 * by a new one.</p>
 */
public interface IotHubClient
{
    /**
     * Opens the client. Opening an open client does nothing.
     *
     * @throws TransportException if the connection could not be established
     */
    void open() throws TransportException;

    /**
     * Closes the client. The connection status becomes {@link IotHubConnectionStatus#DISABLED}.
     *
     * @throws TransportException if the connection could not be closed cleanly
     */
    void close() throws TransportException;

    ConnectionStatusInfo getConnectionStatusInfo();

    /**
     * Registers the callback notified of every connection status change of this client. The callback may be invoked
     * on any thread and should return quickly.
     *
     * @param callback the callback. Can be null to stop notifications if the context is null too.
     * @param callbackContext a context passed to the callback. Can be null.
     */
    void setConnectionStatusChangeCallback(IotHubConnectionStatusChangeCallback callback, Object callbackContext);

    void setMessageCallback(MessageCallback callback, Object callbackContext);

    void subscribeToDesiredProperties(DesiredPropertyUpdateCallback callback, Object callbackContext) throws TransportException;

    void sendEvent(Message message) throws TransportException;

    /**
     * @param timeoutMillis how long to wait for a message
     * @return the next cloud to device message, or null if none arrived within the timeout
     * @throws TransportException if receiving failed
     */
    Message receive(long timeoutMillis) throws TransportException;

    TwinProperties getTwin() throws TransportException;

    void updateReportedProperties(ReportedProperties reportedProperties) throws TransportException;
}
