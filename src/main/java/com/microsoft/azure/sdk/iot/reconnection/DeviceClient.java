// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubTransport;
import com.microsoft.azure.sdk.iot.reconnection.transport.RetryPolicy;
import com.microsoft.azure.sdk.iot.reconnection.twin.DesiredPropertyUpdateCallback;
import com.microsoft.azure.sdk.iot.reconnection.twin.ReportedProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.TwinProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A device client communicating with an IoT Hub over MQTT.
 */
public final class DeviceClient implements IotHubClient
{
    private static final Logger log = LoggerFactory.getLogger(DeviceClient.class);

    private final DeviceClientConfig config;
    private final IotHubTransport transport;

    public DeviceClient(String connectionString)
    {
        this(new DeviceClientConfig(IotHubConnectionString.parse(connectionString)));
    }

    public DeviceClient(DeviceClientConfig config)
    {
        this(config, new IotHubTransport(config));
    }

    DeviceClient(DeviceClientConfig config, IotHubTransport transport)
    {
        if (config == null || transport == null)
        {
            throw new IllegalArgumentException("config and transport cannot be null");
        }

        this.config = config;
        this.transport = transport;
    }

    @Override
    public void open() throws TransportException
    {
        this.transport.open();
        log.info("Device client {} opened successfully", this.config.getDeviceId());
    }

    @Override
    public void close() throws TransportException
    {
        log.debug("Closing device client {}...", this.config.getDeviceId());
        this.transport.close();
        log.info("Device client {} closed successfully", this.config.getDeviceId());
    }

    @Override
    public ConnectionStatusInfo getConnectionStatusInfo()
    {
        return this.transport.getConnectionStatusInfo();
    }

    @Override
    public void setConnectionStatusChangeCallback(IotHubConnectionStatusChangeCallback callback, Object callbackContext)
    {
        this.transport.registerConnectionStatusChangeCallback(callback, callbackContext);
    }

    /**
     * Sets the message callback. Messages that arrive while no callback is set can be read with {@link #receive(long)}.
     *
     * @param callback the message callback. Can be {@code null}.
     * @param callbackContext the context to be passed to the callback. Can be {@code null}.
     * @throws IllegalArgumentException if the callback is {@code null} but a context is passed in.
     */
    @Override
    public void setMessageCallback(MessageCallback callback, Object callbackContext)
    {
        this.transport.setMessageCallback(callback, callbackContext);
    }

    @Override
    public void subscribeToDesiredProperties(DesiredPropertyUpdateCallback callback, Object callbackContext) throws TransportException
    {
        this.transport.subscribeToDesiredProperties(callback, callbackContext);
    }

    @Override
    public void sendEvent(Message message) throws TransportException
    {
        this.transport.sendMessage(message);
    }

    @Override
    public Message receive(long timeoutMillis)
    {
        return this.transport.receive(timeoutMillis);
    }

    @Override
    public TwinProperties getTwin() throws TransportException
    {
        return this.transport.getTwin();
    }

    @Override
    public void updateReportedProperties(ReportedProperties reportedProperties) throws TransportException
    {
        this.transport.updateReportedProperties(reportedProperties);
    }

    /**
     * Sets the policy the client uses to reconnect on its own after losing an established connection.
     *
     * @param retryPolicy the policy
     */
    public void setRetryPolicy(RetryPolicy retryPolicy)
    {
        this.config.setRetryPolicy(retryPolicy);
    }
}
