// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport.mqtt;

import com.microsoft.azure.sdk.iot.reconnection.DeviceClientConfig;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatus;
import com.microsoft.azure.sdk.iot.reconnection.IotHubMessageResult;
import com.microsoft.azure.sdk.iot.reconnection.Message;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubListener;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubTransportConnection;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubTransportMessage;
import com.microsoft.azure.sdk.iot.reconnection.twin.ReportedProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.TwinProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

public class MqttIotHubConnection implements IotHubTransportConnection, MqttMessageListener
{
    private static final Logger log = LoggerFactory.getLogger(MqttIotHubConnection.class);

    /** The MQTT connection lock. */
    private final Object mqttConnectionLock = new Object();

    private final DeviceClientConfig config;
    private volatile IotHubConnectionStatus state = IotHubConnectionStatus.DISCONNECTED;

    private MqttConnection mqttConnection;
    private volatile String connectionId;
    private IotHubListener listener;

    //Messaging clients
    private MqttMessaging deviceMessaging;
    private MqttTwin deviceTwin;

    /**
     * Constructs an instance from the given {@link DeviceClientConfig}
     * object.
     *
     * @param config the client configuration.
     */
    public MqttIotHubConnection(DeviceClientConfig config)
    {
        if (config == null)
        {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.config = config;
    }

    /**
     * Establishes a connection for the device and IoT Hub given in the client
     * configuration. If the connection is already open, the function shall do
     * nothing.
     *
     * @throws TransportException if a connection could not to be established.
     */
    @Override
    public void open() throws TransportException
    {
        synchronized (this.mqttConnectionLock)
        {
            if (this.state == IotHubConnectionStatus.CONNECTED)
            {
                return;
            }

            if (this.listener == null)
            {
                throw new IllegalStateException("A listener must be set before opening the connection");
            }

            this.connectionId = UUID.randomUUID().toString();
            log.debug("Opening MQTT connection {}...", this.connectionId);

            try
            {
                this.mqttConnection = this.createMqttConnection();
                this.deviceMessaging = new MqttMessaging(
                        this.mqttConnection,
                        this.config.getDeviceId(),
                        this.config.getModuleId(),
                        this.listener,
                        this,
                        this.connectionId,
                        this.config.getOperationTimeoutMillis());
                this.deviceTwin = new MqttTwin(this.mqttConnection, this.listener, this.connectionId, this.config.getOperationTimeoutMillis());
                this.mqttConnection.setMqttCallback(this.deviceMessaging);

                this.deviceMessaging.start();
                this.deviceTwin.start();
                this.state = IotHubConnectionStatus.CONNECTED;

                log.debug("MQTT connection opened successfully");
            }
            catch (TransportException e)
            {
                log.warn("Exception encountered while opening MQTT connection; closing connection", e);
                this.state = IotHubConnectionStatus.DISCONNECTED;

                if (this.deviceMessaging != null)
                {
                    try
                    {
                        this.deviceMessaging.stop();
                    }
                    catch (TransportException stopException)
                    {
                        e.addSuppressed(stopException);
                    }
                }

                throw e;
            }
        }

        this.listener.onConnectionEstablished(this.connectionId);
    }

    MqttConnection createMqttConnection() throws TransportException
    {
        return new MqttConnection(
                this.config.getHostUrl(),
                this.config.getClientId(),
                this.config.getUsername(),
                this.config.getPassword(),
                this.config.getKeepAliveIntervalSeconds());
    }

    /**
     * Closes the connection. After the connection is closed, it is no longer usable.
     * If the connection is already closed, the function shall do nothing.
     */
    @Override
    public void close() throws TransportException
    {
        synchronized (this.mqttConnectionLock)
        {
            if (this.deviceTwin != null)
            {
                this.deviceTwin.stop();
                this.deviceTwin = null;
            }

            if (this.state == IotHubConnectionStatus.DISCONNECTED && this.deviceMessaging == null)
            {
                return;
            }

            log.debug("Closing MQTT connection");

            try
            {
                if (this.deviceMessaging != null)
                {
                    this.deviceMessaging.stop();
                    this.deviceMessaging = null;
                }

                log.debug("Successfully closed MQTT connection");
            }
            finally
            {
                this.state = IotHubConnectionStatus.DISCONNECTED;
            }
        }
    }

    @Override
    public void setListener(IotHubListener listener) throws IllegalArgumentException
    {
        if (listener == null)
        {
            throw new IllegalArgumentException("listener cannot be null");
        }

        this.listener = listener;
    }

    /**
     * Sends an event message and waits for the service to acknowledge it.
     *
     * @param message the event message.
     * @throws TransportException if the message could not be sent
     */
    @Override
    public void sendMessage(Message message) throws TransportException
    {
        if (message == null)
        {
            throw new IllegalArgumentException("message cannot be null");
        }

        this.requireOpen().send(message);
    }

    /**
     * Acknowledges a received message. MQTT has no way of abandoning or rejecting a message: an abandoned message is
     * left unacknowledged so that the service delivers it again, a rejected one is acknowledged.
     *
     * @return true if the ACK was sent successfully and false otherwise
     * @throws TransportException if the ACK could not be sent successfully
     */
    @Override
    public boolean sendMessageResult(IotHubTransportMessage message, IotHubMessageResult result) throws TransportException
    {
        if (message == null || result == null)
        {
            throw new IllegalArgumentException("message and result must be non-null");
        }

        if (result == IotHubMessageResult.ABANDON)
        {
            log.debug("Not acknowledging abandoned message {}, the service will deliver it again", message.getMessageId());
            return false;
        }

        return this.requireOpen().sendMessageAcknowledgement(message.getProtocolMessageId());
    }

    @Override
    public TwinProperties getTwin() throws TransportException
    {
        return this.requireTwin().getTwin();
    }

    @Override
    public void updateReportedProperties(ReportedProperties reportedProperties) throws TransportException
    {
        this.requireTwin().updateReportedProperties(reportedProperties);
    }

    @Override
    public void subscribeToDesiredProperties() throws TransportException
    {
        this.requireTwin().subscribeToDesiredProperties();
    }

    @Override
    public String getConnectionId()
    {
        return this.connectionId;
    }

    @Override
    public void onMessageArrived(int messageId)
    {
        MqttMessaging messaging = this.deviceMessaging;
        MqttTwin twin = this.deviceTwin;
        if (messaging == null || twin == null)
        {
            log.debug("Message {} arrived while the connection is closing, ignoring it", messageId);
            return;
        }

        try
        {
            IotHubTransportMessage twinMessage = twin.receive(messageId);
            if (twinMessage != null)
            {
                messaging.sendMessageAcknowledgement(messageId);
                twin.handleTwinMessage(twinMessage);
                return;
            }

            IotHubTransportMessage transportMessage = messaging.receive(messageId);
            if (transportMessage == null)
            {
                //Ack is not sent to service for this message because we cannot interpret the message. Service will likely re-send
                this.mqttConnection.getAllReceivedMessages().poll();
                this.listener.onMessageReceived(null, new TransportException("Message sent from service could not be parsed"));
                log.warn("Received message that could not be parsed. That message has been ignored.");
                return;
            }

            log.debug("MQTT received message ({})", transportMessage);
            this.listener.onMessageReceived(transportMessage, null);
        }
        catch (TransportException e)
        {
            log.warn("Encountered exception while receiving message over MQTT", e);
            this.listener.onMessageReceived(null, new TransportException("Failed to receive message from service", e));
        }
    }

    private MqttMessaging requireOpen() throws TransportException
    {
        MqttMessaging messaging = this.deviceMessaging;
        if (this.state != IotHubConnectionStatus.CONNECTED || messaging == null)
        {
            throw TransportException.retryable("The MQTT connection is not open", null);
        }

        return messaging;
    }

    private MqttTwin requireTwin() throws TransportException
    {
        MqttTwin twin = this.deviceTwin;
        if (this.state != IotHubConnectionStatus.CONNECTED || twin == null)
        {
            throw TransportException.retryable("The MQTT connection is not open", null);
        }

        return twin;
    }
}
