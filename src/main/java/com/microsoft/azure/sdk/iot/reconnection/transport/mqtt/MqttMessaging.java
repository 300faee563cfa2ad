// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport.mqtt;

import com.microsoft.azure.sdk.iot.reconnection.Message;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubListener;
import com.microsoft.azure.sdk.iot.reconnection.transport.mqtt.exceptions.PahoExceptionTranslator;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttException;

/**
 * Telemetry and cloud to device messaging over MQTT.
 */
public class MqttMessaging extends Mqtt
{
    private final String eventsSubscribeTopic;
    private final String eventsSubscribePrefix;
    private final String publishTopic;
    private final long operationTimeoutMillis;

    public MqttMessaging(
            MqttConnection mqttConnection,
            String deviceId,
            String moduleId,
            IotHubListener listener,
            MqttMessageListener messageListener,
            String connectionId,
            long operationTimeoutMillis)
    {
        super(mqttConnection, listener, messageListener, connectionId);

        if (deviceId == null || deviceId.isEmpty())
        {
            throw new IllegalArgumentException("Device id cannot be null or empty");
        }

        String devicePath = (moduleId == null || moduleId.isEmpty())
                ? "devices/" + deviceId
                : "devices/" + deviceId + "/modules/" + moduleId;

        this.publishTopic = devicePath + "/messages/events/";
        this.eventsSubscribePrefix = devicePath + "/messages/devicebound/";
        this.eventsSubscribeTopic = this.eventsSubscribePrefix + "#";
        this.operationTimeoutMillis = operationTimeoutMillis;
    }

    /**
     * Connects and subscribes to cloud to device messages.
     *
     * @throws TransportException if connecting or subscribing failed
     */
    public void start() throws TransportException
    {
        this.connect();
        this.subscribe(this.eventsSubscribeTopic);
    }

    public void stop() throws TransportException
    {
        this.disconnect();
    }

    /**
     * Sends the provided telemetry message over the mqtt connection and waits for the service to acknowledge it.
     *
     * @param message the message to send
     * @throws TransportException if any exception is encountered while sending the message
     */
    public void send(Message message) throws TransportException
    {
        if (message == null)
        {
            throw new IllegalArgumentException("Message cannot be null");
        }

        IMqttDeliveryToken deliveryToken = this.publish(this.publishTopic, message);

        try
        {
            deliveryToken.waitForCompletion(this.operationTimeoutMillis);
        }
        catch (MqttException e)
        {
            throw PahoExceptionTranslator.convertToMqttException(e, "Message " + message.getMessageId() + " was not acknowledged");
        }
    }

    @Override
    protected boolean isTopicOwned(String topic)
    {
        return topic.startsWith(this.eventsSubscribePrefix);
    }
}
