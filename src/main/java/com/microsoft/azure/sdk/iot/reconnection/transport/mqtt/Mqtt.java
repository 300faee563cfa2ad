// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport.mqtt;

import com.microsoft.azure.sdk.iot.reconnection.Message;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubListener;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubTransportMessage;
import com.microsoft.azure.sdk.iot.reconnection.transport.ReconnectionNotifier;
import com.microsoft.azure.sdk.iot.reconnection.transport.mqtt.exceptions.PahoExceptionTranslator;
import org.apache.commons.lang3.tuple.MutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentLinkedQueue;

public abstract class Mqtt implements MqttCallback
{
    private static final Logger log = LoggerFactory.getLogger(Mqtt.class);

    private static final int CONNECTION_TIMEOUT = 60 * 1000;
    private static final int DISCONNECTION_TIMEOUT = 60 * 1000;

    private final MqttConnection mqttConnection;
    private final MqttMessageListener messageListener;
    private final ConcurrentLinkedQueue<Pair<String, byte[]>> allReceivedMessages;
    private final Object stateLock;
    protected final Object incomingLock;
    private final Object publishLock;

    private final IotHubListener listener;
    private final String connectionId;

    /**
     * Constructor to instantiate mqtt broker connection.
     * @param mqttConnection the connection to use
     * @param listener the listener to be called back upon connection lost
     * @param messageListener the listener to be called back upon a message arriving. May be null.
     * @param connectionId the id of the connection
     * @throws IllegalArgumentException if the provided mqttConnection is null
     */
    protected Mqtt(MqttConnection mqttConnection, IotHubListener listener, MqttMessageListener messageListener, String connectionId) throws IllegalArgumentException
    {
        if (mqttConnection == null)
        {
            throw new IllegalArgumentException("Mqtt connection info cannot be null");
        }

        this.mqttConnection = mqttConnection;
        this.allReceivedMessages = mqttConnection.getAllReceivedMessages();
        this.stateLock = mqttConnection.getMqttLock();
        this.incomingLock = new Object();
        this.publishLock = new Object();
        this.listener = listener;
        this.messageListener = messageListener;
        this.connectionId = connectionId;
    }

    /**
     * @param topic the topic a message arrived on
     * @return true if messages on this topic are handled by this client
     */
    protected abstract boolean isTopicOwned(String topic);

    /**
     * Method to connect to mqtt broker connection.
     *
     * @throws TransportException if failed to establish the mqtt connection.
     */
    protected void connect() throws TransportException
    {
        synchronized (this.stateLock)
        {
            try
            {
                if (!this.mqttConnection.getMqttAsyncClient().isConnected())
                {
                    log.debug("Sending MQTT CONNECT packet...");
                    IMqttToken connectToken = this.mqttConnection.getMqttAsyncClient().connect(this.mqttConnection.getConnectionOptions());
                    connectToken.waitForCompletion(CONNECTION_TIMEOUT);
                    log.debug("Sent MQTT CONNECT packet was acknowledged");
                }
            }
            catch (MqttException e)
            {
                log.warn("Exception encountered while sending MQTT CONNECT packet", e);

                try
                {
                    this.disconnect();
                }
                catch (TransportException disconnectException)
                {
                    e.addSuppressed(disconnectException);
                }

                throw PahoExceptionTranslator.convertToMqttException(e, "Unable to establish MQTT connection");
            }
        }
    }

    /**
     * Method to disconnect to mqtt broker connection.
     *
     * @throws TransportException if failed to ends the mqtt connection.
     */
    protected void disconnect() throws TransportException
    {
        try
        {
            if (this.mqttConnection.isConnected())
            {
                log.debug("Sending MQTT DISCONNECT packet");
                IMqttToken disconnectToken = this.mqttConnection.disconnect();

                if (disconnectToken != null)
                {
                    disconnectToken.waitForCompletion(DISCONNECTION_TIMEOUT);
                }

                log.debug("Sent MQTT DISCONNECT packet was acknowledged");
            }

            this.mqttConnection.close();
            this.mqttConnection.setMqttAsyncClient(null);
        }
        catch (MqttException e)
        {
            log.warn("Exception encountered while sending MQTT DISCONNECT packet", e);
            throw PahoExceptionTranslator.convertToMqttException(e, "Unable to disconnect");
        }
    }

    /**
     * Method to publish to mqtt broker connection.
     *
     * @param publishTopic the topic to publish on mqtt broker connection.
     * @param message the message to publish.
     * @return the delivery token of the publication
     * @throws TransportException if connection hasn't been established yet, or if Paho throws for any other reason
     */
    protected IMqttDeliveryToken publish(String publishTopic, Message message) throws TransportException
    {
        if (message == null || publishTopic == null || publishTopic.isEmpty())
        {
            throw new IllegalArgumentException("Cannot publish on null or empty publish topic");
        }

        try
        {
            if (!this.mqttConnection.isConnected())
            {
                throw TransportException.retryable("Cannot publish when mqtt client is disconnected", null);
            }

            while (this.mqttConnection.getMqttAsyncClient().getPendingDeliveryTokens().length >= MqttConnection.MAX_IN_FLIGHT_COUNT)
            {
                Thread.sleep(10);

                if (!this.mqttConnection.isConnected())
                {
                    throw TransportException.retryable("Connection was lost while waiting for mqtt deliveries to finish", null);
                }
            }

            byte[] payload = message.getBytes();
            MqttMessage mqttMessage = (payload.length == 0) ? new MqttMessage() : new MqttMessage(payload);
            mqttMessage.setQos(MqttConnection.QOS);

            synchronized (this.publishLock)
            {
                log.debug("Publishing message ({}) to MQTT topic {}", message, publishTopic);
                IMqttDeliveryToken publishToken = this.mqttConnection.getMqttAsyncClient().publish(publishTopic, mqttMessage);
                log.debug("Message published to MQTT topic {}, mqtt message id {}", publishTopic, publishToken.getMessageId());
                return publishToken;
            }
        }
        catch (MqttException e)
        {
            log.warn("Message could not be published to MQTT topic {}: {}", publishTopic, message, e);
            throw PahoExceptionTranslator.convertToMqttException(e, "Unable to publish message on topic : " + publishTopic);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted, Unable to publish message on topic : " + publishTopic, e);
        }
    }

    /**
     * Method to subscribe to mqtt broker connection.
     *
     * @param topic the topic to subscribe on mqtt broker connection.
     * @throws TransportException if failed to subscribe the mqtt topic.
     */
    protected void subscribe(String topic) throws TransportException
    {
        if (topic == null)
        {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        synchronized (this.stateLock)
        {
            try
            {
                if (!this.mqttConnection.isConnected())
                {
                    throw TransportException.retryable("Cannot subscribe when mqtt client is disconnected", null);
                }

                log.debug("Sending MQTT SUBSCRIBE packet for topic {}", topic);
                IMqttToken subToken = this.mqttConnection.getMqttAsyncClient().subscribe(topic, MqttConnection.QOS);
                subToken.waitForCompletion(MqttConnection.MAX_SUBSCRIBE_ACK_WAIT_TIME);
                log.debug("Sent MQTT SUBSCRIBE packet for topic {} was acknowledged", topic);
            }
            catch (MqttException e)
            {
                log.warn("Encountered exception while sending MQTT SUBSCRIBE packet for topic {}", topic, e);
                throw PahoExceptionTranslator.convertToMqttException(e, "Unable to subscribe to topic :" + topic);
            }
        }
    }

    /**
     * Takes the oldest received message off the queue if its topic is handled by this client.
     *
     * @param protocolMessageId the MQTT message id of the message
     * @return the received message, or {@code null} if the queue is empty or its head belongs to another client
     * @throws TransportException if the queued message has no payload
     */
    public IotHubTransportMessage receive(int protocolMessageId) throws TransportException
    {
        synchronized (this.incomingLock)
        {
            Pair<String, byte[]> messagePair = this.allReceivedMessages.peek();
            if (messagePair == null || messagePair.getKey() == null || !this.isTopicOwned(messagePair.getKey()))
            {
                return null;
            }

            //remove this message from the queue as this is the correct handler
            this.allReceivedMessages.poll();

            if (messagePair.getValue() == null)
            {
                throw new TransportException("Data cannot be null when topic is non-null");
            }

            return new IotHubTransportMessage(messagePair.getValue(), messagePair.getKey(), protocolMessageId);
        }
    }

    /**
     * Event fired when the connection with the MQTT broker is lost.
     * @param throwable Reason for losing the connection.
     */
    @Override
    public void connectionLost(Throwable throwable)
    {
        TransportException ex = null;

        log.warn("Mqtt connection lost", throwable);

        try
        {
            this.disconnect();
        }
        catch (TransportException e)
        {
            ex = e;
        }

        if (this.listener != null)
        {
            if (ex == null)
            {
                if (throwable instanceof MqttException)
                {
                    throwable = PahoExceptionTranslator.convertToMqttException((MqttException) throwable, "Mqtt connection lost");
                    log.debug("Mqtt connection loss interpreted into transport exception: {}", throwable.toString());
                }
                else
                {
                    throwable = TransportException.retryable("Mqtt connection lost", throwable);
                }
            }
            else
            {
                throwable = ex;
            }

            ReconnectionNotifier.notifyDisconnectAsync(throwable, this.listener, this.connectionId);
        }
    }

    /**
     * Event fired when the message arrived on the MQTT broker.
     * @param topic the topic on which message arrived.
     * @param mqttMessage  the message arrived on the Mqtt broker.
     */
    @Override
    public void messageArrived(String topic, MqttMessage mqttMessage)
    {
        log.debug("Mqtt message arrived on topic {} with mqtt message id: {}", topic, mqttMessage.getId());
        this.allReceivedMessages.add(new MutablePair<>(topic, mqttMessage.getPayload()));

        if (this.messageListener != null)
        {
            this.messageListener.onMessageArrived(mqttMessage.getId());
        }
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken iMqttDeliveryToken)
    {
        log.trace("Mqtt message with message id {} was acknowledged by service", iMqttDeliveryToken.getMessageId());
    }

    /**
     * Attempts to send ack for the provided message.
     * @param messageId The message id to send the ack for
     * @return true if the ack is sent successfully or false if the client is closed
     * @throws TransportException if an exception occurs when sending the ack
     */
    protected boolean sendMessageAcknowledgement(int messageId) throws TransportException
    {
        log.debug("Sending mqtt ack for received message with mqtt message id {}", messageId);
        return this.mqttConnection.sendMessageAcknowledgement(messageId);
    }
}
