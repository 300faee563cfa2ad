// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport.mqtt;

import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.transport.mqtt.exceptions.PahoExceptionTranslator;
import org.apache.commons.lang3.tuple.Pair;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * The Paho client of one MQTT session, with its connect options and the queue of messages received on it.
 */
public class MqttConnection
{
    static final int QOS = 1;
    static final int MAX_IN_FLIGHT_COUNT = 10;
    static final int MAX_SUBSCRIBE_ACK_WAIT_TIME = 15 * 1000;

    private static final int MQTT_VERSION = MqttConnectOptions.MQTT_VERSION_3_1_1;

    private MqttAsyncClient mqttAsyncClient;
    private final MqttConnectOptions connectionOptions;
    private final ConcurrentLinkedQueue<Pair<String, byte[]>> allReceivedMessages = new ConcurrentLinkedQueue<>();
    private final Object mqttLock = new Object();

    /**
     * @param serverURI the broker address, such as {@code ssl://myhub.azure-devices.net:8883}
     * @param clientId the MQTT client id
     * @param userName the MQTT user name
     * @param password the SAS token
     * @param keepAliveIntervalSeconds the MQTT keep alive interval
     * @throws TransportException if the Paho client could not be created
     */
    MqttConnection(String serverURI, String clientId, String userName, String password, int keepAliveIntervalSeconds) throws TransportException
    {
        if (serverURI == null || serverURI.isEmpty() || clientId == null || clientId.isEmpty()
                || userName == null || userName.isEmpty() || password == null || password.isEmpty())
        {
            throw new IllegalArgumentException("serverURI, clientId, userName and password cannot be null or empty");
        }

        try
        {
            this.mqttAsyncClient = new MqttAsyncClient(serverURI, clientId, new MemoryPersistence());
            this.mqttAsyncClient.setManualAcks(true);
        }
        catch (MqttException e)
        {
            throw PahoExceptionTranslator.convertToMqttException(e, "Unable to create the MQTT client");
        }

        this.connectionOptions = new MqttConnectOptions();
        this.connectionOptions.setKeepAliveInterval(keepAliveIntervalSeconds);
        this.connectionOptions.setCleanSession(true);
        this.connectionOptions.setMqttVersion(MQTT_VERSION);
        this.connectionOptions.setUserName(userName);
        this.connectionOptions.setPassword(password.toCharArray());
        this.connectionOptions.setMaxInflight(MAX_IN_FLIGHT_COUNT);
        this.connectionOptions.setAutomaticReconnect(false);
    }

    MqttConnection(MqttAsyncClient mqttAsyncClient, MqttConnectOptions connectionOptions)
    {
        this.mqttAsyncClient = mqttAsyncClient;
        this.connectionOptions = connectionOptions;
    }

    MqttAsyncClient getMqttAsyncClient()
    {
        return this.mqttAsyncClient;
    }

    void setMqttAsyncClient(MqttAsyncClient mqttAsyncClient)
    {
        this.mqttAsyncClient = mqttAsyncClient;
    }

    MqttConnectOptions getConnectionOptions()
    {
        return this.connectionOptions;
    }

    ConcurrentLinkedQueue<Pair<String, byte[]>> getAllReceivedMessages()
    {
        return this.allReceivedMessages;
    }

    Object getMqttLock()
    {
        return this.mqttLock;
    }

    void setMqttCallback(MqttCallback mqttCallback)
    {
        if (this.mqttAsyncClient != null)
        {
            this.mqttAsyncClient.setCallback(mqttCallback);
        }
    }

    boolean isConnected()
    {
        return this.mqttAsyncClient != null && this.mqttAsyncClient.isConnected();
    }

    IMqttToken disconnect() throws MqttException
    {
        return this.mqttAsyncClient == null ? null : this.mqttAsyncClient.disconnect();
    }

    void close() throws MqttException
    {
        if (this.mqttAsyncClient != null)
        {
            this.mqttAsyncClient.close();
        }
    }

    /**
     * Acknowledges a message that was received with manual acknowledgement.
     *
     * @param messageId the MQTT message id
     * @return true if the acknowledgement was handed to the client
     * @throws TransportException if the client failed to send the acknowledgement
     */
    boolean sendMessageAcknowledgement(int messageId) throws TransportException
    {
        if (this.mqttAsyncClient == null)
        {
            return false;
        }

        try
        {
            this.mqttAsyncClient.messageArrivedComplete(messageId, QOS);
            return true;
        }
        catch (MqttException e)
        {
            throw PahoExceptionTranslator.convertToMqttException(e, "Unable to acknowledge message " + messageId);
        }
    }
}
