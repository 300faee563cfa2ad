// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport.mqtt;

import com.microsoft.azure.sdk.iot.reconnection.DeviceClientConfig;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionString;
import com.microsoft.azure.sdk.iot.reconnection.IotHubMessageResult;
import com.microsoft.azure.sdk.iot.reconnection.Message;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.UnauthorizedException;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubListener;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubTransportMessage;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class MqttIotHubConnectionTest
{
    private static final String CONNECTION_STRING = "HostName=test.azure-devices.net;DeviceId=device1;SharedAccessKey=dGVzdGtleQ==";
    private static final String DEVICEBOUND_TOPIC = "devices/device1/messages/devicebound/";

    private MqttAsyncClient mqttAsyncClient;
    private MqttConnectOptions connectOptions;
    private IotHubListener listener;
    private MqttIotHubConnection connection;

    @Before
    public void setUp() throws Exception
    {
        this.mqttAsyncClient = mock(MqttAsyncClient.class);
        this.connectOptions = new MqttConnectOptions();
        this.listener = mock(IotHubListener.class);

        when(this.mqttAsyncClient.isConnected()).thenReturn(true);
        when(this.mqttAsyncClient.getPendingDeliveryTokens()).thenReturn(new IMqttDeliveryToken[0]);
        when(this.mqttAsyncClient.subscribe(anyString(), anyInt())).thenReturn(mock(IMqttToken.class));
        when(this.mqttAsyncClient.connect(any(MqttConnectOptions.class))).thenReturn(mock(IMqttToken.class));
        when(this.mqttAsyncClient.publish(anyString(), any(MqttMessage.class))).thenReturn(mock(IMqttDeliveryToken.class));

        DeviceClientConfig config = new DeviceClientConfig(IotHubConnectionString.parse(CONNECTION_STRING));
        this.connection = new MqttIotHubConnection(config)
        {
            @Override
            MqttConnection createMqttConnection()
            {
                return new MqttConnection(MqttIotHubConnectionTest.this.mqttAsyncClient, MqttIotHubConnectionTest.this.connectOptions);
            }
        };
    }

    private MqttCallback openAndCaptureCallback() throws TransportException
    {
        this.connection.setListener(this.listener);
        this.connection.open();

        ArgumentCaptor<MqttCallback> callback = ArgumentCaptor.forClass(MqttCallback.class);
        verify(this.mqttAsyncClient).setCallback(callback.capture());
        return callback.getValue();
    }

    private static MqttMessage mqttMessage(int id, String payload)
    {
        MqttMessage message = new MqttMessage(payload.getBytes(StandardCharsets.UTF_8));
        message.setId(id);
        return message;
    }

    @Test(expected = IllegalStateException.class)
    public void openWithoutListenerIsRejected() throws TransportException
    {
        this.connection.open();
    }

    @Test
    public void openSubscribesAndNotifiesTheListener() throws Exception
    {
        this.connection.setListener(this.listener);
        this.connection.open();

        assertNotNull(this.connection.getConnectionId());
        verify(this.mqttAsyncClient).subscribe(DEVICEBOUND_TOPIC + "#", 1);
        verify(this.mqttAsyncClient).subscribe("$iothub/twin/res/#", 1);
        verify(this.listener).onConnectionEstablished(this.connection.getConnectionId());
    }

    @Test
    public void openSendsConnectWhenTheClientIsNotConnected() throws Exception
    {
        when(this.mqttAsyncClient.isConnected()).thenReturn(false, true);
        this.connection.setListener(this.listener);

        this.connection.open();

        verify(this.mqttAsyncClient).connect(this.connectOptions);
    }

    @Test
    public void rejectedConnectIsReportedAsUnauthorized() throws Exception
    {
        when(this.mqttAsyncClient.isConnected()).thenReturn(false);
        when(this.mqttAsyncClient.connect(any(MqttConnectOptions.class))).thenThrow(new MqttException(MqttException.REASON_CODE_NOT_AUTHORIZED));
        this.connection.setListener(this.listener);

        try
        {
            this.connection.open();
            fail("expected an UnauthorizedException");
        }
        catch (UnauthorizedException e)
        {
            assertFalse(e.isRetryable());
        }

        verify(this.listener, never()).onConnectionEstablished(anyString());
    }

    @Test
    public void everyOpenStartsANewConnectionId() throws Exception
    {
        this.connection.setListener(this.listener);
        this.connection.open();
        String firstConnectionId = this.connection.getConnectionId();
        this.connection.close();

        this.connection.open();

        assertFalse(firstConnectionId.equals(this.connection.getConnectionId()));
    }

    @Test
    public void sendingBeforeOpenIsRetryable()
    {
        try
        {
            this.connection.sendMessage(new Message("hello"));
            fail("expected a TransportException");
        }
        catch (TransportException e)
        {
            assertTrue(e.isRetryable());
        }
    }

    @Test
    public void sendPublishesOnTheEventsTopic() throws Exception
    {
        this.openAndCaptureCallback();

        this.connection.sendMessage(new Message("hello"));

        ArgumentCaptor<MqttMessage> published = ArgumentCaptor.forClass(MqttMessage.class);
        verify(this.mqttAsyncClient).publish(eq("devices/device1/messages/events/"), published.capture());
        assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), published.getValue().getPayload());
        assertEquals(1, published.getValue().getQos());
    }

    @Test
    public void abandonedMessageIsNotAcknowledged() throws Exception
    {
        this.openAndCaptureCallback();

        boolean acknowledged = this.connection.sendMessageResult(new IotHubTransportMessage(new byte[0], DEVICEBOUND_TOPIC, 12), IotHubMessageResult.ABANDON);

        assertFalse(acknowledged);
        verify(this.mqttAsyncClient, never()).messageArrivedComplete(anyInt(), anyInt());
    }

    @Test
    public void completedMessageIsAcknowledged() throws Exception
    {
        this.openAndCaptureCallback();

        boolean acknowledged = this.connection.sendMessageResult(new IotHubTransportMessage(new byte[0], DEVICEBOUND_TOPIC, 12), IotHubMessageResult.COMPLETE);

        assertTrue(acknowledged);
        verify(this.mqttAsyncClient).messageArrivedComplete(12, 1);
    }

    @Test
    public void rejectedMessageIsAcknowledged() throws Exception
    {
        this.openAndCaptureCallback();

        assertTrue(this.connection.sendMessageResult(new IotHubTransportMessage(new byte[0], DEVICEBOUND_TOPIC, 13), IotHubMessageResult.REJECT));

        verify(this.mqttAsyncClient).messageArrivedComplete(13, 1);
    }

    @Test
    public void cloudToDeviceMessageIsHandedToTheListener() throws Exception
    {
        MqttCallback callback = this.openAndCaptureCallback();

        callback.messageArrived(DEVICEBOUND_TOPIC + "%24.mid=abc", mqttMessage(5, "ping"));

        ArgumentCaptor<IotHubTransportMessage> received = ArgumentCaptor.forClass(IotHubTransportMessage.class);
        verify(this.listener).onMessageReceived(received.capture(), isNull());
        assertEquals(5, received.getValue().getProtocolMessageId());
        assertEquals("ping", received.getValue().getBodyAsString());
        verify(this.mqttAsyncClient, never()).messageArrivedComplete(anyInt(), anyInt());
    }

    @Test
    public void twinMessageIsAcknowledgedAndNotHandedToTheListener() throws Exception
    {
        MqttCallback callback = this.openAndCaptureCallback();

        callback.messageArrived("$iothub/twin/res/200/?$rid=unknown", mqttMessage(6, "{}"));

        verify(this.mqttAsyncClient).messageArrivedComplete(6, 1);
        verify(this.listener, never()).onMessageReceived(any(), any());
    }

    @Test
    public void connectionLossIsReportedWithTheConnectionId() throws Exception
    {
        MqttCallback callback = this.openAndCaptureCallback();
        String connectionId = this.connection.getConnectionId();

        callback.connectionLost(new MqttException(MqttException.REASON_CODE_CONNECTION_LOST));

        verify(this.listener, timeout(5000)).onConnectionLost(
                argThat(e -> e instanceof TransportException && ((TransportException) e).isRetryable()),
                eq(connectionId));
    }

    @Test
    public void closeDisconnectsTheClient() throws Exception
    {
        this.openAndCaptureCallback();

        this.connection.close();

        verify(this.mqttAsyncClient).disconnect();
        verify(this.mqttAsyncClient).close();

        try
        {
            this.connection.sendMessage(new Message("hello"));
            fail("expected a TransportException");
        }
        catch (TransportException e)
        {
            assertTrue(e.isRetryable());
        }
    }
}
