// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import com.microsoft.azure.sdk.iot.reconnection.ConnectionStatusInfo;
import com.microsoft.azure.sdk.iot.reconnection.DeviceClientConfig;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatus;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatusChangeReason;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionString;
import com.microsoft.azure.sdk.iot.reconnection.IotHubMessageResult;
import com.microsoft.azure.sdk.iot.reconnection.Message;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.DeviceDisabledException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.UnauthorizedException;
import com.microsoft.azure.sdk.iot.reconnection.twin.DesiredProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.ReportedProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.TwinProperties;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class IotHubTransportTest
{
    private static final String CONNECTION_STRING = "HostName=test.azure-devices.net;DeviceId=device1;SharedAccessKey=dGVzdGtleQ==";

    /**
     * Retries retryable failures up to a maximum, without waiting.
     */
    private static final class ImmediateRetryPolicy implements RetryPolicy
    {
        private final int maxRetries;

        ImmediateRetryPolicy(int maxRetries)
        {
            this.maxRetries = maxRetries;
        }

        @Override
        public RetryDecision getRetryDecision(int currentRetryCount, Throwable lastException)
        {
            boolean retryable = lastException instanceof TransportException && ((TransportException) lastException).isRetryable();
            return new RetryDecision(retryable && currentRetryCount <= this.maxRetries, 0);
        }
    }

    private static final class FakeConnection implements IotHubTransportConnection
    {
        private final List<TransportException> openFailures = new CopyOnWriteArrayList<>();
        private final List<IotHubMessageResult> sentResults = new CopyOnWriteArrayList<>();
        private final List<Message> sentMessages = new CopyOnWriteArrayList<>();
        private final CountDownLatch resultSent = new CountDownLatch(1);

        private IotHubListener listener;
        private TransportException failEveryOpenWith;
        private int openCount;
        private int closeCount;
        private int desiredSubscriptionCount;
        private int connectionCount;

        @Override
        public void open() throws TransportException
        {
            this.openCount++;
            this.connectionCount++;

            if (this.failEveryOpenWith != null)
            {
                throw this.failEveryOpenWith;
            }

            if (!this.openFailures.isEmpty())
            {
                throw this.openFailures.remove(0);
            }
        }

        @Override
        public void close()
        {
            this.closeCount++;
        }

        @Override
        public void setListener(IotHubListener listener)
        {
            this.listener = listener;
        }

        @Override
        public void sendMessage(Message message)
        {
            this.sentMessages.add(message);
        }

        @Override
        public boolean sendMessageResult(IotHubTransportMessage message, IotHubMessageResult result)
        {
            this.sentResults.add(result);
            this.resultSent.countDown();
            return result != IotHubMessageResult.ABANDON;
        }

        @Override
        public TwinProperties getTwin()
        {
            return new TwinProperties(new DesiredProperties(4, Collections.emptyMap()), 2);
        }

        @Override
        public void updateReportedProperties(ReportedProperties reportedProperties)
        {
        }

        @Override
        public void subscribeToDesiredProperties()
        {
            this.desiredSubscriptionCount++;
        }

        @Override
        public String getConnectionId()
        {
            return "connection-" + this.connectionCount;
        }
    }

    private final List<ConnectionStatusInfo> statusChanges = new CopyOnWriteArrayList<>();
    private FakeConnection connection;
    private IotHubTransport transport;

    @Before
    public void setUp()
    {
        DeviceClientConfig config = new DeviceClientConfig(IotHubConnectionString.parse(CONNECTION_STRING));
        config.setRetryPolicy(new ImmediateRetryPolicy(2));

        this.connection = new FakeConnection();
        this.transport = new IotHubTransport(config, this.connection);
        this.transport.registerConnectionStatusChangeCallback((info, context) -> this.statusChanges.add(info), null);
    }

    @After
    public void tearDown() throws TransportException
    {
        this.transport.close();
    }

    private ConnectionStatusInfo lastStatusChange()
    {
        return this.statusChanges.get(this.statusChanges.size() - 1);
    }

    private void assertLastStatus(IotHubConnectionStatus status, IotHubConnectionStatusChangeReason reason)
    {
        assertEquals(status, this.lastStatusChange().getStatus());
        assertEquals(reason, this.lastStatusChange().getChangeReason());
        assertEquals(status, this.transport.getConnectionStatusInfo().getStatus());
    }

    @Test
    public void openReportsConnected() throws TransportException
    {
        this.transport.open();

        assertEquals(1, this.statusChanges.size());
        assertLastStatus(IotHubConnectionStatus.CONNECTED, IotHubConnectionStatusChangeReason.CONNECTION_OK);
        assertSame(this.transport, this.connection.listener);
    }

    @Test
    public void openingAnOpenTransportDoesNothing() throws TransportException
    {
        this.transport.open();
        this.transport.open();

        assertEquals(1, this.connection.openCount);
        assertEquals(1, this.statusChanges.size());
    }

    @Test
    public void rejectedCredentialOnOpenReportsBadCredential()
    {
        UnauthorizedException failure = new UnauthorizedException("bad key");
        this.connection.openFailures.add(failure);

        try
        {
            this.transport.open();
            fail("expected an UnauthorizedException");
        }
        catch (TransportException e)
        {
            assertSame(failure, e);
        }

        assertLastStatus(IotHubConnectionStatus.DISCONNECTED, IotHubConnectionStatusChangeReason.BAD_CREDENTIAL);
        assertSame(failure, this.lastStatusChange().getCause());
    }

    @Test
    public void transportCanBeOpenedAgainAfterAFailedOpen() throws TransportException
    {
        this.connection.openFailures.add(TransportException.retryable("no route to host", null));

        try
        {
            this.transport.open();
            fail("expected a TransportException");
        }
        catch (TransportException e)
        {
            assertLastStatus(IotHubConnectionStatus.DISCONNECTED, IotHubConnectionStatusChangeReason.NO_NETWORK);
        }

        this.transport.open();

        assertLastStatus(IotHubConnectionStatus.CONNECTED, IotHubConnectionStatusChangeReason.CONNECTION_OK);
    }

    @Test
    public void closeReportsDisabled() throws TransportException
    {
        this.transport.open();
        this.transport.close();

        assertEquals(1, this.connection.closeCount);
        assertLastStatus(IotHubConnectionStatus.DISABLED, IotHubConnectionStatusChangeReason.CLIENT_CLOSE);
    }

    @Test
    public void sendingBeforeOpenIsRetryable()
    {
        try
        {
            this.transport.sendMessage(new Message("hello"));
            fail("expected a TransportException");
        }
        catch (TransportException e)
        {
            assertTrue(e.isRetryable());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void sendingAfterCloseIsRejected() throws TransportException
    {
        this.transport.open();
        this.transport.close();

        this.transport.sendMessage(new Message("hello"));
    }

    @Test
    public void sendingWhileConnectedReachesTheConnection() throws TransportException
    {
        this.transport.open();
        Message message = new Message("hello");

        this.transport.sendMessage(message);

        assertEquals(Collections.singletonList(message), this.connection.sentMessages);
    }

    @Test
    public void lostConnectionIsReestablished() throws TransportException
    {
        this.transport.open();

        this.transport.onConnectionLost(TransportException.retryable("connection reset", null), this.connection.getConnectionId());

        assertEquals(3, this.statusChanges.size());
        assertEquals(IotHubConnectionStatus.DISCONNECTED_RETRYING, this.statusChanges.get(1).getStatus());
        assertEquals(IotHubConnectionStatusChangeReason.NO_NETWORK, this.statusChanges.get(1).getChangeReason());
        assertLastStatus(IotHubConnectionStatus.CONNECTED, IotHubConnectionStatusChangeReason.CONNECTION_OK);
        assertEquals(2, this.connection.openCount);
    }

    @Test
    public void desiredPropertiesAreSubscribedAgainAfterAReconnection() throws TransportException
    {
        this.transport.open();
        this.transport.subscribeToDesiredProperties((desired, context) -> { }, null);

        this.transport.onConnectionLost(TransportException.retryable("connection reset", null), this.connection.getConnectionId());

        assertEquals(2, this.connection.desiredSubscriptionCount);
    }

    @Test
    public void reconnectionGivesUpWhenRetriesExpire() throws TransportException
    {
        this.transport.open();
        this.connection.failEveryOpenWith = TransportException.retryable("no route to host", null);

        this.transport.onConnectionLost(TransportException.retryable("connection reset", null), this.connection.getConnectionId());

        assertLastStatus(IotHubConnectionStatus.DISCONNECTED, IotHubConnectionStatusChangeReason.RETRY_EXPIRED);
        // the first open plus one per allowed retry
        assertEquals(3, this.connection.openCount);
    }

    @Test
    public void reconnectionStopsAtATerminalFailure() throws TransportException
    {
        this.transport.open();
        this.connection.failEveryOpenWith = new UnauthorizedException("key revoked");

        this.transport.onConnectionLost(TransportException.retryable("connection reset", null), this.connection.getConnectionId());

        assertLastStatus(IotHubConnectionStatus.DISCONNECTED, IotHubConnectionStatusChangeReason.BAD_CREDENTIAL);
        assertEquals(2, this.connection.openCount);
    }

    @Test
    public void lossOfAnOutdatedConnectionIsIgnored() throws TransportException
    {
        this.transport.open();

        this.transport.onConnectionLost(TransportException.retryable("connection reset", null), "connection-0");

        assertEquals(1, this.statusChanges.size());
        assertEquals(IotHubConnectionStatus.CONNECTED, this.transport.getConnectionStatusInfo().getStatus());
    }

    @Test
    public void lossAfterCloseIsIgnored() throws TransportException
    {
        this.transport.open();
        this.transport.close();
        int statusChangeCount = this.statusChanges.size();

        this.transport.onConnectionLost(TransportException.retryable("connection reset", null), this.connection.getConnectionId());

        assertEquals(statusChangeCount, this.statusChanges.size());
        assertEquals(1, this.connection.openCount);
    }

    @Test
    public void failuresAreMappedToStatusChangeReasons()
    {
        assertEquals(IotHubConnectionStatusChangeReason.BAD_CREDENTIAL,
                IotHubTransport.exceptionToStatusChangeReason(new UnauthorizedException("unauthorized")));
        assertEquals(IotHubConnectionStatusChangeReason.DEVICE_DISABLED,
                IotHubTransport.exceptionToStatusChangeReason(new DeviceDisabledException("disabled", null)));
        assertEquals(IotHubConnectionStatusChangeReason.NO_NETWORK,
                IotHubTransport.exceptionToStatusChangeReason(TransportException.retryable("timeout", null)));
        assertEquals(IotHubConnectionStatusChangeReason.COMMUNICATION_ERROR,
                IotHubTransport.exceptionToStatusChangeReason(new TransportException("protocol error")));
        assertEquals(IotHubConnectionStatusChangeReason.COMMUNICATION_ERROR,
                IotHubTransport.exceptionToStatusChangeReason(new IOException("broken pipe")));
    }

    @Test
    public void messageWithoutCallbackIsBufferedAndCompleted() throws TransportException
    {
        this.transport.open();
        byte[] body = "ping".getBytes(StandardCharsets.UTF_8);

        this.transport.onMessageReceived(new IotHubTransportMessage(body, "devices/device1/messages/devicebound/", 7), null);

        Message received = this.transport.receive(1000);
        assertArrayEquals(body, received.getBytes());
        assertEquals(Collections.singletonList(IotHubMessageResult.COMPLETE), this.connection.sentResults);
        assertNull(this.transport.receive(10));
    }

    @Test
    public void messageCallbackResultIsSentToTheService() throws Exception
    {
        this.transport.open();
        CountDownLatch callbackCalled = new CountDownLatch(1);
        this.transport.setMessageCallback((message, context) ->
        {
            callbackCalled.countDown();
            return IotHubMessageResult.ABANDON;
        }, null);

        this.transport.onMessageReceived(new IotHubTransportMessage(new byte[0], "devices/device1/messages/devicebound/", 8), null);

        assertTrue(callbackCalled.await(5, TimeUnit.SECONDS));
        assertTrue(this.connection.resultSent.await(5, TimeUnit.SECONDS));
        assertEquals(Collections.singletonList(IotHubMessageResult.ABANDON), this.connection.sentResults);
    }

    @Test
    public void desiredPropertiesPatchIsDeliveredToTheCallback() throws Exception
    {
        this.transport.open();
        CountDownLatch delivered = new CountDownLatch(1);
        DesiredProperties patch = new DesiredProperties(5, Collections.emptyMap());
        this.transport.subscribeToDesiredProperties((desired, context) ->
        {
            if (desired == patch && "context".equals(context))
            {
                delivered.countDown();
            }
        }, "context");

        this.transport.onDesiredPropertiesUpdated(patch);

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertEquals(1, this.connection.desiredSubscriptionCount);
    }

    @Test
    public void twinIsReadFromTheConnection() throws TransportException
    {
        this.transport.open();

        assertEquals(4, this.transport.getTwin().getDesired().getVersion());
    }
}
