// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import com.microsoft.azure.sdk.iot.reconnection.CancellationToken;
import com.microsoft.azure.sdk.iot.reconnection.ConnectionStatusInfo;
import com.microsoft.azure.sdk.iot.reconnection.DeviceClientConfig;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatus;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatusChangeCallback;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatusChangeReason;
import com.microsoft.azure.sdk.iot.reconnection.IotHubMessageResult;
import com.microsoft.azure.sdk.iot.reconnection.Message;
import com.microsoft.azure.sdk.iot.reconnection.MessageCallback;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.DeviceDisabledException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.UnauthorizedException;
import com.microsoft.azure.sdk.iot.reconnection.transport.mqtt.MqttIotHubConnection;
import com.microsoft.azure.sdk.iot.reconnection.twin.DesiredProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.DesiredPropertyUpdateCallback;
import com.microsoft.azure.sdk.iot.reconnection.twin.ReportedProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.TwinProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * The connection state machine of a single client. Owns one protocol level connection, reports every change of
 * connection status to the registered callback, and reconnects on its own after losing an established connection,
 * for as long as the configured {@link RetryPolicy} allows.
 */
public class IotHubTransport implements IotHubListener
{
    private static final Logger log = LoggerFactory.getLogger(IotHubTransport.class);

    private final DeviceClientConfig config;
    private final IotHubTransportConnection iotHubTransportConnection;

    private final Object lifecycleLock = new Object();
    private final Object reconnectionLock = new Object();
    private final Object statusLock = new Object();

    /* Messages received from the IoT Hub while no message callback is set */
    private final BlockingQueue<IotHubTransportMessage> receivedMessagesQueue = new LinkedBlockingQueue<>();

    private volatile ConnectionStatusInfo connectionStatusInfo = ConnectionStatusInfo.initial();
    private int currentReconnectionAttempt;
    private long reconnectionAttemptStartTimeMillis;

    // cancelled when the current session ends, aborts a pending reconnection
    private volatile CancellationToken sessionToken = CancellationToken.create();
    private ExecutorService callbackExecutor;

    /*Connection Status change callback information */
    private IotHubConnectionStatusChangeCallback connectionStatusChangeCallback;
    private Object connectionStatusChangeCallbackContext;

    private volatile DesiredPropertyUpdateCallback desiredPropertyUpdateCallback;
    private volatile Object desiredPropertyUpdateCallbackContext;

    public IotHubTransport(DeviceClientConfig config) throws IllegalArgumentException
    {
        this(config, new MqttIotHubConnection(config));
    }

    public IotHubTransport(DeviceClientConfig config, IotHubTransportConnection iotHubTransportConnection) throws IllegalArgumentException
    {
        if (config == null || iotHubTransportConnection == null)
        {
            throw new IllegalArgumentException("config and connection cannot be null");
        }

        this.config = config;
        this.iotHubTransportConnection = iotHubTransportConnection;
    }

    /**
     * Establishes a communication channel with an IoT Hub. If a channel is already open, the function shall do
     * nothing. If opening fails, the connection status becomes DISCONNECTED with a reason derived from the failure.
     *
     * @throws TransportException if a communication channel cannot be established, or a reconnection is in progress
     */
    public void open() throws TransportException
    {
        synchronized (this.lifecycleLock)
        {
            IotHubConnectionStatus status = this.connectionStatusInfo.getStatus();
            if (status == IotHubConnectionStatus.CONNECTED)
            {
                return;
            }

            if (status == IotHubConnectionStatus.DISCONNECTED_RETRYING)
            {
                throw TransportException.retryable("Open cannot be called while transport is reconnecting", null);
            }

            this.sessionToken = CancellationToken.create();
            this.callbackExecutor = Executors.newSingleThreadExecutor();

            try
            {
                this.openConnection(this.sessionToken);
            }
            catch (TransportException e)
            {
                log.warn("Failed to open the connection to the IoT Hub", e);
                this.sessionToken.cancel();
                this.callbackExecutor.shutdown();
                this.updateStatus(IotHubConnectionStatus.DISCONNECTED, exceptionToStatusChangeReason(e), e);
                throw e;
            }

            log.info("Client connection opened successfully");
        }
    }

    /**
     * Closes the connection. The connection status becomes DISABLED with reason CLIENT_CLOSE, and a reconnection in
     * progress is abandoned. The transport can be opened again afterwards.
     *
     * @throws TransportException if an error occurs in closing the connection
     */
    public void close() throws TransportException
    {
        this.closeConnection(IotHubConnectionStatus.DISABLED, IotHubConnectionStatusChangeReason.CLIENT_CLOSE, null);
    }

    /**
     * Registers a callback to be executed whenever the connection status to the IoT Hub has changed.
     *
     * @param callback the callback to be called. Can be null if callbackContext is null
     * @param callbackContext a context to be passed to the callback. Can be {@code null}.
     */
    public void registerConnectionStatusChangeCallback(IotHubConnectionStatusChangeCallback callback, Object callbackContext)
    {
        if (callbackContext != null && callback == null)
        {
            throw new IllegalArgumentException("Callback cannot be null if callback context is not null");
        }

        synchronized (this.statusLock)
        {
            this.connectionStatusChangeCallback = callback;
            this.connectionStatusChangeCallbackContext = callbackContext;
        }
    }

    public ConnectionStatusInfo getConnectionStatusInfo()
    {
        return this.connectionStatusInfo;
    }

    public void setMessageCallback(MessageCallback callback, Object callbackContext)
    {
        if (callback == null && callbackContext != null)
        {
            throw new IllegalArgumentException("Cannot give non-null context for a null callback.");
        }

        this.config.setMessageCallback(callback, callbackContext);
    }

    /**
     * Sets the callback for desired property patches and, if connected, starts their delivery. Patches are delivered
     * again after every reconnection of this transport.
     *
     * @param callback the callback to be called
     * @param callbackContext a context to be passed to the callback. Can be {@code null}.
     * @throws TransportException if the subscription could not be made
     */
    public void subscribeToDesiredProperties(DesiredPropertyUpdateCallback callback, Object callbackContext) throws TransportException
    {
        if (callback == null)
        {
            throw new IllegalArgumentException("callback cannot be null");
        }

        this.desiredPropertyUpdateCallback = callback;
        this.desiredPropertyUpdateCallbackContext = callbackContext;

        this.requireConnected("subscribe to desired properties");
        this.iotHubTransportConnection.subscribeToDesiredProperties();
    }

    /**
     * Sends a telemetry message and waits for the service to acknowledge it.
     *
     * @param message the message to send
     * @throws TransportException if the message could not be sent. The exception is retryable if the transport is
     * not connected at the moment.
     * @throws IllegalStateException if the transport is closed
     */
    public void sendMessage(Message message) throws TransportException
    {
        if (message == null)
        {
            throw new IllegalArgumentException("message cannot be null");
        }

        this.requireConnected("send a message");
        log.debug("Sending message: {}", message);
        this.iotHubTransportConnection.sendMessage(message);
    }

    /**
     * Waits for a cloud to device message. Only messages that arrived while no message callback was set are returned.
     *
     * @param timeoutMillis how long to wait for a message
     * @return the received message, or null if none arrived within the timeout
     * @throws IllegalStateException if the transport is closed
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public Message receive(long timeoutMillis)
    {
        if (this.connectionStatusInfo.getStatus() == IotHubConnectionStatus.DISABLED)
        {
            throw new IllegalStateException("Cannot receive a message when the transport is closed.");
        }

        try
        {
            return this.receivedMessagesQueue.poll(timeoutMillis, TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            CancellationException cancellationException = new CancellationException("Interrupted while waiting for a message");
            cancellationException.initCause(e);
            throw cancellationException;
        }
    }

    public TwinProperties getTwin() throws TransportException
    {
        this.requireConnected("get the twin");
        return this.iotHubTransportConnection.getTwin();
    }

    public void updateReportedProperties(ReportedProperties reportedProperties) throws TransportException
    {
        if (reportedProperties == null)
        {
            throw new IllegalArgumentException("reportedProperties cannot be null");
        }

        this.requireConnected("update reported properties");
        this.iotHubTransportConnection.updateReportedProperties(reportedProperties);
    }

    @Override
    public void onMessageReceived(IotHubTransportMessage message, Throwable e)
    {
        if (message == null)
        {
            log.warn("Exception encountered while receiving messages from service", e);
            return;
        }

        final MessageCallback messageCallback = this.config.getDeviceTelemetryMessageCallback();
        final Object messageCallbackContext = this.config.getDeviceTelemetryMessageContext();

        if (messageCallback == null)
        {
            log.debug("Message was received from IotHub with no callback set, buffering it ({})", message);
            this.receivedMessagesQueue.add(message);
            this.acknowledgeReceivedMessage(message, IotHubMessageResult.COMPLETE);
            return;
        }

        this.executeCallback(() ->
        {
            log.debug("Executing callback for received message: {}", message);
            IotHubMessageResult result = messageCallback.execute(message, messageCallbackContext);
            this.acknowledgeReceivedMessage(message, result == null ? IotHubMessageResult.COMPLETE : result);
        });
    }

    @Override
    public void onDesiredPropertiesUpdated(DesiredProperties desiredProperties)
    {
        final DesiredPropertyUpdateCallback callback = this.desiredPropertyUpdateCallback;
        final Object callbackContext = this.desiredPropertyUpdateCallbackContext;
        if (callback == null)
        {
            log.debug("Desired properties patch received with no callback set, ignoring it ({})", desiredProperties);
            return;
        }

        this.executeCallback(() -> callback.onDesiredPropertiesUpdated(desiredProperties, callbackContext));
    }

    @Override
    public void onConnectionLost(Throwable e, String connectionId)
    {
        synchronized (this.reconnectionLock)
        {
            if (!connectionId.equals(this.iotHubTransportConnection.getConnectionId()))
            {
                //This connection status update is for a connection that is no longer tracked at this level, so it can be ignored.
                log.debug("OnConnectionLost was fired, but for an outdated connection. Ignoring...");
                return;
            }

            if (this.connectionStatusInfo.getStatus() != IotHubConnectionStatus.CONNECTED)
            {
                log.debug("OnConnectionLost was fired, but connection is already disconnected. Ignoring...");
                return;
            }

            if (e instanceof TransportException)
            {
                this.handleDisconnection((TransportException) e);
            }
            else
            {
                this.handleDisconnection(new TransportException(e));
            }
        }
    }

    @Override
    public void onConnectionEstablished(String connectionId)
    {
        if (connectionId.equals(this.iotHubTransportConnection.getConnectionId()))
        {
            log.info("The connection to the IoT Hub has been established");
            this.updateStatusIfSessionActive(this.sessionToken);
        }
    }

    /**
     * Maps a given throwable to an IotHubConnectionStatusChangeReason
     * @param e the throwable to map to an IotHubConnectionStatusChangeReason
     * @return the mapped IotHubConnectionStatusChangeReason
     */
    static IotHubConnectionStatusChangeReason exceptionToStatusChangeReason(Throwable e)
    {
        if (e instanceof UnauthorizedException)
        {
            log.debug("Mapping throwable to BAD_CREDENTIAL because it was an authorization exception: {}", e.toString());
            return IotHubConnectionStatusChangeReason.BAD_CREDENTIAL;
        }

        if (e instanceof DeviceDisabledException)
        {
            log.debug("Mapping throwable to DEVICE_DISABLED: {}", e.toString());
            return IotHubConnectionStatusChangeReason.DEVICE_DISABLED;
        }

        if (e instanceof TransportException && ((TransportException) e).isRetryable())
        {
            log.debug("Mapping throwable to NO_NETWORK because it was a retryable exception: {}", e.toString());
            return IotHubConnectionStatusChangeReason.NO_NETWORK;
        }

        log.debug("Mapping throwable to COMMUNICATION_ERROR because it could not be classified otherwise: {}", String.valueOf(e));
        return IotHubConnectionStatusChangeReason.COMMUNICATION_ERROR;
    }

    private void requireConnected(String operation) throws TransportException
    {
        IotHubConnectionStatus status = this.connectionStatusInfo.getStatus();
        if (status == IotHubConnectionStatus.DISABLED)
        {
            throw new IllegalStateException("Cannot " + operation + " when the transport is closed.");
        }

        if (status != IotHubConnectionStatus.CONNECTED)
        {
            throw TransportException.retryable("Cannot " + operation + " while the transport is " + status, null);
        }
    }

    private void acknowledgeReceivedMessage(IotHubTransportMessage message, IotHubMessageResult result)
    {
        try
        {
            log.debug("Sending {} acknowledgement for received cloud to device message: {}", result, message);
            this.iotHubTransportConnection.sendMessageResult(message, result);
        }
        catch (TransportException e)
        {
            // the service redelivers messages that were not acknowledged
            log.warn("Sending acknowledgement for received cloud to device message failed: {}", message, e);
        }
    }

    private void executeCallback(Runnable callback)
    {
        ExecutorService executor = this.callbackExecutor;
        if (executor == null)
        {
            log.warn("Dropping a callback, the transport has never been opened");
            return;
        }

        try
        {
            executor.execute(() ->
            {
                try
                {
                    callback.run();
                }
                catch (RuntimeException e)
                {
                    log.error("User callback threw an exception", e);
                }
            });
        }
        catch (RejectedExecutionException e)
        {
            log.warn("Dropping a callback, the transport is closed");
        }
    }

    /**
     * Sets this object as the listener of the connection, opens it and subscribes to desired properties if a callback
     * is set.
     * @throws TransportException if any exception is thrown while opening the connection
     */
    private void openConnection(CancellationToken session) throws TransportException
    {
        this.iotHubTransportConnection.setListener(this);
        this.iotHubTransportConnection.open();

        if (this.desiredPropertyUpdateCallback != null)
        {
            this.iotHubTransportConnection.subscribeToDesiredProperties();
        }

        this.updateStatusIfSessionActive(session);
    }

    private void closeConnection(IotHubConnectionStatus status, IotHubConnectionStatusChangeReason reason, Throwable cause) throws TransportException
    {
        synchronized (this.lifecycleLock)
        {
            this.sessionToken.cancel();

            try
            {
                this.iotHubTransportConnection.close();
            }
            finally
            {
                if (this.callbackExecutor != null)
                {
                    this.callbackExecutor.shutdown();
                }

                this.updateStatus(status, reason, cause);
            }

            log.info("Client connection closed with status {} and reason {}", status, reason);
        }
    }

    /**
     * Attempts to reconnect. By the end of this call, the state of this object shall be either CONNECTED or DISCONNECTED
     * @param transportException the exception that caused the disconnection
     */
    private void handleDisconnection(TransportException transportException)
    {
        log.info("Handling a disconnection event: {}", transportException.toString());

        this.updateStatus(IotHubConnectionStatus.DISCONNECTED_RETRYING, exceptionToStatusChangeReason(transportException), transportException);

        log.debug("Starting reconnection logic");
        this.reconnect(transportException, this.sessionToken);
    }

    /**
     * Attempts to close and then re-open the connection until connection reestablished, retry policy expires, a
     * terminal exception is encountered, or the session is closed.
     */
    private void reconnect(TransportException transportException, CancellationToken session)
    {
        if (this.reconnectionAttemptStartTimeMillis == 0)
        {
            this.reconnectionAttemptStartTimeMillis = System.currentTimeMillis();
        }

        RetryDecision retryDecision = null;
        while (this.connectionStatusInfo.getStatus() == IotHubConnectionStatus.DISCONNECTED_RETRYING
                && transportException != null)
        {
            this.currentReconnectionAttempt++;
            log.debug("Attempting reconnect attempt: {}", this.currentReconnectionAttempt);

            retryDecision = this.config.getRetryPolicy().getRetryDecision(this.currentReconnectionAttempt, transportException);
            if (!retryDecision.shouldRetry())
            {
                break;
            }

            try
            {
                session.delay(retryDecision.getDuration());
            }
            catch (CancellationException e)
            {
                log.debug("Reconnection was abandoned because the client was closed");
                return;
            }

            transportException = this.singleReconnectAttempt(session);
        }

        if (transportException == null || session.isCancellationRequested())
        {
            return;
        }

        IotHubConnectionStatusChangeReason reason;
        if (!transportException.isRetryable())
        {
            log.warn("Reconnection was abandoned due to encountering a non-retryable exception: {}", transportException.toString());
            reason = exceptionToStatusChangeReason(transportException);
        }
        else
        {
            log.warn("Reconnection was abandoned due to the retry policy after {} attempts", this.currentReconnectionAttempt);
            reason = IotHubConnectionStatusChangeReason.RETRY_EXPIRED;
        }

        try
        {
            this.closeConnection(IotHubConnectionStatus.DISCONNECTED, reason, transportException);
        }
        catch (TransportException ex)
        {
            log.warn("Encountered an exception while closing the connection, connection state is unknown", ex);
            this.updateStatus(IotHubConnectionStatus.DISCONNECTED, IotHubConnectionStatusChangeReason.COMMUNICATION_ERROR, transportException);
        }
    }

    /**
     * Attempts to close and then re-open the connection once
     * @return the exception encountered during closing or opening, or null if reconnection succeeded
     */
    private TransportException singleReconnectAttempt(CancellationToken session)
    {
        try
        {
            log.debug("Attempting to close and re-open the iot hub transport connection...");
            this.iotHubTransportConnection.close();
            this.openConnection(session);

            if (session.isCancellationRequested())
            {
                // the client was closed while this attempt was opening the connection
                this.iotHubTransportConnection.close();
            }
            else
            {
                log.info("Successfully closed and re-opened the iot hub transport connection");
            }
        }
        catch (TransportException newTransportException)
        {
            log.debug("Failed to close and re-open the iot hub transport connection, checking if another retry attempt should be made: {}", newTransportException.toString());
            return newTransportException;
        }

        return null;
    }

    private void updateStatusIfSessionActive(CancellationToken session)
    {
        synchronized (this.statusLock)
        {
            if (!session.isCancellationRequested())
            {
                this.updateStatus(IotHubConnectionStatus.CONNECTED, IotHubConnectionStatusChangeReason.CONNECTION_OK, null);
            }
        }
    }

    /**
     * If the status or its reason differs from the current one, saves the new status and notifies the registered
     * callback.
     * @param newConnectionStatus the new connection status
     * @param reason the reason for the new connection status
     * @param throwable the associated exception to the connection status change
     */
    private void updateStatus(IotHubConnectionStatus newConnectionStatus, IotHubConnectionStatusChangeReason reason, Throwable throwable)
    {
        synchronized (this.statusLock)
        {
            ConnectionStatusInfo current = this.connectionStatusInfo;
            if (current.getStatus() == newConnectionStatus && current.getChangeReason() == reason)
            {
                return;
            }

            log.info("Updating transport status to new status {} with reason {}", newConnectionStatus, reason);

            ConnectionStatusInfo statusInfo = new ConnectionStatusInfo(newConnectionStatus, reason, throwable);
            this.connectionStatusInfo = statusInfo;

            if (newConnectionStatus == IotHubConnectionStatus.CONNECTED)
            {
                if (this.reconnectionAttemptStartTimeMillis != 0)
                {
                    log.info("Reconnected after {} attempts in {} milliseconds", this.currentReconnectionAttempt, System.currentTimeMillis() - this.reconnectionAttemptStartTimeMillis);
                }

                this.currentReconnectionAttempt = 0;
                this.reconnectionAttemptStartTimeMillis = 0;
            }

            if (this.connectionStatusChangeCallback != null)
            {
                try
                {
                    this.connectionStatusChangeCallback.execute(statusInfo, this.connectionStatusChangeCallbackContext);
                }
                catch (RuntimeException e)
                {
                    log.error("Connection status change callback threw an exception", e);
                }
            }
        }
    }
}
