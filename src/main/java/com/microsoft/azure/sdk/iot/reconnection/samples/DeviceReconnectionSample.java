// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.samples;

import com.google.gson.JsonObject;
import com.microsoft.azure.sdk.iot.reconnection.CancellationToken;
import com.microsoft.azure.sdk.iot.reconnection.IotHubMessageResult;
import com.microsoft.azure.sdk.iot.reconnection.Message;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.UnauthorizedException;
import com.microsoft.azure.sdk.iot.reconnection.lifecycle.ConnectionLifecycleManager;
import com.microsoft.azure.sdk.iot.reconnection.lifecycle.DeviceClientFactory;
import com.microsoft.azure.sdk.iot.reconnection.transport.ExponentialBackoffWithJitter;
import com.microsoft.azure.sdk.iot.reconnection.transport.RetryOperationHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Sends telemetry and receives cloud to device messages for as long as it runs, surviving network outages, token
 * expiry and rejected credentials. Stops after the configured running time, on Ctrl+C, or when the device can no
 * longer connect.
 */
public final class DeviceReconnectionSample
{
    private static final Logger log = LoggerFactory.getLogger(DeviceReconnectionSample.class);

    static final int TEMPERATURE_THRESHOLD = 30;
    private static final long SHUTDOWN_WAIT_SECONDS = 60;
    private static final long RECEIVER_STOP_WAIT_SECONDS = 10;

    private final ConnectionLifecycleManager lifecycleManager;
    private final Duration telemetryInterval;
    private final SampleParameters.MessageReceiveMode messageReceiveMode;
    private final Random random = new Random();

    DeviceReconnectionSample(ConnectionLifecycleManager lifecycleManager, Duration telemetryInterval)
    {
        this(lifecycleManager, telemetryInterval, SampleParameters.MessageReceiveMode.CALLBACK);
    }

    DeviceReconnectionSample(
            ConnectionLifecycleManager lifecycleManager,
            Duration telemetryInterval,
            SampleParameters.MessageReceiveMode messageReceiveMode)
    {
        this.lifecycleManager = lifecycleManager;
        this.telemetryInterval = telemetryInterval;
        this.messageReceiveMode = messageReceiveMode;
    }

    public static void main(String[] args)
    {
        SampleParameters parameters = SampleParameters.load();
        log.info("Supplied with {} connection string(s)", parameters.getConnectionStrings().size());

        Duration runningTime = parameters.getApplicationRunningTime();
        CancellationToken cancellationToken = runningTime == null
                ? CancellationToken.create()
                : CancellationToken.withTimeout(runningTime);

        // an unauthorized open is resolved by the connection status handler moving to the next credential
        ExponentialBackoffWithJitter retryPolicy = new ExponentialBackoffWithJitter(Collections.singleton(UnauthorizedException.class));

        ConnectionLifecycleManager lifecycleManager = new ConnectionLifecycleManager(
                parameters.getConnectionStrings(),
                new DeviceClientFactory(),
                retryPolicy,
                cancellationToken);

        CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() ->
        {
            log.info("Sample execution cancellation requested, will exit");
            cancellationToken.cancel();
            try
            {
                finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        }, "azure-iot-sdk-SampleShutdown"));

        log.info("Sample execution started, press Control+C to quit the sample");
        try
        {
            new DeviceReconnectionSample(lifecycleManager, parameters.getTelemetryInterval(), parameters.getMessageReceiveMode())
                    .run(cancellationToken);
        }
        finally
        {
            finished.countDown();
        }

        log.info("Sample execution finished");
    }

    /**
     * Initializes the client then sends telemetry, and polls for cloud to device messages if asked to, until the
     * token is cancelled. Closes the lifecycle manager on the way out.
     *
     * @param cancellationToken the token that stops the sample
     */
    void run(CancellationToken cancellationToken)
    {
        RetryOperationHelper retryOperationHelper = this.lifecycleManager.getRetryOperationHelper();
        if (this.messageReceiveMode == SampleParameters.MessageReceiveMode.CALLBACK)
        {
            this.lifecycleManager.setMessageCallback(DeviceReconnectionSample::onC2dMessageReceived, null);
        }

        ExecutorService receiver = null;
        try
        {
            // the gate inside makes each attempt a single initialization, the open itself is idempotent
            retryOperationHelper.retryTransientExceptions(
                    "InitializeAndSetupClient",
                    () -> this.lifecycleManager.initializeAndSetupClient(cancellationToken),
                    () -> true,
                    cancellationToken);

            if (this.messageReceiveMode == SampleParameters.MessageReceiveMode.POLLING)
            {
                receiver = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "azure-iot-sdk-SampleReceiver"));
                receiver.submit(() -> this.receiveMessages(cancellationToken));
            }

            this.sendMessages(cancellationToken);
        }
        catch (CancellationException e)
        {
            log.info("Sample execution cancelled");
        }
        catch (TransportException e)
        {
            log.error("Unrecoverable exception caught, user action is required, so exiting", e);
            cancellationToken.cancel();
        }
        finally
        {
            if (receiver != null)
            {
                stopReceiver(receiver);
            }

            try
            {
                this.lifecycleManager.close();
            }
            catch (TransportException e)
            {
                log.warn("Failed to close the client", e);
            }
        }
    }

    private void sendMessages(CancellationToken cancellationToken) throws TransportException
    {
        RetryOperationHelper retryOperationHelper = this.lifecycleManager.getRetryOperationHelper();
        int messageCount = 0;

        while (!cancellationToken.isCancellationRequested())
        {
            if (this.lifecycleManager.isConnected())
            {
                int messageId = ++messageCount;
                log.info("Device sending telemetry message {} to IoT hub", messageId);

                Message message = prepareTelemetryMessage(messageId, 20 + this.random.nextInt(15), 60 + this.random.nextInt(20));
                retryOperationHelper.retryTransientExceptions(
                        "SendTelemetryMessage_" + messageId,
                        () -> this.lifecycleManager.getClient().sendEvent(message),
                        this.lifecycleManager::isConnected,
                        cancellationToken);

                log.info("Device sent telemetry message {} to IoT hub", messageId);
            }

            cancellationToken.delay(this.telemetryInterval.toMillis());
        }
    }

    private void receiveMessages(CancellationToken cancellationToken)
    {
        RetryOperationHelper retryOperationHelper = this.lifecycleManager.getRetryOperationHelper();
        try
        {
            while (!cancellationToken.isCancellationRequested())
            {
                if (!this.lifecycleManager.isConnected())
                {
                    cancellationToken.delay(this.telemetryInterval.toMillis());
                    continue;
                }

                log.info("Device waiting for C2D messages from the hub for {} milliseconds", this.telemetryInterval.toMillis());
                retryOperationHelper.retryTransientExceptions(
                        "ReceiveC2dMessage",
                        this::receiveMessage,
                        this.lifecycleManager::isConnected,
                        cancellationToken);
            }
        }
        catch (CancellationException e)
        {
            log.debug("Stopped receiving C2D messages");
        }
        catch (TransportException e)
        {
            log.error("Unrecoverable exception caught while receiving C2D messages, so exiting", e);
            cancellationToken.cancel();
        }
    }

    private void receiveMessage() throws TransportException
    {
        Message message;
        try
        {
            message = this.lifecycleManager.getClient().receive(this.telemetryInterval.toMillis());
        }
        catch (IllegalStateException e)
        {
            // the client was replaced while waiting
            throw TransportException.retryable("The client was closed while receiving", e);
        }

        if (message == null)
        {
            log.debug("No message received");
            return;
        }

        // buffered messages are completed by the transport when they arrive
        log.info("Received message [{}] with properties {}", message.getBodyAsString(), message.getProperties());
    }

    private static void stopReceiver(ExecutorService receiver)
    {
        receiver.shutdownNow();
        try
        {
            if (!receiver.awaitTermination(RECEIVER_STOP_WAIT_SECONDS, TimeUnit.SECONDS))
            {
                log.warn("The C2D message receiver did not stop in time");
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    static Message prepareTelemetryMessage(int messageId, int temperature, int humidity)
    {
        JsonObject payload = new JsonObject();
        payload.addProperty("temperature", temperature);
        payload.addProperty("humidity", humidity);

        Message message = new Message(payload.toString());
        message.setMessageId(String.valueOf(messageId));
        message.setContentType("application/json");
        message.setContentEncoding(Message.DEFAULT_IOTHUB_MESSAGE_CHARSET.name());
        message.setProperty("temperatureAlert", temperature > TEMPERATURE_THRESHOLD ? "true" : "false");
        return message;
    }

    static IotHubMessageResult onC2dMessageReceived(Message message, Object callbackContext)
    {
        log.info("Received message [{}] with properties {}", message.getBodyAsString(), message.getProperties());
        return IotHubMessageResult.COMPLETE;
    }
}
