// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport.mqtt;

import com.microsoft.azure.sdk.iot.reconnection.Message;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.UnauthorizedException;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubListener;
import com.microsoft.azure.sdk.iot.reconnection.transport.IotHubTransportMessage;
import com.microsoft.azure.sdk.iot.reconnection.twin.DesiredProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.ReportedProperties;
import com.microsoft.azure.sdk.iot.reconnection.twin.TwinProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Device twin requests and desired property notifications over MQTT. Requests are correlated with their responses
 * through a request id.
 */
public class MqttTwin extends Mqtt
{
    private static final Logger log = LoggerFactory.getLogger(MqttTwin.class);

    private static final String RESPONSE_TOPIC_PREFIX = "$iothub/twin/res/";
    private static final String RESPONSE_TOPIC = RESPONSE_TOPIC_PREFIX + "#";
    private static final String GET_TOPIC = "$iothub/twin/GET/?$rid=";
    private static final String PATCH_REPORTED_TOPIC = "$iothub/twin/PATCH/properties/reported/?$rid=";
    private static final String DESIRED_TOPIC_PREFIX = "$iothub/twin/PATCH/properties/desired/";
    private static final String DESIRED_TOPIC = DESIRED_TOPIC_PREFIX + "#";

    // $iothub/twin/res/{status}/?$rid={request id}[&$version={version}]
    private static final Pattern RESPONSE_TOPIC_PATTERN = Pattern.compile("^\\$iothub/twin/res/(\\d+)/\\?\\$rid=([^&]+)");

    private static final int STATUS_OK = 200;
    private static final int STATUS_NO_CONTENT = 204;
    private static final int STATUS_UNAUTHORIZED = 401;
    private static final int STATUS_THROTTLED = 429;
    private static final int STATUS_SERVER_ERROR = 500;

    private final IotHubListener listener;
    private final long operationTimeoutMillis;
    private final Map<String, CompletableFuture<TwinResponse>> pendingRequests = new ConcurrentHashMap<>();

    static final class TwinResponse
    {
        final int status;
        final byte[] body;

        TwinResponse(int status, byte[] body)
        {
            this.status = status;
            this.body = body;
        }
    }

    public MqttTwin(MqttConnection mqttConnection, IotHubListener listener, String connectionId, long operationTimeoutMillis)
    {
        super(mqttConnection, listener, null, connectionId);
        this.listener = listener;
        this.operationTimeoutMillis = operationTimeoutMillis;
    }

    /**
     * Subscribes to twin responses. Must be called on a connected client.
     */
    public void start() throws TransportException
    {
        this.subscribe(RESPONSE_TOPIC);
    }

    public void stop()
    {
        for (CompletableFuture<TwinResponse> pendingRequest : this.pendingRequests.values())
        {
            pendingRequest.completeExceptionally(TransportException.retryable("The connection was closed before the twin request completed", null));
        }

        this.pendingRequests.clear();
    }

    public void subscribeToDesiredProperties() throws TransportException
    {
        this.subscribe(DESIRED_TOPIC);
    }

    public TwinProperties getTwin() throws TransportException
    {
        TwinResponse response = this.sendRequest(GET_TOPIC, new byte[0]);
        if (response.status != STATUS_OK)
        {
            throw statusToException(response.status, "Get twin");
        }

        try
        {
            return TwinProperties.fromJson(new String(response.body, Message.DEFAULT_IOTHUB_MESSAGE_CHARSET));
        }
        catch (IllegalArgumentException e)
        {
            throw new TransportException("The service returned a malformed twin", e);
        }
    }

    public void updateReportedProperties(ReportedProperties reportedProperties) throws TransportException
    {
        TwinResponse response = this.sendRequest(PATCH_REPORTED_TOPIC, reportedProperties.toJson().getBytes(Message.DEFAULT_IOTHUB_MESSAGE_CHARSET));
        if (response.status != STATUS_OK && response.status != STATUS_NO_CONTENT)
        {
            throw statusToException(response.status, "Update reported properties");
        }
    }

    /**
     * Completes the pending request a twin response belongs to, or delivers a desired properties patch.
     *
     * @param message a message that arrived on one of the twin topics
     */
    void handleTwinMessage(IotHubTransportMessage message)
    {
        String topic = message.getTopic();
        if (topic.startsWith(DESIRED_TOPIC_PREFIX))
        {
            this.handleDesiredPropertiesPatch(topic, message.getBytes());
            return;
        }

        Matcher matcher = RESPONSE_TOPIC_PATTERN.matcher(topic);
        if (!matcher.find())
        {
            log.warn("Ignoring twin message on unexpected topic {}", topic);
            return;
        }

        CompletableFuture<TwinResponse> pendingRequest = this.pendingRequests.remove(matcher.group(2));
        if (pendingRequest == null)
        {
            log.debug("Ignoring twin response for unknown request id {}", matcher.group(2));
            return;
        }

        pendingRequest.complete(new TwinResponse(Integer.parseInt(matcher.group(1)), message.getBytes()));
    }

    @Override
    protected boolean isTopicOwned(String topic)
    {
        return topic.startsWith(RESPONSE_TOPIC_PREFIX) || topic.startsWith(DESIRED_TOPIC_PREFIX);
    }

    private void handleDesiredPropertiesPatch(String topic, byte[] payload)
    {
        String json = new String(payload, Message.DEFAULT_IOTHUB_MESSAGE_CHARSET);
        DesiredProperties desiredProperties;
        try
        {
            desiredProperties = DesiredProperties.fromJson(json);
        }
        catch (IllegalArgumentException e)
        {
            log.warn("Ignoring malformed desired properties patch received on topic {}: {}", topic, json, e);
            return;
        }

        if (this.listener != null)
        {
            this.listener.onDesiredPropertiesUpdated(desiredProperties);
        }
    }

    private TwinResponse sendRequest(String topicPrefix, byte[] body) throws TransportException
    {
        String requestId = UUID.randomUUID().toString();
        CompletableFuture<TwinResponse> response = new CompletableFuture<>();
        this.pendingRequests.put(requestId, response);

        try
        {
            this.publish(topicPrefix + requestId, new Message(body));
            return response.get(this.operationTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e)
        {
            throw TransportException.retryable("Timed out waiting for the twin response to request " + requestId, e);
        }
        catch (ExecutionException e)
        {
            if (e.getCause() instanceof TransportException)
            {
                throw (TransportException) e.getCause();
            }

            throw new TransportException("Twin request " + requestId + " failed", e.getCause());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for the twin response to request " + requestId, e);
        }
        finally
        {
            this.pendingRequests.remove(requestId);
        }
    }

    private static TransportException statusToException(int status, String operation)
    {
        String message = operation + " failed with status " + status;
        if (status == STATUS_UNAUTHORIZED)
        {
            return new UnauthorizedException(message);
        }

        if (status == STATUS_THROTTLED || status >= STATUS_SERVER_ERROR)
        {
            return TransportException.retryable(message, null);
        }

        return new TransportException(message);
    }
}
