// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

import com.microsoft.azure.sdk.iot.reconnection.auth.IotHubSasToken;
import com.microsoft.azure.sdk.iot.reconnection.transport.ExponentialBackoffWithJitter;
import com.microsoft.azure.sdk.iot.reconnection.transport.RetryPolicy;

/**
 * Configuration settings for an IoT Hub client. Validates all user-defined
 * settings.
 */
public final class DeviceClientConfig
{
    public static final long DEFAULT_OPERATION_TIMEOUT_MILLIS = 60 * 1000;
    public static final int DEFAULT_KEEP_ALIVE_INTERVAL_SECONDS = 230;
    public static final long DEFAULT_SAS_TOKEN_TIME_TO_LIVE_SECONDS = 60 * 60;

    private static final String SSL_PREFIX = "ssl://";
    private static final String SSL_PORT_SUFFIX = ":8883";
    private static final String API_VERSION = "?api-version=2021-04-12";

    private final IotHubConnectionString connectionString;
    private RetryPolicy retryPolicy = new ExponentialBackoffWithJitter();
    private long operationTimeoutMillis = DEFAULT_OPERATION_TIMEOUT_MILLIS;
    private int keepAliveIntervalSeconds = DEFAULT_KEEP_ALIVE_INTERVAL_SECONDS;
    private long sasTokenTimeToLiveSeconds = DEFAULT_SAS_TOKEN_TIME_TO_LIVE_SECONDS;

    /**
     * The callback to be invoked if a message is received.
     */
    private MessageCallback defaultDeviceTelemetryMessageCallback;
    /** The context to be passed in to the message callback. */
    private Object defaultDeviceTelemetryMessageContext;

    public DeviceClientConfig(IotHubConnectionString connectionString) throws IllegalArgumentException
    {
        if (connectionString == null)
        {
            throw new IllegalArgumentException("connectionString cannot be null");
        }

        this.connectionString = connectionString;
    }

    public IotHubConnectionString getConnectionString()
    {
        return this.connectionString;
    }

    public String getHostUrl()
    {
        return SSL_PREFIX + this.connectionString.getHostName() + SSL_PORT_SUFFIX;
    }

    public String getDeviceId()
    {
        return this.connectionString.getDeviceId();
    }

    public String getModuleId()
    {
        return this.connectionString.getModuleId();
    }

    /**
     * @return the MQTT client id, {@code deviceId} or {@code deviceId/moduleId}
     */
    public String getClientId()
    {
        String moduleId = this.connectionString.getModuleId();
        return moduleId == null ? this.getDeviceId() : this.getDeviceId() + "/" + moduleId;
    }

    public String getUsername()
    {
        return this.connectionString.getHostName() + "/" + this.getClientId() + "/" + API_VERSION;
    }

    /**
     * @return a SAS token valid for the configured time to live, starting now
     */
    public String getPassword()
    {
        return new IotHubSasToken(this.connectionString, this.sasTokenTimeToLiveSeconds).getSasToken();
    }

    public void setMessageCallback(MessageCallback callback, Object context)
    {
        this.defaultDeviceTelemetryMessageCallback = callback;
        this.defaultDeviceTelemetryMessageContext = context;
    }

    public MessageCallback getDeviceTelemetryMessageCallback()
    {
        return this.defaultDeviceTelemetryMessageCallback;
    }

    public Object getDeviceTelemetryMessageContext()
    {
        return this.defaultDeviceTelemetryMessageContext;
    }

    /**
     * Setter for the policy the transport uses to reconnect after losing its connection.
     *
     * @param retryPolicy The types of retry policy to be used
     * @throws IllegalArgumentException if retry policy is null
     */
    public void setRetryPolicy(RetryPolicy retryPolicy) throws IllegalArgumentException
    {
        if (retryPolicy == null)
        {
            throw new IllegalArgumentException("Retry Policy cannot be null.");
        }

        this.retryPolicy = retryPolicy;
    }

    public RetryPolicy getRetryPolicy()
    {
        return this.retryPolicy;
    }

    /**
     * @return how long to wait for the service to acknowledge a request, in milliseconds
     */
    public long getOperationTimeoutMillis()
    {
        return this.operationTimeoutMillis;
    }

    public void setOperationTimeoutMillis(long operationTimeoutMillis)
    {
        if (operationTimeoutMillis <= 0)
        {
            throw new IllegalArgumentException("Operation timeout must be positive");
        }

        this.operationTimeoutMillis = operationTimeoutMillis;
    }

    public int getKeepAliveIntervalSeconds()
    {
        return this.keepAliveIntervalSeconds;
    }

    public void setKeepAliveIntervalSeconds(int keepAliveIntervalSeconds)
    {
        if (keepAliveIntervalSeconds <= 0)
        {
            throw new IllegalArgumentException("Keep alive interval must be positive");
        }

        this.keepAliveIntervalSeconds = keepAliveIntervalSeconds;
    }

    public long getSasTokenTimeToLiveSeconds()
    {
        return this.sasTokenTimeToLiveSeconds;
    }

    public void setSasTokenTimeToLiveSeconds(long sasTokenTimeToLiveSeconds)
    {
        if (sasTokenTimeToLiveSeconds <= 0)
        {
            throw new IllegalArgumentException("SAS token time to live must be positive");
        }

        this.sasTokenTimeToLiveSeconds = sasTokenTimeToLiveSeconds;
    }
}
