// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.samples;

import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Settings of the reconnection sample. Read from {@value #PROPERTIES_RESOURCE} on the classpath; every setting can be
 * overridden by an environment variable.
 */
public final class SampleParameters
{
    static final String PROPERTIES_RESOURCE = "device-reconnection-sample.properties";

    static final String CONNECTION_STRINGS_PROPERTY = "iothub.device.connection.strings";
    static final String RUNNING_TIME_PROPERTY = "application.running.time.seconds";
    static final String TELEMETRY_INTERVAL_PROPERTY = "telemetry.interval.seconds";
    static final String RECEIVE_MODE_PROPERTY = "c2d.receive.mode";

    static final String CONNECTION_STRINGS_ENV = "IOTHUB_DEVICE_CONNECTION_STRINGS";
    static final String RUNNING_TIME_ENV = "APPLICATION_RUNNING_TIME_SECONDS";
    static final String TELEMETRY_INTERVAL_ENV = "TELEMETRY_INTERVAL_SECONDS";
    static final String RECEIVE_MODE_ENV = "C2D_RECEIVE_MODE";

    private static final long DEFAULT_TELEMETRY_INTERVAL_SECONDS = 5;

    /**
     * How the sample gets cloud to device messages.
     */
    public enum MessageReceiveMode
    {
        /** Messages are pushed to a message callback. */
        CALLBACK,

        /** Messages are polled for with a receive call. */
        POLLING
    }

    private final List<String> connectionStrings;
    private final Duration applicationRunningTime;
    private final Duration telemetryInterval;
    private final MessageReceiveMode messageReceiveMode;

    private SampleParameters(
            List<String> connectionStrings,
            Duration applicationRunningTime,
            Duration telemetryInterval,
            MessageReceiveMode messageReceiveMode)
    {
        this.connectionStrings = connectionStrings;
        this.applicationRunningTime = applicationRunningTime;
        this.telemetryInterval = telemetryInterval;
        this.messageReceiveMode = messageReceiveMode;
    }

    /**
     * @return the parameters from the classpath properties and the process environment
     */
    public static SampleParameters load()
    {
        return load(loadProperties(), System.getenv());
    }

    static SampleParameters load(Properties properties, Map<String, String> environment)
    {
        String connectionStrings = setting(properties, CONNECTION_STRINGS_PROPERTY, environment, CONNECTION_STRINGS_ENV);
        List<String> parsedConnectionStrings = new ArrayList<>();
        for (String connectionString : StringUtils.split(StringUtils.defaultString(connectionStrings), ','))
        {
            if (StringUtils.isNotBlank(connectionString))
            {
                parsedConnectionStrings.add(connectionString.trim());
            }
        }

        if (parsedConnectionStrings.isEmpty())
        {
            throw new IllegalArgumentException("At least one device connection string is required, set "
                    + CONNECTION_STRINGS_ENV + " to a comma separated list of connection strings");
        }

        long runningTimeSeconds = parseSeconds(setting(properties, RUNNING_TIME_PROPERTY, environment, RUNNING_TIME_ENV), RUNNING_TIME_ENV, 0);
        long telemetryIntervalSeconds = parseSeconds(
                setting(properties, TELEMETRY_INTERVAL_PROPERTY, environment, TELEMETRY_INTERVAL_ENV),
                TELEMETRY_INTERVAL_ENV,
                DEFAULT_TELEMETRY_INTERVAL_SECONDS);

        if (telemetryIntervalSeconds <= 0)
        {
            throw new IllegalArgumentException(TELEMETRY_INTERVAL_ENV + " must be greater than 0");
        }

        return new SampleParameters(
                Collections.unmodifiableList(parsedConnectionStrings),
                runningTimeSeconds > 0 ? Duration.ofSeconds(runningTimeSeconds) : null,
                Duration.ofSeconds(telemetryIntervalSeconds),
                parseReceiveMode(setting(properties, RECEIVE_MODE_PROPERTY, environment, RECEIVE_MODE_ENV)));
    }

    private static MessageReceiveMode parseReceiveMode(String value)
    {
        if (StringUtils.isBlank(value))
        {
            return MessageReceiveMode.CALLBACK;
        }

        for (MessageReceiveMode mode : MessageReceiveMode.values())
        {
            if (mode.name().equalsIgnoreCase(value.trim()))
            {
                return mode;
            }
        }

        throw new IllegalArgumentException(RECEIVE_MODE_ENV + " must be callback or polling, was " + value);
    }

    private static Properties loadProperties()
    {
        Properties properties = new Properties();
        try (InputStream stream = SampleParameters.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE))
        {
            if (stream != null)
            {
                properties.load(stream);
            }
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Failed to read " + PROPERTIES_RESOURCE, e);
        }

        return properties;
    }

    private static String setting(Properties properties, String propertyName, Map<String, String> environment, String environmentName)
    {
        String value = environment.get(environmentName);
        if (StringUtils.isNotBlank(value))
        {
            return value;
        }

        return properties.getProperty(propertyName);
    }

    private static long parseSeconds(String value, String name, long defaultValue)
    {
        if (StringUtils.isBlank(value))
        {
            return defaultValue;
        }

        try
        {
            return Long.parseLong(value.trim());
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException(name + " must be a number of seconds, was " + value, e);
        }
    }

    public List<String> getConnectionStrings()
    {
        return this.connectionStrings;
    }

    /**
     * @return how long the sample runs for, or null if it runs until stopped
     */
    public Duration getApplicationRunningTime()
    {
        return this.applicationRunningTime;
    }

    public Duration getTelemetryInterval()
    {
        return this.telemetryInterval;
    }

    public MessageReceiveMode getMessageReceiveMode()
    {
        return this.messageReceiveMode;
    }
}
