// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * A parsed device connection string of the form
 * {@code HostName=<host>;DeviceId=<device>;SharedAccessKey=<key>[;ModuleId=<module>]}.
 */
public final class IotHubConnectionString
{
    private static final String VALUE_PAIR_DELIMITER = ";";
    private static final String VALUE_PAIR_SEPARATOR = "=";

    private static final String HOSTNAME_ATTRIBUTE = "HostName";
    private static final String DEVICE_ID_ATTRIBUTE = "DeviceId";
    private static final String MODULE_ID_ATTRIBUTE = "ModuleId";
    private static final String SHARED_ACCESS_KEY_ATTRIBUTE = "SharedAccessKey";
    private static final String SHARED_ACCESS_SIGNATURE_ATTRIBUTE = "SharedAccessSignature";

    private final String hostName;
    private final String deviceId;
    private final String moduleId;
    private final String sharedAccessKey;
    private final String sharedAccessToken;

    private IotHubConnectionString(String hostName, String deviceId, String moduleId, String sharedAccessKey, String sharedAccessToken)
    {
        this.hostName = hostName;
        this.deviceId = deviceId;
        this.moduleId = moduleId;
        this.sharedAccessKey = sharedAccessKey;
        this.sharedAccessToken = sharedAccessToken;
    }

    /**
     * @param connectionString the connection string to parse
     * @return the parsed connection string
     * @throws IllegalArgumentException if the connection string is blank, malformed, or misses a required attribute
     */
    public static IotHubConnectionString parse(String connectionString)
    {
        if (StringUtils.isBlank(connectionString))
        {
            throw new IllegalArgumentException("Connection string cannot be null or empty");
        }

        Map<String, String> attributes = new HashMap<>();
        for (String pair : connectionString.split(VALUE_PAIR_DELIMITER))
        {
            if (StringUtils.isBlank(pair))
            {
                continue;
            }

            int separator = pair.indexOf(VALUE_PAIR_SEPARATOR);
            if (separator <= 0)
            {
                throw new IllegalArgumentException("Connection string segment is not a key=value pair: " + pair.trim());
            }

            // SAS keys are base64 and may end in '=' so only split on the first separator
            attributes.put(pair.substring(0, separator).trim(), pair.substring(separator + 1).trim());
        }

        String hostName = attributes.get(HOSTNAME_ATTRIBUTE);
        String deviceId = attributes.get(DEVICE_ID_ATTRIBUTE);
        String sharedAccessKey = attributes.get(SHARED_ACCESS_KEY_ATTRIBUTE);
        String sharedAccessToken = attributes.get(SHARED_ACCESS_SIGNATURE_ATTRIBUTE);

        if (StringUtils.isBlank(hostName))
        {
            throw new IllegalArgumentException("Connection string is missing " + HOSTNAME_ATTRIBUTE);
        }

        if (StringUtils.isBlank(deviceId))
        {
            throw new IllegalArgumentException("Connection string is missing " + DEVICE_ID_ATTRIBUTE);
        }

        if (StringUtils.isBlank(sharedAccessKey) && StringUtils.isBlank(sharedAccessToken))
        {
            throw new IllegalArgumentException("Connection string must contain either " + SHARED_ACCESS_KEY_ATTRIBUTE
                    + " or " + SHARED_ACCESS_SIGNATURE_ATTRIBUTE);
        }

        return new IotHubConnectionString(hostName, deviceId, attributes.get(MODULE_ID_ATTRIBUTE), sharedAccessKey, sharedAccessToken);
    }

    public String getHostName()
    {
        return this.hostName;
    }

    public String getDeviceId()
    {
        return this.deviceId;
    }

    /**
     * @return the module id, or null for a device identity
     */
    public String getModuleId()
    {
        return this.moduleId;
    }

    /**
     * @return the shared access key, or null if the connection string carries a pre-built token instead
     */
    public String getSharedAccessKey()
    {
        return this.sharedAccessKey;
    }

    /**
     * @return the pre-built shared access signature, or null if the connection string carries a key instead
     */
    public String getSharedAccessToken()
    {
        return this.sharedAccessToken;
    }

    @Override
    public String toString()
    {
        // never print the key
        return HOSTNAME_ATTRIBUTE + "=" + this.hostName + ";" + DEVICE_ID_ATTRIBUTE + "=" + this.deviceId
                + (this.moduleId == null ? "" : ";" + MODULE_ID_ATTRIBUTE + "=" + this.moduleId);
    }
}
