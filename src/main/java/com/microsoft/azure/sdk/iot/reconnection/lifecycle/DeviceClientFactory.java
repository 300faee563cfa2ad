// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.lifecycle;

import com.microsoft.azure.sdk.iot.reconnection.DeviceClient;
import com.microsoft.azure.sdk.iot.reconnection.DeviceClientConfig;
import com.microsoft.azure.sdk.iot.reconnection.IotHubClient;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionString;

import java.util.function.Consumer;

/**
 * Creates MQTT device clients.
 */
public final class DeviceClientFactory implements IotHubClientFactory
{
    private final Consumer<DeviceClientConfig> configCustomizer;

    public DeviceClientFactory()
    {
        this(config -> { });
    }

    /**
     * @param configCustomizer applied to the configuration of every client before it is created
     */
    public DeviceClientFactory(Consumer<DeviceClientConfig> configCustomizer)
    {
        if (configCustomizer == null)
        {
            throw new IllegalArgumentException("configCustomizer cannot be null");
        }

        this.configCustomizer = configCustomizer;
    }

    @Override
    public IotHubClient create(String connectionString)
    {
        DeviceClientConfig config = new DeviceClientConfig(IotHubConnectionString.parse(connectionString));
        this.configCustomizer.accept(config);
        return new DeviceClient(config);
    }
}
