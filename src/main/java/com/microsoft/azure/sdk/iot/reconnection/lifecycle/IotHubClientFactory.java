// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.lifecycle;

import com.microsoft.azure.sdk.iot.reconnection.IotHubClient;

/**
 * Creates an unopened client for a connection string.
 */
@FunctionalInterface
public interface IotHubClientFactory
{
    IotHubClient create(String connectionString);
}
