// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.twin;

/**
 * Receives desired property patches pushed by the service.
 */
public interface DesiredPropertyUpdateCallback
{
    void onDesiredPropertiesUpdated(DesiredProperties desiredProperties, Object callbackContext);
}
