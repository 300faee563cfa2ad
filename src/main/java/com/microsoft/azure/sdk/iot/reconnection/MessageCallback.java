// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

/**
 * Callback invoked when a cloud-to-device message arrives.
 */
public interface MessageCallback
{
    IotHubMessageResult execute(Message message, Object callbackContext);
}
