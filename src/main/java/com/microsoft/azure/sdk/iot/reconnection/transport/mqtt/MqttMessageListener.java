// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport.mqtt;

/**
 * Notified when an MQTT message has been added to the received messages queue.
 */
public interface MqttMessageListener
{
    void onMessageArrived(int messageId);
}
