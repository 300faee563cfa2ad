// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

import com.microsoft.azure.sdk.iot.reconnection.Message;

/**
 * Extends Message, adding the transport artifacts needed to settle it once it has been handled.
 */
public class IotHubTransportMessage extends Message
{
    private final String topic;
    private final int protocolMessageId;

    public IotHubTransportMessage(byte[] data, String topic, int protocolMessageId)
    {
        super(data);
        this.topic = topic;
        this.protocolMessageId = protocolMessageId;
    }

    public String getTopic()
    {
        return this.topic;
    }

    /**
     * @return the id the protocol assigned to this message, used to acknowledge it
     */
    public int getProtocolMessageId()
    {
        return this.protocolMessageId;
    }

    @Override
    public String toString()
    {
        return "topic: " + this.topic + super.toString();
    }
}
