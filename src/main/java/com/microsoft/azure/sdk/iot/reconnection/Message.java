// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A telemetry or cloud-to-device message: an opaque body plus application properties.
 */
public class Message
{
    public static final Charset DEFAULT_IOTHUB_MESSAGE_CHARSET = StandardCharsets.UTF_8;

    private String messageId;
    private String contentType;
    private String contentEncoding;
    private final byte[] body;
    private final Map<String, String> properties = new LinkedHashMap<>();

    public Message(byte[] body)
    {
        if (body == null)
        {
            throw new IllegalArgumentException("Message body cannot be 'null'.");
        }

        this.messageId = UUID.randomUUID().toString();
        this.body = Arrays.copyOf(body, body.length);
    }

    public Message(String body)
    {
        this(requireBody(body).getBytes(DEFAULT_IOTHUB_MESSAGE_CHARSET));
    }

    private static String requireBody(String body)
    {
        if (body == null)
        {
            throw new IllegalArgumentException("Message body cannot be 'null'.");
        }

        return body;
    }

    public byte[] getBytes()
    {
        return Arrays.copyOf(this.body, this.body.length);
    }

    public String getBodyAsString()
    {
        return new String(this.body, DEFAULT_IOTHUB_MESSAGE_CHARSET);
    }

    public String getMessageId()
    {
        return this.messageId;
    }

    public void setMessageId(String messageId)
    {
        this.messageId = messageId;
    }

    public String getContentType()
    {
        return this.contentType;
    }

    public void setContentType(String contentType)
    {
        this.contentType = contentType;
    }

    public String getContentEncoding()
    {
        return this.contentEncoding;
    }

    public void setContentEncoding(String contentEncoding)
    {
        this.contentEncoding = contentEncoding;
    }

    /**
     * Adds or replaces an application property.
     *
     * @param name the property name. Cannot be null or empty.
     * @param value the property value. Cannot be null.
     */
    public void setProperty(String name, String value)
    {
        if (name == null || name.isEmpty() || value == null)
        {
            throw new IllegalArgumentException("Property name and value cannot be null or empty");
        }

        this.properties.put(name, value);
    }

    public String getProperty(String name)
    {
        return this.properties.get(name);
    }

    public Map<String, String> getProperties()
    {
        return Collections.unmodifiableMap(this.properties);
    }

    @Override
    public String toString()
    {
        StringBuilder s = new StringBuilder();
        s.append(" Message details: ");
        if (this.messageId != null && !this.messageId.isEmpty())
        {
            s.append("Message Id [").append(this.messageId).append("] ");
        }

        if (!this.properties.isEmpty())
        {
            s.append("Properties ").append(this.properties).append(' ');
        }

        return s.toString();
    }
}
