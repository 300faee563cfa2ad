// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.twin;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A desired properties document, or a patch of one, together with the twin version it was produced at.
 * Twin metadata entries such as {@code $version} and {@code $metadata} are not part of the properties.
 */
public final class DesiredProperties
{
    static final String VERSION_KEY = "$version";
    private static final String METADATA_PREFIX = "$";

    private final long version;
    private final Map<String, JsonElement> properties;

    public DesiredProperties(long version, Map<String, JsonElement> properties)
    {
        if (properties == null)
        {
            throw new IllegalArgumentException("properties cannot be null");
        }

        this.version = version;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Parses a desired properties JSON object as sent by the service.
     *
     * @param json the JSON object. Must contain a numeric {@code $version}.
     * @return the parsed document
     * @throws IllegalArgumentException if the json is not an object or has no version
     */
    public static DesiredProperties fromJson(String json)
    {
        if (json == null || json.isEmpty())
        {
            throw new IllegalArgumentException("json cannot be null or empty");
        }

        try
        {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject())
            {
                throw new IllegalArgumentException("Desired properties must be a JSON object");
            }

            return fromJsonObject(element.getAsJsonObject());
        }
        catch (JsonParseException | IllegalStateException e)
        {
            throw new IllegalArgumentException("Malformed desired properties: " + e.getMessage(), e);
        }
    }

    static DesiredProperties fromJsonObject(JsonObject jsonObject)
    {
        JsonElement versionElement = jsonObject.get(VERSION_KEY);
        if (versionElement == null || !versionElement.isJsonPrimitive() || !versionElement.getAsJsonPrimitive().isNumber())
        {
            throw new IllegalArgumentException("Desired properties do not carry a numeric " + VERSION_KEY);
        }

        Map<String, JsonElement> properties = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : jsonObject.entrySet())
        {
            if (!entry.getKey().startsWith(METADATA_PREFIX))
            {
                properties.put(entry.getKey(), entry.getValue());
            }
        }

        return new DesiredProperties(versionElement.getAsLong(), properties);
    }

    public long getVersion()
    {
        return this.version;
    }

    public Map<String, JsonElement> getProperties()
    {
        return this.properties;
    }

    @Override
    public String toString()
    {
        return "DesiredProperties{version=" + this.version + ", properties=" + this.properties + "}";
    }
}
