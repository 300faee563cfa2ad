// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.twin;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A reported properties patch. A property set to null is removed from the twin by the service.
 */
public final class ReportedProperties
{
    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final Map<String, JsonElement> properties = new LinkedHashMap<>();

    public ReportedProperties put(String key, JsonElement value)
    {
        if (key == null || key.isEmpty())
        {
            throw new IllegalArgumentException("key cannot be null or empty");
        }

        this.properties.put(key, value == null ? JsonNull.INSTANCE : value);
        return this;
    }

    public ReportedProperties put(String key, String value)
    {
        return this.put(key, value == null ? JsonNull.INSTANCE : new JsonPrimitive(value));
    }

    public ReportedProperties put(String key, Number value)
    {
        return this.put(key, value == null ? JsonNull.INSTANCE : new JsonPrimitive(value));
    }

    public ReportedProperties put(String key, Boolean value)
    {
        return this.put(key, value == null ? JsonNull.INSTANCE : new JsonPrimitive(value));
    }

    public JsonElement get(String key)
    {
        return this.properties.get(key);
    }

    public Map<String, JsonElement> getProperties()
    {
        return Collections.unmodifiableMap(this.properties);
    }

    public boolean isEmpty()
    {
        return this.properties.isEmpty();
    }

    public int size()
    {
        return this.properties.size();
    }

    public String toJson()
    {
        JsonObject jsonObject = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : this.properties.entrySet())
        {
            jsonObject.add(entry.getKey(), entry.getValue());
        }

        return GSON.toJson(jsonObject);
    }

    @Override
    public String toString()
    {
        return this.toJson();
    }
}
