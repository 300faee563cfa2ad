// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.twin;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.Map;

/**
 * The properties section of a device twin: the desired document and the version of the reported document.
 */
public final class TwinProperties
{
    private static final String DESIRED_KEY = "desired";
    private static final String REPORTED_KEY = "reported";

    private final DesiredProperties desired;
    private final long reportedVersion;

    public TwinProperties(DesiredProperties desired, long reportedVersion)
    {
        if (desired == null)
        {
            throw new IllegalArgumentException("desired cannot be null");
        }

        this.desired = desired;
        this.reportedVersion = reportedVersion;
    }

    /**
     * Parses the twin document returned by a twin GET request.
     *
     * @param json a JSON object with {@code desired} and {@code reported} sections
     * @return the parsed twin
     * @throws IllegalArgumentException if the document is malformed
     */
    public static TwinProperties fromJson(String json)
    {
        if (json == null || json.isEmpty())
        {
            throw new IllegalArgumentException("json cannot be null or empty");
        }

        try
        {
            JsonObject twin = JsonParser.parseString(json).getAsJsonObject();
            JsonElement desired = twin.get(DESIRED_KEY);
            if (desired == null || !desired.isJsonObject())
            {
                throw new IllegalArgumentException("Twin document has no desired section");
            }

            long reportedVersion = 0;
            JsonElement reported = twin.get(REPORTED_KEY);
            if (reported != null && reported.isJsonObject())
            {
                JsonElement version = reported.getAsJsonObject().get(DesiredProperties.VERSION_KEY);
                if (version != null && version.isJsonPrimitive())
                {
                    reportedVersion = version.getAsLong();
                }
            }

            return new TwinProperties(DesiredProperties.fromJsonObject(desired.getAsJsonObject()), reportedVersion);
        }
        catch (JsonParseException | IllegalStateException | NumberFormatException e)
        {
            throw new IllegalArgumentException("Malformed twin document: " + e.getMessage(), e);
        }
    }

    public DesiredProperties getDesired()
    {
        return this.desired;
    }

    public long getReportedVersion()
    {
        return this.reportedVersion;
    }

    public Map<String, JsonElement> getDesiredProperties()
    {
        return this.desired.getProperties();
    }

    @Override
    public String toString()
    {
        return "TwinProperties{desired=" + this.desired + ", reportedVersion=" + this.reportedVersion + "}";
    }
}
