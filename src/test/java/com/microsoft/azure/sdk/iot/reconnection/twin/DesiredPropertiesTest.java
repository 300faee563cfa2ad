// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.twin;

import com.google.gson.JsonPrimitive;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DesiredPropertiesTest
{
    @Test
    public void parsesVersionAndPropertiesWithoutMetadata()
    {
        DesiredProperties desired = DesiredProperties.fromJson(
                "{\"telemetryInterval\":30,\"mode\":\"eco\",\"$version\":7,\"$metadata\":{\"$lastUpdated\":\"2021-01-01T00:00:00Z\"}}");

        assertEquals(7, desired.getVersion());
        assertEquals(2, desired.getProperties().size());
        assertEquals(new JsonPrimitive(30), desired.getProperties().get("telemetryInterval"));
        assertEquals(new JsonPrimitive("eco"), desired.getProperties().get("mode"));
        assertFalse(desired.getProperties().containsKey("$metadata"));
    }

    @Test
    public void nestedObjectsAreKeptAsIs()
    {
        DesiredProperties desired = DesiredProperties.fromJson("{\"thresholds\":{\"high\":35,\"low\":10},\"$version\":2}");

        assertTrue(desired.getProperties().get("thresholds").isJsonObject());
        assertEquals(35, desired.getProperties().get("thresholds").getAsJsonObject().get("high").getAsInt());
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingVersionIsRejected()
    {
        DesiredProperties.fromJson("{\"mode\":\"eco\"}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonNumericVersionIsRejected()
    {
        DesiredProperties.fromJson("{\"$version\":\"seven\"}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonObjectDocumentIsRejected()
    {
        DesiredProperties.fromJson("[1,2,3]");
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedJsonIsRejected()
    {
        DesiredProperties.fromJson("{\"$version\":");
    }

    @Test
    public void twinDocumentCarriesDesiredAndReportedVersions()
    {
        TwinProperties twin = TwinProperties.fromJson(
                "{\"desired\":{\"mode\":\"eco\",\"$version\":4},\"reported\":{\"mode\":\"normal\",\"$version\":9}}");

        assertEquals(4, twin.getDesired().getVersion());
        assertEquals(9, twin.getReportedVersion());
        assertEquals(new JsonPrimitive("eco"), twin.getDesiredProperties().get("mode"));
    }

    @Test
    public void twinDocumentWithoutReportedSectionHasReportedVersionZero()
    {
        TwinProperties twin = TwinProperties.fromJson("{\"desired\":{\"$version\":1}}");

        assertEquals(0, twin.getReportedVersion());
        assertTrue(twin.getDesiredProperties().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void twinDocumentWithoutDesiredSectionIsRejected()
    {
        TwinProperties.fromJson("{\"reported\":{\"$version\":1}}");
    }

    @Test
    public void reportedPropertiesKeepNullsForRemoval()
    {
        ReportedProperties reported = new ReportedProperties()
                .put("interval", 30)
                .put("mode", "eco")
                .put("enabled", true)
                .put("obsolete", (String) null);

        assertEquals("{\"interval\":30,\"mode\":\"eco\",\"enabled\":true,\"obsolete\":null}", reported.toJson());
        assertEquals(4, reported.size());
    }
}
