// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.twin;

import com.google.gson.JsonElement;
import com.microsoft.azure.sdk.iot.reconnection.CancellationToken;
import com.microsoft.azure.sdk.iot.reconnection.IotHubClient;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.transport.RetryOperationHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Keeps the reported properties of the device in line with its desired properties. Every desired property is
 * accepted and echoed back as a reported property.
 *
 * <p>Live patches are applied as they arrive. After a reconnection, {@link #reconcile(CancellationToken)} applies the
 * desired properties that changed while the device was offline. The {@link TwinVersionWatermark} makes sure each
 * desired properties version is applied at most once, whichever path delivers it first.</p>
 */
public class TwinReconciler implements DesiredPropertyUpdateCallback
{
    private static final Logger log = LoggerFactory.getLogger(TwinReconciler.class);

    /**
     * Supplies the client operations run against. Reads the current client each time, since the client may be
     * replaced between two attempts.
     */
    @FunctionalInterface
    public interface ClientSupplier
    {
        IotHubClient get() throws TransportException;
    }

    private final ClientSupplier clientSupplier;
    private final BooleanSupplier isClientReady;
    private final RetryOperationHelper retryOperationHelper;
    private final TwinVersionWatermark watermark;
    private final CancellationToken cancellationToken;

    /**
     * @param clientSupplier supplies the client to use
     * @param isClientReady tells whether the client can be used right now
     * @param retryOperationHelper retries twin operations that fail transiently
     * @param watermark the highest applied desired properties version
     * @param cancellationToken the token that stops the twin operations started by live patches
     */
    public TwinReconciler(
            ClientSupplier clientSupplier,
            BooleanSupplier isClientReady,
            RetryOperationHelper retryOperationHelper,
            TwinVersionWatermark watermark,
            CancellationToken cancellationToken)
    {
        if (clientSupplier == null || isClientReady == null || retryOperationHelper == null || watermark == null || cancellationToken == null)
        {
            throw new IllegalArgumentException("None of the parameters can be null");
        }

        this.clientSupplier = clientSupplier;
        this.isClientReady = isClientReady;
        this.retryOperationHelper = retryOperationHelper;
        this.watermark = watermark;
        this.cancellationToken = cancellationToken;
    }

    /**
     * Fetches the twin and applies its desired properties if they are newer than the last applied version.
     *
     * @param cancellationToken the token that stops the twin operations
     * @return true if the desired properties were applied
     * @throws TransportException if the twin could not be fetched or the reported properties could not be updated
     */
    public boolean reconcile(CancellationToken cancellationToken) throws TransportException
    {
        AtomicReference<TwinProperties> twin = new AtomicReference<>();
        this.retryOperationHelper.retryTransientExceptions(
                "GetTwin",
                () -> twin.set(this.clientSupplier.get().getTwin()),
                this.isClientReady,
                cancellationToken);

        DesiredProperties desired = twin.get().getDesired();
        if (!this.watermark.isBehind(desired.getVersion()))
        {
            log.debug("Desired properties version {} is already applied (watermark {}), nothing to reconcile", desired.getVersion(), this.watermark);
            return false;
        }

        log.info("Desired properties version {} is newer than the watermark {}, applying it", desired.getVersion(), this.watermark);
        return this.applyDesiredProperties(desired, cancellationToken);
    }

    @Override
    public void onDesiredPropertiesUpdated(DesiredProperties desiredProperties, Object callbackContext)
    {
        log.info("Desired properties patch received with version {}", desiredProperties.getVersion());

        try
        {
            this.applyDesiredProperties(desiredProperties, this.cancellationToken);
        }
        catch (TransportException e)
        {
            log.error("Failed to report desired properties version {}", desiredProperties.getVersion(), e);
        }
    }

    /**
     * Echoes every desired property back as a reported property and moves the watermark to their version. An update
     * whose version was already applied is ignored.
     *
     * @param desiredProperties the desired properties to apply
     * @param cancellationToken the token that stops the reported properties update
     * @return true if the update was applied
     * @throws TransportException if the reported properties could not be updated
     */
    public boolean applyDesiredProperties(DesiredProperties desiredProperties, CancellationToken cancellationToken) throws TransportException
    {
        if (!this.watermark.tryAdvance(desiredProperties.getVersion()))
        {
            log.debug("Ignoring desired properties version {}, the watermark is already at {}", desiredProperties.getVersion(), this.watermark);
            return false;
        }

        ReportedProperties reportedProperties = new ReportedProperties();
        for (Map.Entry<String, JsonElement> desiredProperty : desiredProperties.getProperties().entrySet())
        {
            log.debug("Accepting desired property {} = {}", desiredProperty.getKey(), desiredProperty.getValue());
            reportedProperties.put(desiredProperty.getKey(), desiredProperty.getValue());
        }

        try
        {
            this.retryOperationHelper.retryTransientExceptions(
                    "UpdateReportedProperties",
                    () -> this.clientSupplier.get().updateReportedProperties(reportedProperties),
                    this.isClientReady,
                    cancellationToken);

            log.info("Reported properties updated for desired properties version {}", desiredProperties.getVersion());
        }
        catch (CancellationException e)
        {
            log.debug("Reporting desired properties version {} was cancelled", desiredProperties.getVersion());
        }

        return true;
    }

    public TwinVersionWatermark getWatermark()
    {
        return this.watermark;
    }
}
