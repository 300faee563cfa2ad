// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

import java.time.Instant;

/**
 * Snapshot of a connection status change as reported by the transport. Instances are immutable; the latest one
 * delivered always wins.
 */
public final class ConnectionStatusInfo
{
    private final IotHubConnectionStatus status;
    private final IotHubConnectionStatusChangeReason changeReason;
    private final RecommendedAction recommendedAction;
    private final Throwable cause;
    private final Instant statusLastChangedOn;

    public ConnectionStatusInfo(IotHubConnectionStatus status, IotHubConnectionStatusChangeReason changeReason)
    {
        this(status, changeReason, null);
    }

    public ConnectionStatusInfo(IotHubConnectionStatus status, IotHubConnectionStatusChangeReason changeReason, Throwable cause)
    {
        if (status == null || changeReason == null)
        {
            throw new IllegalArgumentException("status and changeReason cannot be null");
        }

        this.status = status;
        this.changeReason = changeReason;
        this.cause = cause;
        this.recommendedAction = recommendedActionFor(status, changeReason);
        this.statusLastChangedOn = Instant.now();
    }

    /**
     * The status every client starts in before it is opened for the first time.
     *
     * @return a disconnected status info with reason {@link IotHubConnectionStatusChangeReason#CLIENT_CLOSE}
     */
    public static ConnectionStatusInfo initial()
    {
        return new ConnectionStatusInfo(IotHubConnectionStatus.DISCONNECTED, IotHubConnectionStatusChangeReason.CLIENT_CLOSE);
    }

    static RecommendedAction recommendedActionFor(IotHubConnectionStatus status, IotHubConnectionStatusChangeReason reason)
    {
        switch (status)
        {
            case CONNECTED:
                return RecommendedAction.PERFORM_NORMALLY;

            case DISCONNECTED_RETRYING:
                return RecommendedAction.WAIT_FOR_RETRY_POLICY;

            case DISABLED:
                return RecommendedAction.OPEN_CONNECTION;

            case DISCONNECTED:
            default:
                switch (reason)
                {
                    case RETRY_EXPIRED:
                    case COMMUNICATION_ERROR:
                    case NO_NETWORK:
                    case CLIENT_CLOSE:
                        return RecommendedAction.OPEN_CONNECTION;

                    default:
                        return RecommendedAction.QUIT;
                }
        }
    }

    public IotHubConnectionStatus getStatus()
    {
        return this.status;
    }

    public IotHubConnectionStatusChangeReason getChangeReason()
    {
        return this.changeReason;
    }

    public RecommendedAction getRecommendedAction()
    {
        return this.recommendedAction;
    }

    /**
     * @return the exception behind this status change. May be null.
     */
    public Throwable getCause()
    {
        return this.cause;
    }

    public Instant getStatusLastChangedOn()
    {
        return this.statusLastChangedOn;
    }

    @Override
    public String toString()
    {
        return "status=" + this.status + ", reason=" + this.changeReason + ", recommendation=" + this.recommendedAction;
    }
}
