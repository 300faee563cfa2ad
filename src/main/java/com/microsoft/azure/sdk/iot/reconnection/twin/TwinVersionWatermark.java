// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.twin;

import java.util.concurrent.atomic.AtomicLong;

/**
 * The highest desired properties version applied locally. Never decreases.
 */
public final class TwinVersionWatermark
{
    public static final long INITIAL_VERSION = 1;

    private final AtomicLong version;

    public TwinVersionWatermark()
    {
        this(INITIAL_VERSION);
    }

    public TwinVersionWatermark(long initialVersion)
    {
        this.version = new AtomicLong(initialVersion);
    }

    public long get()
    {
        return this.version.get();
    }

    /**
     * @param serverVersion the desired properties version of the twin on the service
     * @return true if the service holds a version that has not been applied locally
     */
    public boolean isBehind(long serverVersion)
    {
        return serverVersion > this.version.get();
    }

    /**
     * Moves the watermark to the provided version if it is newer than the current one.
     *
     * @param newVersion the version of an update about to be applied
     * @return true if the watermark moved, false if that version or a newer one was already applied
     */
    public boolean tryAdvance(long newVersion)
    {
        while (true)
        {
            long current = this.version.get();
            if (newVersion <= current)
            {
                return false;
            }

            if (this.version.compareAndSet(current, newVersion))
            {
                return true;
            }
        }
    }

    @Override
    public String toString()
    {
        return String.valueOf(this.version.get());
    }
}
