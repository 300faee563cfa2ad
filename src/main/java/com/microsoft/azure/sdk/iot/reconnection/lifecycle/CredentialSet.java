// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.lifecycle;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * An ordered list of candidate connection strings, consumed front to back. A discarded credential is never used
 * again.
 */
public final class CredentialSet
{
    private final Deque<String> credentials;

    public CredentialSet(List<String> credentials)
    {
        if (credentials == null || credentials.isEmpty())
        {
            throw new IllegalArgumentException("At least one credential is required");
        }

        for (String credential : credentials)
        {
            if (StringUtils.isBlank(credential))
            {
                throw new IllegalArgumentException("Credentials cannot be null or blank");
            }
        }

        this.credentials = new ArrayDeque<>(credentials);
    }

    /**
     * @return the credential to connect with
     * @throws IllegalStateException if every credential has been discarded
     */
    public synchronized String current()
    {
        String current = this.credentials.peekFirst();
        if (current == null)
        {
            throw new IllegalStateException("No credentials remain");
        }

        return current;
    }

    /**
     * Discards the provided credential if it is still the current one. A credential that was already discarded is
     * not discarded twice, so a late report of a bad credential leaves its successor alone.
     *
     * @param credential the credential that was rejected
     * @return true if the credential was discarded
     */
    public synchronized boolean discardIfCurrent(String credential)
    {
        String current = this.credentials.peekFirst();
        if (current == null || !current.equals(credential))
        {
            return false;
        }

        this.credentials.removeFirst();
        return true;
    }

    public synchronized boolean isEmpty()
    {
        return this.credentials.isEmpty();
    }

    public synchronized int size()
    {
        return this.credentials.size();
    }
}
