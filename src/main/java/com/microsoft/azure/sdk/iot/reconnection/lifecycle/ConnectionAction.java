// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.lifecycle;

/**
 * What the lifecycle manager does in response to a connection status change.
 */
public enum ConnectionAction
{
    /** Apply the desired property updates missed while disconnected. */
    RECONCILE_TWIN,

    /** Nothing, the client recovers on its own or was closed on purpose. */
    NONE,

    /** Drop the rejected credential and initialize a new client with the next one, or stop if none remain. */
    DISCARD_CREDENTIAL_AND_REINITIALIZE,

    /** Replace the client with a new one. */
    REINITIALIZE,

    /** Stop the application. */
    FATAL,

    /** A combination that should not happen. Logged, no action taken. */
    UNEXPECTED
}
