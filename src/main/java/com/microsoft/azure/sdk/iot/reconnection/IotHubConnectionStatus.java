// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

/**
 * The states a client connection to the IoT Hub can be in.
 */
public enum IotHubConnectionStatus
{
    /** The connection is open and all operations can be carried out normally. */
    CONNECTED,

    /** The connection was lost and the transport is retrying it on its own. Do not close or open the client. */
    DISCONNECTED_RETRYING,

    /** The connection was lost and will not be re-established without a new client instance. */
    DISCONNECTED,

    /** The client was closed on request. */
    DISABLED
}
