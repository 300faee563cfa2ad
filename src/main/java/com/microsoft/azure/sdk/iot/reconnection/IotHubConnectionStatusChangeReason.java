// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

public enum IotHubConnectionStatusChangeReason
{
    CONNECTION_OK,
    BAD_CREDENTIAL,
    DEVICE_DISABLED,
    RETRY_EXPIRED,
    NO_NETWORK,
    COMMUNICATION_ERROR,
    CLIENT_CLOSE,
    UNKNOWN
}
