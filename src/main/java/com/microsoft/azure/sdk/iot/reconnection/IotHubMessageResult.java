// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

/**
 * The acknowledgement an application gives for a cloud-to-device message.
 */
public enum IotHubMessageResult
{
    COMPLETE,
    ABANDON,
    REJECT
}
