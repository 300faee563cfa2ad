// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection;

/**
 * What an application is expected to do after a connection status change.
 */
public enum RecommendedAction
{
    PERFORM_NORMALLY,
    OPEN_CONNECTION,
    WAIT_FOR_RETRY_POLICY,
    QUIT
}
