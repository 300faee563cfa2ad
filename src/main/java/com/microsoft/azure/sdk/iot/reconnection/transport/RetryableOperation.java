// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport;

/**
 * A single attempt of an operation run by {@link RetryOperationHelper}.
 */
@FunctionalInterface
public interface RetryableOperation
{
    OperationResult execute();
}
