// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport.mqtt.exceptions;

import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.UnauthorizedException;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.paho.client.mqttv3.MqttException;

import java.io.IOException;

/**
 * Translates Paho exceptions into transport exceptions, flagging the ones worth retrying.
 */
public final class PahoExceptionTranslator
{
    private PahoExceptionTranslator()
    {
    }

    public static TransportException convertToMqttException(MqttException pahoException, String errorMessage)
    {
        String message = errorMessage + " (reason code " + pahoException.getReasonCode() + ")";

        switch (pahoException.getReasonCode())
        {
            case MqttException.REASON_CODE_FAILED_AUTHENTICATION:
            case MqttException.REASON_CODE_NOT_AUTHORIZED:
                return new UnauthorizedException(message, pahoException);

            case MqttException.REASON_CODE_BROKER_UNAVAILABLE:
            case MqttException.REASON_CODE_CLIENT_TIMEOUT:
            case MqttException.REASON_CODE_WRITE_TIMEOUT:
            case MqttException.REASON_CODE_SERVER_CONNECT_ERROR:
            case MqttException.REASON_CODE_CLIENT_NOT_CONNECTED:
            case MqttException.REASON_CODE_CONNECTION_LOST:
            case MqttException.REASON_CODE_MAX_INFLIGHT:
                return TransportException.retryable(message, pahoException);

            case MqttException.REASON_CODE_CLIENT_EXCEPTION:
                if (ExceptionUtils.indexOfType(pahoException, IOException.class) != -1)
                {
                    // socket level failures are reported with the generic client reason code
                    return TransportException.retryable(message, pahoException);
                }

                return new TransportException(message, pahoException);

            default:
                return new TransportException(message, pahoException);
        }
    }
}
