// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.transport.mqtt.exceptions;

import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.UnauthorizedException;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.junit.Test;

import java.net.SocketException;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class PahoExceptionTranslatorTest
{
    @Test
    public void authenticationFailuresAreUnauthorized()
    {
        MqttException badUserName = new MqttException(MqttException.REASON_CODE_FAILED_AUTHENTICATION);
        MqttException notAuthorized = new MqttException(MqttException.REASON_CODE_NOT_AUTHORIZED);

        TransportException first = PahoExceptionTranslator.convertToMqttException(badUserName, "connect");
        TransportException second = PahoExceptionTranslator.convertToMqttException(notAuthorized, "connect");

        assertTrue(first instanceof UnauthorizedException);
        assertTrue(second instanceof UnauthorizedException);
        assertFalse(first.isRetryable());
        assertSame(badUserName, first.getCause());
    }

    @Test
    public void connectivityFailuresAreRetryable()
    {
        short[] retryableCodes = {
            MqttException.REASON_CODE_BROKER_UNAVAILABLE,
            MqttException.REASON_CODE_CLIENT_TIMEOUT,
            MqttException.REASON_CODE_WRITE_TIMEOUT,
            MqttException.REASON_CODE_SERVER_CONNECT_ERROR,
            MqttException.REASON_CODE_CLIENT_NOT_CONNECTED,
            MqttException.REASON_CODE_CONNECTION_LOST,
            MqttException.REASON_CODE_MAX_INFLIGHT
        };

        for (short reasonCode : retryableCodes)
        {
            TransportException exception = PahoExceptionTranslator.convertToMqttException(new MqttException(reasonCode), "publish");
            assertTrue("reason code " + reasonCode, exception.isRetryable());
        }
    }

    @Test
    public void clientExceptionIsRetryableOnlyWhenCausedByIo()
    {
        MqttException socketFailure = new MqttException(MqttException.REASON_CODE_CLIENT_EXCEPTION, new SocketException("reset"));
        MqttException otherFailure = new MqttException(MqttException.REASON_CODE_CLIENT_EXCEPTION, new IllegalStateException());

        assertTrue(PahoExceptionTranslator.convertToMqttException(socketFailure, "connect").isRetryable());
        assertFalse(PahoExceptionTranslator.convertToMqttException(otherFailure, "connect").isRetryable());
    }

    @Test
    public void otherReasonCodesAreNotRetryable()
    {
        TransportException exception = PahoExceptionTranslator.convertToMqttException(
                new MqttException(MqttException.REASON_CODE_INVALID_PROTOCOL_VERSION), "connect");

        assertFalse(exception.isRetryable());
        assertFalse(exception instanceof UnauthorizedException);
        assertTrue(exception.getMessage().contains("connect"));
    }
}
