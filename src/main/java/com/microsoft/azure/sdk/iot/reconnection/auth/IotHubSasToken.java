// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.auth;

import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionString;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;

/**
 * Builds shared access signatures for a device from its connection string.
 *
 * @see <a href="https://docs.microsoft.com/en-us/azure/iot-hub/iot-hub-devguide-security#security-tokens">Security tokens</a>
 */
public final class IotHubSasToken
{
    private static final String TOKEN_FORMAT = "SharedAccessSignature sr=%s&sig=%s&se=%d";
    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final IotHubConnectionString connectionString;
    private final long timeToLiveSeconds;
    private final Clock clock;

    public IotHubSasToken(IotHubConnectionString connectionString, long timeToLiveSeconds)
    {
        this(connectionString, timeToLiveSeconds, Clock.systemUTC());
    }

    IotHubSasToken(IotHubConnectionString connectionString, long timeToLiveSeconds, Clock clock)
    {
        if (connectionString == null)
        {
            throw new IllegalArgumentException("connectionString cannot be null");
        }

        if (timeToLiveSeconds <= 0)
        {
            throw new IllegalArgumentException("timeToLiveSeconds must be greater than 0");
        }

        this.connectionString = connectionString;
        this.timeToLiveSeconds = timeToLiveSeconds;
        this.clock = clock;
    }

    /**
     * Returns the token to authenticate with. A token supplied in the connection string is returned as is;
     * otherwise a new token expiring after the configured time to live is signed with the shared access key.
     *
     * @return the shared access signature
     * @throws IllegalStateException if the token could not be signed
     */
    public String getSasToken()
    {
        if (this.connectionString.getSharedAccessToken() != null)
        {
            return this.connectionString.getSharedAccessToken();
        }

        long expiryTime = this.clock.instant().getEpochSecond() + this.timeToLiveSeconds;
        String resourceUri = buildResourceUri(this.connectionString);
        String signature = sign(resourceUri + "\n" + expiryTime, this.connectionString.getSharedAccessKey());

        return String.format(TOKEN_FORMAT, urlEncode(resourceUri), urlEncode(signature), expiryTime);
    }

    static String buildResourceUri(IotHubConnectionString connectionString)
    {
        String resourceUri = connectionString.getHostName() + "/devices/" + connectionString.getDeviceId();
        if (connectionString.getModuleId() != null)
        {
            resourceUri += "/modules/" + connectionString.getModuleId();
        }

        return resourceUri;
    }

    private static String sign(String content, String base64Key)
    {
        try
        {
            Mac hmac = Mac.getInstance(HMAC_SHA_256);
            hmac.init(new SecretKeySpec(Base64.getDecoder().decode(base64Key), HMAC_SHA_256));
            return Base64.getEncoder().encodeToString(hmac.doFinal(content.getBytes(StandardCharsets.UTF_8)));
        }
        catch (GeneralSecurityException | IllegalArgumentException e)
        {
            throw new IllegalStateException("Failed to sign the shared access signature", e);
        }
    }

    private static String urlEncode(String value)
    {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
