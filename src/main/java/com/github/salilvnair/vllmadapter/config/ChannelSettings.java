package com.github.salilvnair.vllmadapter.config;

import java.time.Duration;

/**
 * Immutable copy of {@link VllmClientProperties}; equal settings share one channel.
 */
public record ChannelSettings(
        String url,
        String rootCert,
        String certChain,
        String privateKey,
        Duration keepaliveTime,
        Duration keepaliveTimeout,
        boolean keepaliveWithoutCalls,
        int maxInboundMessageSize
) {

    public static ChannelSettings from(VllmClientProperties properties) {
        VllmClientProperties.Credentials credentials = properties.getCredentials() == null
                ? new VllmClientProperties.Credentials()
                : properties.getCredentials();
        return new ChannelSettings(
                properties.getUrl(),
                credentials.getRootCert(),
                credentials.getCertChain(),
                credentials.getPrivateKey(),
                properties.getKeepaliveTime(),
                properties.getKeepaliveTimeout(),
                properties.isKeepaliveWithoutCalls(),
                properties.getMaxInboundMessageSize());
    }

    public boolean tls() {
        return hasText(rootCert);
    }

    public boolean mutualTls() {
        return tls() && hasText(certChain) && hasText(privateKey);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
