package com.github.salilvnair.vllmadapter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the generation service.
 *
 * vllm:
 *   client:
 *     url: vllm.example.com:443
 *     credentials:
 *       root-cert: |
 *         -----BEGIN CERTIFICATE-----
 *       cert-chain: ...
 *       private-key: ...
 *     keepalive-time: 25s
 *
 * Credentials hold PEM content, not file paths. Without a root certificate the channel is
 * plaintext; with a certificate chain and private key it is mutual TLS.
 */
@ConfigurationProperties(prefix = "vllm.client")
@Getter
@Setter
public class VllmClientProperties {

    private String url = "localhost:8033";
    private Credentials credentials = new Credentials();
    private Duration keepaliveTime = Duration.ofSeconds(25);
    private Duration keepaliveTimeout = Duration.ofSeconds(20);
    private boolean keepaliveWithoutCalls = true;
    private int maxInboundMessageSize = 32 * 1024 * 1024;

    @Getter
    @Setter
    public static class Credentials {
        private String rootCert;
        private String certChain;
        private String privateKey;
    }
}
