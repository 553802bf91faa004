package com.github.salilvnair.vllmadapter.config;

import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.TlsChannelCredentials;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

@Slf4j
public class GrpcChannelFactory {

    public ManagedChannel create(ChannelSettings settings) {
        log.debug("[GrpcChannelFactory] creating channel target={} tls={} mtls={}",
                settings.url(), settings.tls(), settings.mutualTls());
        return Grpc.newChannelBuilder(settings.url(), credentials(settings))
                .keepAliveTime(settings.keepaliveTime().toMillis(), TimeUnit.MILLISECONDS)
                .keepAliveTimeout(settings.keepaliveTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .keepAliveWithoutCalls(settings.keepaliveWithoutCalls())
                .maxInboundMessageSize(settings.maxInboundMessageSize())
                .build();
    }

    private ChannelCredentials credentials(ChannelSettings settings) {
        if (!settings.tls()) {
            return InsecureChannelCredentials.create();
        }
        try {
            TlsChannelCredentials.Builder builder = TlsChannelCredentials.newBuilder()
                    .trustManager(pem(settings.rootCert()));
            if (settings.mutualTls()) {
                builder.keyManager(pem(settings.certChain()), pem(settings.privateKey()));
            }
            return builder.build();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read TLS credentials for " + settings.url(), e);
        }
    }

    private static InputStream pem(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
