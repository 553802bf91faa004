package com.github.salilvnair.vllmadapter.config;

import io.grpc.ManagedChannel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrpcChannelFactoryTest {

    private final GrpcChannelFactory factory = new GrpcChannelFactory();

    @Test
    void plaintextChannelTargetsConfiguredUrl() {
        VllmClientProperties properties = new VllmClientProperties();
        properties.setUrl("localhost:18033");

        ManagedChannel channel = factory.create(ChannelSettings.from(properties));
        try {
            assertEquals("localhost:18033", channel.authority());
            assertFalse(channel.isShutdown());
        } finally {
            channel.shutdownNow();
        }
        assertTrue(channel.isShutdown());
    }
}
