package com.github.salilvnair.vllmadapter.config;

import com.github.salilvnair.vllmadapter.llm.client.GenerationServiceClient;
import com.github.salilvnair.vllmadapter.llm.client.GrpcGenerationServiceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds gRPC clients and caches one per distinct {@link ChannelSettings}.
 */
@Slf4j
public class GenerationServiceClientFactory implements DisposableBean {

    private final GrpcChannelFactory channelFactory;
    private final Map<ChannelSettings, GrpcGenerationServiceClient> clients = new ConcurrentHashMap<>();

    public GenerationServiceClientFactory(GrpcChannelFactory channelFactory) {
        this.channelFactory = channelFactory;
    }

    public GenerationServiceClient getClient(VllmClientProperties properties) {
        return getClient(ChannelSettings.from(properties));
    }

    public GenerationServiceClient getClient(ChannelSettings settings) {
        return clients.computeIfAbsent(settings,
                s -> new GrpcGenerationServiceClient(channelFactory.create(s)));
    }

    @Override
    public void destroy() {
        log.debug("[GenerationServiceClientFactory] closing {} client(s)", clients.size());
        clients.values().forEach(GrpcGenerationServiceClient::close);
        clients.clear();
    }
}
