package com.github.salilvnair.vllmadapter.config;

import com.github.salilvnair.vllmadapter.exception.LlmErrorClassifier;
import com.github.salilvnair.vllmadapter.grpc.fmaas.Parameters;
import com.github.salilvnair.vllmadapter.llm.client.GenerationServiceClient;
import com.github.salilvnair.vllmadapter.llm.core.VllmLanguageModel;
import com.github.salilvnair.vllmadapter.llm.model.ExecutionOptions;
import com.github.salilvnair.vllmadapter.llm.model.VllmOutput;
import com.github.salilvnair.vllmadapter.llm.parameter.DecodingParameterResolver;
import com.github.salilvnair.vllmadapter.snapshot.SnapshotRegistry;
import com.github.salilvnair.vllmadapter.snapshot.VllmModelSnapshot;
import com.github.salilvnair.vllmadapter.snapshot.VllmOutputSnapshot;
import com.github.salilvnair.vllmadapter.util.JsonUtil;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({VllmClientProperties.class, VllmModelProperties.class})
public class VllmAdapterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GrpcChannelFactory vllmGrpcChannelFactory() {
        return new GrpcChannelFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerationServiceClientFactory vllmGenerationServiceClientFactory(GrpcChannelFactory channelFactory) {
        return new GenerationServiceClientFactory(channelFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerationServiceClient vllmGenerationServiceClient(GenerationServiceClientFactory clientFactory,
                                                               VllmClientProperties clientProperties) {
        return clientFactory.getClient(clientProperties);
    }

    @Bean
    @ConditionalOnMissingBean
    public LlmErrorClassifier llmErrorClassifier() {
        return new LlmErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public DecodingParameterResolver decodingParameterResolver() {
        return new DecodingParameterResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "vllm.model", name = "model-id")
    public VllmLanguageModel vllmLanguageModel(VllmModelProperties modelProperties,
                                               ObjectProvider<GenerationServiceClient> clients,
                                               DecodingParameterResolver parameterResolver,
                                               LlmErrorClassifier errorClassifier) {
        return VllmLanguageModel.builder()
                .modelId(modelProperties.getModelId())
                .parameters(JsonUtil.mapToProto(modelProperties.getParameters(), Parameters.newBuilder()).build())
                .executionOptions(new ExecutionOptions(modelProperties.getMaxRetries()))
                .clientProvider(clients::getObject)
                .parameterResolver(parameterResolver)
                .errorClassifier(errorClassifier)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotRegistry snapshotRegistry(ObjectProvider<GenerationServiceClient> clients,
                                             DecodingParameterResolver parameterResolver,
                                             LlmErrorClassifier errorClassifier) {
        return new SnapshotRegistry()
                .register("VllmOutput", VllmOutput.class, VllmOutputSnapshot.class, VllmOutput::empty)
                .register("VllmLanguageModel", VllmLanguageModel.class, VllmModelSnapshot.class,
                        () -> VllmLanguageModel.builder()
                                .clientProvider(clients::getObject)
                                .parameterResolver(parameterResolver)
                                .errorClassifier(errorClassifier)
                                .build());
    }
}
