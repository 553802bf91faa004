package com.github.salilvnair.vllmadapter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default model bound under {@code vllm.model}. {@code parameters} follows the proto JSON mapping
 * of {@code fmaas.Parameters}; use bracket notation for snake_case keys in properties files,
 * e.g. {@code vllm.model.parameters.stopping.[max_new_tokens]=200}.
 */
@ConfigurationProperties(prefix = "vllm.model")
@Getter
@Setter
public class VllmModelProperties {

    private String modelId;
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private Integer maxRetries;
}
