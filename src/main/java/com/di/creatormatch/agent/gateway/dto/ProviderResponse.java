package com.di.creatormatch.agent.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Envelope used by every metrics provider endpoint: {@code {"response": ..., "metadata": {...}}}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderResponse<T> {
    private T response;
    private Map<String, Object> metadata;
}
