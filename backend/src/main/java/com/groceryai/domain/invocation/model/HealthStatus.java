package com.groceryai.domain.invocation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthStatus(
        String status,
        String modelId,
        Long latencyMs,
        String region,
        String error
) {
    public static HealthStatus healthy(String modelId, long latencyMs, String region) {
        return new HealthStatus("healthy", modelId, latencyMs, region, null);
    }

    public static HealthStatus unhealthy(String modelId, String region, String error) {
        return new HealthStatus("unhealthy", modelId, null, region, error);
    }

    public boolean isHealthy() {
        return "healthy".equals(status);
    }
}
