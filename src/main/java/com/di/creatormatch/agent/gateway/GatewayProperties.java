package com.di.creatormatch.agent.gateway;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binding for the metrics provider client.
 *
 * <pre>
 * creatormatch:
 *   gateway:
 *     base-url: https://api.example-metrics.com/v1
 *     api-key: ${METRICS_PROVIDER_API_KEY:}
 *     connect-timeout-ms: 5000
 *     read-timeout-ms: 30000
 *     lookup-limit: 10
 *     retry:
 *       max-retries: 3
 *       base-delay-ms: 1000
 *       max-delay-ms: 30000
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "creatormatch.gateway")
public class GatewayProperties {

    // ------------------------------------------------------------------ //
    // Endpoint and credentials                                            //
    // ------------------------------------------------------------------ //

    private String baseUrl = "http://localhost:8089/v1";

    /** Bearer token; blank disables the Authorization header. */
    private String apiKey = "";

    private int connectTimeoutMs = 5_000;
    private int readTimeoutMs = 30_000;

    /** Results requested per text lookup. The provider caps this at 50. */
    private int lookupLimit = 10;

    // ------------------------------------------------------------------ //
    // Retry / backoff                                                     //
    // ------------------------------------------------------------------ //

    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private long baseDelayMs = 1_000;
        private long maxDelayMs = 30_000;
        private double jitterRatio = 0.1;
        private long minDelayMs = 100;
    }

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
                .maxRetries(retry.getMaxRetries())
                .baseDelay(Duration.ofMillis(retry.getBaseDelayMs()))
                .maxDelay(Duration.ofMillis(retry.getMaxDelayMs()))
                .jitterRatio(retry.getJitterRatio())
                .minDelay(Duration.ofMillis(retry.getMinDelayMs()))
                .build();
    }
}
