package com.di.creatormatch.agent.verification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * <pre>
 * creatormatch:
 *   verification:
 *     freshness-hours: 24
 *     max-concurrency: 5
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "creatormatch.verification")
public class VerificationProperties {

    /** Cached metrics younger than this skip the metrics provider. */
    private long freshnessHours = 24;

    /** Verification calls in flight at once. */
    private int maxConcurrency = 5;
}
