package com.di.creatormatch.agent.search;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Search pipeline sizing.
 * <pre>
 * creatormatch:
 *   pipeline:
 *     pool-size: 200
 *     pre-filter-k: 15
 *     verify-cap: 15
 *     timeout-seconds: 60
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "creatormatch.pipeline")
public class PipelineProperties {

    /** Candidates pulled from the store per search. */
    private int poolSize = 200;

    /** Candidates kept by the pre-filter for verification. */
    private int preFilterK = 15;

    /** External metrics calls allowed per search. */
    private int verifyCap = 15;

    /** Deadline for one search, after which verification workers are abandoned. */
    private long timeoutSeconds = 60;
}
