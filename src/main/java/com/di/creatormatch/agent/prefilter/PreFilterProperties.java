package com.di.creatormatch.agent.prefilter;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Heuristic weights for choosing which candidates are worth verification budget.
 *
 * <pre>
 * creatormatch:
 *   prefilter:
 *     metrics-pass-bonus: 3.0
 *     metrics-missing-bonus: 1.5
 *     niche-match-bonus: 2.0
 *     exclude-penalty: 5.0
 *     size-range-bonus: 0.5
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "creatormatch.prefilter")
public class PreFilterProperties {

    /** Known metrics already clear every threshold the query sets. */
    private double metricsPassBonus = 3.0;

    /** Metrics missing, incomplete or stale: verifying may reveal a good fit. */
    private double metricsMissingBonus = 1.5;

    /** Tags intersect the campaign niche (or its aliases) or topic keywords. */
    private double nicheMatchBonus = 2.0;

    /** Tags intersect excluded niches, or a competitor ambassador when the campaign excludes them. */
    private double excludePenalty = 5.0;

    /** Known follower count inside the preferred range. */
    private double sizeRangeBonus = 0.5;
}
