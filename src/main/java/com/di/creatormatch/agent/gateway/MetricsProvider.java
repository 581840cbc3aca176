package com.di.creatormatch.agent.gateway;

import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.agent.gateway.dto.MediaKit;
import com.di.creatormatch.agent.gateway.dto.MediaKitSummary;

import java.util.List;

/**
 * Raw access to the external metrics provider. One method call is one HTTP request; retries are
 * layered on top by {@link MetricsGateway}.
 */
public interface MetricsProvider {

    /**
     * Looks up profiles by free text.
     *
     * @param limit result cap (the provider accepts at most 50)
     */
    List<MediaKitSummary> lookupByText(Platform platform, String query, int limit) throws MetricsProviderException;

    /**
     * Fetches the full media kit for a direct-fetch token.
     *
     * @throws MetricsProviderException with status 404 when no profile exists for the token
     */
    MediaKit fetchDetail(Platform platform, String token) throws MetricsProviderException;
}
