package com.di.creatormatch.agent.gateway;

import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.agent.gateway.dto.MediaKit;
import com.di.creatormatch.agent.gateway.dto.MediaKitSummary;
import com.di.creatormatch.agent.gateway.dto.ProviderResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Clock;
import java.util.Collections;
import java.util.List;

/**
 * {@link MetricsProvider} over HTTP using a dedicated {@link RestTemplate}.
 * <ul>
 *   <li>{@code GET {base}/media-kits?platform_type=&search=&limit=}</li>
 *   <li>{@code GET {base}/media-kits/{platform}/{token}}</li>
 * </ul>
 * Authenticates with {@code Authorization: Bearer <api-key>}.
 */
@Slf4j
@Component
public class RestMetricsProvider implements MetricsProvider {

    static final int MAX_LOOKUP_LIMIT = 50;

    private static final ParameterizedTypeReference<ProviderResponse<List<MediaKitSummary>>> LOOKUP_TYPE =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<ProviderResponse<MediaKit>> DETAIL_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestTemplate restTemplate;
    private final GatewayProperties properties;
    private final Clock clock;

    public RestMetricsProvider(@Qualifier("metricsRestTemplate") RestTemplate restTemplate,
                               GatewayProperties properties,
                               Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<MediaKitSummary> lookupByText(Platform platform, String query, int limit) throws MetricsProviderException {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/media-kits")
                .queryParam("platform_type", platform.getCode())
                .queryParam("search", query)
                .queryParam("limit", Math.max(1, Math.min(limit, MAX_LOOKUP_LIMIT)))
                .encode()
                .build()
                .toUri();
        ProviderResponse<List<MediaKitSummary>> body = exchange(uri, LOOKUP_TYPE, "lookup '" + query + "'");
        if (body == null || body.getResponse() == null) return Collections.emptyList();
        return body.getResponse();
    }

    @Override
    public MediaKit fetchDetail(Platform platform, String token) throws MetricsProviderException {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/media-kits/{platform}/{token}")
                .buildAndExpand(platform.getCode(), token)
                .encode()
                .toUri();
        ProviderResponse<MediaKit> body = exchange(uri, DETAIL_TYPE, "detail " + token);
        if (body == null || body.getResponse() == null) {
            throw MetricsProviderException.notFound("Empty media kit for token " + token);
        }
        return body.getResponse();
    }

    private <T> T exchange(URI uri, ParameterizedTypeReference<T> type, String what) throws MetricsProviderException {
        try {
            ResponseEntity<T> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers()), type);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            String retryAfter = e.getResponseHeaders() != null ? e.getResponseHeaders().getFirst(HttpHeaders.RETRY_AFTER) : null;
            log.debug("[GATEWAY] {} returned HTTP {}", what, status);
            throw MetricsProviderException.http(status, "Metrics provider " + what + " failed with HTTP " + status,
                    RetryAfterParser.parse(retryAfter, clock));
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw MetricsProviderException.timeout("Metrics provider " + what + " timed out", e);
            }
            throw MetricsProviderException.network("Metrics provider " + what + " unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw MetricsProviderException.network("Metrics provider " + what + " failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }
        return headers;
    }
}
