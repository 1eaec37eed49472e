package com.marketdata.jobs.client;

import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.exception.ProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * REST adapter for the analytics, quote and universe endpoints of the
 * companion services. Each call is a blocking POST returning a record count.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RestAnalyticsClient implements AnalyticsClient, QuoteRefreshClient, UniverseClient {

    private final RestTemplate restTemplate;
    private final JobsProperties properties;

    @Override
    public long compute(String computation) {
        return post(properties.getAnalytics().getBaseUrl() + "/compute/" + computation);
    }

    @Override
    public long refreshQuotes() {
        return post(properties.getUpstream().getBaseUrl() + "/quotes/refresh");
    }

    @Override
    public long refreshUniverse() {
        return post(properties.getUpstream().getBaseUrl() + "/universe/refresh");
    }

    @SuppressWarnings("unchecked")
    private long post(String url) {
        log.debug("POST {}", url);
        try {
            Map<String, Object> body = restTemplate.postForObject(url, null, Map.class);
            Object count = body != null ? body.get("records") : null;
            return count instanceof Number ? ((Number) count).longValue() : 0L;
        } catch (HttpStatusCodeException e) {
            throw new ProviderException("POST " + url + " failed with HTTP " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new ProviderException("POST " + url + " failed: " + e.getMessage(), null, e);
        }
    }
}
