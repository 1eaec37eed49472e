package com.marketdata.jobs.client;

import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.domain.DailyBar;
import com.marketdata.jobs.exception.ProviderException;
import com.marketdata.jobs.exception.UpstreamAuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Thin client over the external prices API.
 * HTTP errors become {@link ProviderException} carrying the status code;
 * timeouts and connection failures carry no status.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RestMarketDataProvider implements MarketDataProvider {

    private final RestTemplate restTemplate;
    private final JobsProperties properties;

    @Override
    public void preWarmToken() {
        String url = properties.getUpstream().getBaseUrl() + "/auth/token/refresh";
        try {
            restTemplate.postForEntity(url, null, Void.class);
            log.info("Upstream token pre-warmed");
        } catch (HttpStatusCodeException e) {
            throw new UpstreamAuthException("Token refresh rejected with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new UpstreamAuthException("Token refresh failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<DailyBar> fetchDailyBars(String symbol, LocalDate start, LocalDate end) {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getUpstream().getBaseUrl() + "/prices/daily")
                .queryParam("symbol", symbol)
                .queryParam("start", start)
                .queryParam("end", end)
                .toUriString();

        log.debug("Calling prices API: {}", url);
        try {
            DailyBar[] response = restTemplate.getForObject(url, DailyBar[].class);
            if (response == null) {
                return Collections.emptyList();
            }
            return Arrays.asList(response);

        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 404) {
                // unknown symbol or no data for the range
                return Collections.emptyList();
            }
            throw new ProviderException("HTTP " + status + " for " + symbol, status, e);

        } catch (ResourceAccessException e) {
            throw new ProviderException("I/O error for " + symbol + ": " + e.getMessage(), null, e);

        } catch (RestClientException e) {
            throw new ProviderException("Unexpected response for " + symbol + ": " + e.getMessage(), null, e);
        }
    }
}
