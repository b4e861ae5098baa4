package com.propertyintel.leads.service;

import com.propertyintel.leads.config.LeadRadarProperties;
import com.propertyintel.leads.model.RealiePage;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Thin client over the Realie public property search API.
 *
 * Pages through results until maxRecords are collected or the API runs out.
 * A failed page fails the whole pull; Resilience4j retries it from the start
 * (instance "realieApi").
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RealieApiClient implements RawPropertySource {

    private final RestTemplate restTemplate;
    private final LeadRadarProperties properties;

    @Override
    @Retry(name = "realieApi")
    public List<Map<String, Object>> fetchAll(int maxRecords) {
        int pageSize = Math.max(1, properties.getRealie().getPageSize());
        List<Map<String, Object>> collected = new ArrayList<>();
        int offset = 0;

        while (collected.size() < maxRecords) {
            int remaining = maxRecords - collected.size();
            List<Map<String, Object>> chunk = fetchPage(Math.min(pageSize, remaining), offset);
            if (chunk.isEmpty()) break;

            collected.addAll(chunk.subList(0, Math.min(chunk.size(), remaining)));
            offset += chunk.size();

            if (chunk.size() < pageSize) break;
        }

        log.info("Pulled {} properties from Realie (max {})", collected.size(), maxRecords);
        return collected;
    }

    /**
     * Fetch a single page.
     *
     * @return the page's records (may be empty, never null)
     */
    public List<Map<String, Object>> fetchPage(int limit, int offset) {
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getRealie().getBaseUrl())
                .queryParam("limit", limit)
                .queryParam("offset", offset)
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, properties.getRealie().getApiKey());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        log.debug("Calling Realie API: {}", url);
        try {
            RealiePage page = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), RealiePage.class)
                    .getBody();
            if (page == null || page.getProperties() == null) {
                return Collections.emptyList();
            }
            log.debug("Realie returned {} properties for offset {}", page.getProperties().size(), offset);
            return page.getProperties();

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by Realie API at offset {}", offset);
            throw e;

        } catch (Exception e) {
            log.error("Realie API call failed for URL {}: {}", url, e.getMessage());
            throw e;
        }
    }
}
