package com.rebalancer.leaderboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebalancer.concurrent.TimedCallExecutor;
import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.exception.SourceUnavailableException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link LeaderboardSource} backed by the leaderboard HTTP API.
 *
 * <p>Request: {@code POST <api-url>} with a bearer token and body
 * {@code {"indexId": ..., "algoId": ..., "momDay": "yyyy-MM-dd"}}, where momDay is the most
 * recent Sunday strictly before today.
 *
 * <p>The API answers either with a JSON array or with an object wrapping the array in one
 * of {@code data}, {@code results}, {@code symbols} or {@code stocks}. Array items are
 * plain strings or objects carrying the symbol in {@code symbol}, {@code ticker},
 * {@code stock} or {@code code}.
 *
 * <p>The whole request runs under {@code rebalancer.leaderboard.timeout} on the leaderboard
 * call pool; the RestTemplate's connect and read timeouts only bound single socket waits.
 */
@Component
public class HttpLeaderboardClient implements LeaderboardSource {

    private static final Logger log = LoggerFactory.getLogger(HttpLeaderboardClient.class);

    private static final List<String> LIST_FIELDS = List.of("data", "results", "symbols", "stocks");
    private static final List<String> SYMBOL_FIELDS = List.of("symbol", "ticker", "stock", "code");

    private final RestTemplate restTemplate;
    private final RebalancerProperties.Leaderboard leaderboardProperties;
    private final TimedCallExecutor leaderboardCallExecutor;

    public HttpLeaderboardClient(
            RestTemplate leaderboardRestTemplate,
            RebalancerProperties rebalancerProperties,
            @Qualifier("leaderboardCallExecutor") TimedCallExecutor leaderboardCallExecutor) {
        this.restTemplate = leaderboardRestTemplate;
        this.leaderboardProperties = rebalancerProperties.getLeaderboard();
        this.leaderboardCallExecutor = leaderboardCallExecutor;
    }

    @Override
    public List<String> fetchTopN(String indexId, int n) {
        String apiUrl = leaderboardProperties.getApiUrl();
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new SourceUnavailableException("Leaderboard API URL is not configured");
        }

        String momDay = previousSunday(LocalDate.now()).toString();
        Map<String, String> body = Map.of(
                "indexId", indexId,
                "algoId", leaderboardProperties.getAlgoId(),
                "momDay", momDay);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (leaderboardProperties.getApiToken() != null && !leaderboardProperties.getApiToken().isBlank()) {
            headers.setBearerAuth(leaderboardProperties.getApiToken());
        }

        log.info("Fetching top {} symbols for index {} with momDay={}", n, indexId, momDay);
        JsonNode response = leaderboardCallExecutor.call("fetchTopN", () -> {
            try {
                return restTemplate.postForObject(apiUrl, new HttpEntity<>(body, headers), JsonNode.class);
            } catch (RestClientException e) {
                throw new SourceUnavailableException("Leaderboard request failed: " + e.getMessage(), e);
            }
        });

        List<String> symbols = parseSymbols(response, n);
        if (symbols.size() < n) {
            log.warn("Only received {} symbols for index {}, expected {}", symbols.size(), indexId, n);
        }
        log.info("Retrieved {} symbols for index {}: {}", symbols.size(), indexId, symbols);
        return symbols;
    }

    List<String> parseSymbols(JsonNode response, int n) {
        if (response == null) {
            throw new SourceUnavailableException("Leaderboard returned an empty body");
        }

        JsonNode items = response;
        if (response.isObject()) {
            items = null;
            for (String field : LIST_FIELDS) {
                JsonNode candidate = response.get(field);
                if (candidate != null && candidate.isArray() && !candidate.isEmpty()) {
                    items = candidate;
                    break;
                }
            }
            if (items == null) {
                items = response.path("stocks");
            }
        }
        if (!items.isArray()) {
            throw new SourceUnavailableException("Unexpected leaderboard response format: " + response.getNodeType());
        }

        // Only the first n entries count; entries without a symbol are dropped, not replaced
        List<String> symbols = new ArrayList<>();
        for (int i = 0; i < Math.min(n, items.size()); i++) {
            JsonNode item = items.get(i);
            String symbol = extractSymbol(item);
            if (symbol != null && !symbol.isBlank()) {
                symbols.add(symbol.trim().toUpperCase());
            }
        }
        return symbols;
    }

    private String extractSymbol(JsonNode item) {
        if (item.isTextual()) {
            return item.asText();
        }
        if (item.isObject()) {
            for (String field : SYMBOL_FIELDS) {
                JsonNode value = item.get(field);
                if (value != null && !value.isNull() && !value.asText().isBlank()) {
                    return value.asText();
                }
            }
        }
        return null;
    }

    /** Most recent Sunday strictly before {@code today}. */
    public static LocalDate previousSunday(LocalDate today) {
        return today.with(TemporalAdjusters.previous(DayOfWeek.SUNDAY));
    }
}
