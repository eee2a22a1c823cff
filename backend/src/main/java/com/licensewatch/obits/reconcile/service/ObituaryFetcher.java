package com.licensewatch.obits.reconcile.service;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.licensewatch.obits.config.ReconcilerProperties;
import com.licensewatch.obits.reconcile.http.PoliteHttpClient;
import com.licensewatch.obits.reconcile.model.Candidate;
import com.licensewatch.obits.reconcile.model.FetchFailureKind;
import com.licensewatch.obits.reconcile.model.FetchOutcome;
import com.licensewatch.obits.reconcile.model.HttpFetchResult;
import com.licensewatch.obits.reconcile.model.ObituaryEntry;
import com.licensewatch.obits.reconcile.model.ObituaryNameRecord;
import com.licensewatch.obits.reconcile.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs one obituary search per candidate against the remote search endpoint.
 *
 * <p>429 responses back off exponentially and end the run once retries are exhausted. A 403
 * or a challenge page ends the run immediately. Every other failure is retried after a short
 * fixed delay and then reported as a soft failure, which callers treat as "no results".
 */
@Service
public class ObituaryFetcher {
    private static final Logger log = LoggerFactory.getLogger(ObituaryFetcher.class);
    private static final String ACCEPT = "application/json, */*";

    private final ReconcilerProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ObituaryFetcher(ReconcilerProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public FetchOutcome fetch(Candidate candidate) {
        String url = buildSearchUrl(candidate.firstName(), candidate.lastName());
        if (!sleepJitter()) {
            return FetchOutcome.softFailure(candidate, ReasonCodeClassifier.INTERRUPTED);
        }

        ReconcilerProperties.Fetch fetch = properties.getFetch();
        int maxAttempts = fetch.getMaxAttempts();
        String lastReason = ReasonCodeClassifier.UNKNOWN;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            HttpFetchResult result = httpClient.get(url, ACCEPT);
            boolean lastAttempt = attempt + 1 >= maxAttempts;

            if (PoliteHttpClient.INTERRUPTED.equals(result.errorCode())) {
                return FetchOutcome.softFailure(candidate, ReasonCodeClassifier.INTERRUPTED);
            }
            if (result.statusCode() == 429) {
                if (lastAttempt) {
                    log.warn("Rate limited (429) for {}; retries exhausted after {} attempts", candidate.displayName(), maxAttempts);
                    return FetchOutcome.hardFailure(
                        candidate,
                        FetchFailureKind.RATE_LIMITED,
                        "Rate limited - max retries exceeded for " + candidate.displayName()
                    );
                }
                long waitMs = backoffMillis(fetch.getRateLimitBackoffBaseMs(), attempt);
                log.warn("Rate limited (429) for {}, waiting {}ms", candidate.displayName(), waitMs);
                if (!sleep(waitMs)) {
                    return FetchOutcome.softFailure(candidate, ReasonCodeClassifier.INTERRUPTED);
                }
                continue;
            }
            if (result.statusCode() == 403) {
                log.warn("Blocked (403) for {}", candidate.displayName());
                return FetchOutcome.hardFailure(
                    candidate,
                    FetchFailureKind.BLOCKED,
                    ReasonCodeClassifier.HTTP_403_BLOCKED + ": blocked by server while searching " + candidate.displayName()
                );
            }
            if (ReasonCodeClassifier.isChallenge(result.body())) {
                log.warn("Captcha detected for {}", candidate.displayName());
                return FetchOutcome.hardFailure(
                    candidate,
                    FetchFailureKind.BLOCKED,
                    ReasonCodeClassifier.CAPTCHA_CHALLENGE + ": captcha required while searching " + candidate.displayName()
                );
            }

            if (result.isSuccessful()) {
                try {
                    return FetchOutcome.success(candidate, parseEntries(result.body()));
                } catch (JsonProcessingException e) {
                    lastReason = ReasonCodeClassifier.PARSING_FAILED;
                    log.warn(
                        "Unparsable search response for {} (attempt {}, content type {}): {}",
                        candidate.displayName(),
                        attempt + 1,
                        result.contentType(),
                        e.getOriginalMessage()
                    );
                }
            } else {
                lastReason = ReasonCodeClassifier.fromResult(result);
                if (result.isTransportError()) {
                    log.warn(
                        "Request error for {} (attempt {}, {}ms): {} {}",
                        candidate.displayName(),
                        attempt + 1,
                        elapsedMillis(result),
                        result.errorCode(),
                        result.errorMessage()
                    );
                } else {
                    log.warn("HTTP {} for {} (attempt {}, {}ms)", result.statusCode(), candidate.displayName(), attempt + 1, elapsedMillis(result));
                }
            }

            if (!lastAttempt && !sleep(fetch.getTransientRetryDelayMs())) {
                return FetchOutcome.softFailure(candidate, ReasonCodeClassifier.INTERRUPTED);
            }
        }
        log.warn("Giving up on {} after {} attempts ({}); treating as not found", candidate.displayName(), maxAttempts, lastReason);
        return FetchOutcome.softFailure(candidate, lastReason);
    }

    String buildSearchUrl(String firstName, String lastName) {
        ReconcilerProperties.Search search = properties.getSearch();
        return search.getBaseUrl()
            + "?countryIdList=" + encode(search.getCountryId())
            + "&endDate=" + encode(search.getEndDate())
            + "&firstName=" + encode(firstName)
            + "&keyword="
            + "&lastName=" + encode(lastName)
            + "&limit=" + search.getLimit()
            + "&noticeType=all"
            + "&regionIdList=" + encode(search.getRegionId())
            + "&session_id="
            + "&startDate=" + encode(search.getStartDate());
    }

    List<ObituaryEntry> parseEntries(String body) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(body == null ? "" : body);
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from((JsonParser) null, "search response is not a JSON object");
        }
        JsonNode results = root.path("searchResults");
        List<ObituaryEntry> entries = new ArrayList<>();
        if (!results.isArray()) {
            return entries;
        }
        for (JsonNode node : results) {
            JsonNode name = node.path("name");
            ObituaryNameRecord record = name.isObject()
                ? objectMapper.treeToValue(name, ObituaryNameRecord.class)
                : null;
            entries.add(new ObituaryEntry(
                textOrNull(node.get("id")),
                record,
                node.path("links").path("obituaryUrl").path("href").asText("")
            ));
        }
        return entries;
    }

    /**
     * {@code base * 2^attempt}, saturating at {@link Long#MAX_VALUE}.
     */
    static long backoffMillis(long base, int attempt) {
        if (base <= 0) {
            return 0L;
        }
        if (attempt >= Long.SIZE - 1) {
            return Long.MAX_VALUE;
        }
        try {
            return Math.multiplyExact(base, 1L << Math.max(0, attempt));
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static long elapsedMillis(HttpFetchResult result) {
        return result.duration() == null ? 0L : result.duration().toMillis();
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }

    private static String encode(String value) {
        String trimmed = value == null ? "" : value.trim();
        return URLEncoder.encode(trimmed, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private boolean sleepJitter() {
        ReconcilerProperties.Fetch fetch = properties.getFetch();
        int min = fetch.getJitterMinMs();
        int max = fetch.getJitterMaxMs();
        long delay = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1L) : min;
        return sleep(delay);
    }

    private boolean sleep(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
