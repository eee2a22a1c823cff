package com.licensewatch.obits.reconcile.http;

import com.licensewatch.obits.config.ReconcilerProperties;
import com.licensewatch.obits.reconcile.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Single-attempt HTTP GET with a global cap on in-flight requests. Transport failures are
 * reported through {@link HttpFetchResult#errorCode()} rather than thrown; retry policy
 * belongs to the caller.
 */
@Service
public class PoliteHttpClient {
    public static final String INVALID_URL = "invalid_url";
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String INTERRUPTED = "interrupted";
    public static final String HTTP_ERROR = "http_error";

    private final ReconcilerProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;

    public PoliteHttpClient(
        ReconcilerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, INVALID_URL, "URL missing host or malformed");
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.9")
                .header("Cache-Control", "no-cache")
                .header("Pragma", "no-cache");
            String referer = properties.getReferer();
            if (referer != null && !referer.isBlank()) {
                builder.header("Referer", referer);
            }

            HttpResponse<byte[]> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, HTTP_ERROR, e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
