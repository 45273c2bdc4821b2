package com.product.curation.tracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link PageFetcher} on top of the JDK {@link HttpClient}. Redirects are followed; both the
 * connection and the whole request are bounded by the configured timeout.
 *
 * <pre>
 * PageFetcher fetcher = HttpPageFetcher.builder()
 *     .timeout(Duration.ofSeconds(30))
 *     .userAgent("product-curation/1.0")
 *     .build();
 * </pre>
 */
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; product-curation/1.0; +update-tracker)";

    private final Duration timeout;
    private final String userAgent;
    private final HttpClient httpClient;

    private HttpPageFetcher(Builder builder) {
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.userAgent = builder.userAgent != null ? builder.userAgent : DEFAULT_USER_AGENT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String fetch(String url) throws PageFetchException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new PageFetchException(url, "Invalid URL: " + url, e);
        }
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new PageFetchException(url, "HTTP " + status + " from " + url);
            }
            log.debug("tracker.fetched url={} status={} bytes={}", url, status, response.body().length());
            return response.body();
        } catch (HttpTimeoutException e) {
            throw new PageFetchException(url, "Timed out after " + timeout.toSeconds() + "s fetching " + url, e);
        } catch (IOException e) {
            throw new PageFetchException(url, "I/O error fetching " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException(url, "Interrupted while fetching " + url, e);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration timeout;
        private String userAgent;

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public HttpPageFetcher build() {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            return new HttpPageFetcher(this);
        }
    }
}
