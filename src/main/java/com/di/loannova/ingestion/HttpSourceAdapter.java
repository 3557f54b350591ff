package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.exception.CircuitOpenException;
import com.di.loannova.exception.PipelineException;
import com.di.loannova.exception.TransientNetworkException;
import com.di.loannova.observability.ObservabilityContext;
import com.di.loannova.resilience.CircuitBreaker;
import com.di.loannova.resilience.RateLimiter;
import com.di.loannova.resilience.RetryPolicy;
import com.di.loannova.resilience.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.function.UnaryOperator;

/**
 * Loan tape served over HTTP GET.
 *
 * <p>Each fetch is one breaker-guarded call: the breaker admits or rejects it once, then the
 * retry policy drives the attempts, each throttled by the rate limiter. Timeouts, I/O errors,
 * 5xx and 429 are transient; other 4xx fail at once. Exhausted retries or a terminal error
 * count as a single breaker failure. The breaker, limiter and retry state belong to this
 * adapter instance.
 */
@Slf4j
@Component
public class HttpSourceAdapter implements SourceAdapter {

    private final RestClient restClient;
    private final TabularParser parser;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final UnaryOperator<String> env;

    @Autowired
    public HttpSourceAdapter(RestClient.Builder builder, TabularParser parser, PipelineProperties properties,
                             Clock clock, Sleeper sleeper) {
        this(builder.requestFactory(requestFactory(properties.getSource().getTimeoutSeconds())).build(),
                parser, properties.getHttp(), clock, sleeper, System::getenv);
    }

    HttpSourceAdapter(RestClient restClient, TabularParser parser, PipelineProperties.Http http,
                      Clock clock, Sleeper sleeper, UnaryOperator<String> env) {
        this.restClient = restClient;
        this.parser = parser;
        this.retryPolicy = new RetryPolicy(http.getMaxRetries(), http.getBackoffSeconds(), http.getJitterSeconds(),
                sleeper, new Random());
        this.circuitBreaker = new CircuitBreaker("http-source", http.getFailureThreshold(),
                Duration.ofSeconds(http.getResetSeconds()), clock);
        this.rateLimiter = new RateLimiter(http.getMaxRequestsPerMinute(), clock, sleeper);
        this.env = env;
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutSeconds) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(timeoutSeconds));
        factory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));
        return factory;
    }

    @Override
    public String type() {
        return "http";
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public RawExtract fetch(PipelineProperties.Source source, ObservabilityContext ctx) {
        String url = source.getUrl();
        if (url == null || url.isBlank()) {
            throw new PipelineException("No source url configured for source type 'http'");
        }
        ctx.event("ingestion", "http_start", "initiated", Map.of("url", url));

        try {
            circuitBreaker.acquirePermission();
        } catch (CircuitOpenException e) {
            if (ctx.metrics() != null) ctx.metrics().recordCircuitRejection();
            log.warn("[HTTP] GET {} rejected: circuit '{}' is open", url, e.getBreakerName());
            throw e;
        }

        ResponseEntity<byte[]> response;
        try {
            response = retryPolicy.execute("GET " + url, () -> {
                rateLimiter.acquire();
                return get(url, source);
            }, () -> {
                if (ctx.metrics() != null) ctx.metrics().recordHttpRetry();
            });
            circuitBreaker.recordSuccess();
        } catch (RuntimeException e) {
            circuitBreaker.recordFailure();
            ctx.event("ingestion", "http_failed", "error", Map.of("url", url, "error", String.valueOf(e.getMessage())));
            throw e;
        }

        byte[] body = response.getBody() == null ? new byte[0] : response.getBody();
        MediaType mediaType = response.getHeaders().getContentType();
        String contentType = mediaType == null ? "" : mediaType.toString();
        RawExtract extract = RawExtract.of(type(), url, fileName(url, contentType), contentType, body);
        log.info("[HTTP] GET {} -> {} bytes (sha256={})", url, body.length, extract.sha256());
        return extract;
    }

    @Override
    public Dataset parse(RawExtract extract, PipelineProperties.Source source, ObservabilityContext ctx) {
        Dataset dataset = parser.parseResponse(extract.content(), extract.contentType());
        ctx.event("ingestion", "http_parsed", "success", Map.of("rows", dataset.size(), "checksum", extract.sha256()));
        return dataset;
    }

    private ResponseEntity<byte[]> get(String url, PipelineProperties.Source source) {
        try {
            return restClient.get()
                    .uri(URI.create(url))
                    .headers(h -> applyHeaders(h, source))
                    .retrieve()
                    .toEntity(byte[].class);
        } catch (HttpServerErrorException e) {
            throw new TransientNetworkException("HTTP " + e.getStatusCode().value() + " from " + url, e);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new TransientNetworkException("HTTP 429 (throttled) from " + url, e);
            }
            throw new PipelineException("HTTP " + e.getStatusCode().value() + " from " + url, e);
        } catch (ResourceAccessException e) {
            throw new TransientNetworkException("I/O error calling " + url + ": " + e.getMessage(), e);
        }
    }

    private void applyHeaders(HttpHeaders headers, PipelineProperties.Source source) {
        source.getHeaders().forEach(headers::set);
        String tokenEnv = source.getAuthTokenEnv();
        if (tokenEnv != null && !tokenEnv.isBlank()) {
            String token = env.apply(tokenEnv);
            if (token != null && !token.isBlank()) {
                headers.setBearerAuth(token);
            }
        }
    }

    static String fileName(String url, String contentType) {
        String path = URI.create(url).getPath();
        String last = path == null ? "" : path.substring(path.lastIndexOf('/') + 1);
        if (last.isBlank()) {
            last = "http_response";
        }
        if (last.indexOf('.') < 0) {
            String ct = contentType == null ? "" : contentType.toLowerCase();
            last += ct.contains("json") ? ".json" : ct.contains("csv") ? ".csv" : "";
        }
        return last;
    }
}
