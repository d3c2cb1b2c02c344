package com.regdoc.acquirer.crawl.http;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.detection.ResponseAnalyzer;
import com.regdoc.acquirer.crawl.identity.IdentityPool;
import com.regdoc.acquirer.crawl.identity.IdentityProtocol;
import com.regdoc.acquirer.crawl.identity.NetworkIdentity;
import com.regdoc.acquirer.crawl.model.DetectionOutcome;
import com.regdoc.acquirer.crawl.model.DetectionVerdict;
import com.regdoc.acquirer.crawl.model.HttpFetchResult;
import com.regdoc.acquirer.crawl.model.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class GuardedHttpClient {
    private static final Logger log = LoggerFactory.getLogger(GuardedHttpClient.class);

    private final AcquirerProperties properties;
    private final IdentityPool identityPool;
    private final ResponseAnalyzer responseAnalyzer;
    private final IdentityHttpClients httpClients;

    public GuardedHttpClient(
        AcquirerProperties properties,
        IdentityPool identityPool,
        ResponseAnalyzer responseAnalyzer,
        IdentityHttpClients httpClients
    ) {
        this.properties = properties;
        this.identityPool = identityPool;
        this.responseAnalyzer = responseAnalyzer;
        this.httpClients = httpClients;
    }

    public HttpFetchResult get(String url, String acceptHeader, OperationKind kind) {
        return send(url, "GET", acceptHeader, null, kind);
    }

    public HttpFetchResult postJson(String url, String jsonBody, String acceptHeader, OperationKind kind) {
        return send(url, "POST", acceptHeader, jsonBody == null ? "" : jsonBody, kind);
    }

    private HttpFetchResult send(String url, String method, String acceptHeader, String body, OperationKind kind) {
        identityPool.refreshIfStale();
        if (properties.getHttp().isPaceRequests() && !responseAnalyzer.pause(kind)) {
            return errorResult(url, Instant.now(), null, 0, "interrupted", "interrupted before request");
        }
        int maxAttempts = properties.getHttp().getMaxAttempts();
        NetworkIdentity identity = nextIdentity();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, method, acceptHeader, body, identity, attempt);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            boolean hostile = lastResult.verdict() != null && lastResult.verdict().isIdentityHostile();
            if (hostile || responseAnalyzer.shouldRotateIdentity()) {
                NetworkIdentity previous = identity;
                identity = nextIdentity();
                log.debug("Rotating identity {} -> {} for {}", previous, identity, url);
            }
            if (!responseAnalyzer.pause(OperationKind.RETRY)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private NetworkIdentity nextIdentity() {
        return identityPool
            .acquire(properties.getIdentityPool().isPreferPaid(), IdentityProtocol.HTTP_CLIENT_COMPATIBLE)
            .orElse(NetworkIdentity.direct());
    }

    private HttpFetchResult executeOnce(
        String url,
        String method,
        String acceptHeader,
        String body,
        NetworkIdentity identity,
        int attempt
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, identity, attempt, "invalid_url", "URL missing host or malformed");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getTimeouts().getRequestSeconds()))
                .header("User-Agent", randomUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", properties.getHttp().getAcceptLanguage());
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<String> response = httpClients.clientFor(identity)
                .send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            Duration duration = Duration.between(startedAt, Instant.now());
            DetectionOutcome outcome = responseAnalyzer.classify(
                response.statusCode(),
                response.headers().map(),
                response.body(),
                duration,
                host
            );
            reportToPool(identity, outcome.verdict(), duration);
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                duration,
                identity.name(),
                outcome.verdict(),
                attempt,
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            identityPool.reportFailure(identity);
            return errorResult(url, startedAt, identity, attempt, "timeout", e.getMessage());
        } catch (IOException e) {
            identityPool.reportFailure(identity);
            return errorResult(url, startedAt, identity, attempt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, identity, attempt, "interrupted", e.getMessage());
        } catch (Exception e) {
            identityPool.reportFailure(identity);
            return errorResult(url, startedAt, identity, attempt, "http_error", e.getMessage());
        }
    }

    private void reportToPool(NetworkIdentity identity, DetectionVerdict verdict, Duration latency) {
        if (verdict.isNormal()) {
            identityPool.reportSuccess(identity, latency);
        } else if (verdict.isIdentityHostile()) {
            identityPool.quarantine(identity);
        } else {
            identityPool.reportFailure(identity);
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        if (result.verdict() != null && !result.verdict().isNormal()) {
            return true;
        }
        int status = result.statusCode();
        return status == 408 || status >= 500;
    }

    private String randomUserAgent() {
        List<String> agents = properties.getHttp().getUserAgents();
        return agents.get(ThreadLocalRandom.current().nextInt(agents.size()));
    }

    private HttpFetchResult errorResult(
        String url,
        Instant startedAt,
        NetworkIdentity identity,
        int attempt,
        String code,
        String message
    ) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            identity == null ? null : identity.name(),
            null,
            attempt,
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
