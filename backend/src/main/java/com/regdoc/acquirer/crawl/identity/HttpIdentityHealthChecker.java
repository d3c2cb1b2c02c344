package com.regdoc.acquirer.crawl.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.http.IdentityHttpClients;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
public class HttpIdentityHealthChecker implements IdentityHealthChecker {
    private final List<String> probeUrls;
    private final IdentityHttpClients httpClients;
    private final ObjectMapper objectMapper;

    public HttpIdentityHealthChecker(AcquirerProperties properties, IdentityHttpClients httpClients, ObjectMapper objectMapper) {
        this.probeUrls = properties.getIdentityPool().getProbeUrls();
        this.httpClients = httpClients;
        this.objectMapper = objectMapper;
    }

    @Override
    public HealthCheckResult check(NetworkIdentity identity, Duration timeout) {
        if (identity == null || identity.isDirect()) {
            return HealthCheckResult.healthy(Duration.ZERO);
        }
        if (!IdentityProtocol.HTTP_CLIENT_COMPATIBLE.contains(identity.protocol())) {
            return checkTcp(identity, timeout);
        }
        String lastFailure = "no_probe_urls";
        for (String probeUrl : probeUrls) {
            Instant startedAt = Instant.now();
            try {
                HttpRequest request = HttpRequest.newBuilder(URI.create(probeUrl))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
                HttpResponse<String> response = httpClients.clientFor(identity)
                    .send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                if (response.statusCode() == 200 && namesEgressAddress(response.body())) {
                    return HealthCheckResult.healthy(Duration.between(startedAt, Instant.now()));
                }
                lastFailure = "unexpected_probe_answer status=" + response.statusCode();
            } catch (HttpTimeoutException e) {
                lastFailure = "timeout";
            } catch (IOException e) {
                lastFailure = "io_error: " + e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return HealthCheckResult.failed("interrupted");
            } catch (IllegalArgumentException e) {
                lastFailure = "invalid_probe: " + e.getMessage();
            }
        }
        return HealthCheckResult.failed(lastFailure);
    }

    boolean namesEgressAddress(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return hasText(node, "ip") || hasText(node, "origin");
        } catch (IOException e) {
            return false;
        }
    }

    private boolean hasText(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank();
    }

    private HealthCheckResult checkTcp(NetworkIdentity identity, Duration timeout) {
        Instant startedAt = Instant.now();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(identity.host(), identity.port()), (int) timeout.toMillis());
            return HealthCheckResult.healthy(Duration.between(startedAt, Instant.now()));
        } catch (IOException e) {
            return HealthCheckResult.failed("tcp_connect_failed: " + e.getMessage());
        }
    }
}
