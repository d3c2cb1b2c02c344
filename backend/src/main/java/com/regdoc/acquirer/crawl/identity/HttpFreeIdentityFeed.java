package com.regdoc.acquirer.crawl.identity;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.http.IdentityHttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class HttpFreeIdentityFeed implements FreeIdentityFeed {
    private static final Logger log = LoggerFactory.getLogger(HttpFreeIdentityFeed.class);
    private static final Pattern HOST_PORT = Pattern.compile("^\\s*([A-Za-z0-9.\\-]+):(\\d{1,5})\\s*$");

    private final AcquirerProperties.IdentityPool settings;
    private final int requestTimeoutSeconds;
    private final IdentityHttpClients httpClients;

    public HttpFreeIdentityFeed(AcquirerProperties properties, IdentityHttpClients httpClients) {
        this.settings = properties.getIdentityPool();
        this.requestTimeoutSeconds = properties.getTimeouts().getRequestSeconds();
        this.httpClients = httpClients;
    }

    @Override
    public List<IdentityEndpoint> fetch() {
        Map<String, IdentityEndpoint> unique = new LinkedHashMap<>();
        IdentityProtocol protocol = IdentityProtocol.fromLabel(settings.getFreeFeedProtocol());
        int limit = settings.getFreeFeedLimit();
        for (String url : settings.getFreeFeedUrls()) {
            if (unique.size() >= limit) {
                break;
            }
            String body = download(url);
            if (body == null) {
                continue;
            }
            for (IdentityEndpoint endpoint : parse(body, protocol)) {
                if (unique.size() >= limit) {
                    break;
                }
                unique.putIfAbsent(endpoint.key(), endpoint);
            }
        }
        return new ArrayList<>(unique.values());
    }

    static List<IdentityEndpoint> parse(String body, IdentityProtocol protocol) {
        List<IdentityEndpoint> endpoints = new ArrayList<>();
        for (String line : body.split("\\R")) {
            Matcher matcher = HOST_PORT.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            int port = Integer.parseInt(matcher.group(2));
            if (port <= 0 || port > 65535) {
                continue;
            }
            endpoints.add(new IdentityEndpoint(matcher.group(1), port, protocol));
        }
        return endpoints;
    }

    private String download(String url) {
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(requestTimeoutSeconds))
                .GET()
                .build();
            HttpResponse<String> response = httpClients.direct()
                .send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                log.warn("Free identity feed {} answered {}", url, response.statusCode());
                return null;
            }
            return response.body();
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Free identity feed {} unreachable: {}", url, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }
}
