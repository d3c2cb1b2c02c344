package com.regdoc.acquirer.crawl.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.http.GuardedHttpClient;
import com.regdoc.acquirer.crawl.model.HttpFetchResult;
import com.regdoc.acquirer.crawl.model.MatchCandidate;
import com.regdoc.acquirer.crawl.model.OperationKind;
import com.regdoc.acquirer.crawl.model.RawRecord;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class StructuredApiStrategy implements AcquisitionStrategy {
    private static final Logger log = LoggerFactory.getLogger(StructuredApiStrategy.class);
    private static final String ACCEPT_JSON = "application/json,text/plain;q=0.8,*/*;q=0.5";

    private final AcquirerProperties.StructuredApi settings;
    private final GuardedHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public StructuredApiStrategy(AcquirerProperties properties, GuardedHttpClient httpClient, ObjectMapper objectMapper) {
        this.settings = properties.getStrategies().getStructuredApi();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return StrategyIds.STRUCTURED_API;
    }

    @Override
    public List<MatchCandidate> search(String targetName) throws StrategyException {
        String url = baseUrl() + settings.getSearchPath()
            + "?type=title&searchType=title&keyword=" + encode(targetName)
            + "&page=1&size=" + settings.getPageSize();
        JsonNode result = fetchResult(url, OperationKind.SEARCH);
        JsonNode items = result.path("data");
        List<MatchCandidate> candidates = new ArrayList<>();
        if (!items.isArray()) {
            return candidates;
        }
        int rank = 0;
        for (JsonNode item : items) {
            String title = text(item, "title");
            String id = text(item, "id");
            if (title == null || id == null) {
                continue;
            }
            Map<String, String> attributes = new LinkedHashMap<>();
            putIfPresent(attributes, "type", text(item, "type"));
            putIfPresent(attributes, "office", text(item, "office"));
            putIfPresent(attributes, "expiry", text(item, "expiry"));
            candidates.add(new MatchCandidate(
                title,
                id,
                text(item, "status"),
                text(item, "subtitle"),
                text(item, "publish"),
                rank++,
                attributes
            ));
        }
        log.debug("Registry API returned {} hits for '{}'", candidates.size(), targetName);
        return candidates;
    }

    @Override
    public RawRecord fetchDetail(MatchCandidate candidate) throws StrategyException {
        String url = baseUrl() + settings.getDetailPath() + "?id=" + encode(candidate.sourceRef());
        JsonNode result = fetchResult(url, OperationKind.DETAIL);
        String title = text(result, "title");
        if (title == null) {
            throw new StrategyException(ReasonCodes.PARSING_FAILED, "detail for " + candidate.sourceRef() + " has no title");
        }
        Map<String, String> attributes = new LinkedHashMap<>(candidate.attributes());
        putIfPresent(attributes, "type", text(result, "type"));
        putIfPresent(attributes, "office", text(result, "office"));
        putIfPresent(attributes, "expiry", text(result, "expiry"));
        putIfPresent(attributes, "registryId", candidate.sourceRef());
        return new RawRecord(
            baseUrl() + "/detail2.html?id=" + encode(candidate.sourceRef()),
            title,
            firstNonBlank(text(result, "number"), text(result, "subtitle"), candidate.documentNumber()),
            firstNonBlank(text(result, "publish"), candidate.publishDate()),
            firstNonBlank(text(result, "status"), candidate.statusLabel()),
            firstNonBlank(text(result, "content"), text(result, "body")),
            attributes
        );
    }

    private JsonNode fetchResult(String url, OperationKind kind) throws StrategyException {
        HttpFetchResult fetch = httpClient.get(url, ACCEPT_JSON, kind);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            throw new StrategyException(
                ReasonCodes.fromFetch(fetch),
                "registry API call failed: status=" + fetch.statusCode() + " error=" + fetch.errorCode()
            );
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            throw new StrategyException(ReasonCodes.PARSING_FAILED, "registry API returned invalid JSON", e);
        }
        boolean accepted = root.path("success").asBoolean(false) || root.path("code").asInt(0) == 200;
        JsonNode result = root.path("result");
        if (!accepted || !result.isObject()) {
            throw new StrategyException(ReasonCodes.NO_CANDIDATES, "registry API reported no result");
        }
        return result;
    }

    private String baseUrl() {
        String base = settings.getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.isValueNode() ? value.asText() : value.toString();
        return text.isBlank() ? null : text.trim();
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
