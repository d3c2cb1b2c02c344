package com.regdoc.acquirer.crawl.strategy;

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
public class SearchEngineStrategy implements AcquisitionStrategy {
    private static final Logger log = LoggerFactory.getLogger(SearchEngineStrategy.class);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final AcquirerProperties.SearchEngine settings;
    private final GuardedHttpClient httpClient;

    public SearchEngineStrategy(AcquirerProperties properties, GuardedHttpClient httpClient) {
        this.settings = properties.getStrategies().getSearchEngine();
        this.httpClient = httpClient;
    }

    @Override
    public String id() {
        return StrategyIds.SEARCH_ENGINE;
    }

    @Override
    public List<MatchCandidate> search(String targetName) throws StrategyException {
        if (settings.getEngines().isEmpty()) {
            throw new StrategyException(ReasonCodes.NOT_CONFIGURED, "no search engines configured");
        }
        List<String> filters = settings.getSiteFilters().isEmpty() ? List.of("") : settings.getSiteFilters();
        String lastFailure = null;
        int failures = 0;
        int attempts = 0;
        for (AcquirerProperties.Engine engine : settings.getEngines()) {
            for (String filter : filters) {
                attempts++;
                String query = filter.isBlank() ? targetName : targetName + " site:" + filter;
                String url = engine.getUrlTemplate().replace("{query}", URLEncoder.encode(query, StandardCharsets.UTF_8));
                HttpFetchResult fetch = httpClient.get(url, ACCEPT_HTML, OperationKind.SEARCH);
                if (!fetch.isSuccessful()) {
                    failures++;
                    lastFailure = ReasonCodes.fromFetch(fetch);
                    log.debug("{} query failed for '{}': {}", engine.getName(), query, lastFailure);
                    continue;
                }
                List<MatchCandidate> hits = SearchResultExtractor.extract(
                    fetch.body(),
                    fetch.finalUrlOrRequested(),
                    SearchResultExtractor.selectorForLayout(engine.getLayout()),
                    settings.getSiteFilters(),
                    settings.getMaxResults(),
                    engine.getName()
                );
                if (!hits.isEmpty()) {
                    log.debug("{} returned {} hits for '{}'", engine.getName(), hits.size(), query);
                    return hits;
                }
            }
        }
        if (failures == attempts && lastFailure != null) {
            throw new StrategyException(lastFailure, "every search engine query failed for " + targetName);
        }
        return new ArrayList<>();
    }

    @Override
    public RawRecord fetchDetail(MatchCandidate candidate) throws StrategyException {
        HttpFetchResult fetch = httpClient.get(candidate.sourceRef(), ACCEPT_HTML, OperationKind.DETAIL);
        if (!fetch.isSuccessful()) {
            throw new StrategyException(
                ReasonCodes.fromFetch(fetch),
                "result page " + candidate.sourceRef() + " failed: status=" + fetch.statusCode() + " error=" + fetch.errorCode()
            );
        }
        RawRecord parsed = DetailPageParser.parse(fetch.body(), fetch.finalUrlOrRequested());
        Map<String, String> attributes = new LinkedHashMap<>(parsed.attributes());
        attributes.putAll(candidate.attributes());
        return new RawRecord(
            parsed.sourceUrl(),
            parsed.title(),
            parsed.documentNumber(),
            parsed.publishDate(),
            parsed.status(),
            parsed.content(),
            attributes
        );
    }
}
