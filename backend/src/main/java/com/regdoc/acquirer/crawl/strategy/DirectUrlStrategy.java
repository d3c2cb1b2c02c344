package com.regdoc.acquirer.crawl.strategy;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.http.GuardedHttpClient;
import com.regdoc.acquirer.crawl.match.NameNormalizer;
import com.regdoc.acquirer.crawl.model.HttpFetchResult;
import com.regdoc.acquirer.crawl.model.MatchCandidate;
import com.regdoc.acquirer.crawl.model.OperationKind;
import com.regdoc.acquirer.crawl.model.RawRecord;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class DirectUrlStrategy implements AcquisitionStrategy {
    private static final Logger log = LoggerFactory.getLogger(DirectUrlStrategy.class);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final int MIN_SHARED_KEYWORDS = 2;

    private final AcquirerProperties.DirectUrl settings;
    private final GuardedHttpClient httpClient;

    public DirectUrlStrategy(AcquirerProperties properties, GuardedHttpClient httpClient) {
        this.settings = properties.getStrategies().getDirectUrl();
        this.httpClient = httpClient;
    }

    @Override
    public String id() {
        return StrategyIds.DIRECT_URL;
    }

    @Override
    public List<MatchCandidate> search(String targetName) throws StrategyException {
        Map<String, String> known = settings.getKnown();
        if (known.isEmpty()) {
            throw new StrategyException(ReasonCodes.NOT_CONFIGURED, "no known document URLs configured");
        }
        String target = NameNormalizer.normalize(targetName);
        List<MatchCandidate> exact = new ArrayList<>();
        List<MatchCandidate> contained = new ArrayList<>();
        List<MatchCandidate> byKeyword = new ArrayList<>();
        Set<String> targetKeywords = NameNormalizer.keywords(target);
        for (Map.Entry<String, String> entry : known.entrySet()) {
            String knownName = NameNormalizer.normalize(entry.getKey());
            if (knownName.isEmpty()) {
                continue;
            }
            MatchCandidate candidate = MatchCandidate.of(entry.getKey(), entry.getValue(), null);
            if (knownName.equals(target)) {
                exact.add(candidate);
            } else if (knownName.contains(target) || target.contains(knownName)) {
                contained.add(candidate);
            } else {
                Set<String> knownKeywords = NameNormalizer.keywords(knownName);
                long shared = targetKeywords.stream().filter(knownKeywords::contains).count();
                if (shared >= MIN_SHARED_KEYWORDS) {
                    byKeyword.add(candidate);
                }
            }
        }
        List<MatchCandidate> ordered = new ArrayList<>(exact);
        ordered.addAll(contained);
        ordered.addAll(byKeyword);
        List<MatchCandidate> ranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            MatchCandidate c = ordered.get(i);
            ranked.add(new MatchCandidate(c.title(), c.sourceRef(), null, null, null, i, Map.of("known", "true")));
        }
        if (ranked.isEmpty()) {
            log.debug("No known URL for '{}'", targetName);
        }
        return ranked;
    }

    @Override
    public RawRecord fetchDetail(MatchCandidate candidate) throws StrategyException {
        HttpFetchResult fetch = httpClient.get(candidate.sourceRef(), ACCEPT_HTML, OperationKind.DETAIL);
        if (!fetch.isSuccessful()) {
            throw new StrategyException(
                ReasonCodes.fromFetch(fetch),
                "known URL " + candidate.sourceRef() + " failed: status=" + fetch.statusCode() + " error=" + fetch.errorCode()
            );
        }
        return DetailPageParser.parse(fetch.body(), fetch.finalUrlOrRequested());
    }
}
