package com.regdoc.acquirer.crawl.strategy;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.detection.ResponseAnalyzer;
import com.regdoc.acquirer.crawl.identity.IdentityPool;
import com.regdoc.acquirer.crawl.identity.NetworkIdentity;
import com.regdoc.acquirer.crawl.model.DetectionVerdict;
import com.regdoc.acquirer.crawl.model.MatchCandidate;
import com.regdoc.acquirer.crawl.model.OperationKind;
import com.regdoc.acquirer.crawl.model.RawRecord;
import com.regdoc.acquirer.crawl.session.PhaseSessionManager;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class BrowserSearchStrategy implements AcquisitionStrategy {
    private static final Logger log = LoggerFactory.getLogger(BrowserSearchStrategy.class);

    private final AcquirerProperties properties;
    private final BrowserSessionFactory sessionFactory;
    private final IdentityPool identityPool;
    private final ResponseAnalyzer responseAnalyzer;

    private PhaseSessionManager<BrowserSession> sessions;
    private int openScopes;

    public BrowserSearchStrategy(
        AcquirerProperties properties,
        BrowserSessionFactory sessionFactory,
        IdentityPool identityPool,
        ResponseAnalyzer responseAnalyzer
    ) {
        this.properties = properties;
        this.sessionFactory = sessionFactory;
        this.identityPool = identityPool;
        this.responseAnalyzer = responseAnalyzer;
    }

    @Override
    public String id() {
        return StrategyIds.BROWSER_SEARCH;
    }

    @Override
    public boolean supportsBatchSession() {
        return true;
    }

    @Override
    public boolean escalationTarget() {
        return true;
    }

    @Override
    public synchronized void openSession() {
        if (openScopes == 0) {
            sessions = new PhaseSessionManager<>(
                "browser",
                this::launch,
                properties.getStrategies().getBrowser().getRestartAfterUses()
            );
        }
        openScopes++;
    }

    @Override
    public void closeSession() {
        PhaseSessionManager<BrowserSession> toClose = null;
        synchronized (this) {
            if (openScopes == 0) {
                return;
            }
            openScopes--;
            if (openScopes == 0) {
                toClose = sessions;
                sessions = null;
            }
        }
        if (toClose != null) {
            toClose.close();
        }
    }

    private BrowserSession launch() throws StrategyException {
        NetworkIdentity identity = identityPool
            .acquire(properties.getIdentityPool().isPreferPaid())
            .orElse(null);
        return sessionFactory.open(identity);
    }

    @Override
    public List<MatchCandidate> search(String targetName) throws StrategyException {
        AcquirerProperties.Browser settings = properties.getStrategies().getBrowser();
        String siteFilter = settings.getSiteFilter();
        String query = siteFilter == null || siteFilter.isBlank() ? targetName : targetName + " site:" + siteFilter;
        String url = settings.getSearchUrl().replace("{query}", URLEncoder.encode(query, StandardCharsets.UTF_8));
        String html = navigate(url, OperationKind.SEARCH);
        List<MatchCandidate> hits = SearchResultExtractor.extract(
            html,
            url,
            settings.getResultSelector(),
            siteFilter == null || siteFilter.isBlank() ? List.of() : List.of(siteFilter),
            settings.getMaxResults(),
            "browser"
        );
        log.debug("Browser search returned {} hits for '{}'", hits.size(), targetName);
        return hits;
    }

    @Override
    public RawRecord fetchDetail(MatchCandidate candidate) throws StrategyException {
        String html = navigate(candidate.sourceRef(), OperationKind.DETAIL);
        return DetailPageParser.parse(html, candidate.sourceRef());
    }

    private String navigate(String url, OperationKind kind) throws StrategyException {
        PhaseSessionManager<BrowserSession> scope;
        boolean ownScope = false;
        synchronized (this) {
            if (sessions == null) {
                openSession();
                ownScope = true;
            }
            scope = sessions;
        }
        try {
            if (properties.getHttp().isPaceRequests() && !responseAnalyzer.pause(kind)) {
                throw new StrategyException(ReasonCodes.TIMEOUT, "interrupted before browser navigation");
            }
            return scope.withSession(session -> load(session, url));
        } finally {
            if (ownScope) {
                closeSession();
            }
        }
    }

    private String load(BrowserSession session, String url) throws StrategyException {
        Instant startedAt = Instant.now();
        String html = session.fetchHtml(url);
        Duration elapsed = Duration.between(startedAt, Instant.now());
        DetectionVerdict verdict = responseAnalyzer
            .classify(200, Map.of(), html, null, hostOf(url))
            .verdict();
        NetworkIdentity identity = session.identity();
        if (verdict.isNormal()) {
            if (identity != null) {
                identityPool.reportSuccess(identity, elapsed);
            }
            return html;
        }
        if (identity != null) {
            identityPool.quarantine(identity);
        }
        // The page itself is a challenge; a fresh browser on another identity is needed.
        throw new StrategyException(ReasonCodes.SESSION_FAILED, "browser got " + verdict + " at " + url);
    }

    private static String hostOf(String url) {
        try {
            String host = new URI(url).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
