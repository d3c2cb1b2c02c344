package com.regdoc.acquirer.crawl.service;

import com.regdoc.acquirer.TestProperties;
import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.detection.ResponseAnalyzer;
import com.regdoc.acquirer.crawl.match.MatchResolver;
import com.regdoc.acquirer.crawl.model.AcquisitionResult;
import com.regdoc.acquirer.crawl.model.BatchAcquisitionSummary;
import com.regdoc.acquirer.crawl.model.MatchCandidate;
import com.regdoc.acquirer.crawl.model.RawRecord;
import com.regdoc.acquirer.crawl.strategy.AcquisitionStrategy;
import com.regdoc.acquirer.crawl.strategy.StrategyException;
import com.regdoc.acquirer.crawl.strategy.StrategyIds;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AcquisitionOrchestratorTest {
    private final List<String> invocations = new CopyOnWriteArrayList<>();
    private ExecutorService executor;
    private ScheduledExecutorService scheduler;
    private AcquirerProperties properties;
    private ResponseAnalyzer analyzer;

    private FakeStrategy structuredApi;
    private FakeStrategy directUrl;
    private FakeStrategy searchEngine;
    private FakeStrategy browserSearch;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(16);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        properties = TestProperties.fast();
        analyzer = new ResponseAnalyzer(properties);
        structuredApi = new FakeStrategy(StrategyIds.STRUCTURED_API);
        directUrl = new FakeStrategy(StrategyIds.DIRECT_URL);
        searchEngine = new FakeStrategy(StrategyIds.SEARCH_ENGINE);
        browserSearch = new FakeStrategy(StrategyIds.BROWSER_SEARCH);
        browserSearch.escalation = true;
        browserSearch.batchSession = true;
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    void fallsBackInPriorityOrderUntilAStrategySucceeds() {
        structuredApi.failure = ReasonCodes.HTTP_5XX;
        searchEngine.knows("数据安全法");
        browserSearch.knows("数据安全法");

        AcquisitionResult result = orchestrator(List.of()).acquire("数据安全法");

        assertThat(result.found()).isTrue();
        assertThat(result.strategyUsed()).isEqualTo(StrategyIds.SEARCH_ENGINE);
        assertThat(result.record().title()).isEqualTo("数据安全法");
        assertThat(result.error()).isNull();
        assertThat(invocations).containsExactly(
            "structured-api:数据安全法",
            "direct-url:数据安全法",
            "search-engine:数据安全法"
        );
    }

    @Test
    void exhaustingEveryStrategyReportsTheLastFailure() {
        structuredApi.failure = ReasonCodes.HTTP_5XX;

        AcquisitionResult result = orchestrator(List.of()).acquire("数据安全法");

        assertThat(result.found()).isFalse();
        assertThat(result.record()).isNull();
        assertThat(result.error()).isEqualTo("exhausted (last browser-search: NO_CANDIDATES)");
        assertThat(invocations).hasSize(4);
    }

    @Test
    void unmatchedCandidatesCountAsNoMatch() {
        directUrl.candidateTitle = "中华人民共和国刑法";
        properties.getStrategies().setPriority(List.of(StrategyIds.DIRECT_URL, StrategyIds.STRUCTURED_API));

        AcquisitionResult result = orchestrator(List.of()).acquire("数据安全法");

        assertThat(invocations).containsExactly("direct-url:数据安全法", "structured-api:数据安全法");
        assertThat(result.error()).isEqualTo("exhausted (last structured-api: NO_CANDIDATES)");
    }

    @Test
    void disabledStrategiesAreSkipped() {
        properties.getStrategies().setDisabled(List.of(StrategyIds.STRUCTURED_API, StrategyIds.SEARCH_ENGINE));
        directUrl.knows("数据安全法");

        AcquisitionOrchestrator orchestrator = orchestrator(List.of());
        AcquisitionResult result = orchestrator.acquire("数据安全法");

        assertThat(orchestrator.strategyOrder()).containsExactly(StrategyIds.DIRECT_URL, StrategyIds.BROWSER_SEARCH);
        assertThat(result.strategyUsed()).isEqualTo(StrategyIds.DIRECT_URL);
        assertThat(invocations).containsExactly("direct-url:数据安全法");
    }

    @Test
    void prioritisedStrategyWithoutImplementationFailsAtStartup() {
        assertThatThrownBy(() -> new AcquisitionOrchestrator(
            properties,
            List.of(structuredApi, directUrl, searchEngine),
            new MatchResolver(),
            analyzer,
            List.of(),
            executor,
            scheduler
        )).isInstanceOf(IllegalStateException.class).hasMessageContaining("browser-search");
    }

    @Test
    void banSignalEscalatesToTheBrowserStrategy() {
        for (int i = 0; i < 5; i++) {
            analyzer.classify(403, Map.of(), "", Duration.ofMillis(200), "flk.npc.gov.cn");
        }
        assertThat(analyzer.shouldTreatAsBanned()).isTrue();
        structuredApi.failure = ReasonCodes.BLOCKED;
        directUrl.knows("数据安全法");
        browserSearch.knows("数据安全法");

        AcquisitionResult result = orchestrator(List.of()).acquire("数据安全法");

        assertThat(result.strategyUsed()).isEqualTo(StrategyIds.BROWSER_SEARCH);
        assertThat(invocations).containsExactly("structured-api:数据安全法", "browser-search:数据安全法");
        assertThat(browserSearch.opened.get()).isEqualTo(1);
        assertThat(browserSearch.closed.get()).isEqualTo(1);
    }

    @Test
    void failedEscalationResumesTheRemainingStrategiesInOrder() {
        banSource();
        structuredApi.failure = ReasonCodes.BLOCKED;

        AcquisitionResult result = orchestrator(List.of()).acquire("数据安全法");

        assertThat(result.found()).isFalse();
        assertThat(result.error()).isEqualTo("exhausted (last search-engine: NO_CANDIDATES)");
        assertThat(invocations).containsExactly(
            "structured-api:数据安全法",
            "browser-search:数据安全法",
            "direct-url:数据安全法",
            "search-engine:数据安全法"
        );
    }

    @Test
    void failedEscalationStillLetsALaterStrategySucceed() {
        banSource();
        structuredApi.failure = ReasonCodes.BLOCKED;
        directUrl.knows("数据安全法");

        AcquisitionResult result = orchestrator(List.of()).acquire("数据安全法");

        assertThat(result.strategyUsed()).isEqualTo(StrategyIds.DIRECT_URL);
        assertThat(invocations).containsExactly(
            "structured-api:数据安全法",
            "browser-search:数据安全法",
            "direct-url:数据安全法"
        );
    }

    @Test
    void slowTargetIsAbandonedAtItsBudget() {
        properties.getTimeouts().setPerTargetSeconds(1);
        structuredApi.delay = Duration.ofSeconds(5);

        long startedAt = System.nanoTime();
        AcquisitionResult result = orchestrator(List.of()).acquire("数据安全法");

        assertThat(result.found()).isFalse();
        assertThat(result.error()).isEqualTo(ReasonCodes.TARGET_TIMEOUT);
        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(4));
    }

    @Test
    void everyResultReachesTheSinksEvenWhenOneThrows() {
        directUrl.knows("数据安全法");
        List<AcquisitionResult> received = new CopyOnWriteArrayList<>();
        AcquisitionResultSink broken = result -> {
            throw new IllegalStateException("database down");
        };

        AcquisitionResult result = orchestrator(List.of(broken, received::add)).acquire("数据安全法");

        assertThat(received).containsExactly(result);
    }

    @Test
    void blankTargetNameIsRejected() {
        AcquisitionOrchestrator orchestrator = orchestrator(List.of());

        assertThatThrownBy(() -> orchestrator.acquire("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.acquireBatch(List.of("数据安全法", ""), 2))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.acquireBatch(null, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void batchPhasesNeverRevisitResolvedTargets() {
        structuredApi.knows("数据安全法", "网络安全法");
        directUrl.knows("数据安全法", "个人信息保护法");
        browserSearch.knows("反垄断法");
        List<AcquisitionResult> received = new CopyOnWriteArrayList<>();

        BatchAcquisitionSummary summary = orchestrator(List.of(received::add)).acquireBatch(
            List.of("数据安全法", "网络安全法", "个人信息保护法", "反垄断法", "电子商务法", "数据安全法 "),
            3
        );

        assertThat(summary.results()).extracting(AcquisitionResult::targetName)
            .containsExactly("数据安全法", "网络安全法", "个人信息保护法", "反垄断法", "电子商务法");
        assertThat(summary.results()).extracting(AcquisitionResult::strategyUsed)
            .containsExactly("structured-api", "structured-api", "direct-url", "browser-search", null);
        assertThat(summary.foundCount()).isEqualTo(4);
        assertThat(summary.notFoundCount()).isEqualTo(1);
        assertThat(summary.foundByStrategy()).containsOnly(
            Map.entry("structured-api", 2),
            Map.entry("direct-url", 1),
            Map.entry("browser-search", 1)
        );
        assertThat(summary.results().get(4).error()).isEqualTo("exhausted (last browser-search: NO_CANDIDATES)");

        assertThat(directUrl.searched()).containsExactlyInAnyOrder("个人信息保护法", "反垄断法", "电子商务法");
        assertThat(searchEngine.searched()).containsExactlyInAnyOrder("反垄断法", "电子商务法");
        assertThat(browserSearch.searched()).containsExactlyInAnyOrder("反垄断法", "电子商务法");
        assertThat(invocations).filteredOn(call -> call.endsWith(":数据安全法")).hasSize(1);
        assertThat(received).hasSize(5);
    }

    @Test
    void banSignalMovesTheBrowserPhaseForwardInBatches() {
        banSource();
        browserSearch.knows("数据安全法");
        directUrl.knows("网络安全法");

        BatchAcquisitionSummary summary = orchestrator(List.of())
            .acquireBatch(List.of("数据安全法", "网络安全法"), 2);

        assertThat(summary.results()).extracting(AcquisitionResult::strategyUsed)
            .containsExactly(StrategyIds.BROWSER_SEARCH, StrategyIds.DIRECT_URL);
        assertThat(invocations).filteredOn(call -> call.endsWith(":网络安全法")).containsExactly(
            "structured-api:网络安全法",
            "browser-search:网络安全法",
            "direct-url:网络安全法"
        );
        assertThat(directUrl.searched()).containsExactly("网络安全法");
        assertThat(searchEngine.searched()).isEmpty();
        assertThat(browserSearch.opened.get()).isEqualTo(1);
    }

    @Test
    void batchFanOutStaysWithinTheConcurrencyLimit() {
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= 50; i++) {
            names.add("测试条例" + i);
        }
        structuredApi.knows(names.toArray(new String[0]));
        structuredApi.delay = Duration.ofMillis(20);

        BatchAcquisitionSummary summary = orchestrator(List.of()).acquireBatch(names, 5);

        assertThat(summary.foundCount()).isEqualTo(50);
        assertThat(structuredApi.maxInFlight.get()).isBetween(1, 5);
        assertThat(directUrl.searched()).isEmpty();
    }

    @Test
    void batchSessionIsOpenedOncePerPhase() {
        browserSearch.knows("数据安全法", "网络安全法", "反垄断法");

        BatchAcquisitionSummary summary = orchestrator(List.of())
            .acquireBatch(List.of("数据安全法", "网络安全法", "反垄断法"), 2);

        assertThat(summary.foundCount()).isEqualTo(3);
        assertThat(browserSearch.opened.get()).isEqualTo(1);
        assertThat(browserSearch.closed.get()).isEqualTo(1);
        assertThat(browserSearch.searchedOutsideSession.get()).isZero();
    }

    @Test
    void sessionOpenFailureFailsThePhaseForEveryTarget() {
        browserSearch.knows("数据安全法");
        browserSearch.openFailure = true;

        BatchAcquisitionSummary summary = orchestrator(List.of()).acquireBatch(List.of("数据安全法", "网络安全法"), 2);

        assertThat(summary.foundCount()).isZero();
        assertThat(summary.results()).extracting(AcquisitionResult::error)
            .containsOnly("exhausted (last browser-search: SESSION_FAILED)");
        assertThat(browserSearch.searched()).isEmpty();
    }

    @Test
    void batchTargetOverItsBudgetIsNotRetriedByLaterPhases() {
        properties.getTimeouts().setPerTargetSeconds(1);
        structuredApi.knows("网络安全法");
        structuredApi.slowNames = Set.of("数据安全法");
        structuredApi.delay = Duration.ofSeconds(5);
        directUrl.knows("数据安全法");

        BatchAcquisitionSummary summary = orchestrator(List.of())
            .acquireBatch(List.of("数据安全法", "网络安全法"), 2);

        AcquisitionResult slow = summary.results().get(0);
        assertThat(slow.found()).isFalse();
        assertThat(slow.error()).isEqualTo(ReasonCodes.TARGET_TIMEOUT);
        assertThat(summary.results().get(1).found()).isTrue();
        assertThat(directUrl.searched()).isEmpty();
    }

    @Test
    void queuedBatchTargetsKeepTheirWholeBudget() {
        executor.shutdownNow();
        executor = Executors.newFixedThreadPool(2);
        properties.getTimeouts().setPerTargetSeconds(1);
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            names.add("测试条例" + i);
        }
        structuredApi.delay = Duration.ofMillis(600);
        directUrl.knows(names.toArray(new String[0]));

        BatchAcquisitionSummary summary = orchestrator(List.of()).acquireBatch(names, 10);

        assertThat(summary.foundCount()).isEqualTo(10);
        assertThat(summary.results()).extracting(AcquisitionResult::strategyUsed).containsOnly(StrategyIds.DIRECT_URL);
        assertThat(structuredApi.searched()).hasSize(10);
        assertThat(structuredApi.maxInFlight.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void requestedFanOutIsClampedToTheConfiguredMaximum() {
        properties.getBatch().setMaxConcurrencyLimit(3);
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            names.add("测试条例" + i);
        }
        structuredApi.knows(names.toArray(new String[0]));
        structuredApi.delay = Duration.ofMillis(50);

        BatchAcquisitionSummary summary = orchestrator(List.of()).acquireBatch(names, 1000);

        assertThat(summary.foundCount()).isEqualTo(12);
        assertThat(structuredApi.maxInFlight.get()).isBetween(1, 3);
    }

    private void banSource() {
        for (int i = 0; i < 5; i++) {
            analyzer.classify(403, Map.of(), "", Duration.ofMillis(200), "flk.npc.gov.cn");
        }
        assertThat(analyzer.shouldTreatAsBanned()).isTrue();
    }

    private AcquisitionOrchestrator orchestrator(List<AcquisitionResultSink> sinks) {
        return new AcquisitionOrchestrator(
            properties,
            List.of(browserSearch, searchEngine, directUrl, structuredApi),
            new MatchResolver(),
            analyzer,
            sinks,
            executor,
            scheduler
        );
    }

    private final class FakeStrategy implements AcquisitionStrategy {
        private final String id;
        private final Set<String> known = Collections.synchronizedSet(new HashSet<>());
        private final List<String> searched = new CopyOnWriteArrayList<>();
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private final AtomicInteger opened = new AtomicInteger();
        private final AtomicInteger closed = new AtomicInteger();
        private final AtomicInteger searchedOutsideSession = new AtomicInteger();
        private final AtomicInteger openScopes = new AtomicInteger();
        private volatile String failure;
        private volatile String candidateTitle;
        private volatile Duration delay = Duration.ZERO;
        private volatile Set<String> slowNames;
        private volatile boolean escalation;
        private volatile boolean batchSession;
        private volatile boolean openFailure;

        private FakeStrategy(String id) {
            this.id = id;
        }

        void knows(String... names) {
            known.addAll(List.of(names));
        }

        List<String> searched() {
            return searched;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public List<MatchCandidate> search(String targetName) throws StrategyException {
            invocations.add(id + ":" + targetName);
            searched.add(targetName);
            if (batchSession && openScopes.get() == 0) {
                searchedOutsideSession.incrementAndGet();
            }
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                if (slowNames == null || slowNames.contains(targetName)) {
                    sleep(delay);
                }
                if (failure != null) {
                    throw new StrategyException(failure, id + " failed");
                }
                if (candidateTitle != null) {
                    return List.of(MatchCandidate.of(candidateTitle, "ref:" + candidateTitle, "有效"));
                }
                if (!known.contains(targetName)) {
                    return List.of();
                }
                return List.of(MatchCandidate.of(targetName, id + "/" + targetName, "有效"));
            } finally {
                inFlight.decrementAndGet();
            }
        }

        @Override
        public RawRecord fetchDetail(MatchCandidate candidate) {
            return new RawRecord(
                "https://flk.npc.gov.cn/" + candidate.sourceRef(),
                candidate.title(),
                null,
                "2021-06-10",
                candidate.statusLabel(),
                "第一条",
                Map.of()
            );
        }

        @Override
        public boolean supportsBatchSession() {
            return batchSession;
        }

        @Override
        public void openSession() throws StrategyException {
            if (openFailure) {
                throw new StrategyException(ReasonCodes.SESSION_FAILED, "browser would not start");
            }
            opened.incrementAndGet();
            openScopes.incrementAndGet();
        }

        @Override
        public void closeSession() {
            closed.incrementAndGet();
            openScopes.decrementAndGet();
        }

        @Override
        public boolean escalationTarget() {
            return escalation;
        }

        private void sleep(Duration duration) throws StrategyException {
            if (duration.isZero()) {
                return;
            }
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StrategyException(ReasonCodes.TIMEOUT, "interrupted");
            }
        }
    }
}
