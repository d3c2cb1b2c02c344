package com.regdoc.acquirer.crawl.service;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.detection.ResponseAnalyzer;
import com.regdoc.acquirer.crawl.match.MatchResolver;
import com.regdoc.acquirer.crawl.model.AcquisitionResult;
import com.regdoc.acquirer.crawl.model.BatchAcquisitionSummary;
import com.regdoc.acquirer.crawl.model.MatchCandidate;
import com.regdoc.acquirer.crawl.model.RawRecord;
import com.regdoc.acquirer.crawl.strategy.AcquisitionStrategy;
import com.regdoc.acquirer.crawl.strategy.StrategyException;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class AcquisitionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(AcquisitionOrchestrator.class);

    private final AcquirerProperties properties;
    private final List<AcquisitionStrategy> strategies;
    private final MatchResolver matchResolver;
    private final ResponseAnalyzer responseAnalyzer;
    private final List<AcquisitionResultSink> sinks;
    private final ExecutorService acquisitionExecutor;
    private final ScheduledExecutorService timeoutScheduler;

    public AcquisitionOrchestrator(
        AcquirerProperties properties,
        List<AcquisitionStrategy> availableStrategies,
        MatchResolver matchResolver,
        ResponseAnalyzer responseAnalyzer,
        List<AcquisitionResultSink> sinks,
        @Qualifier("acquisitionExecutor") ExecutorService acquisitionExecutor,
        @Qualifier("acquisitionTimeoutScheduler") ScheduledExecutorService timeoutScheduler
    ) {
        properties.validate();
        this.properties = properties;
        this.strategies = orderByPriority(properties.getStrategies(), availableStrategies);
        this.matchResolver = matchResolver;
        this.responseAnalyzer = responseAnalyzer;
        this.sinks = sinks == null ? List.of() : List.copyOf(sinks);
        this.acquisitionExecutor = acquisitionExecutor;
        this.timeoutScheduler = timeoutScheduler;
        log.info("Acquisition strategies in order: {}", strategies.stream().map(AcquisitionStrategy::id).toList());
    }

    private static List<AcquisitionStrategy> orderByPriority(
        AcquirerProperties.Strategies settings,
        List<AcquisitionStrategy> available
    ) {
        Map<String, AcquisitionStrategy> byId = new LinkedHashMap<>();
        for (AcquisitionStrategy strategy : available) {
            byId.put(strategy.id(), strategy);
        }
        List<AcquisitionStrategy> ordered = new ArrayList<>();
        for (String id : settings.getPriority()) {
            AcquisitionStrategy strategy = byId.get(id);
            if (strategy == null) {
                throw new IllegalStateException("No strategy implementation registered for '" + id + "'");
            }
            if (!settings.isEnabled(id)) {
                log.info("Strategy {} disabled by configuration", id);
                continue;
            }
            ordered.add(strategy);
        }
        if (ordered.isEmpty()) {
            throw new IllegalStateException("Every acquisition strategy is disabled");
        }
        return List.copyOf(ordered);
    }

    public List<String> strategyOrder() {
        return strategies.stream().map(AcquisitionStrategy::id).toList();
    }

    public AcquisitionResult acquire(String targetName) {
        String name = requireName(targetName);
        Instant startedAt = Instant.now();
        Duration budget = Duration.ofSeconds(properties.getTimeouts().getPerTargetSeconds());
        Future<AcquisitionResult> future = acquisitionExecutor.submit(() -> runChain(name, startedAt));
        AcquisitionResult result;
        try {
            result = future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Target '{}' abandoned after {}s", name, budget.toSeconds());
            result = AcquisitionResult.notFound(name, elapsedSince(startedAt), ReasonCodes.TARGET_TIMEOUT);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            result = AcquisitionResult.notFound(name, elapsedSince(startedAt), "interrupted");
        } catch (ExecutionException e) {
            log.warn("Acquisition of '{}' failed unexpectedly", name, e.getCause());
            result = AcquisitionResult.notFound(name, elapsedSince(startedAt), describe(e.getCause()));
        }
        publish(result);
        return result;
    }

    private AcquisitionResult runChain(String name, Instant startedAt) {
        List<AcquisitionStrategy> pending = new ArrayList<>(strategies);
        String lastError = null;
        while (!pending.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                return AcquisitionResult.notFound(name, elapsedSince(startedAt), ReasonCodes.TARGET_TIMEOUT);
            }
            AcquisitionStrategy strategy = pending.remove(0);
            Attempt attempt = attemptWithSession(strategy, name);
            if (attempt.record() != null) {
                log.info("Acquired '{}' via {} in {} ms", name, strategy.id(), elapsedSince(startedAt).toMillis());
                return AcquisitionResult.found(name, attempt.record(), strategy.id(), elapsedSince(startedAt));
            }
            lastError = strategy.id() + ": " + attempt.error();
            escalateIfBanned(strategy, pending);
        }
        log.info("No strategy acquired '{}' (last error {})", name, lastError);
        return AcquisitionResult.notFound(name, elapsedSince(startedAt), exhausted(lastError));
    }

    private Attempt attemptWithSession(AcquisitionStrategy strategy, String name) {
        if (!strategy.supportsBatchSession()) {
            return attempt(strategy, name);
        }
        try {
            strategy.openSession();
        } catch (StrategyException e) {
            log.warn("Strategy {} could not open a session for '{}': {}", strategy.id(), name, e.getMessage());
            return Attempt.failed(e.reasonCode());
        } catch (RuntimeException e) {
            log.warn("Strategy {} could not open a session for '{}'", strategy.id(), name, e);
            return Attempt.failed(describe(e));
        }
        try {
            return attempt(strategy, name);
        } finally {
            strategy.closeSession();
        }
    }

    private Attempt attempt(AcquisitionStrategy strategy, String name) {
        try {
            List<MatchCandidate> candidates = strategy.search(name);
            if (candidates == null || candidates.isEmpty()) {
                log.debug("Strategy {} found no candidates for '{}'", strategy.id(), name);
                return Attempt.failed(ReasonCodes.NO_CANDIDATES);
            }
            Optional<MatchCandidate> winner = matchResolver.resolve(name, candidates);
            if (winner.isEmpty()) {
                log.debug("Strategy {} had {} candidates for '{}', none accepted", strategy.id(), candidates.size(), name);
                return Attempt.failed(ReasonCodes.NO_MATCH);
            }
            RawRecord record = strategy.fetchDetail(winner.get());
            if (record == null) {
                return Attempt.failed(ReasonCodes.DETAIL_FAILED);
            }
            return Attempt.found(record);
        } catch (StrategyException e) {
            log.warn("Strategy {} failed for '{}': {} ({})", strategy.id(), name, e.reasonCode(), e.getMessage());
            return Attempt.failed(e.reasonCode());
        } catch (RuntimeException e) {
            log.warn("Strategy {} threw for '{}'", strategy.id(), name, e);
            return Attempt.failed(describe(e));
        }
    }

    private void escalateIfBanned(AcquisitionStrategy failed, List<AcquisitionStrategy> pending) {
        if (!properties.getStrategies().isEscalateOnBan() || failed.escalationTarget() || pending.isEmpty()) {
            return;
        }
        if (!responseAnalyzer.shouldTreatAsBanned()) {
            return;
        }
        for (int i = 0; i < pending.size(); i++) {
            AcquisitionStrategy candidate = pending.get(i);
            if (candidate.escalationTarget()) {
                if (i > 0) {
                    pending.remove(i);
                    pending.add(0, candidate);
                    log.info("Ban signal after {}, escalating to {}", failed.id(), candidate.id());
                }
                return;
            }
        }
    }

    public BatchAcquisitionSummary acquireBatch(List<String> targetNames, Integer concurrencyLimit) {
        if (targetNames == null) {
            throw new IllegalArgumentException("target names are required");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String targetName : targetNames) {
            distinct.add(requireName(targetName));
        }
        int limit = properties.getBatch().effectiveLimit(concurrencyLimit);
        Instant startedAt = Instant.now();
        Duration perTarget = Duration.ofSeconds(properties.getTimeouts().getPerTargetSeconds());

        Map<String, AcquisitionResult> resolved = new LinkedHashMap<>();
        Map<String, Duration> spent = new LinkedHashMap<>();
        Map<String, String> lastError = new LinkedHashMap<>();
        List<String> unresolved = new ArrayList<>(distinct);
        for (String name : unresolved) {
            spent.put(name, Duration.ZERO);
        }
        log.info("Batch of {} targets started (concurrency {})", unresolved.size(), limit);

        List<AcquisitionStrategy> phases = new ArrayList<>(strategies);
        while (!phases.isEmpty() && !unresolved.isEmpty()) {
            AcquisitionStrategy strategy = phases.remove(0);
            List<String> eligible = new ArrayList<>();
            for (String name : unresolved) {
                if (spent.get(name).compareTo(perTarget) < 0) {
                    eligible.add(name);
                }
            }
            if (eligible.isEmpty()) {
                break;
            }
            Map<String, Attempt> outcomes = runPhase(strategy, eligible, limit, perTarget, spent);
            for (Map.Entry<String, Attempt> entry : outcomes.entrySet()) {
                String name = entry.getKey();
                Attempt attempt = entry.getValue();
                if (attempt.record() != null) {
                    AcquisitionResult result = AcquisitionResult.found(name, attempt.record(), strategy.id(), spent.get(name));
                    resolved.put(name, result);
                    publish(result);
                } else {
                    lastError.put(name, strategy.id() + ": " + attempt.error());
                }
            }
            unresolved.removeAll(resolved.keySet());
            escalateIfBanned(strategy, phases);
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Batch interrupted with {} targets unresolved", unresolved.size());
                break;
            }
        }

        for (String name : unresolved) {
            String error = spent.get(name).compareTo(perTarget) >= 0
                ? ReasonCodes.TARGET_TIMEOUT
                : exhausted(lastError.get(name));
            AcquisitionResult result = AcquisitionResult.notFound(name, spent.get(name), error);
            resolved.put(name, result);
            publish(result);
        }

        List<AcquisitionResult> ordered = new ArrayList<>(distinct.size());
        Map<String, Integer> foundByStrategy = new LinkedHashMap<>();
        int found = 0;
        for (String name : distinct) {
            AcquisitionResult result = resolved.get(name);
            ordered.add(result);
            if (result.found()) {
                found++;
                foundByStrategy.merge(result.strategyUsed(), 1, Integer::sum);
            }
        }
        Instant finishedAt = Instant.now();
        log.info(
            "Batch finished in {} ms: found={}, notFound={}, byStrategy={}",
            Duration.between(startedAt, finishedAt).toMillis(),
            found,
            ordered.size() - found,
            foundByStrategy
        );
        return new BatchAcquisitionSummary(startedAt, finishedAt, ordered, foundByStrategy, found, ordered.size() - found);
    }

    private Map<String, Attempt> runPhase(
        AcquisitionStrategy strategy,
        List<String> targets,
        int limit,
        Duration perTarget,
        Map<String, Duration> spent
    ) {
        log.info("Phase {} started for {} targets", strategy.id(), targets.size());
        Instant phaseStart = Instant.now();
        Map<String, Attempt> outcomes = new LinkedHashMap<>();
        boolean sessionOpen = false;
        if (strategy.supportsBatchSession()) {
            try {
                strategy.openSession();
                sessionOpen = true;
            } catch (StrategyException | RuntimeException e) {
                log.warn("Phase {} skipped, session could not be opened", strategy.id(), e);
                for (String name : targets) {
                    outcomes.put(name, Attempt.failed(ReasonCodes.SESSION_FAILED));
                }
                return outcomes;
            }
        }
        try {
            Semaphore gate = new Semaphore(limit);
            Map<String, GatedInvocation> invocations = new LinkedHashMap<>();
            for (String name : targets) {
                try {
                    gate.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                Duration remaining = perTarget.minus(spent.get(name));
                invocations.put(name, submitGated(strategy, name, gate, remaining));
            }
            for (Map.Entry<String, GatedInvocation> entry : invocations.entrySet()) {
                String name = entry.getKey();
                GatedInvocation invocation = entry.getValue();
                Attempt attempt = await(invocation.task, strategy, name);
                if (ReasonCodes.TARGET_TIMEOUT.equals(attempt.error())) {
                    // cancelled at its deadline
                    spent.put(name, perTarget);
                } else {
                    spent.merge(name, invocation.elapsed(), Duration::plus);
                }
                outcomes.put(name, attempt);
            }
            for (String name : targets) {
                outcomes.putIfAbsent(name, Attempt.failed("interrupted"));
            }
        } finally {
            if (sessionOpen) {
                strategy.closeSession();
            }
        }
        long found = outcomes.values().stream().filter(a -> a.record() != null).count();
        log.info(
            "Phase {} finished in {} ms: resolved {} of {}",
            strategy.id(),
            elapsedSince(phaseStart).toMillis(),
            found,
            targets.size()
        );
        return outcomes;
    }

    /**
     * Runs one invocation holding a permit of {@code gate}. The deadline and the budget clock
     * start when the invocation leaves the executor queue.
     */
    private GatedInvocation submitGated(AcquisitionStrategy strategy, String name, Semaphore gate, Duration deadline) {
        GatedInvocation invocation = new GatedInvocation();
        invocation.task = new FutureTask<>(() -> {
            invocation.startedAt = Instant.now();
            ScheduledFuture<?> canceller = timeoutScheduler.schedule(
                () -> invocation.task.cancel(true),
                Math.max(1L, deadline.toMillis()),
                TimeUnit.MILLISECONDS
            );
            try {
                return attempt(strategy, name);
            } finally {
                canceller.cancel(false);
                invocation.finishedAt = Instant.now();
                gate.release();
            }
        });
        acquisitionExecutor.execute(invocation.task);
        return invocation;
    }

    private Attempt await(Future<Attempt> future, AcquisitionStrategy strategy, String name) {
        try {
            return future.get();
        } catch (CancellationException e) {
            log.warn("Target '{}' abandoned during phase {}", name, strategy.id());
            return Attempt.failed(ReasonCodes.TARGET_TIMEOUT);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Attempt.failed("interrupted");
        } catch (ExecutionException e) {
            log.warn("Phase {} failed for '{}'", strategy.id(), name, e.getCause());
            return Attempt.failed(describe(e.getCause()));
        }
    }

    private void publish(AcquisitionResult result) {
        for (AcquisitionResultSink sink : sinks) {
            try {
                sink.accept(result);
            } catch (RuntimeException e) {
                log.warn("Result sink {} rejected result for '{}'", sink.getClass().getSimpleName(), result.targetName(), e);
            }
        }
    }

    private static String requireName(String targetName) {
        if (targetName == null || targetName.isBlank()) {
            throw new IllegalArgumentException("target name must not be blank");
        }
        return targetName.trim();
    }

    private static String exhausted(String lastError) {
        return lastError == null ? ReasonCodes.EXHAUSTED : ReasonCodes.EXHAUSTED + " (last " + lastError + ")";
    }

    private static Duration elapsedSince(Instant start) {
        return Duration.between(start, Instant.now());
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return ReasonCodes.UNKNOWN;
        }
        String message = error.getMessage();
        return ReasonCodes.STRATEGY_ERROR + ": " + error.getClass().getSimpleName()
            + (message == null || message.isBlank() ? "" : " " + message);
    }

    private record Attempt(RawRecord record, String error) {
        static Attempt found(RawRecord record) {
            return new Attempt(record, null);
        }

        static Attempt failed(String error) {
            return new Attempt(null, error == null ? ReasonCodes.UNKNOWN : error);
        }
    }

    private static final class GatedInvocation {
        private FutureTask<Attempt> task;
        private volatile Instant startedAt;
        private volatile Instant finishedAt;

        Duration elapsed() {
            Instant start = startedAt;
            if (start == null) {
                return Duration.ZERO;
            }
            Instant end = finishedAt;
            return Duration.between(start, end == null ? Instant.now() : end);
        }
    }
}
