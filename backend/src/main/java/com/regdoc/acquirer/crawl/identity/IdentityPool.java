package com.regdoc.acquirer.crawl.identity;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.model.IdentityPoolSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class IdentityPool {
    private static final Logger log = LoggerFactory.getLogger(IdentityPool.class);
    private static final Set<IdentityProtocol> ANY_PROTOCOL = EnumSet.allOf(IdentityProtocol.class);

    private final AcquirerProperties.IdentityPool settings;
    private final IdentityHealthChecker healthChecker;
    private final FreeIdentityFeed freeFeed;
    private final ExecutorService healthCheckExecutor;
    private final Clock clock;

    private final List<NetworkIdentity> paid = new ArrayList<>();
    private final List<NetworkIdentity> free = new ArrayList<>();
    private final Map<IdentityTier, Integer> cursors = new LinkedHashMap<>();
    private final AtomicBoolean sweepRunning = new AtomicBoolean(false);
    private int usesSinceRotation;
    private boolean forceRotation;
    private NetworkIdentity lastSelected;
    private volatile Instant lastSweepAt;

    @Autowired
    public IdentityPool(
        AcquirerProperties properties,
        IdentityHealthChecker healthChecker,
        ObjectProvider<FreeIdentityFeed> freeFeed,
        @Qualifier("healthCheckExecutor") ExecutorService healthCheckExecutor
    ) {
        this(properties.getIdentityPool(), healthChecker, freeFeed.getIfAvailable(), healthCheckExecutor, Clock.systemUTC());
        for (AcquirerProperties.PaidIdentity configured : settings.getPaid()) {
            addIdentity(NetworkIdentity.paid(
                configured.getName(),
                IdentityProtocol.fromLabel(configured.getProtocol()),
                configured.getHost(),
                configured.getPort(),
                configured.getUsername(),
                configured.getPassword()
            ));
        }
        log.info("Identity pool initialised with {} paid identities", paid.size());
    }

    public IdentityPool(
        AcquirerProperties.IdentityPool settings,
        IdentityHealthChecker healthChecker,
        FreeIdentityFeed freeFeed,
        ExecutorService healthCheckExecutor,
        Clock clock
    ) {
        this.settings = settings;
        this.healthChecker = healthChecker;
        this.freeFeed = freeFeed;
        this.healthCheckExecutor = healthCheckExecutor;
        this.clock = clock;
    }

    public synchronized void addIdentity(NetworkIdentity identity) {
        if (identity == null || identity.isDirect()) {
            return;
        }
        List<NetworkIdentity> tierList = identity.tier() == IdentityTier.PAID ? paid : free;
        if (!paid.contains(identity) && !free.contains(identity)) {
            tierList.add(identity);
        }
    }

    public Optional<NetworkIdentity> acquire(boolean preferPaid) {
        return acquire(preferPaid, ANY_PROTOCOL);
    }

    /**
     * Picks an identity whose protocol is in {@code protocols}. Paid first when asked, then free,
     * then paid again as a last resort. Empty means the caller goes out directly.
     */
    public synchronized Optional<NetworkIdentity> acquire(boolean preferPaid, Set<IdentityProtocol> protocols) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        List<NetworkIdentity> paidEligible = eligible(paid, protocols, now);
        List<NetworkIdentity> freeEligible = eligible(free, protocols, now);
        boolean forced = forceRotation || usesSinceRotation >= settings.getForceRotationAfterUses();

        NetworkIdentity chosen;
        if (preferPaid && !paidEligible.isEmpty()) {
            chosen = select(IdentityTier.PAID, paidEligible, forced);
        } else if (!freeEligible.isEmpty()) {
            chosen = select(IdentityTier.FREE, freeEligible, forced);
        } else if (!paidEligible.isEmpty()) {
            chosen = select(IdentityTier.PAID, paidEligible, forced);
        } else {
            return Optional.empty();
        }

        if (forced) {
            log.debug("Forced identity rotation to {}", chosen);
            usesSinceRotation = 0;
            forceRotation = false;
        }
        usesSinceRotation++;
        lastSelected = chosen;
        chosen.markSelected(now);
        return Optional.of(chosen);
    }

    private List<NetworkIdentity> eligible(List<NetworkIdentity> identities, Set<IdentityProtocol> protocols, Instant now) {
        List<NetworkIdentity> result = new ArrayList<>();
        for (NetworkIdentity identity : identities) {
            if (protocols.contains(identity.protocol()) && identity.isEligible(now)) {
                result.add(identity);
            }
        }
        return result;
    }

    private NetworkIdentity select(IdentityTier tier, List<NetworkIdentity> candidates, boolean forced) {
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        if (!settings.isRotationEnabled()) {
            NetworkIdentity pick = candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
            if (forced && pick.equals(lastSelected)) {
                List<NetworkIdentity> others = new ArrayList<>(candidates);
                others.remove(lastSelected);
                pick = others.get(ThreadLocalRandom.current().nextInt(others.size()));
            }
            return pick;
        }
        List<NetworkIdentity> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator
            .comparingDouble(NetworkIdentity::successRate).reversed()
            .thenComparingLong(NetworkIdentity::latencySortKey));
        int cursor = (cursors.getOrDefault(tier, -1) + 1) % ordered.size();
        if (forced && ordered.get(cursor).equals(lastSelected)) {
            cursor = (cursor + 1) % ordered.size();
        }
        cursors.put(tier, cursor);
        return ordered.get(cursor);
    }

    public synchronized void reportSuccess(NetworkIdentity identity, Duration latency) {
        if (identity == null || identity.isDirect()) {
            return;
        }
        identity.recordSuccess(latency, clock.instant());
    }

    public synchronized void reportFailure(NetworkIdentity identity) {
        if (identity == null || identity.isDirect()) {
            return;
        }
        boolean died = identity.recordFailure(clock.instant(), deathThreshold(identity), cooldown());
        if (died) {
            log.warn(
                "Identity {} marked dead after {} consecutive failures, cooling down {}s",
                identity,
                identity.consecutiveFailures(),
                settings.getCooldownSeconds()
            );
        }
    }

    public synchronized void quarantine(NetworkIdentity identity) {
        if (identity == null || identity.isDirect()) {
            return;
        }
        Instant now = clock.instant();
        identity.recordFailure(now, deathThreshold(identity), cooldown());
        identity.coolDown(now.plus(cooldown()));
        forceRotation = true;
        log.warn("Identity {} quarantined for {}s", identity, settings.getCooldownSeconds());
    }

    public int deathThreshold(NetworkIdentity identity) {
        return identity.tier() == IdentityTier.PAID
            ? settings.getPaidDeathThreshold()
            : settings.getFreeDeathThreshold();
    }

    private Duration cooldown() {
        return Duration.ofSeconds(settings.getCooldownSeconds());
    }

    public boolean refreshIfStale() {
        if (!settings.isEnabled() || !isSweepDue()) {
            return false;
        }
        if (!sweepRunning.compareAndSet(false, true)) {
            return false;
        }
        try {
            sweep();
            return true;
        } finally {
            sweepRunning.set(false);
        }
    }

    synchronized boolean isSweepDue() {
        Instant now = clock.instant();
        if (lastSweepAt == null) {
            return true;
        }
        if (Duration.between(lastSweepAt, now).compareTo(Duration.ofMinutes(settings.getSweepIntervalMinutes())) > 0) {
            return true;
        }
        int alive = 0;
        boolean recheckable = false;
        for (NetworkIdentity identity : allIdentities()) {
            if (identity.isAlive()) {
                alive++;
            } else if (!identity.isInCooldown(now)) {
                recheckable = true;
            }
        }
        return alive < settings.getAliveFloor() && recheckable;
    }

    private void sweep() {
        loadFreeIdentities();
        Instant startedAt = clock.instant();
        List<NetworkIdentity> candidates = new ArrayList<>();
        synchronized (this) {
            for (NetworkIdentity identity : allIdentities()) {
                if (!identity.isInCooldown(startedAt)) {
                    candidates.add(identity);
                }
            }
        }
        Duration timeout = Duration.ofSeconds(settings.getProbeTimeoutSeconds());
        Semaphore gate = new Semaphore(settings.getHealthCheckConcurrency());
        List<CompletableFuture<HealthCheckResult>> futures = new ArrayList<>();
        for (NetworkIdentity identity : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> probe(identity, timeout, gate), healthCheckExecutor));
        }

        int healthy = 0;
        for (int i = 0; i < futures.size(); i++) {
            NetworkIdentity identity = candidates.get(i);
            HealthCheckResult result = awaitProbe(futures.get(i), timeout);
            Instant now = clock.instant();
            synchronized (this) {
                if (result.healthy()) {
                    healthy++;
                    identity.recordHealthy(result.latency(), now);
                } else {
                    identity.recordProbeFailure(now, deathThreshold(identity), cooldown());
                    log.debug("Health check failed for {}: {}", identity, result.detail());
                }
            }
        }
        lastSweepAt = clock.instant();
        IdentityPoolSnapshot snapshot = snapshot();
        log.info(
            "Identity sweep checked {} identities, healthy={}, alive now paid={}/{} free={}/{}",
            candidates.size(),
            healthy,
            snapshot.paidAlive(),
            snapshot.paidTotal(),
            snapshot.freeAlive(),
            snapshot.freeTotal()
        );
    }

    private HealthCheckResult probe(NetworkIdentity identity, Duration timeout, Semaphore gate) {
        boolean acquired = false;
        try {
            gate.acquire();
            acquired = true;
            return healthChecker.check(identity, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthCheckResult.failed("interrupted");
        } catch (RuntimeException e) {
            return HealthCheckResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            if (acquired) {
                gate.release();
            }
        }
    }

    private HealthCheckResult awaitProbe(CompletableFuture<HealthCheckResult> future, Duration timeout) {
        long waitMs = timeout.toMillis() * 2 + 1000L;
        try {
            return future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return HealthCheckResult.failed("timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return HealthCheckResult.failed("interrupted");
        } catch (ExecutionException e) {
            return HealthCheckResult.failed("probe_error: " + e.getCause());
        }
    }

    private void loadFreeIdentities() {
        if (freeFeed == null) {
            return;
        }
        List<IdentityEndpoint> endpoints;
        try {
            endpoints = freeFeed.fetch();
        } catch (RuntimeException e) {
            log.warn("Free identity feed failed, keeping {} known free identities", free.size(), e);
            return;
        }
        int added = 0;
        synchronized (this) {
            for (IdentityEndpoint endpoint : endpoints) {
                if (free.size() >= settings.getFreeFeedLimit()) {
                    break;
                }
                NetworkIdentity candidate = NetworkIdentity.free(endpoint);
                if (!free.contains(candidate) && !paid.contains(candidate)) {
                    free.add(candidate);
                    added++;
                }
            }
        }
        if (added > 0) {
            log.info("Loaded {} free identities from feed", added);
        }
    }

    private List<NetworkIdentity> allIdentities() {
        List<NetworkIdentity> all = new ArrayList<>(paid.size() + free.size());
        all.addAll(paid);
        all.addAll(free);
        return all;
    }

    public synchronized List<NetworkIdentity> identities() {
        return List.copyOf(allIdentities());
    }

    public synchronized IdentityPoolSnapshot snapshot() {
        Instant now = clock.instant();
        int paidAlive = 0;
        int freeAlive = 0;
        int inCooldown = 0;
        double rateSum = 0.0;
        List<NetworkIdentity> all = allIdentities();
        for (NetworkIdentity identity : all) {
            if (identity.isAlive()) {
                if (identity.tier() == IdentityTier.PAID) {
                    paidAlive++;
                } else {
                    freeAlive++;
                }
            }
            if (identity.isInCooldown(now)) {
                inCooldown++;
            }
            rateSum += identity.successRate();
        }
        double meanRate = all.isEmpty() ? 0.0 : rateSum / all.size();
        return new IdentityPoolSnapshot(paid.size(), paidAlive, free.size(), freeAlive, inCooldown, meanRate, lastSweepAt);
    }
}
