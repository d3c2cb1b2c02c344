package com.regdoc.acquirer.crawl.identity;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

public final class NetworkIdentity {
    private static final double LATENCY_WEIGHT = 0.3;
    private static final NetworkIdentity DIRECT = new NetworkIdentity(
        "direct",
        IdentityKind.DIRECT,
        null,
        null,
        0,
        null,
        null,
        IdentityTier.FREE,
        true
    );

    private final String name;
    private final IdentityKind kind;
    private final IdentityProtocol protocol;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final IdentityTier tier;

    private long successCount;
    private long failureCount;
    private int consecutiveFailures;
    private Instant lastUsedAt;
    private Instant lastCheckedAt;
    private Duration observedLatency;
    private boolean alive;
    private Instant cooldownUntil;

    private NetworkIdentity(
        String name,
        IdentityKind kind,
        IdentityProtocol protocol,
        String host,
        int port,
        String username,
        String password,
        IdentityTier tier,
        boolean alive
    ) {
        this.name = name;
        this.kind = kind;
        this.protocol = protocol;
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.tier = tier;
        this.alive = alive;
    }

    public static NetworkIdentity direct() {
        return DIRECT;
    }

    public static NetworkIdentity paid(
        String name,
        IdentityProtocol protocol,
        String host,
        int port,
        String username,
        String password
    ) {
        requireEndpoint(host, port);
        String safeName = name == null || name.isBlank() ? host + ":" + port : name;
        return new NetworkIdentity(safeName, IdentityKind.PROXIED, protocol, host, port, username, password, IdentityTier.PAID, true);
    }

    // Untrusted until a health check passes.
    public static NetworkIdentity free(IdentityEndpoint endpoint) {
        requireEndpoint(endpoint.host(), endpoint.port());
        return new NetworkIdentity(
            "free-" + endpoint.key(),
            IdentityKind.PROXIED,
            endpoint.protocol(),
            endpoint.host(),
            endpoint.port(),
            null,
            null,
            IdentityTier.FREE,
            false
        );
    }

    private static void requireEndpoint(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("identity host is required");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("identity port out of range: " + port);
        }
    }

    public String name() {
        return name;
    }

    public IdentityKind kind() {
        return kind;
    }

    public IdentityProtocol protocol() {
        return protocol;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public IdentityTier tier() {
        return tier;
    }

    public boolean isDirect() {
        return kind == IdentityKind.DIRECT;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    public String key() {
        if (isDirect()) {
            return name;
        }
        return host.toLowerCase(Locale.ROOT) + ":" + port;
    }

    public String proxyServer() {
        if (isDirect()) {
            return null;
        }
        return protocol.browserScheme() + "://" + host + ":" + port;
    }

    public synchronized long successCount() {
        return successCount;
    }

    public synchronized long failureCount() {
        return failureCount;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant lastUsedAt() {
        return lastUsedAt;
    }

    public synchronized Instant lastCheckedAt() {
        return lastCheckedAt;
    }

    public synchronized Duration observedLatency() {
        return observedLatency;
    }

    public synchronized boolean isAlive() {
        return alive;
    }

    public synchronized Instant cooldownUntil() {
        return cooldownUntil;
    }

    public synchronized double successRate() {
        long total = successCount + failureCount;
        return total == 0 ? 0.0 : (double) successCount / total;
    }

    synchronized boolean isInCooldown(Instant now) {
        return cooldownUntil != null && now.isBefore(cooldownUntil);
    }

    synchronized boolean isEligible(Instant now) {
        return alive && !isInCooldown(now);
    }

    synchronized long latencySortKey() {
        return observedLatency == null ? Long.MAX_VALUE : observedLatency.toMillis();
    }

    synchronized void markSelected(Instant now) {
        lastUsedAt = now;
    }

    synchronized void recordSuccess(Duration latency, Instant now) {
        successCount++;
        consecutiveFailures = 0;
        lastUsedAt = now;
        if (latency != null) {
            observedLatency = observedLatency == null ? latency : smoothed(observedLatency, latency);
        }
    }

    // Exponential moving average, weight 0.3 on the newest sample.
    private static Duration smoothed(Duration previous, Duration latest) {
        long millis = Math.round(previous.toMillis() * (1 - LATENCY_WEIGHT) + latest.toMillis() * LATENCY_WEIGHT);
        return Duration.ofMillis(millis);
    }

    synchronized boolean recordFailure(Instant now, int deathThreshold, Duration cooldown) {
        failureCount++;
        consecutiveFailures++;
        lastUsedAt = now;
        if (alive && consecutiveFailures >= deathThreshold) {
            alive = false;
            cooldownUntil = now.plus(cooldown);
            return true;
        }
        return false;
    }

    synchronized void recordHealthy(Duration latency, Instant now) {
        alive = true;
        consecutiveFailures = 0;
        cooldownUntil = null;
        lastCheckedAt = now;
        if (latency != null) {
            observedLatency = latency;
        }
    }

    synchronized void recordProbeFailure(Instant now, int deathThreshold, Duration cooldown) {
        lastCheckedAt = now;
        failureCount++;
        consecutiveFailures++;
        if (!alive || consecutiveFailures >= deathThreshold) {
            alive = false;
            cooldownUntil = now.plus(cooldown);
        }
    }

    synchronized void coolDown(Instant until) {
        if (cooldownUntil == null || until.isAfter(cooldownUntil)) {
            cooldownUntil = until;
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof NetworkIdentity that)) {
            return false;
        }
        return kind == that.kind && Objects.equals(key(), that.key());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, key());
    }

    @Override
    public String toString() {
        return isDirect() ? "direct" : name + " [" + tier + " " + protocol + " " + key() + "]";
    }
}
