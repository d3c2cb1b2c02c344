package com.regdoc.acquirer.crawl.detection;

import com.regdoc.acquirer.crawl.model.DetectionVerdict;
import com.regdoc.acquirer.crawl.model.SiteDetectionStats;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

// Not thread-safe; ResponseAnalyzer guards it.
class DetectionMetrics {
    private long totalRequests;
    private long successfulRequests;
    private long blockedRequests;
    private long captchaRequests;
    private long rateLimitedRequests;
    private int consecutiveBlocks;
    private Instant lastBlockedAt;
    private final Map<String, long[]> siteCounters = new LinkedHashMap<>();
    private final Deque<Boolean> recent = new ArrayDeque<>();
    private final int windowSize;
    private int recentHostile;

    DetectionMetrics(int windowSize) {
        this.windowSize = Math.max(1, windowSize);
    }

    void record(DetectionVerdict verdict, String site, Instant now) {
        totalRequests++;
        remember(!verdict.isNormal());
        long[] counters = siteCounters.computeIfAbsent(site == null ? "unknown" : site, ignored -> new long[5]);
        counters[0]++;
        switch (verdict) {
            case NORMAL -> {
                successfulRequests++;
                consecutiveBlocks = 0;
                counters[1]++;
                return;
            }
            case CAPTCHA -> {
                captchaRequests++;
                counters[3]++;
            }
            case RATE_LIMITED -> {
                rateLimitedRequests++;
                counters[4]++;
            }
            default -> {
                blockedRequests++;
                counters[2]++;
            }
        }
        consecutiveBlocks++;
        lastBlockedAt = now;
    }

    private void remember(boolean hostile) {
        recent.addLast(hostile);
        if (hostile) {
            recentHostile++;
        }
        if (recent.size() > windowSize) {
            if (recent.removeFirst()) {
                recentHostile--;
            }
        }
    }

    // Zero until minSamples verdicts are in.
    double recentBlockRate(int minSamples) {
        if (recent.isEmpty() || recent.size() < minSamples) {
            return 0.0;
        }
        return (double) recentHostile / recent.size();
    }

    double blockRate() {
        if (totalRequests == 0) {
            return 0.0;
        }
        return (double) (blockedRequests + captchaRequests + rateLimitedRequests) / totalRequests;
    }

    double successRate() {
        if (totalRequests == 0) {
            return 0.0;
        }
        return (double) successfulRequests / totalRequests;
    }

    long totalRequests() {
        return totalRequests;
    }

    long successfulRequests() {
        return successfulRequests;
    }

    long blockedRequests() {
        return blockedRequests;
    }

    long captchaRequests() {
        return captchaRequests;
    }

    long rateLimitedRequests() {
        return rateLimitedRequests;
    }

    int consecutiveBlocks() {
        return consecutiveBlocks;
    }

    Instant lastBlockedAt() {
        return lastBlockedAt;
    }

    Map<String, SiteDetectionStats> siteStats() {
        Map<String, SiteDetectionStats> stats = new LinkedHashMap<>();
        siteCounters.forEach((site, c) -> stats.put(site, new SiteDetectionStats(c[0], c[1], c[2], c[3], c[4])));
        return stats;
    }
}
