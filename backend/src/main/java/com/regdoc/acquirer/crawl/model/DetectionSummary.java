package com.regdoc.acquirer.crawl.model;

import java.time.Instant;
import java.util.Map;

public record DetectionSummary(
    AnticrawlerLevel level,
    long totalRequests,
    long successfulRequests,
    long blockedRequests,
    long captchaRequests,
    long rateLimitedRequests,
    double successRate,
    double blockRate,
    int consecutiveBlocks,
    Instant lastBlockedAt,
    long suggestedDelayMillis,
    boolean shouldRotateIdentity,
    Map<String, SiteDetectionStats> siteStats
) {
}
