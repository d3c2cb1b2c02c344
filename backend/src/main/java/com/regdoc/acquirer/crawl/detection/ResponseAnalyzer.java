package com.regdoc.acquirer.crawl.detection;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.model.AnticrawlerLevel;
import com.regdoc.acquirer.crawl.model.DetectionOutcome;
import com.regdoc.acquirer.crawl.model.DetectionSummary;
import com.regdoc.acquirer.crawl.model.DetectionVerdict;
import com.regdoc.acquirer.crawl.model.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

@Service
public class ResponseAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ResponseAnalyzer.class);

    private final AcquirerProperties.Detection settings;
    private final DetectionMetrics metrics;
    private AnticrawlerLevel level = AnticrawlerLevel.NONE;

    public ResponseAnalyzer(AcquirerProperties properties) {
        this.settings = properties.getDetection();
        this.metrics = new DetectionMetrics(settings.getRateWindowSize());
    }

    public DetectionOutcome classify(int statusCode, Map<String, List<String>> headers, String body, Duration responseTime) {
        return classify(statusCode, headers, body, responseTime, null);
    }

    public DetectionOutcome classify(
        int statusCode,
        Map<String, List<String>> headers,
        String body,
        Duration responseTime,
        String site
    ) {
        DetectionVerdict verdict = detect(statusCode, headers, body, responseTime);
        AnticrawlerLevel current = record(verdict, site);
        if (!verdict.isNormal()) {
            log.debug("Hostile response from {}: {} (status {})", site, verdict, statusCode);
        }
        return new DetectionOutcome(verdict, current);
    }

    public DetectionVerdict detect(int statusCode, Map<String, List<String>> headers, String body, Duration responseTime) {
        DetectionVerdict byStatus = checkStatus(statusCode);
        if (!byStatus.isNormal()) {
            return byStatus;
        }
        DetectionVerdict byHeaders = checkHeaders(headers);
        if (!byHeaders.isNormal()) {
            return byHeaders;
        }
        DetectionVerdict byBody = checkBody(body);
        if (!byBody.isNormal()) {
            return byBody;
        }
        return checkTiming(responseTime, body == null ? 0 : body.length());
    }

    private DetectionVerdict checkStatus(int statusCode) {
        if (DetectionRules.RATE_LIMIT_STATUSES.contains(statusCode)) {
            return DetectionVerdict.RATE_LIMITED;
        }
        if (DetectionRules.IP_BAN_STATUSES.contains(statusCode)) {
            return DetectionVerdict.IP_BANNED;
        }
        if (DetectionRules.BLOCK_STATUSES.contains(statusCode)) {
            return DetectionVerdict.BLOCKED;
        }
        return DetectionVerdict.NORMAL;
    }

    private DetectionVerdict checkHeaders(Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty()) {
            return DetectionVerdict.NORMAL;
        }
        boolean cloudflare = false;
        boolean waf = false;
        for (String name : headers.keySet()) {
            if (name == null) {
                continue;
            }
            String lower = name.toLowerCase(Locale.ROOT);
            cloudflare |= DetectionRules.CLOUDFLARE_HEADERS.contains(lower);
            waf |= DetectionRules.WAF_HEADERS.contains(lower);
        }
        if (cloudflare) {
            return DetectionVerdict.CLOUDFLARE_CHALLENGE;
        }
        return waf ? DetectionVerdict.WAF_DETECTED : DetectionVerdict.NORMAL;
    }

    // Only the head is scanned; challenge pages put their prompt up front.
    private DetectionVerdict checkBody(String body) {
        if (body == null || body.isBlank() || settings.getBodyScanMaxChars() == 0) {
            return DetectionVerdict.NORMAL;
        }
        CharSequence head = body.length() > settings.getBodyScanMaxChars()
            ? body.subSequence(0, settings.getBodyScanMaxChars())
            : body;
        for (Map.Entry<DetectionVerdict, List<Pattern>> entry : DetectionRules.BODY_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(head).find()) {
                    return entry.getKey();
                }
            }
        }
        return DetectionVerdict.NORMAL;
    }

    private DetectionVerdict checkTiming(Duration responseTime, int bodyLength) {
        if (responseTime == null) {
            return DetectionVerdict.NORMAL;
        }
        long millis = responseTime.toMillis();
        if (millis < settings.getFastResponseMillis() && bodyLength < settings.getFastResponseMaxBodyChars()) {
            return DetectionVerdict.BLOCKED;
        }
        if (millis > settings.getSlowResponseMillis()) {
            return DetectionVerdict.RATE_LIMITED;
        }
        return DetectionVerdict.NORMAL;
    }

    private synchronized AnticrawlerLevel record(DetectionVerdict verdict, String site) {
        metrics.record(verdict, site, Instant.now());
        double recentRate = metrics.recentBlockRate(settings.getRateMinSamples());
        AnticrawlerLevel next = deriveLevel(metrics.consecutiveBlocks(), recentRate);
        if (next != level) {
            log.info("Anticrawler level {} -> {} (consecutive blocks {}, recent block rate {})",
                level, next, metrics.consecutiveBlocks(), String.format(Locale.ROOT, "%.2f", recentRate));
            level = next;
        }
        return level;
    }

    // Consecutive thresholds are inclusive, rate thresholds exclusive.
    AnticrawlerLevel deriveLevel(int consecutiveBlocks, double blockRate) {
        List<Integer> consecutive = settings.getConsecutiveThresholds();
        List<Double> rates = settings.getRateThresholds();
        AnticrawlerLevel[] tiers = {
            AnticrawlerLevel.EXTREME,
            AnticrawlerLevel.HIGH,
            AnticrawlerLevel.MEDIUM,
            AnticrawlerLevel.LOW
        };
        for (int i = 0; i < tiers.length; i++) {
            int index = tiers.length - 1 - i;
            if (consecutiveBlocks >= consecutive.get(index) || blockRate > rates.get(index)) {
                return tiers[i];
            }
        }
        return AnticrawlerLevel.NONE;
    }

    public synchronized AnticrawlerLevel currentLevel() {
        return level;
    }

    public synchronized int consecutiveBlocks() {
        return metrics.consecutiveBlocks();
    }

    public Duration adaptiveDelay(OperationKind kind) {
        AnticrawlerLevel current = currentLevel();
        double base = settings.getBaseDelayMillis() * settings.getLevelMultipliers().get(current.ordinal());
        double scaled = base * operationMultiplier(kind);
        double jitter = settings.getJitterMin() >= settings.getJitterMax()
            ? settings.getJitterMin()
            : ThreadLocalRandom.current().nextDouble(settings.getJitterMin(), settings.getJitterMax());
        long millis = Math.round(scaled * jitter);
        return Duration.ofMillis(Math.max(0L, Math.min(millis, settings.getMaxDelayMillis())));
    }

    private double operationMultiplier(OperationKind kind) {
        if (kind == null) {
            return 1.0;
        }
        return switch (kind) {
            case SEARCH -> settings.getSearchMultiplier();
            case RETRY -> settings.getRetryMultiplier();
            case DETAIL -> settings.getDetailMultiplier();
            case DEFAULT -> 1.0;
        };
    }

    /**
     * Sleeps for {@link #adaptiveDelay(OperationKind)}.
     *
     * @return false when interrupted, with the interrupt flag restored
     */
    public boolean pause(OperationKind kind) {
        long sleepMs = adaptiveDelay(kind).toMillis();
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public synchronized boolean shouldRotateIdentity() {
        return metrics.consecutiveBlocks() >= settings.getRotateThreshold()
            || level.atLeast(AnticrawlerLevel.HIGH);
    }

    public synchronized boolean shouldTreatAsBanned() {
        return metrics.consecutiveBlocks() >= settings.getBanThreshold()
            || level == AnticrawlerLevel.EXTREME;
    }

    public synchronized DetectionSummary summary() {
        return new DetectionSummary(
            level,
            metrics.totalRequests(),
            metrics.successfulRequests(),
            metrics.blockedRequests(),
            metrics.captchaRequests(),
            metrics.rateLimitedRequests(),
            metrics.successRate(),
            metrics.blockRate(),
            metrics.consecutiveBlocks(),
            metrics.lastBlockedAt(),
            adaptiveDelay(OperationKind.DEFAULT).toMillis(),
            shouldRotateIdentity(),
            metrics.siteStats()
        );
    }
}
