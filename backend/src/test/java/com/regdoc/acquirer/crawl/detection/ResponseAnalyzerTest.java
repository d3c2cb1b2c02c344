package com.regdoc.acquirer.crawl.detection;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.model.AnticrawlerLevel;
import com.regdoc.acquirer.crawl.model.DetectionSummary;
import com.regdoc.acquirer.crawl.model.DetectionVerdict;
import com.regdoc.acquirer.crawl.model.OperationKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseAnalyzerTest {
    private static final Duration NORMAL_TIME = Duration.ofMillis(400);

    @Test
    void classifiesByStatusHeadersBodyAndTiming() {
        ResponseAnalyzer analyzer = new ResponseAnalyzer(new AcquirerProperties());

        assertThat(analyzer.detect(429, Map.of(), "", NORMAL_TIME)).isEqualTo(DetectionVerdict.RATE_LIMITED);
        assertThat(analyzer.detect(403, Map.of(), "", NORMAL_TIME)).isEqualTo(DetectionVerdict.IP_BANNED);
        assertThat(analyzer.detect(522, Map.of(), "", NORMAL_TIME)).isEqualTo(DetectionVerdict.BLOCKED);
        assertThat(analyzer.detect(200, Map.of("CF-Mitigated", List.of("challenge")), "<html></html>", NORMAL_TIME))
            .isEqualTo(DetectionVerdict.CLOUDFLARE_CHALLENGE);
        assertThat(analyzer.detect(200, Map.of(), "<p>请输入验证码后继续</p>", NORMAL_TIME))
            .isEqualTo(DetectionVerdict.CAPTCHA);
        assertThat(analyzer.detect(200, Map.of(), "short", Duration.ofMillis(5))).isEqualTo(DetectionVerdict.BLOCKED);
        assertThat(analyzer.detect(200, Map.of(), "<p>ok</p>", Duration.ofSeconds(45)))
            .isEqualTo(DetectionVerdict.RATE_LIMITED);
        assertThat(analyzer.detect(200, Map.of(), "<h1>数据安全法</h1>", NORMAL_TIME)).isEqualTo(DetectionVerdict.NORMAL);
    }

    @Test
    void largeBodiesAreScannedOnlyAtTheHead() {
        AcquirerProperties properties = new AcquirerProperties();
        properties.getDetection().setBodyScanMaxChars(100);
        ResponseAnalyzer analyzer = new ResponseAnalyzer(properties);
        String challenge = "<p>请输入验证码后继续</p>" + "<div>&nbsp;</div>".repeat(500);
        String document = "<h1>数据安全法</h1>" + "第一条 ".repeat(100) + "短信验证码";

        assertThat(analyzer.detect(200, Map.of(), challenge, NORMAL_TIME)).isEqualTo(DetectionVerdict.CAPTCHA);
        assertThat(analyzer.detect(200, Map.of(), document, NORMAL_TIME)).isEqualTo(DetectionVerdict.NORMAL);
    }

    @Test
    void levelNeverDropsDuringABlockRunAndNormalResetsStreak() {
        ResponseAnalyzer analyzer = new ResponseAnalyzer(new AcquirerProperties());
        for (int i = 0; i < 20; i++) {
            analyzer.classify(200, Map.of(), "<p>正文</p>", null, "flk.npc.gov.cn");
        }
        assertThat(analyzer.currentLevel()).isEqualTo(AnticrawlerLevel.NONE);

        List<AnticrawlerLevel> levels = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            levels.add(analyzer.classify(403, Map.of(), null, null, "flk.npc.gov.cn").level());
        }
        for (int i = 1; i < levels.size(); i++) {
            assertThat(levels.get(i)).isGreaterThanOrEqualTo(levels.get(i - 1));
        }
        assertThat(levels.get(0)).isEqualTo(AnticrawlerLevel.LOW);
        assertThat(levels.get(9)).isEqualTo(AnticrawlerLevel.EXTREME);
        assertThat(analyzer.consecutiveBlocks()).isEqualTo(10);
        assertThat(analyzer.shouldTreatAsBanned()).isTrue();

        analyzer.classify(200, Map.of(), "<p>正文</p>", null, "flk.npc.gov.cn");

        assertThat(analyzer.consecutiveBlocks()).isZero();
        // 10 of the last 20 responses blocked
        assertThat(analyzer.currentLevel()).isEqualTo(AnticrawlerLevel.MEDIUM);
        assertThat(analyzer.shouldTreatAsBanned()).isFalse();
    }

    @Test
    void earlyBlocksRollOutOfTheRateWindow() {
        ResponseAnalyzer analyzer = new ResponseAnalyzer(new AcquirerProperties());
        for (int i = 0; i < 10; i++) {
            analyzer.classify(403, Map.of(), null, null, "flk.npc.gov.cn");
        }
        for (int i = 0; i < 17; i++) {
            analyzer.classify(200, Map.of(), "<p>正文</p>", null, "flk.npc.gov.cn");
        }
        // 3 of the last 20 blocked
        assertThat(analyzer.currentLevel()).isEqualTo(AnticrawlerLevel.LOW);

        analyzer.classify(200, Map.of(), "<p>正文</p>", null, "flk.npc.gov.cn");

        assertThat(analyzer.currentLevel()).isEqualTo(AnticrawlerLevel.NONE);
        assertThat(analyzer.shouldRotateIdentity()).isFalse();
        DetectionSummary summary = analyzer.summary();
        assertThat(summary.totalRequests()).isEqualTo(28);
        assertThat(summary.blockedRequests()).isEqualTo(10);
    }

    @Test
    void singleEarlyBlockDoesNotLookLikeABan() {
        ResponseAnalyzer analyzer = new ResponseAnalyzer(new AcquirerProperties());

        AnticrawlerLevel level = analyzer.classify(403, Map.of(), null, null, "flk.npc.gov.cn").level();

        assertThat(level).isEqualTo(AnticrawlerLevel.LOW);
        assertThat(analyzer.shouldTreatAsBanned()).isFalse();
    }

    @Test
    void levelIsAPureFunctionOfStreakAndRate() {
        ResponseAnalyzer analyzer = new ResponseAnalyzer(new AcquirerProperties());

        assertThat(analyzer.deriveLevel(0, 0.0)).isEqualTo(AnticrawlerLevel.NONE);
        assertThat(analyzer.deriveLevel(0, 0.1)).isEqualTo(AnticrawlerLevel.NONE);
        assertThat(analyzer.deriveLevel(1, 0.0)).isEqualTo(AnticrawlerLevel.LOW);
        assertThat(analyzer.deriveLevel(0, 0.31)).isEqualTo(AnticrawlerLevel.MEDIUM);
        assertThat(analyzer.deriveLevel(5, 0.0)).isEqualTo(AnticrawlerLevel.HIGH);
        assertThat(analyzer.deriveLevel(0, 0.81)).isEqualTo(AnticrawlerLevel.EXTREME);
    }

    @Test
    void rotationAdviceFollowsStreak() {
        ResponseAnalyzer analyzer = new ResponseAnalyzer(new AcquirerProperties());
        for (int i = 0; i < 30; i++) {
            analyzer.classify(200, Map.of(), "<p>正文</p>", null, "a");
        }
        analyzer.classify(429, Map.of(), null, null, "a");
        analyzer.classify(429, Map.of(), null, null, "a");
        assertThat(analyzer.shouldRotateIdentity()).isFalse();

        analyzer.classify(429, Map.of(), null, null, "a");
        assertThat(analyzer.shouldRotateIdentity()).isTrue();
    }

    @Test
    void adaptiveDelayScalesWithOperationAndLevel() {
        AcquirerProperties properties = new AcquirerProperties();
        properties.getDetection().setJitterMin(1.0);
        properties.getDetection().setJitterMax(1.0);
        ResponseAnalyzer analyzer = new ResponseAnalyzer(properties);

        assertThat(analyzer.adaptiveDelay(OperationKind.DEFAULT)).isEqualTo(Duration.ofMillis(1000));
        assertThat(analyzer.adaptiveDelay(OperationKind.SEARCH)).isEqualTo(Duration.ofMillis(1500));

        for (int i = 0; i < 10; i++) {
            analyzer.classify(403, Map.of(), null, null, "a");
        }
        assertThat(analyzer.currentLevel()).isEqualTo(AnticrawlerLevel.EXTREME);
        assertThat(analyzer.adaptiveDelay(OperationKind.DEFAULT)).isEqualTo(Duration.ofMillis(10000));
        assertThat(analyzer.adaptiveDelay(OperationKind.RETRY)).isEqualTo(Duration.ofMillis(20000));
        assertThat(analyzer.adaptiveDelay(OperationKind.SEARCH)).isEqualTo(Duration.ofMillis(15000));
    }

    @Test
    void summaryReportsPerSiteCounters() {
        ResponseAnalyzer analyzer = new ResponseAnalyzer(new AcquirerProperties());
        analyzer.classify(200, Map.of(), "<p>正文</p>", null, "flk.npc.gov.cn");
        analyzer.classify(429, Map.of(), null, null, "www.bing.com");

        DetectionSummary summary = analyzer.summary();

        assertThat(summary.totalRequests()).isEqualTo(2);
        assertThat(summary.successfulRequests()).isEqualTo(1);
        assertThat(summary.rateLimitedRequests()).isEqualTo(1);
        assertThat(summary.siteStats()).containsKeys("flk.npc.gov.cn", "www.bing.com");
    }
}
