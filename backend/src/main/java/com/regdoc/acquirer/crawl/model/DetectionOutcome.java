package com.regdoc.acquirer.crawl.model;

public record DetectionOutcome(
    DetectionVerdict verdict,
    AnticrawlerLevel level
) {
}
