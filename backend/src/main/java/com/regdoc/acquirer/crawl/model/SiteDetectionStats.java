package com.regdoc.acquirer.crawl.model;

public record SiteDetectionStats(
    long total,
    long success,
    long blocked,
    long captcha,
    long rateLimited
) {
}
