package com.regdoc.acquirer.crawl.api;

public record AcquireRequest(
    String name
) {
}
