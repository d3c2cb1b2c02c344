package com.regdoc.acquirer.crawl.api;

import java.util.List;

public record BatchAcquireRequest(
    List<String> names,
    Integer concurrencyLimit
) {
}
