package com.regdoc.acquirer.crawl.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record BatchAcquisitionSummary(
    Instant startedAt,
    Instant finishedAt,
    List<AcquisitionResult> results,
    Map<String, Integer> foundByStrategy,
    int foundCount,
    int notFoundCount
) {
}
