package com.regdoc.acquirer.crawl.model;

import java.time.Duration;
import java.time.Instant;

public record AcquisitionResult(
    String targetName,
    boolean found,
    RawRecord record,
    String strategyUsed,
    Duration elapsedTime,
    Instant acquiredAt,
    String error
) {
    public static AcquisitionResult found(String targetName, RawRecord record, String strategyUsed, Duration elapsed) {
        return new AcquisitionResult(targetName, true, record, strategyUsed, elapsed, Instant.now(), null);
    }

    public static AcquisitionResult notFound(String targetName, Duration elapsed, String error) {
        return new AcquisitionResult(targetName, false, null, null, elapsed, Instant.now(), error);
    }

    public long elapsedMillis() {
        return elapsedTime == null ? 0L : elapsedTime.toMillis();
    }
}
