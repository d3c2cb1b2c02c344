package com.regdoc.acquirer.crawl.identity;

import java.time.Duration;

public record HealthCheckResult(
    boolean healthy,
    Duration latency,
    String detail
) {
    public static HealthCheckResult healthy(Duration latency) {
        return new HealthCheckResult(true, latency, null);
    }

    public static HealthCheckResult failed(String detail) {
        return new HealthCheckResult(false, null, detail);
    }
}
