package com.regdoc.acquirer.crawl.identity;

import java.time.Duration;

public interface IdentityHealthChecker {
    HealthCheckResult check(NetworkIdentity identity, Duration timeout);
}
