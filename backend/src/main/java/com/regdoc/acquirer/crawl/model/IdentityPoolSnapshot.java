package com.regdoc.acquirer.crawl.model;

import java.time.Instant;

public record IdentityPoolSnapshot(
    int paidTotal,
    int paidAlive,
    int freeTotal,
    int freeAlive,
    int inCooldown,
    double meanSuccessRate,
    Instant lastSweepAt
) {
    public int total() {
        return paidTotal + freeTotal;
    }

    public int alive() {
        return paidAlive + freeAlive;
    }
}
