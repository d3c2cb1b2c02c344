package com.regdoc.acquirer.crawl.model;

public enum AnticrawlerLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    EXTREME;

    public boolean atLeast(AnticrawlerLevel other) {
        return compareTo(other) >= 0;
    }
}
