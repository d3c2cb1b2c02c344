package com.regdoc.acquirer.crawl.strategy;

import java.util.List;

public final class StrategyIds {
    public static final String STRUCTURED_API = "structured-api";
    public static final String DIRECT_URL = "direct-url";
    public static final String SEARCH_ENGINE = "search-engine";
    public static final String BROWSER_SEARCH = "browser-search";

    public static final List<String> ALL = List.of(STRUCTURED_API, DIRECT_URL, SEARCH_ENGINE, BROWSER_SEARCH);

    private StrategyIds() {}
}
