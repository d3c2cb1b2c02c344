package com.regdoc.acquirer.crawl.strategy;

import com.regdoc.acquirer.crawl.identity.NetworkIdentity;

public interface BrowserSession extends AutoCloseable {

    String fetchHtml(String url) throws StrategyException;

    NetworkIdentity identity();

    @Override
    void close();
}
