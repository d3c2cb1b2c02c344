package com.regdoc.acquirer.crawl.strategy;

import com.regdoc.acquirer.crawl.identity.NetworkIdentity;

public interface BrowserSessionFactory {

    BrowserSession open(NetworkIdentity identity) throws StrategyException;
}
