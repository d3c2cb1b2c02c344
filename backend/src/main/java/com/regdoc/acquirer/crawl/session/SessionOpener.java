package com.regdoc.acquirer.crawl.session;

import com.regdoc.acquirer.crawl.strategy.StrategyException;

@FunctionalInterface
public interface SessionOpener<S extends AutoCloseable> {
    S open() throws StrategyException;
}
