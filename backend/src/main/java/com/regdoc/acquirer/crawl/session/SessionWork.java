package com.regdoc.acquirer.crawl.session;

import com.regdoc.acquirer.crawl.strategy.StrategyException;

@FunctionalInterface
public interface SessionWork<S, T> {
    T apply(S session) throws StrategyException;
}
