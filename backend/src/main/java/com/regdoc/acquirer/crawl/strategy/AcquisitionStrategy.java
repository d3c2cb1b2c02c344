package com.regdoc.acquirer.crawl.strategy;

import com.regdoc.acquirer.crawl.model.MatchCandidate;
import com.regdoc.acquirer.crawl.model.RawRecord;

import java.util.List;

/**
 * One way of locating and retrieving a regulatory document.
 *
 * <p>Implementations must be safe for concurrent {@link #search} and {@link #fetchDetail} calls
 * on different targets. Strategies that hold an expensive automation resource report
 * {@link #supportsBatchSession()} and get {@link #openSession()} / {@link #closeSession()}
 * around each batch phase; calls to the pair may nest and must be balanced.
 */
public interface AcquisitionStrategy {

    String id();

    List<MatchCandidate> search(String targetName) throws StrategyException;

    RawRecord fetchDetail(MatchCandidate candidate) throws StrategyException;

    default boolean supportsBatchSession() {
        return false;
    }

    default void openSession() throws StrategyException {
    }

    default void closeSession() {
    }

    default boolean escalationTarget() {
        return false;
    }
}
