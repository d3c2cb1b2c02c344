package com.regdoc.acquirer.crawl.session;

import com.regdoc.acquirer.crawl.strategy.StrategyException;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class PhaseSessionManager<S extends AutoCloseable> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PhaseSessionManager.class);

    private final String name;
    private final SessionOpener<S> opener;
    private final int restartAfterUses;
    private final Deque<S> idle = new ArrayDeque<>();
    private final Map<S, Integer> uses = new IdentityHashMap<>();
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger discarded = new AtomicInteger();
    private boolean closed;

    public PhaseSessionManager(String name, SessionOpener<S> opener, int restartAfterUses) {
        this.name = name;
        this.opener = opener;
        this.restartAfterUses = Math.max(1, restartAfterUses);
    }

    public <T> T withSession(SessionWork<S, T> work) throws StrategyException {
        S session = borrow();
        boolean healthy = false;
        try {
            T result = work.apply(session);
            healthy = true;
            return result;
        } catch (StrategyException e) {
            healthy = !ReasonCodes.SESSION_FAILED.equals(e.reasonCode());
            throw e;
        } finally {
            giveBack(session, healthy);
        }
    }

    private S borrow() throws StrategyException {
        synchronized (this) {
            if (closed) {
                throw new StrategyException(ReasonCodes.SESSION_FAILED, name + " session scope already closed");
            }
            S existing = idle.pollFirst();
            if (existing != null) {
                return existing;
            }
        }
        S fresh = opener.open();
        opened.incrementAndGet();
        synchronized (this) {
            uses.put(fresh, 0);
        }
        log.info("{} session opened ({} so far in this phase)", name, opened.get());
        return fresh;
    }

    private void giveBack(S session, boolean healthy) {
        boolean dispose;
        synchronized (this) {
            int count = uses.getOrDefault(session, 0) + 1;
            uses.put(session, count);
            if (!healthy) {
                log.warn("{} session failed, discarding it", name);
                dispose = true;
            } else if (count >= restartAfterUses) {
                log.info("{} session reached {} uses, restarting", name, count);
                dispose = true;
            } else {
                dispose = closed;
            }
            if (dispose) {
                uses.remove(session);
            } else {
                idle.addLast(session);
            }
        }
        if (dispose) {
            discarded.incrementAndGet();
            closeQuietly(session);
        }
    }

    @Override
    public void close() {
        Deque<S> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayDeque<>(idle);
            for (S session : toClose) {
                uses.remove(session);
            }
            idle.clear();
        }
        for (S session : toClose) {
            closeQuietly(session);
        }
        log.info("{} sessions closed for phase (opened={}, recycled={})", name, opened.get(), discarded.get());
    }

    private void closeQuietly(S session) {
        try {
            session.close();
        } catch (Exception e) {
            log.warn("{} session did not close cleanly", name, e);
        }
    }

    public int openedCount() {
        return opened.get();
    }

    public synchronized int liveCount() {
        return uses.size();
    }
}
