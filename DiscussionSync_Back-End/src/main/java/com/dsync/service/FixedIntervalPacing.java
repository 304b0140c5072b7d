package com.dsync.service;

import com.dsync.repo.CollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Keeps a minimum interval between two mutating calls, whichever sync routine issues them.
 */
@Component
public class FixedIntervalPacing implements SyncPacing {

    private static final Logger log = LoggerFactory.getLogger(FixedIntervalPacing.class);

    private final long minIntervalMillis;

    private long lastPermitNanos;

    private boolean permitted;

    public FixedIntervalPacing(@Value("${sync.pacing.min-interval-ms:1000}") long minIntervalMillis) {
        this.minIntervalMillis = Math.max(0, minIntervalMillis);
    }

    @Override
    public synchronized void awaitPermit() {
        long now = System.nanoTime();
        if (permitted) {
            long waitMillis = minIntervalMillis - (now - lastPermitNanos) / 1_000_000L;
            if (waitMillis > 0) {
                log.debug("Pacing: waiting {} ms before the next write", waitMillis);
                try {
                    Thread.sleep(waitMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CollaboratorException(CollaboratorException.Kind.TRANSIENT,
                            "Interrupted while waiting for the write pacing interval", e);
                }
                now = System.nanoTime();
            }
        }
        lastPermitNanos = now;
        permitted = true;
    }

    public long getMinIntervalMillis() {
        return minIntervalMillis;
    }
}
