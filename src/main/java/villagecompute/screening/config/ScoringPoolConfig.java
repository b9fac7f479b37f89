/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import org.jboss.logging.Logger;

/**
 * Produces the fixed thread pool that runs CPU-bound fuzzy scoring.
 *
 * <p>
 * Search jobs submit scoring work here and wait for the result, so the search worker loop never scores on its own
 * thread. Pool size comes from {@code screening.scoring.pool-size} (default 4).
 */
@ApplicationScoped
public class ScoringPoolConfig {

    private static final Logger LOG = Logger.getLogger(ScoringPoolConfig.class);

    public static final String SCORING_POOL = "scoring-pool";

    @Inject
    JobsConfig jobsConfig;

    @Produces
    @ApplicationScoped
    @Named(SCORING_POOL)
    public ExecutorService createScoringPool() {
        int size = jobsConfig.getScoringPoolSize();
        LOG.infof("Creating fuzzy scoring pool: threads=%d", size);
        return Executors.newFixedThreadPool(size, new ScoringThreadFactory());
    }

    public void closeScoringPool(@Disposes @Named(SCORING_POOL) ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Scoring pool did not terminate in 10s, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    static final class ScoringThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "fuzzy-scoring-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
