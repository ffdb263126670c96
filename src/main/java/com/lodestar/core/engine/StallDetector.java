package com.lodestar.core.engine;

import com.lodestar.core.config.LodestarProperties;
import com.lodestar.core.persistence.SessionKey;
import com.lodestar.core.phase.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detects sessions that keep running iterations without changing anything:
 * same durable fingerprint and same phase before and after.
 * <p>
 * Counts consecutive no-progress iterations per session; any progress resets
 * the count, and so does the end of the session. Counts live in memory only.
 */
@Service
public class StallDetector {

    private static final Logger log = LoggerFactory.getLogger(StallDetector.class);

    private final ConcurrentHashMap<SessionKey, Integer> noProgressCounts = new ConcurrentHashMap<>();
    private final int maxStalledIterations;

    public StallDetector(LodestarProperties properties) {
        this.maxStalledIterations = properties.getEngine().getMaxStalledIterations();
        if (maxStalledIterations < 1) {
            throw new IllegalArgumentException(
                    "lodestar.engine.max-stalled-iterations must be at least 1, got " + maxStalledIterations);
        }
    }

    public static boolean madeProgress(String fingerprintBefore, Phase phaseBefore,
                                       String fingerprintAfter, Phase phaseAfter) {
        return !fingerprintBefore.equals(fingerprintAfter) || !Objects.equals(phaseBefore, phaseAfter);
    }

    /**
     * Records one finished iteration.
     *
     * @return {@code true} if the session has now gone {@code max-stalled-iterations}
     *         consecutive iterations without progress
     */
    public boolean recordIteration(SessionKey key, boolean progressed) {
        if (progressed) {
            noProgressCounts.remove(key);
            return false;
        }
        int count = noProgressCounts.merge(key, 1, Integer::sum);
        log.debug("Session {} made no progress ({} of {})", key, count, maxStalledIterations);
        return count >= maxStalledIterations;
    }

    public int stalledCount(SessionKey key) {
        return noProgressCounts.getOrDefault(key, 0);
    }

    public int maxStalledIterations() {
        return maxStalledIterations;
    }

    public void reset(SessionKey key) {
        noProgressCounts.remove(key);
    }

    /** Number of sessions with a non-zero count. */
    public int trackedSessions() {
        return noProgressCounts.size();
    }
}
