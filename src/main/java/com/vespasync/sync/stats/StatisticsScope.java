package com.vespasync.sync.stats;

/**
 * Which statistics rows a recompute replaces. Score dimensions and the readiness index are
 * recomputed by separate stages, so each deletes only its own rows.
 */
public enum StatisticsScope {
    SCORES,
    READINESS
}
