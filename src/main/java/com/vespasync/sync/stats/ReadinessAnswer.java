package com.vespasync.sync.stats;

import java.util.UUID;

/**
 * One outcome-question response, located by institution, person, cycle and period.
 */
public record ReadinessAnswer(UUID institutionId, UUID personId, int cycle, String period, String questionId, int value) {
}
