package com.vespasync.sync.stats;

import java.util.UUID;

public record ScoreObservation(UUID institutionId, int cycle, String period, String dimension, double value) {
}
