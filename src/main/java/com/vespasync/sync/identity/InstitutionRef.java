package com.vespasync.sync.identity;

import java.util.UUID;

public record InstitutionRef(UUID id, String externalId, String name, boolean usesCalendarYear) {
}
