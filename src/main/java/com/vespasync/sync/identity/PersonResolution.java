package com.vespasync.sync.identity;

import java.util.UUID;

/**
 * Outcome of {@link IdentityResolver#resolvePerson(String, String)}.
 *
 * @param minted  a new internal id was created for this email
 * @param rebound the external id was previously bound to a different internal id
 */
public record PersonResolution(UUID personId, String email, boolean minted, boolean rebound) {
}
