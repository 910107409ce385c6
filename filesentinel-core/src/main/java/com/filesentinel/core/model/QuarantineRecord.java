package com.filesentinel.core.model;

import java.time.Instant;

/**
 * Policy metadata for a quarantined copy. The bytes themselves live in the blob
 * store under {@code location}.
 */
public record QuarantineRecord(String location, Instant expiresAt, AccessLevel accessLevel,
        boolean reviewRequired, Instant reviewDeadline) {
}
