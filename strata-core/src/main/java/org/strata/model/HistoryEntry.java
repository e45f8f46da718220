package org.strata.model;

import lombok.Value;

import java.time.Instant;

/**
 * One completed unit transition. {@code sequence} is assigned by the state store; entries
 * created before persisting carry {@code 0}.
 */
@Value
public class HistoryEntry {
    long sequence;
    String versionId;
    Direction direction;
    Instant appliedAt;

    public static HistoryEntry of(String versionId, Direction direction, Instant appliedAt) {
        return new HistoryEntry(0L, versionId, direction, appliedAt);
    }
}
