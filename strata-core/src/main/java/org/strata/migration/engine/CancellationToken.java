package org.strata.migration.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation. Checked before each unit and, when DDL is not transactional,
 * before each operation.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
