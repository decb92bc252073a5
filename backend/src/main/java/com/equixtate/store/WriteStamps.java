package com.equixtate.store;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * updatedAt for the next write: the current time at millisecond precision (what MongoDB keeps),
 * bumped past the previous stamp when the clock has not moved.
 */
final class WriteStamps {

    private WriteStamps() {
    }

    static Instant next(Instant previous, Clock clock) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (previous != null && !now.isAfter(previous)) {
            return previous.truncatedTo(ChronoUnit.MILLIS).plusMillis(1);
        }
        return now;
    }
}
