package com.stationsync.synchronizer.support;

import java.time.Duration;

/**
 * Blocking pause used between chunks and runs; replaced by a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    Sleeper NONE = duration -> { };

    void sleep(Duration duration) throws InterruptedException;
}
