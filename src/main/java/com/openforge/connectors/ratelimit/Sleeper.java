package com.openforge.connectors.ratelimit;

import java.time.Duration;

/**
 * Interruptible pause. Swapped for a fake clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
