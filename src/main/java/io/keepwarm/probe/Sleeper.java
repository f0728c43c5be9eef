package io.keepwarm.probe;

import java.time.Duration;

/**
 * Waits between retry attempts. Swapped for a recording implementation in tests.
 */
@FunctionalInterface
public interface Sleeper {
    
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
    
    void sleep(Duration duration) throws InterruptedException;
}
