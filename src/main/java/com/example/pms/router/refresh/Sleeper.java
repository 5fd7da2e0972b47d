package com.example.pms.router.refresh;

import java.time.Duration;

/**
 * Pauses the calling thread between retries. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
