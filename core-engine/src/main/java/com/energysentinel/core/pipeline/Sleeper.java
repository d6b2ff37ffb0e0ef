package com.energysentinel.core.pipeline;

import java.time.Duration;

/**
 * Pauses the calling thread between retry attempts. Replaced in tests to
 * avoid real waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
