package com.di.creatormatch.agent.gateway;

import java.time.Duration;

/**
 * Blocking wait between retry attempts. Tests inject a recording implementation instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
}
