package com.tradeagent.execution;

import java.time.Duration;

/** Blocking pause, swapped out in tests so poll loops run instantly. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
}
