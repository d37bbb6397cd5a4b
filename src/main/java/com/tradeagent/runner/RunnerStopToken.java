package com.tradeagent.runner;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop signal for a {@link Runner}. Checked between cycles, never mid-cycle.
 * Sleeping through {@link #await} wakes up as soon as a stop is requested.
 */
public class RunnerStopToken {

    private final CountDownLatch stopped = new CountDownLatch(1);

    public void requestStop() {
        stopped.countDown();
    }

    public boolean isStopRequested() {
        return stopped.getCount() == 0;
    }

    /**
     * Waits up to {@code duration} or until a stop is requested.
     *
     * @return true when a stop was requested
     */
    public boolean await(Duration duration) throws InterruptedException {
        return stopped.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
