package uk.gov.di.federation.assertion.services;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Lets another thread stop a verification poll. Cancelling wakes a poller that is waiting between
 * attempts; a request already on the wire is allowed to finish.
 */
public class CancellationSignal {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /** Waits up to {@code timeout}; returns true if cancelled in the meantime. */
    boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
