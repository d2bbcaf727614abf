package gmail.cleanup.app.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop signal for one sync run. The scan loop checks it between batches;
 * in-flight remote calls are never interrupted.
 */
public class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits for {@code delay} or until cancelled, whichever comes first.
     * @return true if the token was cancelled
     */
    public boolean awaitCancellation(Duration delay) throws InterruptedException {
        return cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
