package gmail.cleanup.app.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gate for every outbound Gmail API call.
 *
 * <p>Bounds both the number of calls in flight ({@code maxConcurrency}) and the number of calls
 * started within any rolling {@code window} ({@code maxRequests}). Start times are kept in a
 * circular buffer; entries older than the window are expired on each admission check.
 * Callers are admitted in FIFO order.
 *
 * <pre>
 * try (RateLimiter.Permit permit = rateLimiter.acquire()) {
 *     gmailApiService.trash(token, chunk);
 * }
 * </pre>
 */
@Slf4j
public class RateLimiter {
    private final int maxConcurrency;
    private final Semaphore slots;
    private final ReentrantLock admission = new ReentrantLock(true);
    private final long[] startTimes;
    private final long windowNanos;
    private int index;
    private int count;
    private final AtomicLong backOffUntil;
    private final AtomicInteger outstanding = new AtomicInteger();

    public RateLimiter(int maxConcurrency, int maxRequests, Duration window) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxConcurrency = maxConcurrency;
        this.slots = new Semaphore(maxConcurrency, true);
        this.startTimes = new long[maxRequests];
        this.windowNanos = window.toNanos();
        this.backOffUntil = new AtomicLong(System.nanoTime());
    }

    /**
     * Blocks until a concurrency slot is free and the rolling window has room.
     * The returned permit must be released once the remote call finishes, whether it failed or not.
     */
    public Permit acquire() throws InterruptedException {
        slots.acquire();
        boolean admitted = false;
        try {
            admission.lockInterruptibly();
            try {
                long wait;
                while ((wait = nanosUntilAdmission(System.nanoTime())) > 0) {
                    TimeUnit.NANOSECONDS.sleep(wait);
                }
                record(System.nanoTime());
            } finally {
                admission.unlock();
            }
            admitted = true;
        } finally {
            if (!admitted) {
                slots.release();
            }
        }
        outstanding.incrementAndGet();
        return new Permit();
    }

    public void release(Permit permit) {
        if (permit != null) {
            permit.close();
        }
    }

    /**
     * Holds back all new admissions for at least {@code delay}. Used when Gmail reports throttling.
     */
    public void backOff(Duration delay) {
        long until = System.nanoTime() + delay.toNanos();
        backOffUntil.accumulateAndGet(until, (current, next) -> next - current > 0 ? next : current);
        log.warn("Rate limiter backing off for {} ms", delay.toMillis());
    }

    public int outstanding() {
        return outstanding.get();
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    private long nanosUntilAdmission(long now) {
        long backOffWait = backOffUntil.get() - now;
        expire(now);
        long windowWait = 0;
        if (count >= startTimes.length) {
            int oldest = (index - count + startTimes.length) % startTimes.length;
            windowWait = startTimes[oldest] + windowNanos - now;
        }
        return Math.max(backOffWait, windowWait);
    }

    private void expire(long now) {
        while (count > 0) {
            int oldest = (index - count + startTimes.length) % startTimes.length;
            if (now - startTimes[oldest] >= windowNanos) {
                count--;
            } else {
                break;
            }
        }
    }

    private void record(long now) {
        startTimes[index] = now;
        index = (index + 1) % startTimes.length;
        count++;
    }

    /**
     * One admitted call. Closing it more than once has no further effect.
     */
    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                outstanding.decrementAndGet();
                slots.release();
            }
        }
    }
}
