package github.sarthakdev143.film_factory.ratelimit;

import github.sarthakdev143.film_factory.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Bounds concurrent calls to one class of external resource and spaces call starts at least
 * {@code 60 / maxPerMinute} seconds apart. Waiters queue roughly in arrival order.
 */
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final String name;
    private final int maxConcurrent;
    private final long minSpacingNanos;
    private final Semaphore slots;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final Object pacingLock = new Object();
    private long nextStartNanos;
    private boolean started;

    public RateLimiter(String name, int maxConcurrent, int maxPerMinute) {
        this(name, maxConcurrent, maxPerMinute, System::nanoTime, Sleeper.SYSTEM);
    }

    public RateLimiter(String name, int maxConcurrent, int maxPerMinute, LongSupplier nanoClock, Sleeper sleeper) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1 for limiter " + name + ".");
        }
        this.name = name;
        this.maxConcurrent = maxConcurrent;
        this.minSpacingNanos = maxPerMinute > 0 ? TimeUnit.MINUTES.toNanos(1) / maxPerMinute : 0L;
        this.slots = new Semaphore(maxConcurrent, true);
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    public Permit acquire() throws InterruptedException {
        return acquire(null);
    }

    /**
     * Blocks until a slot is free and the pacing interval has passed, then runs {@code onAcquired}.
     * A failing callback is logged and does not fail the acquisition.
     */
    public Permit acquire(Runnable onAcquired) throws InterruptedException {
        slots.acquire();
        try {
            awaitStartSlot();
        } catch (InterruptedException e) {
            slots.release();
            throw e;
        }

        Permit permit = new Permit();
        if (onAcquired != null) {
            try {
                onAcquired.run();
            } catch (RuntimeException callbackError) {
                logger.warn("on-acquired callback failed for limiter {}", name, callbackError);
            }
        }
        return permit;
    }

    public String name() {
        return name;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public Duration minSpacing() {
        return Duration.ofNanos(minSpacingNanos);
    }

    public int inFlight() {
        return maxConcurrent - slots.availablePermits();
    }

    private void awaitStartSlot() throws InterruptedException {
        if (minSpacingNanos == 0) {
            return;
        }

        long startAt;
        synchronized (pacingLock) {
            long now = nanoClock.getAsLong();
            startAt = started ? Math.max(now, nextStartNanos) : now;
            nextStartNanos = startAt + minSpacingNanos;
            started = true;
        }

        long remaining = startAt - nanoClock.getAsLong();
        while (remaining > 0) {
            sleeper.sleep(Duration.ofMillis((remaining + 999_999L) / 1_000_000L));
            remaining = startAt - nanoClock.getAsLong();
        }
    }

    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
        }
    }
}
