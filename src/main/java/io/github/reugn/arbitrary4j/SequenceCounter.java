package io.github.reugn.arbitrary4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of strictly increasing values used to make generated fields unique.
 *
 * <p>Each {@link #next()} is a single atomic increment, so concurrent generations sharing
 * a counter never observe the same value. The counter is never reset.
 */
public final class SequenceCounter {

    private final AtomicLong value;

    /**
     * Creates a counter whose first {@link #next()} returns 1.
     */
    public SequenceCounter() {
        this(0);
    }

    /**
     * @param start the value treated as already returned; the first {@link #next()} returns {@code start + 1}
     */
    public SequenceCounter(long start) {
        if (start < 0) {
            throw new IllegalArgumentException("Counter start must not be negative: " + start);
        }
        this.value = new AtomicLong(start);
    }

    /**
     * @return a value strictly greater than every value previously returned by this counter
     */
    public long next() {
        return value.incrementAndGet();
    }

    /**
     * @return the last value returned by {@link #next()}, or the start value if none was drawn
     */
    public long current() {
        return value.get();
    }

    @Override
    public String toString() {
        return "SequenceCounter[" + value.get() + "]";
    }
}
