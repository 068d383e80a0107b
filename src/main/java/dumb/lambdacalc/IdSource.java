package dumb.lambdacalc;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out variable identities. Each {@link Session} owns one, so sessions never
 * share identities.
 */
public final class IdSource {
    private final AtomicLong next;

    public IdSource() {
        this(0);
    }

    public IdSource(long start) {
        this.next = new AtomicLong(start);
    }

    public long next() {
        return next.getAndIncrement();
    }

    public long peek() {
        return next.get();
    }
}
