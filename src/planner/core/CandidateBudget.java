package planner.core;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Global cap on emitted candidates. Shared by every producer of a run, so the
 * total never exceeds {@code max} however many threads draw from it.
 */
public class CandidateBudget {
    private final int max;
    private final AtomicInteger used = new AtomicInteger();

    public CandidateBudget(int max) {
        if (max < 1)
            throw new IllegalArgumentException("maxCandidates must be positive (got " + max + ")");
        this.max = max;
    }

    public boolean tryAcquire() {
        while (true) {
            int current = used.get();
            if (current >= max)
                return false;
            if (used.compareAndSet(current, current + 1))
                return true;
        }
    }

    public int getMax() {
        return max;
    }

    public boolean isSpent() {
        return used.get() >= max;
    }
}
