package planner.core;

import planner.model.Offering;
import planner.model.OfferingGroup;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy Cartesian product of the offering groups: one offering per group.
 * <p>
 * Order is odometer order: the last group varies fastest, the first group
 * slowest, offerings within a group in their group order. Each emitted tuple
 * takes one unit from the {@link CandidateBudget}; once it is spent the
 * iterator ends and {@link #isTruncated()} reports whether combinations were
 * left over. Single use, not restartable.
 */
public class CombinationEnumerator implements Iterator<List<Offering>> {

    private final List<OfferingGroup> groups;
    private final CandidateBudget budget;

    // index into each group for the next tuple; null once exhausted
    private int[] cursor;
    private boolean reserved = false;
    private boolean truncated = false;
    private int emitted = 0;

    public CombinationEnumerator(List<OfferingGroup> groups, CandidateBudget budget) {
        if (groups == null || budget == null)
            throw new IllegalArgumentException("groups and budget are required");
        this.groups = List.copyOf(groups);
        this.budget = budget;

        boolean anyEmpty = false;
        for (OfferingGroup g : this.groups) {
            if (g.isEmpty()) {
                anyEmpty = true;
                break;
            }
        }
        // no groups at all -> nothing to choose, not one empty tuple
        this.cursor = (this.groups.isEmpty() || anyEmpty) ? null : new int[this.groups.size()];
    }

    /**
     * Product of the group sizes, saturating at {@link Long#MAX_VALUE}. Zero when
     * there are no groups or one of them is empty.
     */
    public static long productSize(List<OfferingGroup> groups) {
        if (groups == null || groups.isEmpty())
            return 0L;
        long total = 1L;
        for (OfferingGroup g : groups) {
            if (g.isEmpty())
                return 0L;
            try {
                total = Math.multiplyExact(total, (long) g.size());
            } catch (ArithmeticException overflow) {
                total = Long.MAX_VALUE;
            }
        }
        return total;
    }

    @Override
    public boolean hasNext() {
        if (reserved)
            return true;
        if (cursor == null)
            return false;
        if (budget.tryAcquire()) {
            reserved = true;
            return true;
        }
        truncated = true;
        cursor = null;
        return false;
    }

    @Override
    public List<Offering> next() {
        if (!hasNext())
            throw new NoSuchElementException();

        List<Offering> tuple = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            tuple.add(groups.get(i).getOfferings().get(cursor[i]));
        }
        reserved = false;
        emitted++;
        advance();
        return tuple;
    }

    private void advance() {
        for (int i = groups.size() - 1; i >= 0; i--) {
            cursor[i]++;
            if (cursor[i] < groups.get(i).size())
                return;
            cursor[i] = 0;
        }
        // wrapped past the first group
        cursor = null;
    }

    /** True when the budget ran out before the product was exhausted. */
    public boolean isTruncated() {
        return truncated;
    }

    public int getEmitted() {
        return emitted;
    }
}
