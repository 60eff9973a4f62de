package planner.core;

import planner.model.ScheduleCandidate;

import java.util.Comparator;

/**
 * Total orders over candidates. Both break ties by more credits first, then by
 * enumeration order, so the ranking is deterministic.
 */
public enum RankingPolicy {

    /** Fewest conflicts first, then highest priority sum. */
    CONFLICT_FIRST(Comparator
            .comparingInt(ScheduleCandidate::getConflictCount)
            .thenComparing(Comparator.comparingInt(ScheduleCandidate::getTotalPriority).reversed())),

    /** Highest priority sum first, then fewest conflicts. */
    PRIORITY_FIRST(Comparator
            .comparingInt(ScheduleCandidate::getTotalPriority).reversed()
            .thenComparingInt(ScheduleCandidate::getConflictCount));

    private final Comparator<ScheduleCandidate> order;

    RankingPolicy(Comparator<ScheduleCandidate> keys) {
        this.order = keys
                .thenComparing(Comparator.comparingInt(ScheduleCandidate::getTotalCredits).reversed())
                .thenComparingInt(ScheduleCandidate::getSequence);
    }

    public Comparator<ScheduleCandidate> comparator() {
        return order;
    }
}
