package planner.core;

import planner.model.ScheduleCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sorts evaluated candidates under a policy and splits them into clean
 * (no conflict) and conflicting lists. Needs the whole, already collected set.
 */
public class CandidateRanker {

    public Ranking rank(List<ScheduleCandidate> candidates, RankingPolicy policy) {
        if (policy == null)
            throw new IllegalArgumentException("policy is required");

        List<ScheduleCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(policy.comparator());

        List<ScheduleCandidate> clean = new ArrayList<>();
        List<ScheduleCandidate> conflicting = new ArrayList<>();
        for (ScheduleCandidate c : ranked) {
            if (c.isClean())
                clean.add(c);
            else
                conflicting.add(c);
        }
        return new Ranking(ranked, clean, conflicting);
    }

    public static class Ranking {
        private final List<ScheduleCandidate> ranked;
        private final List<ScheduleCandidate> clean;
        private final List<ScheduleCandidate> conflicting;

        Ranking(List<ScheduleCandidate> ranked, List<ScheduleCandidate> clean, List<ScheduleCandidate> conflicting) {
            this.ranked = Collections.unmodifiableList(ranked);
            this.clean = Collections.unmodifiableList(clean);
            this.conflicting = Collections.unmodifiableList(conflicting);
        }

        public List<ScheduleCandidate> getRanked() { return ranked; }
        public List<ScheduleCandidate> getClean() { return clean; }
        public List<ScheduleCandidate> getConflicting() { return conflicting; }
    }
}
