package planner.core;

import planner.model.Category;
import planner.model.Offering;
import planner.model.ScheduleCandidate;
import planner.model.SlotConflict;

import java.util.List;

/**
 * Turns one enumerated tuple into a {@link ScheduleCandidate}. Stateless and
 * safe to call from several worker threads.
 */
public class CandidateEvaluator {
    private final ConflictDetector detector;

    public CandidateEvaluator() {
        this(new ConflictDetector());
    }

    public CandidateEvaluator(ConflictDetector detector) {
        this.detector = detector;
    }

    public ScheduleCandidate evaluate(int sequence, List<Offering> tuple) {
        int required = 0;
        int elective = 0;
        int priority = 0;
        for (Offering o : tuple) {
            if (o.getCategory() == Category.REQUIRED)
                required += o.getCredits();
            else
                elective += o.getCredits();
            priority += o.getPriority();
        }
        List<SlotConflict> conflicts = detector.detect(tuple);
        return new ScheduleCandidate(sequence, tuple, conflicts, required, elective, priority);
    }
}
