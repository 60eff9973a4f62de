package planner.core;

import planner.model.ScheduleCandidate;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one planner run: either ranked candidates (clean and conflicting,
 * with a truncation flag) or a feasibility failure with its reason.
 */
public class PlanResult {

    public enum Status {
        DONE,
        FAILED
    }

    private final Status status;
    private final RankingPolicy policy;
    private final List<ScheduleCandidate> ranked;
    private final List<ScheduleCandidate> clean;
    private final List<ScheduleCandidate> conflicting;
    private final boolean truncated;
    private final long productSize;
    private final String failureReason;
    private final List<String> missingCourses;

    private PlanResult(Status status, RankingPolicy policy, CandidateRanker.Ranking ranking,
                       boolean truncated, long productSize, String failureReason, List<String> missingCourses) {
        this.status = status;
        this.policy = policy;
        this.ranked = ranking == null ? List.of() : ranking.getRanked();
        this.clean = ranking == null ? List.of() : ranking.getClean();
        this.conflicting = ranking == null ? List.of() : ranking.getConflicting();
        this.truncated = truncated;
        this.productSize = productSize;
        this.failureReason = failureReason;
        this.missingCourses = Collections.unmodifiableList(missingCourses);
    }

    static PlanResult done(RankingPolicy policy, CandidateRanker.Ranking ranking, boolean truncated, long productSize) {
        return new PlanResult(Status.DONE, policy, ranking, truncated, productSize, null, List.of());
    }

    static PlanResult empty(RankingPolicy policy) {
        return new PlanResult(Status.DONE, policy, null, false, 0L, null, List.of());
    }

    static PlanResult failed(RankingPolicy policy, MandatoryUnsatisfiableException e) {
        return new PlanResult(Status.FAILED, policy, null, false, 0L, e.getMessage(), e.getMissingCourses());
    }

    public Status getStatus() { return status; }
    public boolean isFailed() { return status == Status.FAILED; }
    public RankingPolicy getPolicy() { return policy; }

    /** All candidates under the active policy. */
    public List<ScheduleCandidate> getRanked() { return ranked; }
    public List<ScheduleCandidate> getClean() { return clean; }
    public List<ScheduleCandidate> getConflicting() { return conflicting; }
    public int getCandidateCount() { return ranked.size(); }

    /** The cap stopped enumeration early; the lists are partial. */
    public boolean isTruncated() { return truncated; }

    /** Number of combinations the catalog allows, saturating at Long.MAX_VALUE. */
    public long getProductSize() { return productSize; }

    public String getFailureReason() { return failureReason; }
    public List<String> getMissingCourses() { return missingCourses; }
}
