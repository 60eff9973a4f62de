package planner.core;

import planner.config.PlannerConfig;

/**
 * Policy and limits of one planner run. The candidate cap is required.
 */
public class PlanRequest {
    private final RankingPolicy policy;
    private final int maxCandidates;
    private final int parallelism;

    public PlanRequest(RankingPolicy policy, int maxCandidates) {
        this(policy, maxCandidates, PlannerConfig.DEFAULT_PARALLELISM);
    }

    public PlanRequest(RankingPolicy policy, int maxCandidates, int parallelism) {
        if (policy == null)
            throw new IllegalArgumentException("Ranking policy is required");
        if (maxCandidates < 1)
            throw new IllegalArgumentException("maxCandidates must be positive (got " + maxCandidates + ")");
        if (parallelism < 1)
            throw new IllegalArgumentException("parallelism must be >= 1 (got " + parallelism + ")");
        this.policy = policy;
        this.maxCandidates = maxCandidates;
        this.parallelism = parallelism;
    }

    public RankingPolicy getPolicy() { return policy; }
    public int getMaxCandidates() { return maxCandidates; }
    public int getParallelism() { return parallelism; }
}
