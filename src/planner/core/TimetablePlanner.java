package planner.core;

import planner.model.Offering;
import planner.model.OfferingGroup;
import planner.model.ScheduleCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the whole pipeline for a catalog: grouping and mandatory pre-check,
 * bounded enumeration, conflict detection and ranking.
 * <p>
 * Nothing from one run leaks into the next; only {@link #getState()} reflects
 * the last invocation. Interrupting the calling thread abandons a run with a
 * {@link CancellationException}.
 */
public class TimetablePlanner {

    private final OfferingGrouper grouper = new OfferingGrouper();
    private final CandidateEvaluator evaluator = new CandidateEvaluator();
    private final CandidateRanker ranker = new CandidateRanker();

    private volatile PlannerState state = PlannerState.IDLE;

    public PlannerState getState() {
        return state;
    }

    public synchronized PlanResult evaluate(List<Offering> catalog, PlanRequest request) {
        if (request == null)
            throw new IllegalArgumentException("request is required");
        List<Offering> snapshot = catalog == null ? List.of() : List.copyOf(catalog);

        System.out.println("Planner started: " + snapshot.size() + " offerings, policy="
                + request.getPolicy() + ", cap=" + request.getMaxCandidates());
        state = PlannerState.EVALUATING;

        try {
            // 1. Grouping + feasibility (fail fast, before any enumeration)
            List<OfferingGroup> groups;
            try {
                groups = grouper.group(snapshot);
            } catch (MandatoryUnsatisfiableException e) {
                System.err.println("Planner failed: " + e.getMessage());
                state = PlannerState.FAILED;
                return PlanResult.failed(request.getPolicy(), e);
            }

            if (groups.isEmpty()) {
                System.out.println("No courses to plan (catalog empty or all offerings excluded).");
                state = PlannerState.DONE;
                return PlanResult.empty(request.getPolicy());
            }

            // 2. Size the product up front so truncation is known before the work starts
            long productSize = CombinationEnumerator.productSize(groups);
            if (productSize > request.getMaxCandidates()) {
                System.out.println("Warning: " + productSize + " combinations possible, only the first "
                        + request.getMaxCandidates() + " will be evaluated.");
            }

            // 3. Enumerate + evaluate
            CandidateBudget budget = new CandidateBudget(request.getMaxCandidates());
            CombinationEnumerator enumerator = new CombinationEnumerator(groups, budget);
            List<ScheduleCandidate> candidates = request.getParallelism() > 1
                    ? evaluateParallel(enumerator, request.getParallelism())
                    : evaluateSequential(enumerator);

            // 4. Rank once every candidate is in
            CandidateRanker.Ranking ranking = ranker.rank(candidates, request.getPolicy());
            boolean truncated = enumerator.isTruncated();

            System.out.println("Planner finished: " + candidates.size() + " candidates ("
                    + ranking.getClean().size() + " clean, " + ranking.getConflicting().size() + " conflicting)"
                    + (truncated ? ", truncated at " + request.getMaxCandidates() : ""));
            state = PlannerState.DONE;
            return PlanResult.done(request.getPolicy(), ranking, truncated, productSize);
        } catch (RuntimeException e) {
            // cancelled or broken run: nothing to keep
            state = PlannerState.IDLE;
            throw e;
        }
    }

    private List<ScheduleCandidate> evaluateSequential(CombinationEnumerator enumerator) {
        List<ScheduleCandidate> out = new ArrayList<>();
        int sequence = 0;
        while (enumerator.hasNext()) {
            if (Thread.currentThread().isInterrupted())
                throw new CancellationException("Planner run cancelled");
            out.add(evaluator.evaluate(sequence++, enumerator.next()));
        }
        return out;
    }

    private List<ScheduleCandidate> evaluateParallel(CombinationEnumerator enumerator, int workers) {
        if (Thread.currentThread().isInterrupted())
            throw new CancellationException("Planner run cancelled");
        TupleSource source = new TupleSource(enumerator);
        ConcurrentLinkedQueue<ScheduleCandidate> collected = new ConcurrentLinkedQueue<>();
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                futures.add(pool.submit(() -> {
                    SequencedTuple t;
                    while (!Thread.currentThread().isInterrupted() && (t = source.take()) != null) {
                        collected.add(evaluator.evaluate(t.sequence, t.tuple));
                    }
                }));
            }
            // join before ranking
            for (Future<?> f : futures) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Planner run cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            throw new IllegalStateException("Candidate evaluation failed", cause);
        } finally {
            pool.shutdownNow();
        }
        return new ArrayList<>(collected);
    }

    /**
     * Hands tuples to the workers one at a time. The sequence number is fixed at
     * hand-out, so the result does not depend on thread timing.
     */
    private static class TupleSource {
        private final CombinationEnumerator enumerator;
        private int sequence = 0;

        TupleSource(CombinationEnumerator enumerator) {
            this.enumerator = enumerator;
        }

        synchronized SequencedTuple take() {
            if (!enumerator.hasNext())
                return null;
            return new SequencedTuple(sequence++, enumerator.next());
        }
    }

    private static class SequencedTuple {
        final int sequence;
        final List<Offering> tuple;

        SequencedTuple(int sequence, List<Offering> tuple) {
            this.sequence = sequence;
            this.tuple = tuple;
        }
    }
}
