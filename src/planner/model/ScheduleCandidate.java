package planner.model;

import java.util.List;

/**
 * One complete selection (one offering per course name) with its metrics and
 * slot collisions. Read-only; built by the evaluator.
 */
public class ScheduleCandidate {
    private final int sequence;
    private final List<Offering> offerings;
    private final List<SlotConflict> conflicts;
    private final int totalCredits;
    private final int requiredCredits;
    private final int electiveCredits;
    private final int totalPriority;

    public ScheduleCandidate(int sequence,
                             List<Offering> offerings,
                             List<SlotConflict> conflicts,
                             int requiredCredits,
                             int electiveCredits,
                             int totalPriority) {
        if (offerings == null || conflicts == null)
            throw new IllegalArgumentException("null candidate data");
        this.sequence = sequence;
        this.offerings = List.copyOf(offerings);
        this.conflicts = List.copyOf(conflicts);
        this.requiredCredits = requiredCredits;
        this.electiveCredits = electiveCredits;
        this.totalCredits = requiredCredits + electiveCredits;
        this.totalPriority = totalPriority;
    }

    /** Position in enumeration order, starting at 0. */
    public int getSequence() { return sequence; }
    public List<Offering> getOfferings() { return offerings; }
    public List<SlotConflict> getConflicts() { return conflicts; }
    public int getConflictCount() { return conflicts.size(); }
    public int getTotalCredits() { return totalCredits; }
    public int getRequiredCredits() { return requiredCredits; }
    public int getElectiveCredits() { return electiveCredits; }
    public int getTotalPriority() { return totalPriority; }

    public boolean isClean() {
        return conflicts.isEmpty();
    }

    @Override
    public String toString() {
        return "#" + sequence + " " + offerings + " conflicts=" + conflicts.size()
                + " priority=" + totalPriority + " credits=" + totalCredits;
    }
}
