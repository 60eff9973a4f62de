package planner.export;

import planner.io.TimeSlotParser;
import planner.model.Offering;
import planner.model.ScheduleCandidate;
import planner.model.SlotConflict;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain-text summary of ranked candidates.
 */
public class CandidateReport {

    /** "Plan 2 (conflicts: 1, priority: 9, credits: 7)"; no conflict part when clean. */
    public static String header(int rank, ScheduleCandidate c) {
        StringBuilder sb = new StringBuilder("Plan ").append(rank).append(" (");
        if (!c.isClean())
            sb.append("conflicts: ").append(c.getConflictCount()).append(", ");
        sb.append("priority: ").append(c.getTotalPriority())
                .append(", credits: ").append(c.getTotalCredits()).append(")");
        return sb.toString();
    }

    public static List<String> describe(int rank, ScheduleCandidate c) {
        List<String> lines = new ArrayList<>();
        lines.add(header(rank, c));
        lines.add("Required: " + c.getRequiredCredits() + ", Elective: " + c.getElectiveCredits());
        for (Offering o : c.getOfferings()) {
            lines.add("- " + describe(o));
        }
        if (!c.isClean()) {
            lines.add("Conflicts:");
            for (SlotConflict sc : c.getConflicts()) {
                lines.add("- " + sc.getDay() + " period " + sc.getPeriod() + ": " + occupants(sc));
            }
        }
        return lines;
    }

    public static String describe(Offering o) {
        StringBuilder sb = new StringBuilder()
                .append(o.getName()).append(" (").append(o.getCategory()).append(")")
                .append(" section ").append(o.getSectionId())
                .append(", ").append(o.getCredits()).append(" credits")
                .append(", priority ").append(o.getPriority());
        if (!o.getTeacher().isEmpty())
            sb.append(", teacher ").append(o.getTeacher());
        if (!o.getNotes().isEmpty())
            sb.append(", notes ").append(o.getNotes());
        sb.append(", slots ").append(o.getTimeSlots().isEmpty() ? "-" : TimeSlotParser.format(o.getTimeSlots()));
        return sb.toString();
    }

    // "A(Teacher), B"
    public static String occupants(SlotConflict sc) {
        return sc.getOfferings().stream()
                .map(o -> o.getTeacher().isEmpty() ? o.getName() : o.getName() + "(" + o.getTeacher() + ")")
                .collect(Collectors.joining(", "));
    }

    /** Short one-cell form used by the exports: "A [01]; B [02]". */
    public static String offeringsCell(ScheduleCandidate c) {
        return c.getOfferings().stream()
                .map(Offering::toString)
                .collect(Collectors.joining("; "));
    }

    public static List<String> describeAll(String title, List<ScheduleCandidate> candidates) {
        List<String> lines = new ArrayList<>();
        lines.add("### " + title);
        if (candidates.isEmpty()) {
            lines.add("(none)");
            return lines;
        }
        int rank = 1;
        for (ScheduleCandidate c : candidates) {
            lines.addAll(describe(rank++, c));
            lines.add("");
        }
        return lines;
    }
}
