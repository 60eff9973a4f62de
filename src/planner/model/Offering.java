package planner.model;

import planner.config.PlannerConfig;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One concrete section of a course: a name, a section id, its weekly slots and
 * the user's preference data. Offerings sharing a name are alternatives.
 * <p>
 * Instances are immutable and validated on construction; use {@link #builder(String, String)}.
 */
public class Offering {
    private final String name;
    private final Category category;
    private final String sectionId;
    private final int credits;
    private final int priority;
    private final List<TimeSlot> timeSlots;
    private final boolean mandatory;
    private final boolean excluded;
    private final String teacher;
    private final String notes;

    private Offering(Builder b) {
        if (b.name == null || b.name.trim().isEmpty())
            throw new IllegalArgumentException("Offering name is required");
        if (b.sectionId == null || b.sectionId.trim().isEmpty())
            throw new IllegalArgumentException("Section id is required for '" + b.name.trim() + "'");
        if (b.category == null)
            throw new IllegalArgumentException("Category is required for '" + b.name.trim() + "'");
        if (b.credits < 0)
            throw new IllegalArgumentException("Credits must be >= 0 (got " + b.credits + ")");
        if (b.priority < PlannerConfig.MIN_PRIORITY || b.priority > PlannerConfig.MAX_PRIORITY)
            throw new IllegalArgumentException("Priority must be between " + PlannerConfig.MIN_PRIORITY
                    + " and " + PlannerConfig.MAX_PRIORITY + " (got " + b.priority + ")");

        this.name = b.name.trim();
        this.category = b.category;
        this.sectionId = b.sectionId.trim();
        this.credits = b.credits;
        this.priority = b.priority;
        this.timeSlots = Collections.unmodifiableList(dedupe(b.timeSlots));
        this.mandatory = b.mandatory;
        this.excluded = b.excluded;
        this.teacher = b.teacher == null ? "" : b.teacher.trim();
        this.notes = b.notes == null ? "" : b.notes.trim();
    }

    // first occurrence of each (day, period) wins
    private static List<TimeSlot> dedupe(List<TimeSlot> raw) {
        Set<SlotKey> seen = new LinkedHashSet<>();
        List<TimeSlot> out = new ArrayList<>();
        for (TimeSlot ts : raw) {
            if (ts == null)
                throw new IllegalArgumentException("null time slot");
            if (seen.add(ts.key()))
                out.add(ts);
        }
        return out;
    }

    public static Builder builder(String name, String sectionId) {
        return new Builder(name, sectionId);
    }

    public Builder toBuilder() {
        return new Builder(name, sectionId)
                .category(category)
                .credits(credits)
                .priority(priority)
                .timeSlots(timeSlots)
                .mandatory(mandatory)
                .excluded(excluded)
                .teacher(teacher)
                .notes(notes);
    }

    public String getName() { return name; }
    public Category getCategory() { return category; }
    public String getSectionId() { return sectionId; }
    public int getCredits() { return credits; }
    public int getPriority() { return priority; }
    public List<TimeSlot> getTimeSlots() { return timeSlots; }
    public boolean isMandatory() { return mandatory; }
    public boolean isExcluded() { return excluded; }
    public String getTeacher() { return teacher; }
    public String getNotes() { return notes; }

    public boolean isRequired() {
        return category == Category.REQUIRED;
    }

    /** Same course and same section. */
    public boolean sameKey(String otherName, String otherSectionId) {
        return name.equals(otherName == null ? null : otherName.trim())
                && sectionId.equals(otherSectionId == null ? null : otherSectionId.trim());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Offering)) return false;
        Offering other = (Offering) o;
        return credits == other.credits
                && priority == other.priority
                && mandatory == other.mandatory
                && excluded == other.excluded
                && name.equals(other.name)
                && category == other.category
                && sectionId.equals(other.sectionId)
                && timeSlots.equals(other.timeSlots)
                && teacher.equals(other.teacher)
                && notes.equals(other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category, sectionId, credits, priority, timeSlots,
                mandatory, excluded, teacher, notes);
    }

    @Override
    public String toString() {
        return name + " [" + sectionId + "]";
    }

    public static class Builder {
        private final String name;
        private final String sectionId;
        private Category category = Category.ELECTIVE;
        private int credits = PlannerConfig.DEFAULT_CREDITS;
        private int priority = PlannerConfig.DEFAULT_PRIORITY;
        private final List<TimeSlot> timeSlots = new ArrayList<>();
        private boolean mandatory = false;
        private boolean excluded = false;
        private String teacher = "";
        private String notes = "";

        private Builder(String name, String sectionId) {
            this.name = name;
            this.sectionId = sectionId;
        }

        public Builder category(Category category) {
            this.category = category;
            return this;
        }

        public Builder credits(int credits) {
            this.credits = credits;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder slot(Day day, int period) {
            timeSlots.add(new TimeSlot(day, period));
            return this;
        }

        public Builder slot(TimeSlot slot) {
            timeSlots.add(slot);
            return this;
        }

        public Builder timeSlots(Collection<TimeSlot> slots) {
            timeSlots.clear();
            if (slots != null)
                timeSlots.addAll(slots);
            return this;
        }

        public Builder mandatory(boolean mandatory) {
            this.mandatory = mandatory;
            return this;
        }

        public Builder excluded(boolean excluded) {
            this.excluded = excluded;
            return this;
        }

        public Builder teacher(String teacher) {
            this.teacher = teacher;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Offering build() {
            return new Offering(this);
        }
    }
}
