package planner.model;

import java.util.Locale;

public enum Day {
    MON("Mon", "Monday"),
    TUE("Tue", "Tuesday"),
    WED("Wed", "Wednesday"),
    THU("Thu", "Thursday"),
    FRI("Fri", "Friday"),
    SAT("Sat", "Saturday"),
    SUN("Sun", "Sunday");

    private final String label;
    private final String fullName;

    Day(String label, String fullName) {
        this.label = label;
        this.fullName = fullName;
    }

    public String getLabel() {
        return label;
    }

    /**
     * "Mon", "mon", "MONDAY" -> MON.
     */
    public static Day parse(String raw) {
        if (raw == null)
            throw new IllegalArgumentException("Day is null");
        String t = raw.trim().toLowerCase(Locale.ROOT);
        for (Day d : values()) {
            if (d.label.toLowerCase(Locale.ROOT).equals(t) || d.fullName.toLowerCase(Locale.ROOT).equals(t))
                return d;
        }
        throw new IllegalArgumentException("Unknown day: '" + raw + "'");
    }

    @Override
    public String toString() {
        return label;
    }
}
