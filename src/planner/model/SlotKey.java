package planner.model;

import java.util.Comparator;

/**
 * (day, period) pair used as the occupancy key of the conflict index.
 */
public record SlotKey(Day day, int period) implements Comparable<SlotKey> {

    private static final Comparator<SlotKey> ORDER = Comparator
            .comparing(SlotKey::day)
            .thenComparingInt(SlotKey::period);

    @Override
    public int compareTo(SlotKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return day + " " + period;
    }
}
