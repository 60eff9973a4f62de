package planner.model;

import java.util.Objects;

/**
 * One weekly meeting of an offering. Only (day, period) decides occupancy;
 * the room is descriptive.
 */
public class TimeSlot {
    private final Day day;
    private final int period;
    private final String room;

    public TimeSlot(Day day, int period) {
        this(day, period, "");
    }

    public TimeSlot(Day day, int period, String room) {
        if (day == null)
            throw new IllegalArgumentException("null day");
        if (period < 1)
            throw new IllegalArgumentException("period must be positive: " + period);
        this.day = day;
        this.period = period;
        this.room = (room == null) ? "" : room.trim();
    }

    public Day getDay() { return day; }
    public int getPeriod() { return period; }
    public String getRoom() { return room; }

    public SlotKey key() {
        return new SlotKey(day, period);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSlot)) return false;
        TimeSlot other = (TimeSlot) o;
        return period == other.period && day == other.day && room.equals(other.room);
    }

    @Override
    public int hashCode() {
        return Objects.hash(day, period, room);
    }

    @Override
    public String toString() {
        return room.isEmpty() ? day + " " + period : day + " " + period + " " + room;
    }
}
