package planner.model;

import java.util.Collections;
import java.util.List;

public class SlotConflict {
    private final SlotKey slot;
    private final List<Offering> offerings; // tuple order

    public SlotConflict(SlotKey slot, List<Offering> offerings) {
        if (slot == null || offerings == null || offerings.size() < 2)
            throw new IllegalArgumentException("A conflict needs a slot and at least two offerings");
        this.slot = slot;
        this.offerings = Collections.unmodifiableList(offerings);
    }

    public SlotKey getSlot() { return slot; }
    public Day getDay() { return slot.day(); }
    public int getPeriod() { return slot.period(); }
    public List<Offering> getOfferings() { return offerings; }

    @Override
    public String toString() {
        return slot + " " + offerings;
    }
}
