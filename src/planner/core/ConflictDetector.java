package planner.core;

import planner.model.Offering;
import planner.model.SlotConflict;
import planner.model.SlotKey;
import planner.model.TimeSlot;

import java.util.*;

public class ConflictDetector {

    // (day, period) -> offerings in the tuple meeting then
    public Map<SlotKey, List<Offering>> buildSlotIndex(List<Offering> tuple) {
        Map<SlotKey, List<Offering>> index = new LinkedHashMap<>();
        for (Offering o : tuple) {
            for (TimeSlot ts : o.getTimeSlots()) {
                index.computeIfAbsent(ts.key(), k -> new ArrayList<>()).add(o);
            }
        }
        return index;
    }

    /**
     * Every (day, period) occupied by two or more offerings of the tuple, sorted
     * by day then period. The list size is the candidate's conflict count: one
     * per colliding slot, however many offerings share it.
     */
    public List<SlotConflict> detect(List<Offering> tuple) {
        if (tuple == null || tuple.isEmpty())
            return List.of();

        List<SlotConflict> conflicts = new ArrayList<>();
        for (Map.Entry<SlotKey, List<Offering>> e : buildSlotIndex(tuple).entrySet()) {
            if (e.getValue().size() > 1)
                conflicts.add(new SlotConflict(e.getKey(), e.getValue()));
        }
        conflicts.sort(Comparator.comparing(SlotConflict::getSlot));
        return conflicts;
    }
}
