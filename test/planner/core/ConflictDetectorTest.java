package planner.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static planner.testing.TestOfferings.offering;

import java.util.List;
import org.junit.jupiter.api.Test;
import planner.model.Day;
import planner.model.Offering;
import planner.model.SlotConflict;
import planner.model.SlotKey;

final class ConflictDetectorTest {

    private final ConflictDetector detector = new ConflictDetector();

    @Test
    void disjointSlotsHaveNoConflict() {
        assertTrue(detector.detect(List.of(offering("A", "1", "Mon 1; Mon 2"), offering("B", "1", "Tue 1"))).isEmpty());
    }

    @Test
    void countsCollidingSlotsNotCollidingPairs() {
        Offering a = offering("A", "1", "Mon 1");
        Offering b = offering("B", "1", "Mon 1");
        Offering c = offering("C", "1", "Mon 1");

        List<SlotConflict> conflicts = detector.detect(List.of(a, b, c));

        // three offerings, three pairs, one slot
        assertEquals(1, conflicts.size());
        assertEquals(new SlotKey(Day.MON, 1), conflicts.get(0).getSlot());
        assertEquals(List.of(a, b, c), conflicts.get(0).getOfferings());
    }

    @Test
    void conflictsAreSortedByDayThenPeriod() {
        Offering a = offering("A", "1", "Fri 2; Mon 3; Mon 1");
        Offering b = offering("B", "1", "Mon 1; Fri 2; Mon 3");

        List<SlotConflict> conflicts = detector.detect(List.of(a, b));

        assertEquals(3, conflicts.size());
        assertEquals(new SlotKey(Day.MON, 1), conflicts.get(0).getSlot());
        assertEquals(new SlotKey(Day.MON, 3), conflicts.get(1).getSlot());
        assertEquals(new SlotKey(Day.FRI, 2), conflicts.get(2).getSlot());
    }

    @Test
    void roomDoesNotAffectOccupancy() {
        List<SlotConflict> conflicts = detector.detect(List.of(
                offering("A", "1", "Wed 4 A101"), offering("B", "1", "Wed 4 B312")));

        assertEquals(1, conflicts.size());
    }

    @Test
    void offeringWithoutSlotsNeverConflicts() {
        Offering online = offering("Online", "1", "");
        assertTrue(detector.detect(List.of(online, offering("A", "1", "Mon 1"))).isEmpty());
        assertTrue(detector.buildSlotIndex(List.of(online)).isEmpty());
    }

    @Test
    void detectionIsIndependentOfCallOrder() {
        List<Offering> tuple = List.of(offering("A", "1", "Mon 1; Tue 2"), offering("B", "1", "Tue 2"));
        List<SlotConflict> first = detector.detect(tuple);
        detector.detect(List.of(offering("X", "1", "Mon 1"), offering("Y", "1", "Mon 1")));
        List<SlotConflict> again = detector.detect(tuple);

        assertEquals(first.size(), again.size());
        assertEquals(first.get(0).getSlot(), again.get(0).getSlot());
    }
}
