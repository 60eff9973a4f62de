package planner.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static planner.testing.TestOfferings.offering;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ScheduleCandidateTest {

    @Test
    void keepsItsOwnCopyOfOfferingsAndConflicts() {
        Offering a = offering("A", "1", "Mon 1");
        Offering b = offering("B", "1", "Mon 1");
        List<Offering> tuple = new ArrayList<>(List.of(a, b));
        List<SlotConflict> conflicts = new ArrayList<>(List.of(new SlotConflict(new SlotKey(Day.MON, 1), List.of(a, b))));

        ScheduleCandidate c = new ScheduleCandidate(0, tuple, conflicts, 0, 4, 6);
        tuple.clear();
        conflicts.clear();

        assertEquals(List.of(a, b), c.getOfferings());
        assertEquals(1, c.getConflictCount());
        assertFalse(c.isClean());
    }
}
