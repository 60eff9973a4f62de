package planner.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class OfferingTest {

    @Test
    void builderAppliesDefaults() {
        Offering o = Offering.builder("  Calculus ", " 01 ").build();

        assertEquals("Calculus", o.getName());
        assertEquals("01", o.getSectionId());
        assertEquals(Category.ELECTIVE, o.getCategory());
        assertEquals(0, o.getCredits());
        assertEquals(3, o.getPriority());
        assertTrue(o.getTimeSlots().isEmpty());
        assertFalse(o.isMandatory());
        assertFalse(o.isExcluded());
        assertEquals("", o.getTeacher());
        assertEquals("", o.getNotes());
    }

    @Test
    void rejectsOutOfRangePriority() {
        assertThrows(IllegalArgumentException.class, () -> Offering.builder("A", "1").priority(0).build());
        assertThrows(IllegalArgumentException.class, () -> Offering.builder("A", "1").priority(6).build());
    }

    @Test
    void rejectsNegativeCredits() {
        assertThrows(IllegalArgumentException.class, () -> Offering.builder("A", "1").credits(-1).build());
    }

    @Test
    void rejectsBlankNameOrSection() {
        assertThrows(IllegalArgumentException.class, () -> Offering.builder(" ", "1").build());
        assertThrows(IllegalArgumentException.class, () -> Offering.builder("A", "").build());
        assertThrows(IllegalArgumentException.class, () -> Offering.builder("A", "1").category(null).build());
    }

    @Test
    void duplicateSlotsAreDroppedKeepingFirstOccurrence() {
        Offering o = Offering.builder("A", "1")
                .slot(Day.MON, 1)
                .slot(new TimeSlot(Day.TUE, 2, "B312"))
                .slot(new TimeSlot(Day.MON, 1, "A101"))
                .slot(Day.TUE, 2)
                .build();

        assertEquals(List.of(new TimeSlot(Day.MON, 1), new TimeSlot(Day.TUE, 2, "B312")), o.getTimeSlots());
    }

    @Test
    void timeSlotsAreImmutable() {
        Offering o = Offering.builder("A", "1").slot(Day.MON, 1).build();
        assertThrows(UnsupportedOperationException.class, () -> o.getTimeSlots().add(new TimeSlot(Day.FRI, 2)));
    }

    @Test
    void toBuilderCopiesEveryField() {
        Offering o = Offering.builder("A", "1").category(Category.REQUIRED).credits(3).priority(5)
                .slot(Day.WED, 4).mandatory(true).teacher("Lin").notes("lab").build();

        assertEquals(o, o.toBuilder().build());
        Offering excluded = o.toBuilder().excluded(true).build();
        assertTrue(excluded.isExcluded());
        assertFalse(o.isExcluded());
    }

    @Test
    void timeSlotRejectsNonPositivePeriod() {
        assertThrows(IllegalArgumentException.class, () -> new TimeSlot(Day.MON, 0));
        assertThrows(IllegalArgumentException.class, () -> new TimeSlot(null, 1));
    }

    @Test
    void dayParsesShortAndLongNames() {
        assertEquals(Day.MON, Day.parse("Mon"));
        assertEquals(Day.SUN, Day.parse(" sunday "));
        assertEquals(Day.THU, Day.parse("THU"));
        assertThrows(IllegalArgumentException.class, () -> Day.parse("Funday"));
    }
}
