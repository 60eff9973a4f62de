package planner.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static planner.testing.TestOfferings.offering;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import planner.model.Offering;
import planner.model.OfferingGroup;

final class CombinationEnumeratorTest {

    private static OfferingGroup group(String name, int size) {
        List<Offering> list = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            list.add(offering(name, String.valueOf(i), "Mon " + i));
        }
        return new OfferingGroup(name, list);
    }

    private static List<List<Offering>> drain(CombinationEnumerator e) {
        List<List<Offering>> out = new ArrayList<>();
        while (e.hasNext()) {
            out.add(e.next());
        }
        return out;
    }

    private static String label(List<Offering> tuple) {
        return tuple.stream().map(o -> o.getName() + o.getSectionId()).collect(Collectors.joining());
    }

    @Test
    void lastGroupVariesFastest() {
        CombinationEnumerator e = new CombinationEnumerator(List.of(group("A", 2), group("B", 3)), new CandidateBudget(100));

        List<String> labels = drain(e).stream().map(CombinationEnumeratorTest::label).collect(Collectors.toList());

        assertEquals(List.of("A1B1", "A1B2", "A1B3", "A2B1", "A2B2", "A2B3"), labels);
        assertFalse(e.isTruncated());
    }

    @Test
    void exhaustiveWhenProductFitsTheCapExactly() {
        CombinationEnumerator e = new CombinationEnumerator(List.of(group("A", 2), group("B", 2)), new CandidateBudget(4));

        assertEquals(4, drain(e).size());
        assertFalse(e.isTruncated());
    }

    @Test
    void stopsAtCapAndReportsTruncation() {
        List<OfferingGroup> groups = List.of(group("A", 3), group("B", 3), group("C", 3));
        CombinationEnumerator e = new CombinationEnumerator(groups, new CandidateBudget(10));

        List<List<Offering>> tuples = drain(e);

        assertEquals(10, tuples.size());
        assertTrue(e.isTruncated());
        assertEquals(10, e.getEmitted());
        Set<String> distinct = new HashSet<>();
        tuples.forEach(t -> distinct.add(label(t)));
        assertEquals(10, distinct.size());
    }

    @Test
    void everyTupleHoldsOneOfferingPerGroup() {
        CombinationEnumerator e = new CombinationEnumerator(List.of(group("A", 2), group("B", 1), group("C", 2)),
                new CandidateBudget(100));

        for (List<Offering> tuple : drain(e)) {
            assertEquals(List.of("A", "B", "C"), tuple.stream().map(Offering::getName).collect(Collectors.toList()));
        }
    }

    @Test
    void emptyGroupOrNoGroupsYieldNothing() {
        CombinationEnumerator withEmpty = new CombinationEnumerator(
                List.of(group("A", 2), new OfferingGroup("B", List.of())), new CandidateBudget(10));
        CombinationEnumerator none = new CombinationEnumerator(List.of(), new CandidateBudget(10));

        assertFalse(withEmpty.hasNext());
        assertFalse(none.hasNext());
        assertFalse(withEmpty.isTruncated());
        assertThrows(NoSuchElementException.class, none::next);
    }

    @Test
    void productSizeMultipliesGroupSizesAndSaturates() {
        assertEquals(12L, CombinationEnumerator.productSize(List.of(group("A", 3), group("B", 4))));
        assertEquals(0L, CombinationEnumerator.productSize(List.of()));
        assertEquals(0L, CombinationEnumerator.productSize(List.of(group("A", 3), new OfferingGroup("B", List.of()))));

        List<OfferingGroup> huge = new ArrayList<>();
        for (int i = 0; i < 70; i++) {
            huge.add(group("G" + i, 2));
        }
        assertEquals(Long.MAX_VALUE, CombinationEnumerator.productSize(huge));
    }

    @Test
    void sharedBudgetCapsTwoEnumeratorsTogether() {
        CandidateBudget budget = new CandidateBudget(5);
        CombinationEnumerator first = new CombinationEnumerator(List.of(group("A", 3)), budget);
        CombinationEnumerator second = new CombinationEnumerator(List.of(group("B", 3)), budget);

        int total = drain(first).size() + drain(second).size();

        assertEquals(5, total);
        assertTrue(second.isTruncated());
        assertTrue(budget.isSpent());
    }

    @Test
    void groupIsUnaffectedByLaterChangesToTheCallersList() {
        List<Offering> backing = new ArrayList<>(List.of(offering("A", "1", "Mon 1"), offering("A", "2", "Tue 1")));
        OfferingGroup a = new OfferingGroup("A", backing);
        CombinationEnumerator e = new CombinationEnumerator(List.of(a), new CandidateBudget(10));

        backing.clear();

        assertEquals(2, a.size());
        assertEquals(List.of("A1", "A2"), drain(e).stream().map(CombinationEnumeratorTest::label)
                .collect(Collectors.toList()));
    }

    @Test
    void budgetRejectsNonPositiveCap() {
        assertThrows(IllegalArgumentException.class, () -> new CandidateBudget(0));
    }
}
