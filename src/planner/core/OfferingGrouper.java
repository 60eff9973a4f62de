package planner.core;

import planner.model.Offering;
import planner.model.OfferingGroup;

import java.util.*;

/**
 * Splits a catalog into one group per course name and checks that every
 * mandatory course can still be picked.
 */
public class OfferingGrouper {

    private static final Comparator<Offering> GROUP_ORDER = Comparator
            // mandatory sections first
            .comparing((Offering o) -> !o.isMandatory())
            // then the user's preference, highest first
            .thenComparing(Comparator.comparingInt(Offering::getPriority).reversed());

    /**
     * @return groups in order of first appearance of their name; empty when the
     *         catalog is empty or every offering is excluded
     * @throws MandatoryUnsatisfiableException if a mandatory name has no
     *         non-excluded offering left
     */
    public List<OfferingGroup> group(List<Offering> catalog) throws MandatoryUnsatisfiableException {
        if (catalog == null || catalog.isEmpty())
            return List.of();

        // name -> available sections, catalog order
        Map<String, List<Offering>> byName = new LinkedHashMap<>();
        Set<String> mandatoryNames = new LinkedHashSet<>();
        for (Offering o : catalog) {
            if (o.isMandatory())
                mandatoryNames.add(o.getName());
            if (o.isExcluded())
                continue;
            byName.computeIfAbsent(o.getName(), k -> new ArrayList<>()).add(o);
        }

        List<String> missing = new ArrayList<>();
        for (String name : mandatoryNames) {
            if (!byName.containsKey(name))
                missing.add(name);
        }
        if (!missing.isEmpty())
            throw new MandatoryUnsatisfiableException(missing);

        List<OfferingGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<Offering>> e : byName.entrySet()) {
            List<Offering> sections = new ArrayList<>(e.getValue());
            // List.sort is stable: equal keys keep catalog order
            sections.sort(GROUP_ORDER);
            groups.add(new OfferingGroup(e.getKey(), sections));
        }
        return groups;
    }
}
