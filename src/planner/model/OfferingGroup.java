package planner.model;

import java.util.List;

/**
 * All available (non-excluded) offerings of one course name. Every candidate
 * takes exactly one offering from every group.
 */
public class OfferingGroup {
    private final String name;
    private final List<Offering> offerings;

    public OfferingGroup(String name, List<Offering> offerings) {
        if (name == null || offerings == null)
            throw new IllegalArgumentException("null group");
        this.name = name;
        this.offerings = List.copyOf(offerings);
    }

    public String getName() {
        return name;
    }

    public List<Offering> getOfferings() {
        return offerings;
    }

    public int size() {
        return offerings.size();
    }

    public boolean isEmpty() {
        return offerings.isEmpty();
    }

    @Override
    public String toString() {
        return name + offerings;
    }
}
