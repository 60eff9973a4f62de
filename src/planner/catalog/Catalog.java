package planner.catalog;

import planner.model.Offering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Editable pool of offerings the planner reads from. An offering is identified
 * by its (name, section id); the catalog never holds two with the same key.
 */
public class Catalog {
    private final List<Offering> offerings = new ArrayList<>();

    public Catalog() {
    }

    public Catalog(List<Offering> initial) {
        addAll(initial);
    }

    public void addOffering(Offering offering) {
        if (offering == null)
            throw new IllegalArgumentException("null offering");
        if (indexOf(offering.getName(), offering.getSectionId()) >= 0)
            throw new IllegalArgumentException("Course '" + offering.getName() + "' (section "
                    + offering.getSectionId() + ") already exists");
        offerings.add(offering);
    }

    /**
     * Adds every offering whose key is not taken yet.
     *
     * @return how many were skipped as duplicates
     */
    public int addAll(List<Offering> batch) {
        if (batch == null)
            return 0;
        int skipped = 0;
        for (Offering o : batch) {
            if (o == null || indexOf(o.getName(), o.getSectionId()) >= 0) {
                skipped++;
                continue;
            }
            offerings.add(o);
        }
        return skipped;
    }

    /** Replaces the entry in place; the replacement may carry a new key. */
    public void updateOffering(String name, String sectionId, Offering replacement) {
        if (replacement == null)
            throw new IllegalArgumentException("null replacement");
        int idx = indexOf(name, sectionId);
        if (idx < 0)
            throw new IllegalArgumentException("No course '" + name + "' (section " + sectionId + ")");
        int clash = indexOf(replacement.getName(), replacement.getSectionId());
        if (clash >= 0 && clash != idx)
            throw new IllegalArgumentException("Course '" + replacement.getName() + "' (section "
                    + replacement.getSectionId() + ") already exists");
        offerings.set(idx, replacement);
    }

    public boolean removeOffering(String name, String sectionId) {
        int idx = indexOf(name, sectionId);
        if (idx < 0)
            return false;
        offerings.remove(idx);
        return true;
    }

    public List<Offering> listOfferings() {
        return Collections.unmodifiableList(new ArrayList<>(offerings));
    }

    public int size() {
        return offerings.size();
    }

    private int indexOf(String name, String sectionId) {
        for (int i = 0; i < offerings.size(); i++) {
            if (offerings.get(i).sameKey(name, sectionId))
                return i;
        }
        return -1;
    }
}
