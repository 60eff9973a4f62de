package planner.core;

import java.util.List;

/**
 * A course marked mandatory has no available (non-excluded) offering.
 */
public class MandatoryUnsatisfiableException extends Exception {
    private final List<String> missingCourses;

    public MandatoryUnsatisfiableException(List<String> missingCourses) {
        super(buildMessage(missingCourses));
        this.missingCourses = List.copyOf(missingCourses);
    }

    private static String buildMessage(List<String> missing) {
        if (missing == null || missing.isEmpty())
            throw new IllegalArgumentException("at least one missing course is required");
        if (missing.size() == 1)
            return "Mandatory course '" + missing.get(0) + "' has no available offering (all sections excluded)";
        return "Mandatory courses have no available offering: " + String.join(", ", missing);
    }

    /** First missing course in catalog order. */
    public String getCourseName() {
        return missingCourses.get(0);
    }

    public List<String> getMissingCourses() {
        return missingCourses;
    }
}
