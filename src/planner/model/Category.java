package planner.model;

public enum Category {
    REQUIRED("Required"),
    ELECTIVE("Elective");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
