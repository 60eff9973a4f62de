package planner.core;

public enum PlannerState {
    IDLE,
    EVALUATING,
    DONE,
    FAILED
}
