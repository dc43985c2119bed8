package com.meridian.exception;

import com.meridian.model.Alternative;
import com.meridian.model.TaskCategory;

import java.util.List;

/**
 * Every candidate was filtered out. Carries the rejected candidates for diagnosis.
 */
public class NoEligibleModelException extends RoutingException {

    private final TaskCategory taskCategory;
    private final List<Alternative> alternatives;

    public NoEligibleModelException(TaskCategory taskCategory, List<Alternative> alternatives) {
        super("No eligible model for task category " + taskCategory
                + " (" + alternatives.size() + " candidates rejected)");
        this.taskCategory = taskCategory;
        this.alternatives = List.copyOf(alternatives);
    }

    public TaskCategory getTaskCategory() {
        return taskCategory;
    }

    public List<Alternative> getAlternatives() {
        return alternatives;
    }
}
