package com.filesentinel.core.policy;

import com.filesentinel.core.model.ThreatAction;

import java.util.List;

/**
 * Ordered, duplicate-free list of actions to execute for one upload.
 */
public final class ResponsePlan {

    private final List<PlannedAction> steps;

    public ResponsePlan(List<PlannedAction> steps) {
        this.steps = List.copyOf(steps);
    }

    public List<PlannedAction> getSteps() {
        return steps;
    }

    public List<ThreatAction> getActions() {
        return steps.stream().map(PlannedAction::action).toList();
    }

    public boolean contains(ThreatAction action) {
        return steps.stream().anyMatch(s -> s.action() == action);
    }

    public PlannedAction step(ThreatAction action) {
        return steps.stream().filter(s -> s.action() == action).findFirst().orElse(null);
    }

    @Override
    public String toString() {
        return "ResponsePlan" + getActions();
    }
}
