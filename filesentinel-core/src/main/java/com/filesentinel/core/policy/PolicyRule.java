package com.filesentinel.core.policy;

import com.filesentinel.core.model.ResponseOrigin;
import com.filesentinel.core.model.ThreatAction;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * One row of the response decision table.
 *
 * @param group rules sharing a group are exclusive: only the first matching
 *              one fires. Null for rules that always get evaluated.
 */
public record PolicyRule(String id, String group, ResponseOrigin origin, String description,
        Predicate<PolicyInput> condition, List<ThreatAction> actions) {

    public PolicyRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(condition, "condition");
        actions = List.copyOf(actions);
    }

    public boolean matches(PolicyInput input) {
        return condition.test(input);
    }
}
