package com.filesentinel.core.policy;

import com.filesentinel.core.model.ResponseOrigin;
import com.filesentinel.core.model.ThreatAction;

/**
 * An action in a response plan, with the rule that first asked for it.
 */
public record PlannedAction(ThreatAction action, String ruleId, ResponseOrigin origin, String reason) {
}
