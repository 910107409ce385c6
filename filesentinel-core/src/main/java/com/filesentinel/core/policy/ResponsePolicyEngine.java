package com.filesentinel.core.policy;

import com.filesentinel.core.config.FileSentinelProperties;
import com.filesentinel.core.model.DataClassification;
import com.filesentinel.core.model.PiiDetectionResult;
import com.filesentinel.core.model.ResponseOrigin;
import com.filesentinel.core.model.Severity;
import com.filesentinel.core.model.ThreatAction;
import com.filesentinel.core.model.ThreatDetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.filesentinel.core.model.ThreatAction.BLOCK;
import static com.filesentinel.core.model.ThreatAction.DELETE;
import static com.filesentinel.core.model.ThreatAction.ESCALATE;
import static com.filesentinel.core.model.ThreatAction.LOG;
import static com.filesentinel.core.model.ThreatAction.NOTIFY;
import static com.filesentinel.core.model.ThreatAction.QUARANTINE;
import static com.filesentinel.core.model.ThreatAction.SANITIZE;

/**
 * Decides which response actions an upload gets. Pure: same inputs, same plan.
 *
 * <p>
 * The decision table is evaluated top to bottom. Rules in the same group are
 * else-if chained; an action is added once, by the first rule asking for it.
 * </p>
 *
 * <pre>
 * #   rule                                         group  adds
 * 1   always                                       -      LOG
 * 2a  score >= auto-quarantine and CRITICAL        risk   BLOCK, DELETE, ESCALATE
 * 2b  score >= auto-quarantine and HIGH            risk   QUARANTINE, ESCALATE
 * 2c  score >= auto-quarantine                     risk   QUARANTINE
 * 3   severity MEDIUM                              risk   NOTIFY
 * 4   ransomware, malware or backdoor found        -      BLOCK, ESCALATE
 * 5   PII restricted or any critical finding       pii    BLOCK, SANITIZE, ESCALATE
 * 6   PII confidential                             pii    SANITIZE, NOTIFY
 * 7   any PII finding                              pii    NOTIFY
 * 8   notifications on and (score >= notify
 *     threshold or any PII)                        -      NOTIFY
 * </pre>
 */
public class ResponsePolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(ResponsePolicyEngine.class);

    private final List<PolicyRule> rules;

    public ResponsePolicyEngine() {
        this(defaultRules());
    }

    public ResponsePolicyEngine(List<PolicyRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<PolicyRule> defaultRules() {
        return List.of(
                new PolicyRule("1", null, ResponseOrigin.POLICY, "Every scan is logged",
                        in -> true, List.of(LOG)),
                new PolicyRule("2a", "risk", ResponseOrigin.THREAT_DETECTION,
                        "Critical risk above the auto-quarantine threshold",
                        in -> in.atOrAboveAutoQuarantine() && in.severity() == Severity.CRITICAL,
                        List.of(BLOCK, DELETE, ESCALATE)),
                new PolicyRule("2b", "risk", ResponseOrigin.THREAT_DETECTION,
                        "High risk above the auto-quarantine threshold",
                        in -> in.atOrAboveAutoQuarantine() && in.severity() == Severity.HIGH,
                        List.of(QUARANTINE, ESCALATE)),
                new PolicyRule("2c", "risk", ResponseOrigin.THREAT_DETECTION,
                        "Risk above the auto-quarantine threshold",
                        PolicyInput::atOrAboveAutoQuarantine,
                        List.of(QUARANTINE)),
                new PolicyRule("3", "risk", ResponseOrigin.THREAT_DETECTION, "Medium severity threats",
                        in -> in.severity() == Severity.MEDIUM, List.of(NOTIFY)),
                new PolicyRule("4", null, ResponseOrigin.THREAT_DETECTION,
                        "Ransomware, malware or backdoor detected",
                        PolicyInput::hasHostileThreat, List.of(BLOCK, ESCALATE)),
                new PolicyRule("5", "pii", ResponseOrigin.PII_DETECTION,
                        "Restricted data or critical PII",
                        in -> in.piiClassification() == DataClassification.RESTRICTED || in.hasCriticalPii(),
                        List.of(BLOCK, SANITIZE, ESCALATE)),
                new PolicyRule("6", "pii", ResponseOrigin.PII_DETECTION, "Confidential data",
                        in -> in.piiClassification() == DataClassification.CONFIDENTIAL,
                        List.of(SANITIZE, NOTIFY)),
                new PolicyRule("7", "pii", ResponseOrigin.PII_DETECTION, "PII present",
                        PolicyInput::hasPiiFindings, List.of(NOTIFY)),
                new PolicyRule("8", null, ResponseOrigin.POLICY, "Notification threshold reached",
                        in -> in.settings().getNotifications().isEnabled()
                                && (in.riskScore() >= in.settings().getNotifyThreshold() || in.hasPiiFindings()),
                        List.of(NOTIFY)));
    }

    public ResponsePlan decide(ThreatDetectionResult threatResult, PiiDetectionResult piiResult,
            FileSentinelProperties settings) {
        PolicyInput input = new PolicyInput(threatResult, piiResult, settings);
        Set<String> firedGroups = new HashSet<>();
        Set<ThreatAction> planned = EnumSet.noneOf(ThreatAction.class);
        List<PlannedAction> steps = new ArrayList<>();

        for (PolicyRule rule : rules) {
            if (rule.group() != null && firedGroups.contains(rule.group()))
                continue;
            if (!rule.matches(input))
                continue;
            if (rule.group() != null)
                firedGroups.add(rule.group());
            for (ThreatAction action : rule.actions()) {
                if (planned.add(action)) {
                    steps.add(new PlannedAction(action, rule.id(), rule.origin(), rule.description()));
                }
            }
        }

        ResponsePlan plan = new ResponsePlan(steps);
        log.debug("[FileSentinel] Scan {} planned {}", threatResult.getScanId(), plan);
        return plan;
    }

    public List<PolicyRule> getRules() {
        return rules;
    }
}
