package com.clinicalguard.signal;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.clinicalguard.config.GuardProperties;
import com.clinicalguard.rules.RuleOutcome;
import com.clinicalguard.validation.ValidationIssue;

/**
 * Merges validator issues and rule outcomes into one {@link DecisionSignal}.
 *
 * Color is a strict lattice (RED over YELLOW over GREEN), never a weighted score.
 * Findings are ordered blocking issues first, then the remaining issues by
 * severity descending, then rule outcomes in evaluation order.
 */
@Component
public class SignalAggregator {

    private final Set<String> supervisorCategories;

    @Autowired
    public SignalAggregator(GuardProperties properties) {
        this(properties.getAggregator().getSupervisorCategories());
    }

    public SignalAggregator(Set<String> supervisorCategories) {
        this.supervisorCategories = supervisorCategories == null ? Set.of()
            : supervisorCategories.stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public DecisionSignal aggregate(List<ValidationIssue> issues, List<RuleOutcome> outcomes) {
        List<Finding> findings = new ArrayList<>();
        SignalColor color = SignalColor.GREEN;
        OverridePolicy policy = OverridePolicy.NONE;

        List<ValidationIssue> orderedIssues = new ArrayList<>(issues != null ? issues : List.of());
        // List.sort is stable: equal keys keep validator order
        orderedIssues.sort(Comparator.comparing((ValidationIssue i) -> !i.isBlocking())
            .thenComparing(ValidationIssue::getSeverity, Comparator.reverseOrder()));

        for (ValidationIssue issue : orderedIssues) {
            SignalColor tier = issue.getSeverity().tier();
            color = color.worst(tier);
            if (issue.isBlocking()) {
                policy = policy.strictest(OverridePolicy.BLOCKED);
            } else if (tier != SignalColor.GREEN) {
                policy = policy.strictest(OverridePolicy.REQUIRES_JUSTIFICATION);
            }
            findings.add(Finding.builder()
                .sourceId(issue.getIssueId())
                .source(FindingSource.valueOf(issue.getKind().name()))
                .category(issue.getKind().name())
                .severity(issue.getSeverity())
                .color(tier)
                .message(issue.getMessage())
                .blocking(issue.isBlocking())
                .build());
        }

        for (RuleOutcome outcome : outcomes != null ? outcomes : List.<RuleOutcome>of()) {
            SignalColor tier = outcome.getSeverity().tier();
            color = color.worst(tier);
            if (tier != SignalColor.GREEN) {
                policy = policy.strictest(requiresSupervisor(outcome)
                    ? OverridePolicy.REQUIRES_SUPERVISOR
                    : OverridePolicy.REQUIRES_JUSTIFICATION);
            }
            findings.add(Finding.builder()
                .sourceId(outcome.getRuleId())
                .source(FindingSource.RULE)
                .category(outcome.getCategory() != null && !outcome.getCategory().isBlank()
                    ? outcome.getCategory().toLowerCase(Locale.ROOT)
                    : FindingSource.RULE.name())
                .severity(outcome.getSeverity())
                .color(tier)
                .message(outcome.getMessage())
                .outcomeTag(outcome.getOutcomeTag())
                .blocking(false)
                .build());
        }

        if (color == SignalColor.GREEN) {
            policy = OverridePolicy.NONE;
        }
        return new DecisionSignal(color, findings, policy);
    }

    private boolean requiresSupervisor(RuleOutcome outcome) {
        return outcome.getCategory() != null
            && supervisorCategories.contains(outcome.getCategory().toLowerCase(Locale.ROOT));
    }
}
