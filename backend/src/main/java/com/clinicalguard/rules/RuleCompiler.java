package com.clinicalguard.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.clinicalguard.rules.expression.Expression;
import com.clinicalguard.rules.expression.ExpressionParser;
import com.clinicalguard.rules.expression.MalformedRuleException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns authored rule definitions into a {@link RuleSet}. Inactive rules are
 * left out; malformed rules are logged as configuration defects and skipped
 * without affecting the rest.
 */
@Component
@Slf4j
public class RuleCompiler {

    private final ExpressionParser parser;

    public RuleCompiler() {
        this(new ObjectMapper());
    }

    public RuleCompiler(ObjectMapper objectMapper) {
        this.parser = new ExpressionParser(objectMapper);
    }

    public RuleSet compile(Collection<RuleDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            return RuleSet.empty();
        }

        // Several versions of one rule id: the highest version wins.
        Map<String, RuleDefinition> latest = new HashMap<>();
        for (RuleDefinition definition : definitions) {
            if (definition == null || definition.getRuleId() == null || definition.getRuleId().isBlank()) {
                log.error("Configuration defect: rule without id skipped");
                continue;
            }
            latest.merge(definition.getRuleId(), definition,
                (a, b) -> b.getVersion() > a.getVersion() ? b : a);
        }

        List<CompiledRule> compiled = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (RuleDefinition definition : latest.values()) {
            if (!definition.isActive()) {
                continue;
            }
            if (definition.getSeverity() == null) {
                log.error("Configuration defect: rule {} v{} has no severity, skipped",
                    definition.getRuleId(), definition.getVersion());
                skipped.add(definition.getRuleId());
                continue;
            }
            try {
                Expression expression = parser.parse(definition.getLogic());
                compiled.add(new CompiledRule(definition, expression));
            } catch (MalformedRuleException e) {
                log.error("Configuration defect: rule {} v{} skipped: {}",
                    definition.getRuleId(), definition.getVersion(), e.getMessage());
                skipped.add(definition.getRuleId());
            }
        }

        RuleSet ruleSet = new RuleSet(compiled, skipped);
        log.info("Compiled {} active rules ({} skipped as malformed)", ruleSet.size(), skipped.size());
        return ruleSet;
    }
}
