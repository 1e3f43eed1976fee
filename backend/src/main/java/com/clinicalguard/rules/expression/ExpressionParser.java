package com.clinicalguard.rules.expression;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses JSON-Logic style rule text into an {@link Expression} tree.
 *
 * Supported operators: {@code > < >= <= == and or in if var}. Anything else,
 * including an object with more than one key, is rejected.
 */
public class ExpressionParser {

    private final ObjectMapper objectMapper;

    public ExpressionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Expression parse(String logic) {
        if (logic == null || logic.isBlank()) {
            throw new MalformedRuleException("Rule logic is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(logic);
        } catch (JsonProcessingException e) {
            throw new MalformedRuleException("Rule logic is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public Expression parse(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            throw new MalformedRuleException("Rule logic is empty");
        }
        if (node.isNull()) {
            return new Literal(null);
        }
        if (node.isBoolean()) {
            return new Literal(node.booleanValue());
        }
        if (node.isNumber()) {
            return new Literal(node.decimalValue());
        }
        if (node.isTextual()) {
            return new Literal(node.textValue());
        }
        if (node.isArray()) {
            return new ArrayExpression(parseAll(node));
        }
        if (node.isObject()) {
            return parseOperation(node);
        }
        throw new MalformedRuleException("Unsupported JSON node: " + node.getNodeType());
    }

    private Expression parseOperation(JsonNode node) {
        if (node.size() != 1) {
            throw new MalformedRuleException("Operation object must have exactly one key, found " + node.size());
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        Map.Entry<String, JsonNode> entry = fields.next();
        String operator = entry.getKey();
        JsonNode rawArgs = entry.getValue();

        if ("var".equals(operator)) {
            return parseVar(rawArgs);
        }

        List<Expression> args = rawArgs.isArray() ? parseAll(rawArgs) : List.of(parse(rawArgs));

        Optional<ComparisonOperator> comparison = ComparisonOperator.fromSymbol(operator);
        if (comparison.isPresent()) {
            requireArity(operator, args, 2, 2);
            return new Comparison(comparison.get(), args.get(0), args.get(1));
        }
        return switch (operator) {
            case "and" -> {
                requireArity(operator, args, 1, Integer.MAX_VALUE);
                yield new BooleanCombination(BooleanOperator.AND, args);
            }
            case "or" -> {
                requireArity(operator, args, 1, Integer.MAX_VALUE);
                yield new BooleanCombination(BooleanOperator.OR, args);
            }
            case "in" -> {
                requireArity(operator, args, 2, 2);
                yield new Membership(args.get(0), args.get(1));
            }
            case "if" -> {
                requireArity(operator, args, 2, Integer.MAX_VALUE);
                yield new Conditional(args);
            }
            default -> throw new MalformedRuleException("Unsupported operator '" + operator + "'");
        };
    }

    private Expression parseVar(JsonNode rawArgs) {
        JsonNode pathNode = rawArgs;
        Expression fallback = null;
        if (rawArgs.isArray()) {
            if (rawArgs.isEmpty() || rawArgs.size() > 2) {
                throw new MalformedRuleException("var takes a path and an optional default");
            }
            pathNode = rawArgs.get(0);
            if (rawArgs.size() == 2) {
                fallback = parse(rawArgs.get(1));
            }
        }
        if (!pathNode.isTextual() || pathNode.textValue().isBlank()) {
            throw new MalformedRuleException("var path must be a non-empty string");
        }
        return new VarReference(pathNode.textValue(), fallback);
    }

    private List<Expression> parseAll(JsonNode array) {
        List<Expression> result = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            result.add(parse(element));
        }
        return result;
    }

    private static void requireArity(String operator, List<Expression> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new MalformedRuleException(
                "Operator '" + operator + "' takes " + (min == max ? String.valueOf(min) : "at least " + min)
                    + " argument(s), found " + args.size());
        }
    }
}
