package com.awesomeposter.core.guard;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles guard conditions and evaluates them against a run's facet values.
 * <p>
 * Evaluation never throws: a missing variable, a missing facet or a type mismatch is
 * reported on the affected guard's result, and its sibling guards are still evaluated.
 */
@Component
public class GuardEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GuardEvaluator.class);

    /** Name the value resolved from a guard's (facet, path) is bound to. */
    public static final String VALUE_VARIABLE = "value";

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws ConditionSyntaxException if the expression is malformed
     */
    public CompiledCondition compile(String source) {
        return ConditionParser.parse(source);
    }

    public GuardDefinition define(String facet, String path, String condition) {
        return new GuardDefinition(facet, path, compile(condition));
    }

    public ConditionOutcome evaluate(CompiledCondition condition, Map<String, Object> facts) {
        try {
            Object result = eval(condition.root(), facts);
            if (!(result instanceof Boolean satisfied)) {
                return ConditionOutcome.error("Condition did not evaluate to a boolean: " + describe(result));
            }
            return ConditionOutcome.of(satisfied);
        } catch (EvaluationException e) {
            return ConditionOutcome.error(e.getMessage());
        }
    }

    /**
     * Evaluates every guard against the facets, in declaration order.
     */
    public List<GuardResult> evaluateGuards(List<GuardDefinition> guards, Map<String, Object> facets) {
        List<GuardResult> results = new ArrayList<>(guards.size());
        for (GuardDefinition guard : guards) {
            GuardResult result = evaluateGuard(guard, facets);
            if (!result.passed()) {
                log.info("Guard {}{} not satisfied: {}", guard.facet(), guard.path(),
                        result.error() != null ? result.error() : guard.condition().canonical());
            }
            results.add(result);
        }
        return results;
    }

    GuardResult evaluateGuard(GuardDefinition guard, Map<String, Object> facets) {
        String expression = guard.condition().source();
        if (!facets.containsKey(guard.facet())) {
            return new GuardResult(guard.facet(), guard.path(), expression, false,
                    "Facet '" + guard.facet() + "' is not present");
        }
        try {
            Object resolved = resolvePointer(guard.facet(), facets.get(guard.facet()), guard.path());

            Map<String, Object> facts = new LinkedHashMap<>(facets);
            facts.put(VALUE_VARIABLE, resolved);
            String lastSegment = lastSegment(guard.path());
            if (lastSegment != null && !facets.containsKey(lastSegment)) {
                facts.put(lastSegment, resolved);
            }

            ConditionOutcome outcome = evaluate(guard.condition(), facts);
            return new GuardResult(guard.facet(), guard.path(), expression, outcome.satisfied(), outcome.error());
        } catch (EvaluationException e) {
            return new GuardResult(guard.facet(), guard.path(), expression, false, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Guard {}{} failed unexpectedly", guard.facet(), guard.path(), e);
            return new GuardResult(guard.facet(), guard.path(), expression, false,
                    "Guard evaluation failed: " + e.getMessage());
        }
    }

    // -- Evaluation ----------------------------------------------------------

    private Object eval(ConditionNode node, Map<String, Object> facts) {
        return switch (node.kind()) {
            case LITERAL -> ((ConditionNode.Literal) node).value();
            case VARIABLE -> lookup((ConditionNode.Variable) node, facts);
            case LIST -> ((ConditionNode.ListLiteral) node).items().stream()
                    .map(item -> eval(item, facts))
                    .toList();
            case COMPARISON -> {
                var comparison = (ConditionNode.Comparison) node;
                yield compare(comparison.operator(), eval(comparison.left(), facts), eval(comparison.right(), facts));
            }
            case MEMBERSHIP -> {
                var membership = (ConditionNode.Membership) node;
                yield contains(eval(membership.container(), facts), eval(membership.element(), facts));
            }
            case NOT -> !bool(eval(((ConditionNode.Not) node).operand(), facts));
            case AND -> {
                var and = (ConditionNode.And) node;
                yield bool(eval(and.left(), facts)) && bool(eval(and.right(), facts));
            }
            case OR -> {
                var or = (ConditionNode.Or) node;
                yield bool(eval(or.left(), facts)) || bool(eval(or.right(), facts));
            }
        };
    }

    private Object lookup(ConditionNode.Variable variable, Map<String, Object> facts) {
        Object current = facts;
        for (String segment : variable.segments()) {
            current = child(normalize(current), segment);
            if (current == Missing.INSTANCE) {
                throw new EvaluationException("Unknown variable '" + variable.canonical() + "'");
            }
        }
        return current;
    }

    private Object resolvePointer(String facet, Object value, String path) {
        if (path.isEmpty()) {
            return value;
        }
        JsonPointer pointer;
        try {
            pointer = JsonPointer.compile(path);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException("Path '" + path + "' could not be resolved in facet '" + facet + "'");
        }
        Object current = value;
        while (!pointer.matches()) {
            current = child(normalize(current), pointer.getMatchingProperty());
            if (current == Missing.INSTANCE) {
                throw new EvaluationException("Path '" + path + "' could not be resolved in facet '" + facet + "'");
            }
            pointer = pointer.tail();
        }
        return current;
    }

    private static Object child(Object container, String segment) {
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(segment) ? map.get(segment) : Missing.INSTANCE;
        }
        if (container instanceof List<?> list) {
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : Missing.INSTANCE;
            } catch (NumberFormatException e) {
                return Missing.INSTANCE;
            }
        }
        return Missing.INSTANCE;
    }

    /** Facet values may be records or beans; view them as maps and lists. */
    private Object normalize(Object value) {
        if (value == null || value instanceof Map || value instanceof List || value instanceof String
                || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        try {
            return objectMapper.convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException("Value of type " + value.getClass().getSimpleName()
                    + " cannot be inspected: " + e.getMessage());
        }
    }

    private static boolean compare(Operator op, Object left, Object right) {
        if (op == Operator.EQ) {
            return equalValues(left, right);
        }
        if (op == Operator.NE) {
            return !equalValues(left, right);
        }
        int cmp;
        if (left instanceof Number l && right instanceof Number r) {
            cmp = decimal(l).compareTo(decimal(r));
        } else if (left instanceof String l && right instanceof String r) {
            cmp = l.compareTo(r);
        } else {
            throw new EvaluationException("Cannot compare " + describe(left) + " " + op.symbol() + " " + describe(right));
        }
        return switch (op) {
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            case EQ, NE -> throw new IllegalStateException("handled above");
        };
    }

    private static boolean contains(Object container, Object element) {
        if (container instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> equalValues(item, element));
        }
        if (container instanceof String text && element instanceof String part) {
            return text.contains(part);
        }
        if (container instanceof Map<?, ?> map && element instanceof String key) {
            return map.containsKey(key);
        }
        throw new EvaluationException("Cannot test membership of " + describe(element) + " in " + describe(container));
    }

    private static boolean equalValues(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return decimal(l).compareTo(decimal(r)) == 0;
        }
        return Objects.equals(left, right);
    }

    private static BigDecimal decimal(Number number) {
        if (number instanceof BigDecimal d) {
            return d;
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new EvaluationException("Not a finite number: " + number);
        }
    }

    private static boolean bool(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new EvaluationException("Expected a boolean but got " + describe(value));
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value.getClass().getSimpleName().toLowerCase() + " " + value;
    }

    private static String lastSegment(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        return segment.isEmpty() ? null : segment.replace("~1", "/").replace("~0", "~");
    }

    private enum Missing { INSTANCE }

    private static final class EvaluationException extends RuntimeException {
        EvaluationException(String message) {
            super(message);
        }
    }
}
