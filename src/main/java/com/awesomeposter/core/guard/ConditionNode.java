package com.awesomeposter.core.guard;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Node of a compiled guard condition tree.
 * <p>
 * Every node renders a canonical, fully parenthesized form so two conditions that differ
 * only in whitespace or keyword spelling compile to the same text.
 */
public sealed interface ConditionNode {

    enum Kind { LITERAL, VARIABLE, LIST, COMPARISON, MEMBERSHIP, NOT, AND, OR }

    Kind kind();

    String canonical();

    record Literal(Object value) implements ConditionNode {
        public Kind kind() { return Kind.LITERAL; }

        public String canonical() {
            if (value == null) {
                return "null";
            }
            if (value instanceof String s) {
                return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
            }
            if (value instanceof BigDecimal d) {
                return d.stripTrailingZeros().toPlainString();
            }
            return String.valueOf(value);
        }
    }

    /**
     * A path into the facts, kept as segments whether written dotted ({@code a.b}) or as a
     * pointer ({@code /a/b}).
     */
    record Variable(List<String> segments) implements ConditionNode {
        public Variable {
            segments = List.copyOf(segments);
        }

        public Kind kind() { return Kind.VARIABLE; }

        public String canonical() {
            return String.join(".", segments);
        }
    }

    record ListLiteral(List<ConditionNode> items) implements ConditionNode {
        public ListLiteral {
            items = List.copyOf(items);
        }

        public Kind kind() { return Kind.LIST; }

        public String canonical() {
            return items.stream().map(ConditionNode::canonical).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    record Comparison(Operator operator, ConditionNode left, ConditionNode right) implements ConditionNode {
        public Kind kind() { return Kind.COMPARISON; }

        public String canonical() {
            return "(" + left.canonical() + " " + operator.symbol() + " " + right.canonical() + ")";
        }
    }

    record Membership(ConditionNode element, ConditionNode container) implements ConditionNode {
        public Kind kind() { return Kind.MEMBERSHIP; }

        public String canonical() {
            return "(" + element.canonical() + " in " + container.canonical() + ")";
        }
    }

    record Not(ConditionNode operand) implements ConditionNode {
        public Kind kind() { return Kind.NOT; }

        public String canonical() {
            return "!" + operand.canonical();
        }
    }

    record And(ConditionNode left, ConditionNode right) implements ConditionNode {
        public Kind kind() { return Kind.AND; }

        public String canonical() {
            return "(" + left.canonical() + " && " + right.canonical() + ")";
        }
    }

    record Or(ConditionNode left, ConditionNode right) implements ConditionNode {
        public Kind kind() { return Kind.OR; }

        public String canonical() {
            return "(" + left.canonical() + " || " + right.canonical() + ")";
        }
    }
}
