package com.awesomeposter.core.guard;

import java.util.Set;

/**
 * A guard condition ready for evaluation.
 *
 * @param source    the expression as written
 * @param canonical normalized, fully parenthesized form
 * @param variables canonical paths of every variable the expression reads
 * @param root      the expression tree
 */
public record CompiledCondition(
    String source,
    String canonical,
    Set<String> variables,
    ConditionNode root
) {
    public CompiledCondition {
        variables = Set.copyOf(variables);
    }
}
