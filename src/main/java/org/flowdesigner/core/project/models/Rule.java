package org.flowdesigner.core.project.models;

/**
 * Visibility rule: the owning field is shown when the source field's value equals {@code value}.
 * A field's rules are OR-ed. Equality is structural.
 */
public record Rule(
        String sourceFieldId,
        RuleOperator operator,
        String value
) {
    public static Rule equalsTo(String sourceFieldId, String value) {
        return new Rule(sourceFieldId, RuleOperator.EQUALS, value);
    }
}
