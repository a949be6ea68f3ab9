package org.flowdesigner.core.process.models;

import lombok.Builder;

import java.util.List;

/**
 * A decision field proposed for a task, synthesized from a downstream gateway.
 *
 * @param id      "{sourceTaskId}_{gatewayId}"
 * @param label   normalized gateway name
 * @param kind    list or yes/no list
 * @param options option labels in transition order
 */
@Builder(toBuilder = true)
public record DecisionFieldCandidate(
        String id,
        String label,
        DecisionFieldKind kind,
        List<String> options
) {
    public DecisionFieldCandidate {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public DecisionFieldCandidate withLabel(String newLabel) {
        return toBuilder().label(newLabel).build();
    }

    public DecisionFieldCandidate withOptions(List<String> newOptions) {
        return toBuilder().options(newOptions).build();
    }
}
