package org.flowdesigner.core.process.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of decision-field derivation for one diagram: the importable tasks in document order and the
 * candidate fields per task id. Every task has an entry, possibly empty.
 */
public record DerivedCandidates(
        List<RawNode> tasks,
        Map<String, List<DecisionFieldCandidate>> fieldsByTask
) {
    public DerivedCandidates {
        tasks = List.copyOf(tasks);
        Map<String, List<DecisionFieldCandidate>> copy = new LinkedHashMap<>();
        fieldsByTask.forEach((taskId, fields) -> copy.put(taskId, List.copyOf(fields)));
        fieldsByTask = Collections.unmodifiableMap(copy);
    }

    public List<DecisionFieldCandidate> fieldsOf(String taskId) {
        return fieldsByTask.getOrDefault(taskId, List.of());
    }
}
