package org.flowdesigner.core.process.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The caller-filtered candidate set handed to the editor for merging.
 * Immutable, so it can be produced off the thread that owns the project and merged later.
 *
 * @param diagramId    archive entry name of the source diagram
 * @param diagramLabel display label of the source diagram
 * @param tasks        selected tasks, in the order they should be appended
 * @param fieldsByTask selected candidate fields per task id
 */
public record ImportSelection(
        String diagramId,
        String diagramLabel,
        List<RawNode> tasks,
        Map<String, List<DecisionFieldCandidate>> fieldsByTask
) {
    public ImportSelection {
        tasks = List.copyOf(tasks);
        Map<String, List<DecisionFieldCandidate>> copy = new LinkedHashMap<>();
        fieldsByTask.forEach((taskId, fields) -> copy.put(taskId, List.copyOf(fields)));
        fieldsByTask = Collections.unmodifiableMap(copy);
    }

    public List<DecisionFieldCandidate> fieldsOf(String taskId) {
        return fieldsByTask.getOrDefault(taskId, List.of());
    }
}
