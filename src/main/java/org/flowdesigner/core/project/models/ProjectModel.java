package org.flowdesigner.core.project.models;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The whole flow being designed: its tasks in navigation order and the global object type name.
 */
@Data
@NoArgsConstructor
public class ProjectModel {
    public static final String DEFAULT_FLOW_NAME = "Novo fluxo";

    private String flowName = DEFAULT_FLOW_NAME;
    /**
     * Name every object-typed field takes. Empty until defined.
     */
    private String objectType = "";
    private List<Task> tasks = new ArrayList<>();

    public ProjectModel(String flowName) {
        this.flowName = flowName;
    }

    public Stream<Field> allFields() {
        return tasks.stream().flatMap(task -> task.getFields().stream());
    }

    public boolean hasObjectType() {
        return objectType != null && !objectType.isBlank();
    }

    public ProjectModel copy() {
        ProjectModel copy = new ProjectModel(flowName);
        copy.objectType = objectType;
        copy.tasks = tasks.stream().map(Task::copy).collect(Collectors.toCollection(ArrayList::new));
        return copy;
    }
}
