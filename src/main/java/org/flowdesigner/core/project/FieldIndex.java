package org.flowdesigner.core.project;

import org.flowdesigner.core.project.models.Field;
import org.flowdesigner.core.project.models.ProjectModel;
import org.flowdesigner.core.project.models.Task;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Id lookups over a project. Rebuilt after every structural change, never updated piecemeal.
 */
public class FieldIndex {
    private final Map<String, Task> tasksById = new HashMap<>();
    private final Map<String, Field> fieldsById = new HashMap<>();
    private final Map<String, String> taskIdByFieldId = new HashMap<>();

    public void rebuild(ProjectModel project) {
        tasksById.clear();
        fieldsById.clear();
        taskIdByFieldId.clear();

        for (Task task : project.getTasks()) {
            tasksById.put(task.getId(), task);
            for (Field field : task.getFields()) {
                fieldsById.put(field.getId(), field);
                taskIdByFieldId.put(field.getId(), task.getId());
            }
        }
    }

    public Optional<Task> task(String taskId) {
        return Optional.ofNullable(taskId == null ? null : tasksById.get(taskId));
    }

    public Optional<Field> field(String fieldId) {
        return Optional.ofNullable(fieldId == null ? null : fieldsById.get(fieldId));
    }

    public Optional<Task> ownerOf(String fieldId) {
        return task(taskIdByFieldId.get(fieldId));
    }

    public boolean containsTask(String taskId) {
        return tasksById.containsKey(taskId);
    }

    public boolean containsField(String fieldId) {
        return fieldsById.containsKey(fieldId);
    }

    public String fieldName(String fieldId) {
        return field(fieldId).map(Field::getName).orElse("");
    }
}
