package org.flowdesigner.core.project.models;

/**
 * Reference to a field of a task, used for origin links.
 */
public record FieldRef(
        String taskId,
        String fieldId
) {
}
