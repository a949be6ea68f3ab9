package org.flowdesigner.core.project;

import org.flowdesigner.core.project.models.Field;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Fields copied out of a project, ready to be pasted as independent copies or as origin-linked fields.
 * Holds its own copies, so later edits to the project do not leak in.
 */
public final class FieldClipboard {
    private final String sourceTaskId;
    private final List<Field> fields;

    FieldClipboard(String sourceTaskId, List<Field> fields) {
        this.sourceTaskId = sourceTaskId;
        this.fields = fields.stream().map(Field::copy).collect(Collectors.toUnmodifiableList());
    }

    public String getSourceTaskId() {
        return sourceTaskId;
    }

    public List<Field> getFields() {
        return fields.stream().map(Field::copy).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }
}
