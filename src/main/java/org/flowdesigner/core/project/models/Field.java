package org.flowdesigner.core.project.models;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A form field of a task.
 * <p>
 * Cross-references (origin, rule sources) are held by id only. Mutations go through
 * {@code ProjectEditor}, which keeps those references and the name lock consistent.
 */
@Data
@NoArgsConstructor
public class Field {
    private String id;
    private String name;
    private FieldType type = FieldType.TEXT;
    private boolean required;
    private boolean readonly;
    /**
     * ';'-separated options for list types, display text for informative fields.
     */
    private String options = "";
    private String note = "";
    private FieldRef origin;
    private List<Rule> rules = new ArrayList<>();
    private NameLock nameLock = NameLock.NONE;
    private String nameBeforeObject = "";
    private String nameBeforeOrigin = "";

    public Field(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public boolean hasOrigin() {
        return origin != null;
    }

    public boolean isNameLocked() {
        return nameLock.isLocked();
    }

    public Field copy() {
        Field copy = new Field(id, name);
        copy.type = type;
        copy.required = required;
        copy.readonly = readonly;
        copy.options = options;
        copy.note = note;
        copy.origin = origin;
        copy.rules = new ArrayList<>(rules);
        copy.nameLock = nameLock;
        copy.nameBeforeObject = nameBeforeObject;
        copy.nameBeforeOrigin = nameBeforeOrigin;
        return copy;
    }
}
