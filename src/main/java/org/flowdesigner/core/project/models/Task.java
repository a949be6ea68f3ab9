package org.flowdesigner.core.project.models;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
public class Task {
    private String id;
    private String name;
    private List<Field> fields = new ArrayList<>();

    public Task(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public int indexOf(String fieldId) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getId().equals(fieldId)) {
                return i;
            }
        }
        return -1;
    }

    public Task copy() {
        Task copy = new Task(id, name);
        copy.fields = fields.stream().map(Field::copy).collect(Collectors.toCollection(ArrayList::new));
        return copy;
    }
}
