package org.flowdesigner.core.persistence.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskEntry {
    public String id;
    public String name;
    public List<FieldEntry> fields = new ArrayList<>();
}
