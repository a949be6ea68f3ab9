package org.flowdesigner.core.persistence.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Saved project document.
 * <p>
 * Example:
 * {
 *   "flow_name": "Compras",
 *   "object_type": "Pedido",
 *   "tasks": [ { "id": "a1b2c3d4", "name": "Aprovar", "fields": [ ... ] } ]
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectFile {
    @JsonProperty("flow_name")
    public String flowName;

    @JsonProperty("object_type")
    public String objectType = "";

    public List<TaskEntry> tasks = new ArrayList<>();
}
