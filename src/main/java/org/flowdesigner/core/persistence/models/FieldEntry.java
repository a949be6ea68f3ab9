package org.flowdesigner.core.persistence.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A field as saved. Types are stored by label ("Texto", "Lista", "Objeto", ...), the name lock reason as
 * "", "objeto" or "origem".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldEntry {
    public String id;
    public String name;

    @JsonProperty("ftype")
    public String type = "Texto";

    public boolean required;
    public boolean readonly;
    public String options = "";
    public String note = "";

    @JsonProperty("origin_task")
    public String originTask;

    @JsonProperty("origin_field")
    public String originField;

    @JsonProperty("name_locked")
    public boolean nameLocked;

    @JsonProperty("name_lock_reason")
    public String nameLockReason = "";

    @JsonProperty("name_before_obj")
    public String nameBeforeObject = "";

    @JsonProperty("name_before_origin")
    public String nameBeforeOrigin = "";

    /**
     * Object type of an object field. Only read when the project itself has no object type.
     */
    @JsonProperty("obj_type")
    public String objectType = "";

    @JsonProperty("cond")
    public List<RuleEntry> rules = new ArrayList<>();
}
