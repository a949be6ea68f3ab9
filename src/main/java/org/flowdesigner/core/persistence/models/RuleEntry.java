package org.flowdesigner.core.persistence.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleEntry {
    @JsonProperty("src_field")
    public String sourceField;

    @JsonProperty("op")
    public String operator = "==";

    public String value = "";
}
