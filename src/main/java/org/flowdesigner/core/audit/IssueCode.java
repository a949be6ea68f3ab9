package org.flowdesigner.core.audit;

/**
 * Consistency findings reported by {@link ProjectAuditor}. None of them blocks editing or saving.
 */
public enum IssueCode {
    OPT_EDIT("Field is optional and editable"),
    REQ_RO("Field is required and readonly but has no origin, so it can never be filled"),
    LIST_NO_OPTS("List field has no options"),
    INFO_NO_TEXT("Informative field has no text to display"),
    ANX_NO_TYPE("Attachment field does not declare its document types"),
    NO_NAME("Field has no name"),
    DUP_NAME("Another field of the same task has this name"),
    BAD_ORIGIN("Origin points at a field that no longer exists"),
    BAD_RULE("A visibility rule depends on a field that no longer exists"),
    OBJ_NO_TYPE("Object fields exist but the flow has no object type");

    private final String description;

    IssueCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
