package org.flowdesigner.core.audit;

/**
 * One finding of an audit run.
 *
 * @param fieldId empty for project-level findings
 */
public record AuditIssue(
        IssueCode code,
        String taskId,
        String fieldId,
        String message
) {
    /**
     * Stable across runs as long as the ids do not change, so a finding the operator dismissed can be recognized
     * again.
     */
    public String key() {
        return code + "|" + taskId + "|" + fieldId;
    }
}
