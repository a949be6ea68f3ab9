package org.flowdesigner.core.audit;

import org.flowdesigner.core.config.DesignerSettings;
import org.flowdesigner.core.project.models.Field;
import org.flowdesigner.core.project.models.FieldType;
import org.flowdesigner.core.project.models.ProjectModel;
import org.flowdesigner.core.project.models.Task;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only consistency scan of a project. Never changes the project; fixing a finding is an explicit editor
 * operation.
 */
public class ProjectAuditor {
    static final String ATTACHMENT_TYPE_MARKER = "[Tipo de Doc.:";

    public static List<AuditIssue> audit(ProjectModel project) {
        return audit(project, Set.of(), DesignerSettings.defaults());
    }

    public static List<AuditIssue> audit(ProjectModel project, Set<String> ignoredKeys) {
        return audit(project, ignoredKeys, DesignerSettings.defaults());
    }

    /**
     * @param ignoredKeys {@link AuditIssue#key()} values the operator chose to dismiss
     * @param settings    supplies the default field name, which counts as no name at all
     */
    public static List<AuditIssue> audit(ProjectModel project, Set<String> ignoredKeys, DesignerSettings settings) {
        String defaultFieldName = settings.defaultFieldName == null ? "" : settings.defaultFieldName.strip();
        Set<String> fieldIds = project.allFields().map(Field::getId).collect(Collectors.toSet());
        List<AuditIssue> issues = new ArrayList<>();

        for (Task task : project.getTasks()) {
            Set<String> namesInTask = new HashSet<>();
            for (Field field : task.getFields()) {
                checkField(task, field, fieldIds, defaultFieldName, issues);
                if (!namesInTask.add(field.getName())) {
                    issues.add(issue(IssueCode.DUP_NAME, task, field));
                }
            }
        }

        boolean hasObjectField = project.allFields().anyMatch(field -> field.getType() == FieldType.OBJECT);
        if (hasObjectField && !project.hasObjectType()) {
            String taskId = project.getTasks().isEmpty() ? "" : project.getTasks().get(0).getId();
            issues.add(new AuditIssue(IssueCode.OBJ_NO_TYPE, taskId, "", IssueCode.OBJ_NO_TYPE.getDescription()));
        }

        return issues.stream()
                .filter(issue -> !ignoredKeys.contains(issue.key()))
                .collect(Collectors.toList());
    }

    private static void checkField(Task task, Field field, Set<String> fieldIds, String defaultFieldName,
                                   List<AuditIssue> issues) {
        if (!field.isRequired() && !field.isReadonly()) {
            issues.add(issue(IssueCode.OPT_EDIT, task, field));
        }
        if (field.isRequired() && field.isReadonly() && !field.hasOrigin()) {
            issues.add(issue(IssueCode.REQ_RO, task, field));
        }
        if (field.getType().isList() && isBlank(field.getOptions()) && !field.hasOrigin()) {
            issues.add(issue(IssueCode.LIST_NO_OPTS, task, field));
        }
        if (field.getType() == FieldType.INFORMATIVE && isBlank(field.getOptions())) {
            issues.add(issue(IssueCode.INFO_NO_TEXT, task, field));
        }
        if (field.getType() == FieldType.ATTACHMENT
                && (field.getNote() == null || !field.getNote().contains(ATTACHMENT_TYPE_MARKER))) {
            issues.add(issue(IssueCode.ANX_NO_TYPE, task, field));
        }
        if (isBlank(field.getName()) || field.getName().strip().equalsIgnoreCase(defaultFieldName)) {
            issues.add(issue(IssueCode.NO_NAME, task, field));
        }
        if (field.hasOrigin() && !fieldIds.contains(field.getOrigin().fieldId())) {
            issues.add(issue(IssueCode.BAD_ORIGIN, task, field));
        }
        // one finding per field, however many rules dangle
        if (field.getRules().stream().anyMatch(rule -> !fieldIds.contains(rule.sourceFieldId()))) {
            issues.add(issue(IssueCode.BAD_RULE, task, field));
        }
    }

    private static AuditIssue issue(IssueCode code, Task task, Field field) {
        return new AuditIssue(code, task.getId(), field.getId(),
                code.getDescription() + ": '" + field.getName() + "' in task '" + task.getName() + "'");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
