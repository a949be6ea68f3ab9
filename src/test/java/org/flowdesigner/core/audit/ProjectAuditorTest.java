package org.flowdesigner.core.audit;

import org.flowdesigner.core.config.DesignerSettings;
import org.flowdesigner.core.project.models.Field;
import org.flowdesigner.core.project.models.FieldRef;
import org.flowdesigner.core.project.models.FieldType;
import org.flowdesigner.core.project.models.ProjectModel;
import org.flowdesigner.core.project.models.Rule;
import org.flowdesigner.core.project.models.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProjectAuditorTest {
    private ProjectModel project;
    private Task task;

    @BeforeEach
    void setUp() {
        project = new ProjectModel("Fluxo");
        task = new Task("t1", "Tarefa");
        project.getTasks().add(task);
    }

    private Field add(String id, String name) {
        Field field = new Field(id, name);
        field.setRequired(true);
        task.getFields().add(field);
        return field;
    }

    private List<IssueCode> codesFor(String fieldId) {
        return ProjectAuditor.audit(project).stream()
                .filter(issue -> issue.fieldId().equals(fieldId))
                .map(AuditIssue::code)
                .collect(Collectors.toList());
    }

    @Test
    void shouldReportNothingForConsistentProject() {
        Field status = add("f1", "Status");
        status.setType(FieldType.LIST);
        status.setOptions("Aberto; Fechado");
        Field detail = add("f2", "Detalhe");
        detail.getRules().add(Rule.equalsTo("f1", "Aberto"));

        assertTrue(ProjectAuditor.audit(project).isEmpty());
    }

    @Test
    void shouldFlagEditabilityIssues() {
        Field optional = add("f1", "Opcional");
        optional.setRequired(false);
        Field stuck = add("f2", "Travado");
        stuck.setReadonly(true);
        Field linked = add("f3", "Ligado");
        linked.setReadonly(true);
        linked.setOrigin(new FieldRef("t1", "f1"));

        assertEquals(List.of(IssueCode.OPT_EDIT), codesFor("f1"));
        assertEquals(List.of(IssueCode.REQ_RO), codesFor("f2"));
        assertTrue(codesFor("f3").isEmpty());
    }

    @Test
    void shouldFlagContentIssues() {
        Field list = add("f1", "Lista");
        list.setType(FieldType.MULTI_LIST);
        Field info = add("f2", "Aviso");
        info.setType(FieldType.INFORMATIVE);
        Field attachment = add("f3", "Documento");
        attachment.setType(FieldType.ATTACHMENT);
        attachment.setNote("qualquer");
        Field typedAttachment = add("f4", "Nota fiscal");
        typedAttachment.setType(FieldType.ATTACHMENT);
        typedAttachment.setNote("[Tipo de Doc.: NF-e]");

        assertEquals(List.of(IssueCode.LIST_NO_OPTS), codesFor("f1"));
        assertEquals(List.of(IssueCode.INFO_NO_TEXT), codesFor("f2"));
        assertEquals(List.of(IssueCode.ANX_NO_TYPE), codesFor("f3"));
        assertTrue(codesFor("f4").isEmpty());
    }

    @Test
    void shouldNotFlagLinkedListWithoutOptions() {
        add("f1", "Origem").setType(FieldType.LIST);
        Field linked = add("f2", "Lista ligada");
        linked.setType(FieldType.LIST);
        linked.setOrigin(new FieldRef("t1", "f1"));

        assertFalse(codesFor("f2").contains(IssueCode.LIST_NO_OPTS));
    }

    @Test
    void shouldFlagNamingIssues() {
        add("f1", "  ");
        add("f2", "NOVO CAMPO");
        add("f3", "Valor");
        add("f4", "Valor");

        assertEquals(List.of(IssueCode.NO_NAME), codesFor("f1"));
        assertEquals(List.of(IssueCode.NO_NAME), codesFor("f2"));
        assertTrue(codesFor("f3").isEmpty());
        assertEquals(List.of(IssueCode.DUP_NAME), codesFor("f4"));
    }

    @Test
    void shouldTreatConfiguredDefaultNameAsMissing() {
        DesignerSettings settings = DesignerSettings.defaults();
        settings.defaultFieldName = "Campo sem nome";
        add("f1", "campo sem nome");
        add("f2", "Novo campo");

        List<AuditIssue> issues = ProjectAuditor.audit(project, Set.of(), settings);

        assertTrue(issues.stream().anyMatch(issue -> issue.code() == IssueCode.NO_NAME && issue.fieldId().equals("f1")));
        assertTrue(issues.stream().noneMatch(issue -> issue.code() == IssueCode.NO_NAME && issue.fieldId().equals("f2")));
    }

    @Test
    void shouldFlagDanglingReferencesOncePerField() {
        Field field = add("f1", "Campo");
        field.setOrigin(new FieldRef("t9", "gone"));
        field.getRules().add(Rule.equalsTo("ghost1", "a"));
        field.getRules().add(Rule.equalsTo("ghost2", "b"));

        assertEquals(List.of(IssueCode.BAD_ORIGIN, IssueCode.BAD_RULE), codesFor("f1"));
    }

    @Test
    void shouldFlagObjectFieldsWithoutObjectType() {
        add("f1", "Pedido").setType(FieldType.OBJECT);

        List<AuditIssue> issues = ProjectAuditor.audit(project);

        AuditIssue issue = issues.stream().filter(i -> i.code() == IssueCode.OBJ_NO_TYPE).findFirst().orElseThrow();
        assertEquals("t1", issue.taskId());
        assertEquals("", issue.fieldId());

        project.setObjectType("Pedido");
        assertTrue(ProjectAuditor.audit(project).stream().noneMatch(i -> i.code() == IssueCode.OBJ_NO_TYPE));
    }

    @Test
    void shouldSkipIgnoredIssues() {
        add("f1", "Opcional").setRequired(false);
        AuditIssue issue = ProjectAuditor.audit(project).get(0);
        assertEquals("OPT_EDIT|t1|f1", issue.key());

        assertTrue(ProjectAuditor.audit(project, Set.of(issue.key())).isEmpty());
    }
}
