package org.flowdesigner.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.flowdesigner.core.config.DesignerSettings;
import org.flowdesigner.core.persistence.models.FieldEntry;
import org.flowdesigner.core.persistence.models.ProjectFile;
import org.flowdesigner.core.persistence.models.RuleEntry;
import org.flowdesigner.core.persistence.models.TaskEntry;
import org.flowdesigner.core.project.models.Field;
import org.flowdesigner.core.project.models.FieldRef;
import org.flowdesigner.core.project.models.FieldType;
import org.flowdesigner.core.project.models.NameLock;
import org.flowdesigner.core.project.models.ProjectModel;
import org.flowdesigner.core.project.models.Rule;
import org.flowdesigner.core.project.models.RuleOperator;
import org.flowdesigner.core.project.models.Task;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Saves and loads projects as JSON.
 * <p>
 * Loading never trusts the document: it is validated against {@code schemas/project_schema.json} and then
 * normalized to the same invariants the editor enforces. Dangling origins and rules are kept so the audit can
 * report them.
 */
@Slf4j
public class ProjectFileHelper {
    private static final String SCHEMA_RESOURCE = "schemas/project_schema.json";
    private static final String LOCK_OBJECT = "objeto";
    private static final String LOCK_ORIGIN = "origem";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    public static void save(ProjectModel project, Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(out, toFile(project));
        }
        log.info("Saved project '{}' to {}", project.getFlowName(), path);
    }

    public static ProjectModel load(Path path) throws IOException {
        return load(path, DesignerSettings.defaults());
    }

    /**
     * @throws IOException              if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if the document does not match the project schema
     */
    public static ProjectModel load(Path path, DesignerSettings settings) throws IOException {
        JsonNode projectNode;
        try (InputStream in = Files.newInputStream(path)) {
            projectNode = mapper.readTree(in);
        }
        validate(projectNode, path.toString());
        ProjectModel project = toModel(mapper.treeToValue(projectNode, ProjectFile.class), settings);
        log.info("Loaded project '{}' from {} ({} task(s))", project.getFlowName(), path, project.getTasks().size());
        return project;
    }

    public static String toJson(ProjectModel project) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toFile(project));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize project " + project.getFlowName(), e);
        }
    }

    public static ProjectModel fromJson(String json) throws IOException {
        return fromJson(json, DesignerSettings.defaults());
    }

    public static ProjectModel fromJson(String json, DesignerSettings settings) throws IOException {
        JsonNode projectNode = mapper.readTree(json);
        validate(projectNode, "<string>");
        return toModel(mapper.treeToValue(projectNode, ProjectFile.class), settings);
    }

    /**
     * @throws IllegalArgumentException listing every schema violation
     */
    public static void validate(JsonNode projectNode, String sourceName) {
        Set<ValidationMessage> errors = schema().validate(projectNode);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Project document '" + sourceName + "' is invalid: " + details);
        }
    }

    static ProjectFile toFile(ProjectModel project) {
        ProjectFile file = new ProjectFile();
        file.flowName = project.getFlowName();
        file.objectType = project.getObjectType();
        for (Task task : project.getTasks()) {
            TaskEntry taskEntry = new TaskEntry();
            taskEntry.id = task.getId();
            taskEntry.name = task.getName();
            for (Field field : task.getFields()) {
                taskEntry.fields.add(toEntry(field, project.getObjectType()));
            }
            file.tasks.add(taskEntry);
        }
        return file;
    }

    private static FieldEntry toEntry(Field field, String objectType) {
        FieldEntry entry = new FieldEntry();
        entry.id = field.getId();
        entry.name = field.getName();
        entry.type = field.getType().getLabel();
        entry.required = field.isRequired();
        entry.readonly = field.isReadonly();
        entry.options = field.getOptions();
        entry.note = field.getNote();
        if (field.hasOrigin()) {
            entry.originTask = field.getOrigin().taskId();
            entry.originField = field.getOrigin().fieldId();
        }
        entry.nameLocked = field.isNameLocked();
        switch (field.getNameLock()) {
            case FROM_OBJECT_TYPE:
                entry.nameLockReason = LOCK_OBJECT;
                break;
            case FROM_ORIGIN:
                entry.nameLockReason = LOCK_ORIGIN;
                break;
            default:
                entry.nameLockReason = "";
        }
        entry.nameBeforeObject = field.getNameBeforeObject();
        entry.nameBeforeOrigin = field.getNameBeforeOrigin();
        entry.objectType = field.getType() == FieldType.OBJECT ? objectType : "";
        for (Rule rule : field.getRules()) {
            RuleEntry ruleEntry = new RuleEntry();
            ruleEntry.sourceField = rule.sourceFieldId();
            ruleEntry.operator = rule.operator().getSymbol();
            ruleEntry.value = rule.value();
            entry.rules.add(ruleEntry);
        }
        return entry;
    }

    /**
     * Builds a project from a parsed document and brings it back to the editor's invariants.
     */
    static ProjectModel toModel(ProjectFile file, DesignerSettings settings) {
        ProjectModel project = new ProjectModel(isBlank(file.flowName) ? ProjectModel.DEFAULT_FLOW_NAME : file.flowName);
        project.setObjectType(file.objectType == null ? "" : file.objectType.strip());

        Set<String> taskIds = new HashSet<>();
        Set<String> fieldIds = new HashSet<>();
        for (TaskEntry taskEntry : file.tasks) {
            String taskId = uniqueId(taskEntry.id, taskIds, "task");
            Task task = new Task(taskId, taskEntry.name == null ? "" : taskEntry.name);
            for (FieldEntry fieldEntry : taskEntry.fields) {
                task.getFields().add(toField(fieldEntry, uniqueId(fieldEntry.id, fieldIds, "field")));
            }
            project.getTasks().add(task);
        }

        resolveOriginTasks(project);
        normalizeObjectFields(project, file, settings);
        return project;
    }

    private static Field toField(FieldEntry entry, String fieldId) {
        Field field = new Field(fieldId, entry.name == null ? "" : entry.name);
        field.setType(FieldType.fromLabel(entry.type));
        field.setRequired(entry.required);
        field.setReadonly(entry.readonly);
        field.setOptions(entry.options == null ? "" : entry.options);
        field.setNote(entry.note == null ? "" : entry.note);
        field.setNameBeforeObject(entry.nameBeforeObject == null ? "" : entry.nameBeforeObject);
        field.setNameBeforeOrigin(entry.nameBeforeOrigin == null ? "" : entry.nameBeforeOrigin);
        if (!isBlank(entry.originField)) {
            field.setOrigin(new FieldRef(entry.originTask, entry.originField));
        }

        if (LOCK_OBJECT.equals(entry.nameLockReason)) {
            field.setNameLock(NameLock.FROM_OBJECT_TYPE);
        } else if (LOCK_ORIGIN.equals(entry.nameLockReason) && field.hasOrigin()) {
            field.setNameLock(NameLock.FROM_ORIGIN);
        } else {
            field.setNameLock(NameLock.NONE);
        }

        for (RuleEntry ruleEntry : entry.rules) {
            Rule rule = new Rule(ruleEntry.sourceField, RuleOperator.fromSymbol(ruleEntry.operator),
                    ruleEntry.value == null ? "" : ruleEntry.value);
            if (field.getRules().contains(rule)) {
                log.warn("Dropping duplicate rule on field {}: {} {} {}", fieldId, rule.sourceFieldId(),
                        rule.operator().getSymbol(), rule.value());
                continue;
            }
            field.getRules().add(rule);
        }
        return field;
    }

    /**
     * Origin task ids are informational; the field id is authoritative.
     */
    private static void resolveOriginTasks(ProjectModel project) {
        Map<String, String> ownerByFieldId = new HashMap<>();
        project.getTasks().forEach(task -> task.getFields().forEach(field -> ownerByFieldId.put(field.getId(), task.getId())));
        project.allFields()
                .filter(Field::hasOrigin)
                .filter(field -> ownerByFieldId.containsKey(field.getOrigin().fieldId()))
                .forEach(field -> field.setOrigin(new FieldRef(ownerByFieldId.get(field.getOrigin().fieldId()),
                        field.getOrigin().fieldId())));
    }

    private static void normalizeObjectFields(ProjectModel project, ProjectFile file, DesignerSettings settings) {
        if (!project.hasObjectType()) {
            String objectType = file.tasks.stream()
                    .flatMap(task -> task.fields.stream())
                    .filter(entry -> FieldType.OBJECT.getLabel().equals(entry.type))
                    .map(entry -> isBlank(entry.objectType) ? entry.name : entry.objectType)
                    .findFirst()
                    .orElse(null);
            if (objectType != null) {
                project.setObjectType(isBlank(objectType) ? settings.defaultObjectName : objectType.strip());
            }
        }

        for (Task task : project.getTasks()) {
            boolean seenObjectField = false;
            for (Field field : task.getFields()) {
                if (field.getType() == FieldType.OBJECT && !seenObjectField) {
                    seenObjectField = true;
                    if (field.hasOrigin()) {
                        log.warn("Object field {} cannot have an origin, clearing it", field.getId());
                        field.setOrigin(null);
                        field.setNameBeforeOrigin("");
                    }
                    field.setName(project.getObjectType());
                    field.setNameLock(NameLock.FROM_OBJECT_TYPE);
                    continue;
                }
                if (field.getType() == FieldType.OBJECT) {
                    log.warn("Task {} has more than one object field, demoting {} to {}", task.getId(), field.getId(),
                            FieldType.TEXT.getLabel());
                    field.setType(FieldType.TEXT);
                    field.setName(isBlank(field.getNameBeforeObject()) ? field.getName() : field.getNameBeforeObject());
                    field.setNameBeforeObject("");
                }
                normalizeNameLock(field);
            }
        }
    }

    // a non-object field is name-locked exactly when it has an origin
    private static void normalizeNameLock(Field field) {
        if (!field.hasOrigin()) {
            field.setNameLock(NameLock.NONE);
            return;
        }
        if (field.getNameLock() == NameLock.NONE) {
            log.warn("Field {} has an origin but no name lock, locking it to its origin", field.getId());
        }
        field.setNameLock(NameLock.FROM_ORIGIN);
        if (isBlank(field.getNameBeforeOrigin())) {
            field.setNameBeforeOrigin(field.getName());
        }
    }

    private static String uniqueId(String id, Set<String> used, String kind) {
        if (!isBlank(id) && used.add(id)) {
            return id;
        }
        String generated;
        do {
            generated = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (!used.add(generated));
        if (!isBlank(id)) {
            log.warn("Duplicate {} id {} re-assigned to {}", kind, id, generated);
        }
        return generated;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static JsonSchema schema() {
        try (InputStream schemaStream = ProjectFileHelper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return factory.getSchema(mapper.readTree(schemaStream));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource: " + SCHEMA_RESOURCE, e);
        }
    }
}
