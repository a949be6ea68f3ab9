package org.flowdesigner.core.project;

import lombok.extern.slf4j.Slf4j;
import org.flowdesigner.core.audit.AuditIssue;
import org.flowdesigner.core.audit.ProjectAuditor;
import org.flowdesigner.core.config.DesignerSettings;
import org.flowdesigner.core.history.HistoryManager;
import org.flowdesigner.core.history.ProjectSnapshot;
import org.flowdesigner.core.process.models.DecisionFieldCandidate;
import org.flowdesigner.core.process.models.ImportSelection;
import org.flowdesigner.core.process.models.RawNode;
import org.flowdesigner.core.project.models.Field;
import org.flowdesigner.core.project.models.FieldRef;
import org.flowdesigner.core.project.models.FieldType;
import org.flowdesigner.core.project.models.NameLock;
import org.flowdesigner.core.project.models.ProjectModel;
import org.flowdesigner.core.project.models.Rule;
import org.flowdesigner.core.project.models.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.flowdesigner.core.project.FieldMutationException.Reason.DUPLICATE_RULE;
import static org.flowdesigner.core.project.FieldMutationException.Reason.INVALID_VALUE;
import static org.flowdesigner.core.project.FieldMutationException.Reason.NAME_LOCKED;
import static org.flowdesigner.core.project.FieldMutationException.Reason.OBJECT_TYPE_CONFLICT;
import static org.flowdesigner.core.project.FieldMutationException.Reason.OBJECT_TYPE_UNDEFINED;
import static org.flowdesigner.core.project.FieldMutationException.Reason.ORIGIN_INCOMPATIBLE;
import static org.flowdesigner.core.project.FieldMutationException.Reason.ORIGIN_NOT_FOUND;
import static org.flowdesigner.core.project.FieldMutationException.Reason.RULE_SOURCE_NOT_FOUND;

/**
 * Owns the live project and is the only place it is changed.
 * <p>
 * Every mutating operation checks its preconditions first, then records a snapshot in the history, then applies
 * the change and rebuilds the id index. A rejected operation throws {@link FieldMutationException} and leaves both
 * the project and the history untouched. An operation that would not change anything records nothing.
 * Unknown task or field ids are caller errors and raise {@link IllegalArgumentException}.
 * <p>
 * Not thread-safe: the editor assumes exclusive access to its project.
 */
@Slf4j
public class ProjectEditor {
    private static final String COPY_SUFFIX = " (Cópia)";

    private final DesignerSettings settings;
    private final HistoryManager history;
    private final FieldIndex index = new FieldIndex();
    private final Set<String> selectedFieldIds = new LinkedHashSet<>();
    private ProjectModel project;
    private String activeTaskId;

    public ProjectEditor() {
        this(DesignerSettings.defaults());
    }

    public ProjectEditor(DesignerSettings settings) {
        this(new ProjectModel(), settings);
    }

    public ProjectEditor(ProjectModel project, DesignerSettings settings) {
        this.settings = settings;
        this.history = new HistoryManager(settings.undoLimit);
        open(project);
    }

    // ---- project lifecycle, navigation and selection (not recorded in history) ----

    /**
     * Replaces the edited project with a copy of {@code model}. History is cleared.
     */
    public void open(ProjectModel model) {
        project = model.copy();
        index.rebuild(project);
        selectedFieldIds.clear();
        activeTaskId = project.getTasks().isEmpty() ? null : project.getTasks().get(0).getId();
        history.clear();
        log.info("Opened project '{}' with {} task(s)", project.getFlowName(), project.getTasks().size());
    }

    public void resetToBlank() {
        open(new ProjectModel());
    }

    public void setActiveTask(String taskId) {
        if (taskId != null) {
            requireTask(taskId);
        }
        activeTaskId = taskId;
    }

    public void select(String... fieldIds) {
        for (String fieldId : fieldIds) {
            requireField(fieldId);
        }
        Collections.addAll(selectedFieldIds, fieldIds);
    }

    public void deselect(String... fieldIds) {
        for (String fieldId : fieldIds) {
            selectedFieldIds.remove(fieldId);
        }
    }

    public void clearSelection() {
        selectedFieldIds.clear();
    }

    // ---- flow level ----

    public void renameFlow(String flowName) {
        String name = requireText(flowName, "Flow name");
        if (name.equals(project.getFlowName())) {
            return;
        }
        mutate(() -> project.setFlowName(name));
    }

    /**
     * Sets the global object type and renames every object-typed field (and the fields linked to them) after it.
     */
    public void setObjectType(String objectType) {
        String name = requireText(objectType, "Object type");
        if (name.equals(project.getObjectType())) {
            return;
        }
        mutate(() -> {
            project.setObjectType(name);
            project.allFields()
                    .filter(field -> field.getType() == FieldType.OBJECT)
                    .collect(Collectors.toList())
                    .forEach(field -> {
                        field.setName(name);
                        propagateName(field);
                    });
        });
    }

    // ---- tasks ----

    /**
     * @return id of the new task, appended at the end
     */
    public String createTask(String taskName) {
        String name = requireText(taskName, "Task name");
        String taskId = newId(new HashSet<>());
        mutate(() -> {
            project.getTasks().add(new Task(taskId, name));
            if (activeTaskId == null) {
                activeTaskId = taskId;
            }
        });
        return taskId;
    }

    public void renameTask(String taskId, String taskName) {
        Task task = requireTask(taskId);
        String name = requireText(taskName, "Task name");
        if (name.equals(task.getName())) {
            return;
        }
        mutate(() -> task.setName(name));
    }

    /**
     * Removes the task and cleans up every rule and origin link that pointed at one of its fields.
     */
    public void deleteTask(String taskId) {
        Task task = requireTask(taskId);
        Set<String> removed = task.getFields().stream().map(Field::getId).collect(Collectors.toSet());
        mutate(() -> {
            int position = project.getTasks().indexOf(task);
            project.getTasks().remove(position);
            cascadeDeletion(removed);
            selectedFieldIds.removeAll(removed);
            if (taskId.equals(activeTaskId)) {
                List<Task> tasks = project.getTasks();
                activeTaskId = tasks.isEmpty() ? null : tasks.get(Math.min(position, tasks.size() - 1)).getId();
            }
        });
        log.debug("Deleted task {} with {} field(s)", taskId, removed.size());
    }

    /**
     * Moves a task {@code delta} positions, clamped to the list bounds.
     */
    public void moveTask(String taskId, int delta) {
        Task task = requireTask(taskId);
        List<Task> tasks = project.getTasks();
        int from = tasks.indexOf(task);
        int to = Math.max(0, Math.min(tasks.size() - 1, from + delta));
        if (from == to) {
            return;
        }
        mutate(() -> tasks.add(to, tasks.remove(from)));
    }

    // ---- fields ----

    public String addField(String taskId) {
        return addField(taskId, settings.defaultFieldName);
    }

    /**
     * Appends a {@link FieldType#TEXT} field to the task.
     *
     * @return id of the new field
     */
    public String addField(String taskId, String fieldName) {
        Task task = requireTask(taskId);
        String name = requireText(fieldName, "Field name");
        String fieldId = newId(new HashSet<>());
        mutate(() -> task.getFields().add(new Field(fieldId, name)));
        return fieldId;
    }

    public void deleteField(String fieldId) {
        deleteFields(List.of(fieldId));
    }

    /**
     * Deletes all given fields as a single undoable step.
     * Rules referencing any of them are stripped project-wide and origin links to them are cleared,
     * restoring the name each linked field had before it was linked.
     */
    public void deleteFields(Collection<String> fieldIds) {
        Set<String> removed = new LinkedHashSet<>(fieldIds);
        removed.forEach(this::requireField);
        if (removed.isEmpty()) {
            return;
        }
        mutate(() -> {
            project.getTasks().forEach(task -> task.getFields().removeIf(field -> removed.contains(field.getId())));
            cascadeDeletion(removed);
            selectedFieldIds.removeAll(removed);
        });
        log.debug("Deleted field(s) {}", removed);
    }

    public void deleteSelectedFields() {
        deleteFields(new ArrayList<>(selectedFieldIds));
        selectedFieldIds.clear();
    }

    /**
     * Renames a field and every field that mirrors it through an origin link.
     *
     * @throws FieldMutationException {@code NAME_LOCKED} when the name follows the object type or an origin
     */
    public void renameField(String fieldId, String fieldName) {
        Field field = requireField(fieldId);
        if (field.isNameLocked()) {
            throw new FieldMutationException(NAME_LOCKED,
                    "Name of field '" + field.getName() + "' is locked (" + field.getNameLock() + ")");
        }
        String name = Objects.requireNonNull(fieldName, "fieldName").strip();
        if (name.equals(field.getName())) {
            return;
        }
        mutate(() -> {
            field.setName(name);
            propagateName(field);
        });
    }

    public void changeFieldType(String fieldId, FieldType type) {
        changeFieldType(fieldId, type, null);
    }

    /**
     * Changes a field's type.
     * <p>
     * Becoming {@link FieldType#OBJECT} requires the field to take no part in any origin link and to be the only
     * object field of its task. The field takes the project's object type as its locked name; when the project has none yet,
     * {@code objectTypeName} defines it. Leaving the object type restores the name the field had before.
     * {@link FieldType#INFORMATIVE} forces readonly; types that are neither lists nor informative drop options.
     *
     * @param objectTypeName object type to define when the project has none, ignored otherwise
     */
    public void changeFieldType(String fieldId, FieldType type, String objectTypeName) {
        Field field = requireField(fieldId);
        Objects.requireNonNull(type, "type");
        if (field.getType() == type) {
            return;
        }
        if (type == FieldType.OBJECT) {
            String objectName = checkObjectField(field, objectTypeName);
            mutate(() -> {
                if (!project.hasObjectType()) {
                    project.setObjectType(objectName);
                }
                field.setNameBeforeObject(field.getName());
                field.setName(objectName);
                field.setNameLock(NameLock.FROM_OBJECT_TYPE);
                field.setType(FieldType.OBJECT);
                field.setOptions("");
                propagateName(field);
            });
            return;
        }
        mutate(() -> {
            if (field.getType() == FieldType.OBJECT) {
                String previous = field.getNameBeforeObject();
                field.setName(previous == null || previous.isBlank() ? settings.defaultFieldName : previous);
                field.setNameBeforeObject("");
                field.setNameLock(NameLock.NONE);
                propagateName(field);
            }
            field.setType(type);
            if (type == FieldType.INFORMATIVE) {
                field.setReadonly(true);
            } else if (!type.isList()) {
                field.setOptions("");
            }
        });
    }

    public void setRequired(String fieldId, boolean required) {
        Field field = requireField(fieldId);
        if (field.isRequired() == required) {
            return;
        }
        mutate(() -> field.setRequired(required));
    }

    public void setReadonly(String fieldId, boolean readonly) {
        Field field = requireField(fieldId);
        if (field.getType() == FieldType.INFORMATIVE && !readonly) {
            throw new FieldMutationException(INVALID_VALUE, "Informative fields are always readonly");
        }
        if (field.isReadonly() == readonly) {
            return;
        }
        mutate(() -> field.setReadonly(readonly));
    }

    public void setOptions(String fieldId, String options) {
        Field field = requireField(fieldId);
        String value = options == null ? "" : options;
        if (value.equals(field.getOptions())) {
            return;
        }
        mutate(() -> field.setOptions(value));
    }

    public void setNote(String fieldId, String note) {
        Field field = requireField(fieldId);
        String value = note == null ? "" : note;
        if (value.equals(field.getNote())) {
            return;
        }
        mutate(() -> field.setNote(value));
    }

    /**
     * Moves a field to {@code targetIndex} within its own task.
     *
     * @throws IndexOutOfBoundsException when the index is outside the task's field list
     */
    public void moveField(String fieldId, int targetIndex) {
        requireField(fieldId);
        Task owner = index.ownerOf(fieldId).orElseThrow();
        List<Field> fields = owner.getFields();
        Objects.checkIndex(targetIndex, fields.size());
        int from = owner.indexOf(fieldId);
        if (from == targetIndex) {
            return;
        }
        mutate(() -> fields.add(targetIndex, fields.remove(from)));
    }

    // ---- origins ----

    public void setOrigin(String fieldId, String originFieldId) {
        setOrigin(fieldId, originFieldId, true, false);
    }

    /**
     * Links a field to an origin field: name, type and options are copied from the origin and the name is locked
     * until the link is cleared. A field linked to an informative origin is always readonly.
     *
     * @throws FieldMutationException {@code ORIGIN_NOT_FOUND} when the origin does not exist,
     *                                {@code ORIGIN_INCOMPATIBLE} when either field is object-typed, the field would
     *                                link to itself or the link would close a cycle
     */
    public void setOrigin(String fieldId, String originFieldId, boolean readonly, boolean required) {
        Field field = requireField(fieldId);
        if (field.getType() == FieldType.OBJECT) {
            throw new FieldMutationException(ORIGIN_INCOMPATIBLE, "Object field '" + field.getName() + "' cannot have an origin");
        }
        Field origin = index.field(originFieldId).orElseThrow(() ->
                new FieldMutationException(ORIGIN_NOT_FOUND, "Origin field " + originFieldId + " does not exist"));
        if (origin.getId().equals(fieldId)) {
            throw new FieldMutationException(ORIGIN_INCOMPATIBLE, "A field cannot be its own origin");
        }
        if (origin.getType() == FieldType.OBJECT) {
            throw new FieldMutationException(ORIGIN_INCOMPATIBLE, "Object field '" + origin.getName() + "' cannot be an origin");
        }
        if (originChainReaches(origin, fieldId)) {
            throw new FieldMutationException(ORIGIN_INCOMPATIBLE,
                    "Linking '" + field.getName() + "' to '" + origin.getName() + "' would create an origin cycle");
        }
        String originTaskId = index.ownerOf(originFieldId).orElseThrow().getId();
        mutate(() -> {
            if (field.getNameLock() != NameLock.FROM_ORIGIN) {
                field.setNameBeforeOrigin(field.getName());
            }
            field.setOrigin(new FieldRef(originTaskId, originFieldId));
            field.setName(origin.getName());
            field.setType(origin.getType());
            field.setOptions(origin.getOptions());
            field.setReadonly(readonly || origin.getType() == FieldType.INFORMATIVE);
            field.setRequired(required);
            field.setNameLock(NameLock.FROM_ORIGIN);
            propagateName(field);
        });
    }

    /**
     * Removes the origin link, restoring the name from before the link.
     */
    public void clearOrigin(String fieldId) {
        Field field = requireField(fieldId);
        if (!field.hasOrigin()) {
            return;
        }
        mutate(() -> {
            unlinkOrigin(field);
            propagateName(field);
        });
    }

    // ---- visibility rules ----

    /**
     * Adds "show when {@code sourceFieldId} equals {@code value}". Rules of one field are OR-ed.
     */
    public void addRule(String fieldId, String sourceFieldId, String value) {
        Field field = requireField(fieldId);
        if (value == null || value.isBlank()) {
            throw new FieldMutationException(INVALID_VALUE, "Rule value must not be blank");
        }
        if (fieldId.equals(sourceFieldId)) {
            throw new FieldMutationException(INVALID_VALUE, "A field cannot depend on itself");
        }
        if (!index.containsField(sourceFieldId)) {
            throw new FieldMutationException(RULE_SOURCE_NOT_FOUND, "Rule source field " + sourceFieldId + " does not exist");
        }
        Rule rule = Rule.equalsTo(sourceFieldId, value.strip());
        if (field.getRules().contains(rule)) {
            throw new FieldMutationException(DUPLICATE_RULE,
                    "Field '" + field.getName() + "' already has rule " + index.fieldName(sourceFieldId) + " == " + rule.value());
        }
        mutate(() -> field.getRules().add(rule));
    }

    public void removeRule(String fieldId, int ruleIndex) {
        Field field = requireField(fieldId);
        Objects.checkIndex(ruleIndex, field.getRules().size());
        mutate(() -> field.getRules().remove(ruleIndex));
    }

    public void clearRules(String fieldId) {
        Field field = requireField(fieldId);
        if (field.getRules().isEmpty()) {
            return;
        }
        mutate(() -> field.getRules().clear());
    }

    /**
     * Strips rules whose source field no longer exists and clears origins that no longer resolve.
     *
     * @return number of references removed
     */
    public int cleanupDanglingReferences() {
        int dangling = (int) project.allFields()
                .mapToLong(field -> danglingRules(field).size() + (hasDanglingOrigin(field) ? 1 : 0))
                .sum();
        if (dangling == 0) {
            return 0;
        }
        mutate(() -> project.allFields().forEach(field -> {
            field.getRules().removeAll(danglingRules(field));
            if (hasDanglingOrigin(field)) {
                unlinkOrigin(field);
            }
        }));
        log.info("Removed {} dangling reference(s)", dangling);
        return dangling;
    }

    // ---- duplicate, copy and paste ----

    /**
     * Inserts an independent copy right after the field: same settings and rules, no origin.
     *
     * @return id of the copy
     */
    public String duplicateField(String fieldId) {
        Field field = requireField(fieldId);
        if (field.getType() == FieldType.OBJECT) {
            throw new FieldMutationException(OBJECT_TYPE_CONFLICT, "Object fields cannot be duplicated");
        }
        Task owner = index.ownerOf(fieldId).orElseThrow();
        String copyId = newId(new HashSet<>());
        mutate(() -> {
            Field copy = field.copy();
            copy.setId(copyId);
            copy.setName(field.getName() + COPY_SUFFIX);
            copy.setOrigin(null);
            copy.setNameLock(NameLock.NONE);
            copy.setNameBeforeOrigin("");
            owner.getFields().add(owner.indexOf(fieldId) + 1, copy);
        });
        return copyId;
    }

    public FieldClipboard copyFields(Collection<String> fieldIds) {
        List<Field> fields = fieldIds.stream().map(this::requireField).collect(Collectors.toList());
        String sourceTaskId = fields.isEmpty() ? null : index.ownerOf(fields.get(0).getId()).orElseThrow().getId();
        return new FieldClipboard(sourceTaskId, fields);
    }

    public FieldClipboard copySelectedFields() {
        return copyFields(new ArrayList<>(selectedFieldIds));
    }

    /**
     * Pastes independent copies into the task. Rules between copied fields are remapped to the new copies;
     * rules pointing elsewhere are kept as they are, even when their source no longer exists.
     *
     * @return ids of the pasted fields, in clipboard order
     */
    public List<String> pasteAsCopy(FieldClipboard clipboard, String targetTaskId) {
        Task target = requireTask(targetTaskId);
        List<Field> copies = clipboard.getFields();
        if (copies.isEmpty()) {
            return List.of();
        }
        long objectFields = copies.stream().filter(field -> field.getType() == FieldType.OBJECT).count();
        if (objectFields > 1 || (objectFields == 1 && hasObjectField(target, null))) {
            throw new FieldMutationException(OBJECT_TYPE_CONFLICT,
                    "Task '" + target.getName() + "' can hold only one object field");
        }

        Set<String> pending = new HashSet<>();
        Map<String, String> newIds = new HashMap<>();
        copies.forEach(field -> newIds.put(field.getId(), newId(pending)));

        mutate(() -> {
            for (Field copy : copies) {
                copy.setId(newIds.get(copy.getId()));
                copy.setRules(copy.getRules().stream()
                        .map(rule -> remap(rule, newIds))
                        .distinct()
                        .collect(Collectors.toCollection(ArrayList::new)));
                if (copy.hasOrigin()) {
                    relinkPastedOrigin(copy, newIds, target.getId());
                }
                if (copy.getType() == FieldType.OBJECT && project.hasObjectType()) {
                    copy.setName(project.getObjectType());
                }
                target.getFields().add(copy);
            }
            index.rebuild(project);
            copies.stream().flatMap(copy -> copy.getRules().stream())
                    .filter(rule -> !index.containsField(rule.sourceFieldId()))
                    .forEach(rule -> log.warn("Pasted rule refers to missing field {}", rule.sourceFieldId()));
        });
        return copies.stream().map(Field::getId).collect(Collectors.toList());
    }

    /**
     * Pastes one origin-linked field per clipboard field whose source still exists and is not object-typed.
     * Linked fields are readonly, not required and carry no rules.
     *
     * @return ids of the pasted fields
     */
    public List<String> pasteLinked(FieldClipboard clipboard, String targetTaskId) {
        Task target = requireTask(targetTaskId);
        List<Field> sources = clipboard.getFields().stream()
                .map(copy -> index.field(copy.getId()))
                .flatMap(Optional::stream)
                .filter(source -> source.getType() != FieldType.OBJECT)
                .collect(Collectors.toList());
        if (sources.isEmpty()) {
            return List.of();
        }

        Set<String> pending = new HashSet<>();
        List<Field> links = new ArrayList<>();
        for (Field source : sources) {
            Field link = new Field(newId(pending), source.getName());
            link.setType(source.getType());
            link.setOptions(source.getOptions());
            link.setReadonly(true);
            link.setRequired(false);
            link.setOrigin(new FieldRef(index.ownerOf(source.getId()).orElseThrow().getId(), source.getId()));
            link.setNameLock(NameLock.FROM_ORIGIN);
            link.setNameBeforeOrigin(source.getName());
            links.add(link);
        }
        mutate(() -> target.getFields().addAll(links));
        return links.stream().map(Field::getId).collect(Collectors.toList());
    }

    // ---- import ----

    /**
     * Appends the selected imported tasks with their decision fields, all typed {@link FieldType#LIST}.
     * Imported fields are never linked to fields already in the project.
     *
     * @return ids of the new tasks, in selection order
     */
    public List<String> mergeImportedTasks(ImportSelection selection) {
        if (selection.tasks().isEmpty()) {
            return List.of();
        }
        Set<String> pending = new HashSet<>();
        List<Task> imported = new ArrayList<>();
        for (RawNode node : selection.tasks()) {
            String taskName = node.name() == null || node.name().isBlank() ? node.id() : node.name();
            Task task = new Task(newId(pending), taskName);
            for (DecisionFieldCandidate candidate : selection.fieldsOf(node.id())) {
                Field field = new Field(newId(pending), candidate.label());
                field.setType(FieldType.LIST);
                field.setOptions(String.join(settings.optionSeparator, candidate.options()));
                task.getFields().add(field);
            }
            imported.add(task);
        }

        mutate(() -> {
            project.getTasks().addAll(imported);
            String label = selection.diagramLabel();
            if (label != null && !label.isBlank()) {
                project.setFlowName(label.strip());
            }
            if (activeTaskId == null) {
                activeTaskId = imported.get(0).getId();
            }
        });
        log.info("Merged {} task(s) from diagram '{}'", imported.size(), selection.diagramLabel());
        return imported.stream().map(Task::getId).collect(Collectors.toList());
    }

    // ---- history ----

    /**
     * @return false when there was nothing to undo
     */
    public boolean undo() {
        Optional<ProjectSnapshot> previous = history.undo(snapshot());
        previous.ifPresent(this::restore);
        return previous.isPresent();
    }

    /**
     * @return false when there was nothing to redo
     */
    public boolean redo() {
        Optional<ProjectSnapshot> next = history.redo(snapshot());
        next.ifPresent(this::restore);
        return next.isPresent();
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    public int undoDepth() {
        return history.undoDepth();
    }

    public ProjectSnapshot snapshot() {
        return ProjectSnapshot.capture(project, activeTaskId, selectedFieldIds);
    }

    // ---- read access ----

    /**
     * @return a copy of the edited project
     */
    public ProjectModel getProject() {
        return project.copy();
    }

    public Optional<Task> findTask(String taskId) {
        return index.task(taskId).map(Task::copy);
    }

    public Optional<Field> findField(String fieldId) {
        return index.field(fieldId).map(Field::copy);
    }

    public String getActiveTaskId() {
        return activeTaskId;
    }

    public Set<String> getSelectedFieldIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(selectedFieldIds));
    }

    public List<AuditIssue> audit() {
        return ProjectAuditor.audit(project, Set.of(), settings);
    }

    // ---- internals ----

    private void mutate(Runnable change) {
        history.record(snapshot());
        change.run();
        index.rebuild(project);
    }

    private void restore(ProjectSnapshot snapshot) {
        project = snapshot.project();
        index.rebuild(project);
        activeTaskId = index.containsTask(snapshot.activeTaskId()) ? snapshot.activeTaskId()
                : project.getTasks().isEmpty() ? null : project.getTasks().get(0).getId();
        selectedFieldIds.clear();
        snapshot.selectedFieldIds().stream().filter(index::containsField).forEach(selectedFieldIds::add);
    }

    private Task requireTask(String taskId) {
        return index.task(taskId).orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
    }

    private Field requireField(String fieldId) {
        return index.field(fieldId).orElseThrow(() -> new IllegalArgumentException("Unknown field: " + fieldId));
    }

    private static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new FieldMutationException(INVALID_VALUE, what + " must not be blank");
        }
        return value.strip();
    }

    /**
     * @return the name the field will take as an object field
     */
    private String checkObjectField(Field field, String objectTypeName) {
        if (field.hasOrigin()) {
            throw new FieldMutationException(ORIGIN_INCOMPATIBLE,
                    "Field '" + field.getName() + "' has an origin and cannot become an object field");
        }
        if (project.allFields().anyMatch(other -> other.hasOrigin() && other.getOrigin().fieldId().equals(field.getId()))) {
            throw new FieldMutationException(ORIGIN_INCOMPATIBLE,
                    "Field '" + field.getName() + "' is the origin of other fields and cannot become an object field");
        }
        Task owner = index.ownerOf(field.getId()).orElseThrow();
        if (hasObjectField(owner, field.getId())) {
            throw new FieldMutationException(OBJECT_TYPE_CONFLICT,
                    "Task '" + owner.getName() + "' already has an object field");
        }
        if (project.hasObjectType()) {
            return project.getObjectType();
        }
        if (objectTypeName == null || objectTypeName.isBlank()) {
            throw new FieldMutationException(OBJECT_TYPE_UNDEFINED, "No object type defined for the project");
        }
        return objectTypeName.strip();
    }

    private static boolean hasObjectField(Task task, String exceptFieldId) {
        return task.getFields().stream()
                .anyMatch(field -> field.getType() == FieldType.OBJECT && !field.getId().equals(exceptFieldId));
    }

    private void cascadeDeletion(Set<String> removed) {
        project.allFields().forEach(field -> {
            field.getRules().removeIf(rule -> removed.contains(rule.sourceFieldId()));
            if (field.hasOrigin() && removed.contains(field.getOrigin().fieldId())) {
                unlinkOrigin(field);
            }
        });
    }

    private static void unlinkOrigin(Field field) {
        if (field.getNameLock() == NameLock.FROM_ORIGIN) {
            String previous = field.getNameBeforeOrigin();
            if (previous != null && !previous.isEmpty()) {
                field.setName(previous);
            }
            field.setNameLock(NameLock.NONE);
        }
        field.setNameBeforeOrigin("");
        field.setOrigin(null);
    }

    /**
     * Pushes the field's name down every origin link that mirrors it.
     */
    private void propagateName(Field source) {
        Deque<Field> pending = new ArrayDeque<>(List.of(source));
        Set<String> visited = new HashSet<>();
        while (!pending.isEmpty()) {
            Field current = pending.pop();
            if (!visited.add(current.getId())) {
                continue;
            }
            project.allFields()
                    .filter(field -> field.hasOrigin() && field.getOrigin().fieldId().equals(current.getId()))
                    .filter(field -> field.getNameLock() == NameLock.FROM_ORIGIN)
                    .forEach(field -> {
                        field.setName(current.getName());
                        pending.push(field);
                    });
        }
    }

    private boolean originChainReaches(Field start, String fieldId) {
        Set<String> visited = new HashSet<>();
        Field current = start;
        while (current != null && current.hasOrigin() && visited.add(current.getId())) {
            String next = current.getOrigin().fieldId();
            if (next.equals(fieldId)) {
                return true;
            }
            current = index.field(next).orElse(null);
        }
        return false;
    }

    private void relinkPastedOrigin(Field copy, Map<String, String> newIds, String targetTaskId) {
        String originId = copy.getOrigin().fieldId();
        if (newIds.containsKey(originId)) {
            copy.setOrigin(new FieldRef(targetTaskId, newIds.get(originId)));
        } else if (!index.containsField(originId)) {
            unlinkOrigin(copy);
        }
    }

    private static Rule remap(Rule rule, Map<String, String> newIds) {
        String source = newIds.get(rule.sourceFieldId());
        return source == null ? rule : new Rule(source, rule.operator(), rule.value());
    }

    private List<Rule> danglingRules(Field field) {
        return field.getRules().stream()
                .filter(rule -> !index.containsField(rule.sourceFieldId()))
                .collect(Collectors.toList());
    }

    private boolean hasDanglingOrigin(Field field) {
        return field.hasOrigin() && !index.containsField(field.getOrigin().fieldId());
    }

    private String newId(Set<String> pending) {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (index.containsField(id) || index.containsTask(id) || !pending.add(id));
        return id;
    }
}
