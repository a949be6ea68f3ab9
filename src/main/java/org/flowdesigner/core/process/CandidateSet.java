package org.flowdesigner.core.process;

import org.flowdesigner.core.process.models.DecisionFieldCandidate;
import org.flowdesigner.core.process.models.DerivedCandidates;
import org.flowdesigner.core.process.models.ImportSelection;
import org.flowdesigner.core.process.models.RawNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Working copy of one diagram's candidates while the user picks what to import.
 * Everything starts selected. Edits here never touch a project; {@link #toSelection()} produces the immutable
 * value the editor merges.
 */
public class CandidateSet {
    private final String diagramId;
    private final String diagramLabel;
    private final List<RawNode> tasks;
    private final List<String> originalOrder;
    private final Map<String, List<DecisionFieldCandidate>> fieldsByTask = new LinkedHashMap<>();
    private final Set<String> selectedTaskIds = new LinkedHashSet<>();
    private final Set<String> selectedFieldIds = new LinkedHashSet<>();

    public CandidateSet(String diagramId, String diagramLabel, DerivedCandidates derived) {
        this.diagramId = diagramId;
        this.diagramLabel = diagramLabel;
        this.tasks = new ArrayList<>(derived.tasks());
        this.originalOrder = tasks.stream().map(RawNode::id).collect(Collectors.toList());

        for (RawNode task : tasks) {
            List<DecisionFieldCandidate> fields = new ArrayList<>(derived.fieldsOf(task.id()));
            fieldsByTask.put(task.id(), fields);
            selectedTaskIds.add(task.id());
            fields.forEach(field -> selectedFieldIds.add(field.id()));
        }
    }

    public String getDiagramId() { return diagramId; }
    public String getDiagramLabel() { return diagramLabel; }

    public List<RawNode> getTasks() {
        return List.copyOf(tasks);
    }

    public List<DecisionFieldCandidate> getFields(String taskId) {
        return List.copyOf(fieldsByTask.getOrDefault(taskId, List.of()));
    }

    public void reorderTask(String taskId, int delta) {
        int index = indexOf(taskId);
        if (index == -1) {
            return;
        }
        int newIndex = index + delta;
        if (newIndex < 0 || newIndex >= tasks.size()) {
            return;
        }
        tasks.add(newIndex, tasks.remove(index));
    }

    public void sortAlphabetically() {
        tasks.sort(Comparator.comparing(task -> task.name().toLowerCase(Locale.ROOT)));
    }

    public void restoreOriginalOrder() {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < originalOrder.size(); i++) {
            position.put(originalOrder.get(i), i);
        }
        tasks.sort(Comparator.comparing(task -> position.getOrDefault(task.id(), originalOrder.size())));
    }

    /**
     * Tasks whose name, field labels or field options contain the query, case-insensitively.
     * A blank query matches every task.
     */
    public List<RawNode> search(String query) {
        String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (q.isEmpty()) {
            return getTasks();
        }

        List<RawNode> visible = new ArrayList<>();
        for (RawNode task : tasks) {
            List<String> pool = new ArrayList<>();
            pool.add(task.name());
            for (DecisionFieldCandidate field : fieldsByTask.getOrDefault(task.id(), List.of())) {
                pool.add(field.label());
                pool.addAll(field.options());
            }
            if (pool.stream().anyMatch(item -> item != null && item.toLowerCase(Locale.ROOT).contains(q))) {
                visible.add(task);
            }
        }
        return visible;
    }

    public void setTaskSelected(String taskId, boolean selected) {
        if (selected) selectedTaskIds.add(taskId);
        else selectedTaskIds.remove(taskId);
    }

    public void setFieldSelected(String fieldId, boolean selected) {
        if (selected) selectedFieldIds.add(fieldId);
        else selectedFieldIds.remove(fieldId);
    }

    public boolean isTaskSelected(String taskId) {
        return selectedTaskIds.contains(taskId);
    }

    public boolean isFieldSelected(String fieldId) {
        return selectedFieldIds.contains(fieldId);
    }

    public void renameTask(String taskId, String newName) {
        int index = indexOf(taskId);
        if (index == -1) {
            throw new IllegalArgumentException("Unknown candidate task: " + taskId);
        }
        RawNode task = tasks.get(index);
        tasks.set(index, new RawNode(task.id(), newName, task.kind(), task.hasImplementation()));
    }

    public void editField(String taskId, String fieldId, String newLabel, List<String> newOptions) {
        List<DecisionFieldCandidate> fields = fieldsByTask.get(taskId);
        if (fields == null) {
            throw new IllegalArgumentException("Unknown candidate task: " + taskId);
        }
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).id().equals(fieldId)) {
                fields.set(i, fields.get(i).withLabel(newLabel).withOptions(newOptions));
                return;
            }
        }
        throw new IllegalArgumentException("Unknown candidate field: " + fieldId);
    }

    /**
     * Snapshot of the selected tasks, in current order, with their selected fields.
     */
    public ImportSelection toSelection() {
        List<RawNode> selectedTasks = tasks.stream()
                .filter(task -> selectedTaskIds.contains(task.id()))
                .collect(Collectors.toList());

        Map<String, List<DecisionFieldCandidate>> selectedFields = new LinkedHashMap<>();
        for (RawNode task : selectedTasks) {
            selectedFields.put(task.id(), fieldsByTask.getOrDefault(task.id(), List.of()).stream()
                    .filter(field -> selectedFieldIds.contains(field.id()))
                    .collect(Collectors.toList()));
        }
        return new ImportSelection(diagramId, diagramLabel, selectedTasks, selectedFields);
    }

    private int indexOf(String taskId) {
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).id().equals(taskId)) {
                return i;
            }
        }
        return -1;
    }
}
