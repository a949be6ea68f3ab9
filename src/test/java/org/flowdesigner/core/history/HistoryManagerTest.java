package org.flowdesigner.core.history;

import org.flowdesigner.core.project.models.Field;
import org.flowdesigner.core.project.models.ProjectModel;
import org.flowdesigner.core.project.models.Task;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HistoryManagerTest {

    private static ProjectSnapshot snapshotNamed(String flowName) {
        return ProjectSnapshot.capture(new ProjectModel(flowName), null, Set.of());
    }

    @Test
    void shouldUndoAndRedoInOrder() {
        HistoryManager history = new HistoryManager(10);
        history.record(snapshotNamed("v1"));
        history.record(snapshotNamed("v2"));

        Optional<ProjectSnapshot> undone = history.undo(snapshotNamed("v3"));
        assertEquals("v2", undone.orElseThrow().project().getFlowName());
        assertTrue(history.canRedo());

        Optional<ProjectSnapshot> redone = history.redo(snapshotNamed("v2"));
        assertEquals("v3", redone.orElseThrow().project().getFlowName());
        assertEquals(2, history.undoDepth());
        assertEquals(0, history.redoDepth());
    }

    @Test
    void shouldReturnEmptyWhenNothingToUndoOrRedo() {
        HistoryManager history = new HistoryManager(5);

        assertTrue(history.undo(snapshotNamed("now")).isEmpty());
        assertTrue(history.redo(snapshotNamed("now")).isEmpty());
        assertFalse(history.canUndo());
        assertFalse(history.canRedo());
    }

    @Test
    void shouldClearRedoWhenRecording() {
        HistoryManager history = new HistoryManager(5);
        history.record(snapshotNamed("v1"));
        history.undo(snapshotNamed("v2"));
        assertTrue(history.canRedo());

        history.record(snapshotNamed("v1b"));

        assertFalse(history.canRedo());
    }

    @Test
    void shouldDropOldestBeyondMaxDepth() {
        HistoryManager history = new HistoryManager(3);
        for (int i = 1; i <= 5; i++) {
            history.record(snapshotNamed("v" + i));
        }

        assertEquals(3, history.undoDepth());
        assertEquals("v5", history.undo(snapshotNamed("v6")).orElseThrow().project().getFlowName());
        assertEquals("v4", history.undo(snapshotNamed("v5")).orElseThrow().project().getFlowName());
        assertEquals("v3", history.undo(snapshotNamed("v4")).orElseThrow().project().getFlowName());
        assertFalse(history.canUndo());
    }

    @Test
    void shouldMoveSnapshotsToRedoStack() {
        HistoryManager history = new HistoryManager(2);
        history.record(snapshotNamed("v1"));
        history.record(snapshotNamed("v2"));
        history.undo(snapshotNamed("v3"));
        history.undo(snapshotNamed("v2"));

        assertEquals(2, history.redoDepth());
        assertEquals(0, history.undoDepth());
    }

    @Test
    void shouldRejectNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryManager(0));
    }

    @Test
    void shouldKeepSnapshotsImmutable() {
        ProjectModel project = new ProjectModel("Fluxo");
        Task task = new Task("t1", "Tarefa");
        task.getFields().add(new Field("f1", "Campo"));
        project.getTasks().add(task);

        ProjectSnapshot snapshot = ProjectSnapshot.capture(project, "t1", Set.of("f1"));
        task.getFields().get(0).setName("Alterado");
        snapshot.project().getTasks().clear();

        ProjectModel restored = snapshot.project();
        assertEquals("Campo", restored.getTasks().get(0).getFields().get(0).getName());
        assertEquals("t1", snapshot.activeTaskId());
        assertEquals(Set.of("f1"), snapshot.selectedFieldIds());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.selectedFieldIds().add("f2"));
    }
}
