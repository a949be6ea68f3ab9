package org.flowdesigner.core.history;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Undo/redo stacks of project snapshots, each capped at {@code maxDepth} (oldest dropped first).
 * <p>
 * Callers record the current state before every mutation. Recording clears the redo stack.
 */
@Slf4j
public class HistoryManager {
    private final int maxDepth;
    private final Deque<ProjectSnapshot> undoStack = new ArrayDeque<>();
    private final Deque<ProjectSnapshot> redoStack = new ArrayDeque<>();

    public HistoryManager(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("History depth must be at least 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Pushes the state captured before a mutation and forgets everything that could be redone.
     */
    public void record(ProjectSnapshot before) {
        push(undoStack, before);
        redoStack.clear();
    }

    /**
     * Steps back one mutation.
     *
     * @param current the state right now, kept so it can be redone
     * @return the state to restore, or empty when there is nothing to undo
     */
    public Optional<ProjectSnapshot> undo(ProjectSnapshot current) {
        if (undoStack.isEmpty()) {
            return Optional.empty();
        }
        push(redoStack, current);
        return Optional.of(undoStack.pop());
    }

    /**
     * Re-applies the last undone mutation.
     *
     * @param current the state right now, kept so it can be undone again
     * @return the state to restore, or empty when there is nothing to redo
     */
    public Optional<ProjectSnapshot> redo(ProjectSnapshot current) {
        if (redoStack.isEmpty()) {
            return Optional.empty();
        }
        push(undoStack, current);
        return Optional.of(redoStack.pop());
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }

    private void push(Deque<ProjectSnapshot> stack, ProjectSnapshot snapshot) {
        stack.push(snapshot);
        if (stack.size() > maxDepth) {
            stack.removeLast();
            log.debug("History depth {} reached, dropped oldest snapshot", maxDepth);
        }
    }
}
