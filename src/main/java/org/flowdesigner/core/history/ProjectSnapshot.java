package org.flowdesigner.core.history;

import org.flowdesigner.core.project.models.ProjectModel;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Full copy of the editor state taken right before a mutation.
 * The project is deep-copied on capture and again on every read, so a pushed snapshot never changes.
 */
public final class ProjectSnapshot {
    private final ProjectModel project;
    private final String activeTaskId;
    private final Set<String> selectedFieldIds;

    private ProjectSnapshot(ProjectModel project, String activeTaskId, Set<String> selectedFieldIds) {
        this.project = project;
        this.activeTaskId = activeTaskId;
        this.selectedFieldIds = selectedFieldIds;
    }

    public static ProjectSnapshot capture(ProjectModel project, String activeTaskId, Set<String> selectedFieldIds) {
        return new ProjectSnapshot(project.copy(), activeTaskId, Collections.unmodifiableSet(new LinkedHashSet<>(selectedFieldIds)));
    }

    public ProjectModel project() {
        return project.copy();
    }

    public String activeTaskId() {
        return activeTaskId;
    }

    public Set<String> selectedFieldIds() {
        return selectedFieldIds;
    }
}
