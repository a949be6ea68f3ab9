package org.flowdesigner.core.process.models;

/**
 * One activity of a diagram as read from the process definition.
 *
 * @param id                the activity id ({@code Id} attribute)
 * @param name              the normalized activity name, empty when absent
 * @param kind              task, gateway or generic activity
 * @param hasImplementation true iff the activity carries an {@code Implementation} child
 */
public record RawNode(
        String id,
        String name,
        NodeKind kind,
        boolean hasImplementation
) {
    public boolean isImplementedTask() {
        return kind == NodeKind.TASK && hasImplementation;
    }
}
