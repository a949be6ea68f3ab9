package org.flowdesigner.core.process.models;

/**
 * Classification of a diagram activity.
 * An activity with a {@code Route} child is a gateway, one with an {@code Implementation} child is a task,
 * anything else is a generic activity.
 */
public enum NodeKind {
    TASK,
    GATEWAY,
    GENERIC_ACTIVITY
}
