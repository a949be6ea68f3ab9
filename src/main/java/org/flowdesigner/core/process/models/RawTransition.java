package org.flowdesigner.core.process.models;

/**
 * A transition between two activities.
 *
 * @param from source activity id
 * @param to   destination activity id
 * @param name normalized transition label, empty when unnamed
 */
public record RawTransition(
        String from,
        String to,
        String name
) {
}
