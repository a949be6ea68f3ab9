package org.flowdesigner.core.process.models;

import org.w3c.dom.Document;

/**
 * A diagram entry pulled out of a process archive, before normalization.
 *
 * @param entryName    name of the nested archive entry inside the outer archive (e.g. "Main.diag")
 * @param document     the parsed {@code Diagram.xml}, or null when the entry could not be read or parsed
 * @param namespaceUri namespace of the root element, used to qualify every lookup; null when unqualified
 */
public record DiagramDocument(
        String entryName,
        Document document,
        String namespaceUri
) {
    public static DiagramDocument unreadable(String entryName) {
        return new DiagramDocument(entryName, null, null);
    }

    public boolean isReadable() {
        return document != null;
    }
}
