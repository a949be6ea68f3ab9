package org.flowdesigner.core.process.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One normalized process diagram.
 * Nodes keep document order. A diagram that could not be read is kept as a label-only entry
 * ({@code readable == false}, no nodes, no transitions).
 */
public record RawDiagram(
        String id,
        String label,
        Map<String, RawNode> nodes,
        List<RawTransition> transitions,
        boolean readable
) {
    public RawDiagram {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        transitions = List.copyOf(transitions);
    }

    public static RawDiagram labelOnly(String entryName) {
        return new RawDiagram(entryName, entryName, Map.of(), List.of(), false);
    }
}
