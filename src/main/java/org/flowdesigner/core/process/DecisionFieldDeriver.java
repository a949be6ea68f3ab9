package org.flowdesigner.core.process;

import org.flowdesigner.core.config.DesignerSettings;
import org.flowdesigner.core.process.models.DecisionFieldCandidate;
import org.flowdesigner.core.process.models.DecisionFieldKind;
import org.flowdesigner.core.process.models.DerivedCandidates;
import org.flowdesigner.core.process.models.NodeKind;
import org.flowdesigner.core.process.models.RawDiagram;
import org.flowdesigner.core.process.models.RawNode;
import org.flowdesigner.core.process.models.RawTransition;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Synthesizes decision fields from gateways.
 * <p>
 * Every implemented task that feeds a gateway receives one list field whose options are the gateway's outgoing
 * choices. A gateway reachable from several tasks yields one independent candidate per task, and candidate ids
 * are unique within a diagram.
 */
public class DecisionFieldDeriver {

    public static DerivedCandidates derive(RawDiagram diagram) {
        return derive(diagram.nodes(), diagram.transitions(), DesignerSettings.defaults());
    }

    public static DerivedCandidates derive(RawDiagram diagram, DesignerSettings settings) {
        return derive(diagram.nodes(), diagram.transitions(), settings);
    }

    /**
     * Derives importable tasks and their decision-field candidates.
     *
     * @param nodes       diagram nodes by id, in document order
     * @param transitions diagram transitions, in document order
     * @param settings    supplies the yes/no fallback options
     * @return implemented tasks in node order, and candidates per task id (every task present, possibly empty)
     */
    public static DerivedCandidates derive(Map<String, RawNode> nodes, List<RawTransition> transitions,
                                           DesignerSettings settings) {
        Map<String, List<RawTransition>> outgoing = new LinkedHashMap<>();
        Map<String, List<RawTransition>> incoming = new LinkedHashMap<>();
        for (RawTransition transition : transitions) {
            outgoing.computeIfAbsent(transition.from(), k -> new ArrayList<>()).add(transition);
            incoming.computeIfAbsent(transition.to(), k -> new ArrayList<>()).add(transition);
        }

        List<RawNode> tasks = nodes.values().stream()
                .filter(RawNode::isImplementedTask)
                .collect(Collectors.toList());

        Map<String, List<DecisionFieldCandidate>> fieldsByTask = new LinkedHashMap<>();
        for (RawNode task : tasks) {
            fieldsByTask.put(task.id(), new ArrayList<>());
        }

        for (RawNode gateway : nodes.values()) {
            if (gateway.kind() != NodeKind.GATEWAY) continue;

            List<RawTransition> out = outgoing.getOrDefault(gateway.id(), List.of());
            List<String> options = deriveOptions(out, nodes, settings.binaryFallbackOptions);
            DecisionFieldKind kind = classify(options, settings.binaryFallbackOptions);
            String label = DiagramNormalizer.normalizeLabel(gateway.name());

            Set<String> fedBy = new HashSet<>();
            for (RawTransition in : incoming.getOrDefault(gateway.id(), List.of())) {
                RawNode source = nodes.get(in.from());
                if (source == null || !source.isImplementedTask()) continue;
                // parallel transitions from one task still give a single candidate
                if (!fedBy.add(source.id())) continue;

                fieldsByTask.get(source.id()).add(DecisionFieldCandidate.builder()
                        .id(source.id() + "_" + gateway.id())
                        .label(label)
                        .kind(kind)
                        .options(options)
                        .build());
            }
        }

        return new DerivedCandidates(tasks, fieldsByTask);
    }

    /**
     * Options of a gateway: named outgoing transitions; failing that, the names of the destinations; failing that,
     * the yes/no fallback when the gateway has exactly two exits.
     */
    static List<String> deriveOptions(List<RawTransition> out, Map<String, RawNode> nodes,
                                      List<String> binaryFallback) {
        List<String> options = new ArrayList<>();
        for (RawTransition transition : out) {
            if (!transition.name().isEmpty()) {
                options.add(transition.name());
            }
        }

        if (options.isEmpty()) {
            for (RawTransition transition : out) {
                RawNode destination = nodes.get(transition.to());
                if (destination != null && !destination.name().isEmpty()) {
                    options.add(destination.name());
                }
            }
        }

        if (options.isEmpty() && out.size() == 2) {
            options.addAll(binaryFallback);
        }
        return options;
    }

    static DecisionFieldKind classify(List<String> options, List<String> binaryFallback) {
        Set<String> folded = options.stream().map(DecisionFieldDeriver::fold).collect(Collectors.toSet());
        Set<String> binary = new HashSet<>();
        binaryFallback.forEach(option -> binary.add(fold(option)));
        return folded.equals(binary) ? DecisionFieldKind.BINARY_LIST : DecisionFieldKind.LIST;
    }

    // case- and accent-insensitive form: "Não" -> "nao"
    static String fold(String s) {
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}", "").toLowerCase(Locale.ROOT);
    }
}
