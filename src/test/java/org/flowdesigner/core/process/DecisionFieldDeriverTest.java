package org.flowdesigner.core.process;

import org.flowdesigner.core.config.DesignerSettings;
import org.flowdesigner.core.process.models.DecisionFieldCandidate;
import org.flowdesigner.core.process.models.DecisionFieldKind;
import org.flowdesigner.core.process.models.DerivedCandidates;
import org.flowdesigner.core.process.models.NodeKind;
import org.flowdesigner.core.process.models.RawNode;
import org.flowdesigner.core.process.models.RawTransition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DecisionFieldDeriverTest {
    private static final DesignerSettings SETTINGS = DesignerSettings.defaults();

    private final Map<String, RawNode> nodes = new LinkedHashMap<>();
    private final List<RawTransition> transitions = new ArrayList<>();

    private void task(String id, String name) {
        nodes.put(id, new RawNode(id, name, NodeKind.TASK, true));
    }

    private void gateway(String id, String name) {
        nodes.put(id, new RawNode(id, name, NodeKind.GATEWAY, false));
    }

    private void activity(String id, String name) {
        nodes.put(id, new RawNode(id, name, NodeKind.GENERIC_ACTIVITY, false));
    }

    private void flow(String from, String to, String name) {
        transitions.add(new RawTransition(from, to, name));
    }

    private DerivedCandidates derive() {
        return DecisionFieldDeriver.derive(nodes, transitions, SETTINGS);
    }

    @Test
    void shouldCreateOneCandidatePerUpstreamTask() {
        task("A", "Analisar");
        task("B", "Revisar");
        gateway("G", "Pedido  aprovado?");
        activity("OK", "Fim");
        activity("NOK", "Cancelado");
        flow("A", "G", "");
        flow("B", "G", "");
        flow("G", "OK", "Aprovado");
        flow("G", "NOK", "Reprovado");

        DerivedCandidates derived = derive();

        assertEquals(List.of("A", "B"), derived.tasks().stream().map(RawNode::id).collect(Collectors.toList()));
        DecisionFieldCandidate a = derived.fieldsOf("A").get(0);
        DecisionFieldCandidate b = derived.fieldsOf("B").get(0);
        assertEquals("A_G", a.id());
        assertEquals("B_G", b.id());
        assertEquals("Pedido aprovado?", a.label());
        assertEquals(a.label(), b.label());
        assertEquals(List.of("Aprovado", "Reprovado"), a.options());
        assertEquals(List.of("Aprovado", "Reprovado"), b.options());
        assertEquals(DecisionFieldKind.LIST, a.kind());
        assertEquals(DecisionFieldKind.LIST, b.kind());
    }

    @Test
    void shouldCreateSingleCandidateForParallelTransitions() {
        task("A", "Analisar");
        gateway("G", "Aprovado?");
        activity("OK", "Fim");
        activity("NOK", "Cancelado");
        flow("A", "G", "");
        flow("A", "G", "Reenviar");
        flow("G", "OK", "Sim");
        flow("G", "NOK", "Não");

        List<DecisionFieldCandidate> fields = derive().fieldsOf("A");

        assertEquals(List.of("A_G"), fields.stream().map(DecisionFieldCandidate::id).collect(Collectors.toList()));
        assertEquals(DecisionFieldKind.BINARY_LIST, fields.get(0).kind());
    }

    @Test
    void shouldFallBackToYesNoForTwoUnnamedExits() {
        task("A", "Analisar");
        gateway("G", "Ok?");
        activity("X", "");
        activity("Y", "");
        flow("A", "G", "");
        flow("G", "X", "");
        flow("G", "Y", "");

        DecisionFieldCandidate candidate = derive().fieldsOf("A").get(0);

        assertEquals(List.of("Sim", "Não"), candidate.options());
        assertEquals(DecisionFieldKind.BINARY_LIST, candidate.kind());
    }

    @Test
    void shouldUseDestinationNamesWhenTransitionsAreUnnamed() {
        task("A", "Analisar");
        gateway("G", "Rota");
        task("X", "Emitir nota");
        activity("Y", "Arquivar");
        activity("Z", "");
        flow("A", "G", "");
        flow("G", "X", "");
        flow("G", "Y", "");
        flow("G", "Z", "");

        DecisionFieldCandidate candidate = derive().fieldsOf("A").get(0);

        assertEquals(List.of("Emitir nota", "Arquivar"), candidate.options());
        assertEquals(DecisionFieldKind.LIST, candidate.kind());
    }

    @Test
    void shouldPreferTransitionNamesOverDestinationNames() {
        task("A", "Analisar");
        gateway("G", "Rota");
        activity("X", "Destino X");
        activity("Y", "Destino Y");
        flow("A", "G", "");
        flow("G", "X", "Caminho X");
        flow("G", "Y", "");

        assertEquals(List.of("Caminho X"), derive().fieldsOf("A").get(0).options());
    }

    @Test
    void shouldClassifyYesNoIgnoringCaseAndAccents() {
        task("A", "Analisar");
        gateway("G", "Ok?");
        activity("X", "");
        activity("Y", "");
        flow("A", "G", "");
        flow("G", "X", "NAO");
        flow("G", "Y", "sim");

        DecisionFieldCandidate candidate = derive().fieldsOf("A").get(0);

        assertEquals(List.of("NAO", "sim"), candidate.options());
        assertEquals(DecisionFieldKind.BINARY_LIST, candidate.kind());
    }

    @Test
    void shouldNotFallBackForSingleUnnamedExit() {
        task("A", "Analisar");
        gateway("G", "Ok?");
        activity("X", "");
        flow("A", "G", "");
        flow("G", "X", "");

        DecisionFieldCandidate candidate = derive().fieldsOf("A").get(0);

        assertTrue(candidate.options().isEmpty());
        assertEquals(DecisionFieldKind.LIST, candidate.kind());
    }

    @Test
    void shouldIgnoreGatewaysNotFedByImplementedTasks() {
        task("A", "Analisar");
        nodes.put("M", new RawNode("M", "Manual", NodeKind.TASK, false));
        activity("S", "Início");
        gateway("G", "Ok?");
        flow("S", "G", "");
        flow("M", "G", "");
        flow("G", "A", "Sim");

        DerivedCandidates derived = derive();

        assertEquals(List.of("A"), derived.tasks().stream().map(RawNode::id).collect(Collectors.toList()));
        assertTrue(derived.fieldsOf("A").isEmpty());
        assertTrue(derived.fieldsByTask().containsKey("A"));
        assertTrue(derived.fieldsOf("M").isEmpty());
    }

    @Test
    void shouldCollectSeveralGatewaysForOneTask() {
        task("A", "Analisar");
        gateway("G1", "Primeira");
        gateway("G2", "Segunda");
        flow("A", "G1", "");
        flow("A", "G2", "");
        flow("G1", "A", "Voltar");
        flow("G2", "A", "Repetir");

        List<DecisionFieldCandidate> fields = derive().fieldsOf("A");

        assertEquals(List.of("A_G1", "A_G2"), fields.stream().map(DecisionFieldCandidate::id).collect(Collectors.toList()));
    }

    @Test
    void shouldBeDeterministic() {
        task("A", "Analisar");
        task("B", "Revisar");
        gateway("G", "Decisão");
        activity("X", "");
        activity("Y", "");
        flow("A", "G", "");
        flow("B", "G", "");
        flow("G", "X", "");
        flow("G", "Y", "");

        assertEquals(derive(), derive());
    }

    @Test
    void shouldUseConfiguredFallbackOptions() {
        DesignerSettings settings = DesignerSettings.defaults();
        settings.binaryFallbackOptions = List.of("Yes", "No");
        task("A", "Check");
        gateway("G", "Ok?");
        activity("X", "");
        activity("Y", "");
        flow("A", "G", "");
        flow("G", "X", "");
        flow("G", "Y", "");

        DecisionFieldCandidate candidate = DecisionFieldDeriver.derive(nodes, transitions, settings).fieldsOf("A").get(0);

        assertEquals(List.of("Yes", "No"), candidate.options());
        assertEquals(DecisionFieldKind.BINARY_LIST, candidate.kind());
    }
}
