package org.flowdesigner.core.process;

import org.flowdesigner.core.process.models.DecisionFieldCandidate;
import org.flowdesigner.core.process.models.DecisionFieldKind;
import org.flowdesigner.core.process.models.DerivedCandidates;
import org.flowdesigner.core.process.models.ImportSelection;
import org.flowdesigner.core.process.models.NodeKind;
import org.flowdesigner.core.process.models.RawNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CandidateSetTest {
    private CandidateSet candidates;

    private static DecisionFieldCandidate candidate(String id, String label, String... options) {
        return DecisionFieldCandidate.builder()
                .id(id)
                .label(label)
                .kind(DecisionFieldKind.LIST)
                .options(List.of(options))
                .build();
    }

    private List<String> taskIds() {
        return candidates.getTasks().stream().map(RawNode::id).collect(Collectors.toList());
    }

    @BeforeEach
    void setUp() {
        List<RawNode> tasks = List.of(
                new RawNode("T1", "Revisar", NodeKind.TASK, true),
                new RawNode("T2", "aprovar", NodeKind.TASK, true),
                new RawNode("T3", "Conferir", NodeKind.TASK, true));
        Map<String, List<DecisionFieldCandidate>> fields = new LinkedHashMap<>();
        fields.put("T1", List.of(candidate("T1_G", "Revisão ok?", "Sim", "Não")));
        fields.put("T2", List.of(candidate("T2_G", "Aprovado?", "Aprovar", "Devolver")));
        fields.put("T3", List.of());
        candidates = new CandidateSet("a.diag", "Compras", new DerivedCandidates(tasks, fields));
    }

    @Test
    void shouldStartWithEverythingSelected() {
        assertTrue(candidates.isTaskSelected("T1"));
        assertTrue(candidates.isTaskSelected("T3"));
        assertTrue(candidates.isFieldSelected("T2_G"));
    }

    @Test
    void shouldReorderTasksWithinBounds() {
        candidates.reorderTask("T3", -1);
        assertEquals(List.of("T1", "T3", "T2"), taskIds());

        candidates.reorderTask("T1", -1);
        assertEquals(List.of("T1", "T3", "T2"), taskIds());

        candidates.reorderTask("T2", 5);
        assertEquals(List.of("T1", "T3", "T2"), taskIds());
    }

    @Test
    void shouldSortAndRestoreOrder() {
        candidates.sortAlphabetically();
        assertEquals(List.of("T2", "T3", "T1"), taskIds());

        candidates.restoreOriginalOrder();
        assertEquals(List.of("T1", "T2", "T3"), taskIds());
    }

    @Test
    void shouldSearchNamesLabelsAndOptions() {
        assertEquals(List.of("T1"), ids(candidates.search("revis")));
        assertEquals(List.of("T2"), ids(candidates.search("DEVOLVER")));
        assertEquals(List.of("T1"), ids(candidates.search("não")));
        assertEquals(3, candidates.search("  ").size());
    }

    @Test
    void shouldProduceSelectionInCurrentOrder() {
        candidates.reorderTask("T2", -1);
        candidates.setTaskSelected("T3", false);
        candidates.setFieldSelected("T1_G", false);

        ImportSelection selection = candidates.toSelection();

        assertEquals(List.of("T2", "T1"), ids(selection.tasks()));
        assertTrue(selection.fieldsOf("T1").isEmpty());
        assertEquals("T2_G", selection.fieldsOf("T2").get(0).id());
        assertEquals("Compras", selection.diagramLabel());
    }

    @Test
    void shouldApplyEditsToSelection() {
        candidates.renameTask("T1", "Revisar contrato");
        candidates.editField("T1", "T1_G", "Contrato ok?", List.of("Ok", "Corrigir", "Cancelar"));

        ImportSelection selection = candidates.toSelection();

        assertEquals("Revisar contrato", selection.tasks().get(0).name());
        DecisionFieldCandidate edited = selection.fieldsOf("T1").get(0);
        assertEquals("Contrato ok?", edited.label());
        assertEquals(List.of("Ok", "Corrigir", "Cancelar"), edited.options());
        assertEquals("T1_G", edited.id());
    }

    @Test
    void shouldRejectEditsOfUnknownCandidates() {
        assertThrows(IllegalArgumentException.class, () -> candidates.renameTask("nope", "x"));
        assertThrows(IllegalArgumentException.class, () -> candidates.editField("T1", "nope", "x", List.of()));
        assertThrows(IllegalArgumentException.class, () -> candidates.editField("nope", "T1_G", "x", List.of()));
    }

    @Test
    void shouldKeepSelectionIndependentOfLaterEdits() {
        ImportSelection selection = candidates.toSelection();
        candidates.renameTask("T1", "Outro nome");

        assertEquals("Revisar", selection.tasks().get(0).name());
        assertThrows(UnsupportedOperationException.class, () -> selection.tasks().clear());
    }

    private static List<String> ids(List<RawNode> nodes) {
        return nodes.stream().map(RawNode::id).collect(Collectors.toList());
    }
}
