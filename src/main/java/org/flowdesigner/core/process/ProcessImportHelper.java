package org.flowdesigner.core.process;

import lombok.extern.slf4j.Slf4j;
import org.flowdesigner.core.config.DesignerSettings;
import org.flowdesigner.core.process.models.DerivedCandidates;
import org.flowdesigner.core.process.models.DiagramDocument;
import org.flowdesigner.core.process.models.RawDiagram;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point of the import pipeline: archive -> diagrams -> decision-field candidates.
 * The result is a candidate set only; merging into a project goes through the editor.
 */
@Slf4j
public class ProcessImportHelper {
    private static final Comparator<RawDiagram> BY_LABEL_THEN_ENTRY =
            Comparator.comparing(RawDiagram::label).thenComparing(RawDiagram::id);

    public static List<RawDiagram> importArchive(Path archivePath) {
        return importArchive(archivePath, DesignerSettings.defaults());
    }

    /**
     * Reads and normalizes every diagram of a process archive.
     *
     * @param archivePath path to the archive
     * @param settings    import settings
     * @return diagrams sorted by label, ties broken by entry name
     * @throws DiagramImportException if the archive is unreadable or holds no usable diagram
     */
    public static List<RawDiagram> importArchive(Path archivePath, DesignerSettings settings) {
        List<DiagramDocument> documents = ProcessArchiveReader.read(archivePath, settings);

        List<RawDiagram> diagrams = documents.stream()
                .map(document -> DiagramNormalizer.normalize(document, settings))
                .sorted(BY_LABEL_THEN_ENTRY)
                .collect(Collectors.toList());

        long labelOnly = diagrams.stream().filter(diagram -> !diagram.readable()).count();
        log.info("Imported {} diagram(s) from {} ({} label-only)", diagrams.size(), archivePath.getFileName(),
                labelOnly);
        return diagrams;
    }

    public static DerivedCandidates deriveCandidates(RawDiagram diagram) {
        return DecisionFieldDeriver.derive(diagram);
    }

    public static DerivedCandidates deriveCandidates(RawDiagram diagram, DesignerSettings settings) {
        return DecisionFieldDeriver.derive(diagram, settings);
    }

    /**
     * Derives the candidates of one diagram and wraps them for selection and reordering.
     */
    public static CandidateSet openCandidates(RawDiagram diagram, DesignerSettings settings) {
        return new CandidateSet(diagram.id(), diagram.label(), DecisionFieldDeriver.derive(diagram, settings));
    }

    public static CandidateSet openCandidates(RawDiagram diagram) {
        return openCandidates(diagram, DesignerSettings.defaults());
    }
}
