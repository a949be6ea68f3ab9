package org.flowdesigner.core.process;

import lombok.extern.slf4j.Slf4j;
import org.flowdesigner.core.config.DesignerSettings;
import org.flowdesigner.core.process.models.DiagramDocument;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;

/**
 * Byte and XML layer of the import: opens the outer process archive, walks its nested diagram archives and
 * parses each {@code Diagram.xml}. Knows nothing about tasks or fields.
 */
@Slf4j
public class ProcessArchiveReader {

    public static List<DiagramDocument> read(Path archivePath) {
        return read(archivePath, DesignerSettings.defaults());
    }

    /**
     * Reads every diagram of a process archive.
     * <p>
     * Entries that are not nested archives, or that lack the diagram entry, are skipped. A nested archive that
     * breaks while being read, or whose XML is malformed, is returned as an unreadable document so the caller can
     * still list it under its entry name.
     *
     * @param archivePath path to the outer archive (e.g. a Bizagi .bpm file)
     * @param settings    supplies the diagram extension and the diagram entry name
     * @return documents in archive order
     * @throws DiagramImportException ARCHIVE_UNREADABLE if the outer archive cannot be opened,
     *                                NO_DIAGRAMS_FOUND if no entry yields a parseable diagram
     */
    public static List<DiagramDocument> read(Path archivePath, DesignerSettings settings) {
        String extension = settings.diagramExtension.toLowerCase(Locale.ROOT);
        List<DiagramDocument> documents = new ArrayList<>();

        try (ZipFile archive = new ZipFile(archivePath.toFile())) {
            for (ZipEntry entry : Collections.list(archive.entries())) {
                if (entry.isDirectory() || !entry.getName().toLowerCase(Locale.ROOT).endsWith(extension)) {
                    continue;
                }
                readDiagramEntry(archive, entry, settings.diagramEntryName).ifPresent(documents::add);
            }
        } catch (IOException e) {
            throw new DiagramImportException(DiagramImportException.Reason.ARCHIVE_UNREADABLE,
                    "Failed to open process archive: " + archivePath, e);
        }

        if (documents.stream().noneMatch(DiagramDocument::isReadable)) {
            throw new DiagramImportException(DiagramImportException.Reason.NO_DIAGRAMS_FOUND,
                    "No usable " + settings.diagramExtension + " diagram found in " + archivePath);
        }
        return documents;
    }

    /**
     * Reads one nested diagram archive. The nested stream is closed before returning.
     */
    private static Optional<DiagramDocument> readDiagramEntry(ZipFile archive, ZipEntry entry, String diagramEntryName) {
        String entryName = entry.getName();
        byte[] xml;

        try (InputStream raw = archive.getInputStream(entry);
             ZipInputStream nested = new ZipInputStream(raw)) {
            NestedLookup lookup = findEntry(nested, diagramEntryName);
            if (!lookup.isArchive()) {
                log.debug("Skipping '{}': not a nested archive", entryName);
                return Optional.empty();
            }
            if (lookup.content() == null) {
                log.debug("Skipping '{}': no {} inside", entryName, diagramEntryName);
                return Optional.empty();
            }
            xml = lookup.content();
        } catch (IOException e) {
            log.debug("Diagram '{}' could not be read, keeping label only: {}", entryName, e.getMessage());
            return Optional.of(DiagramDocument.unreadable(entryName));
        }

        try {
            Document doc = parseXml(xml);
            String namespaceUri = doc.getDocumentElement().getNamespaceURI();
            return Optional.of(new DiagramDocument(entryName, doc, namespaceUri));
        } catch (SAXException | IOException e) {
            log.debug("Diagram '{}' has malformed XML, keeping label only: {}", entryName, e.getMessage());
            return Optional.of(DiagramDocument.unreadable(entryName));
        }
    }

    private static NestedLookup findEntry(ZipInputStream nested, String wantedName) throws IOException {
        boolean sawEntry = false;
        ZipEntry inner;
        while ((inner = nested.getNextEntry()) != null) {
            sawEntry = true;
            if (wantedName.equals(inner.getName())) {
                return new NestedLookup(true, nested.readAllBytes());
            }
        }
        return new NestedLookup(sawEntry, null);
    }

    static Document parseXml(byte[] xml) throws SAXException, IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(xml));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable", e);
        }
    }

    // isArchive is false when the stream held no zip entry at all
    private record NestedLookup(boolean isArchive, byte[] content) {
    }
}
