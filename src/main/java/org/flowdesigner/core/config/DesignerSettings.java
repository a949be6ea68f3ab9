package org.flowdesigner.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime settings of the designer core.
 * <p>
 * Example designer-settings.json:
 * {
 *   "undoLimit": 50,
 *   "diagramExtension": ".diag",
 *   "mainPoolName": "processo principal"
 * }
 * Keys that are absent keep the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DesignerSettings {
    /**
     * Maximum depth of the undo and redo stacks. The oldest entry is dropped on overflow.
     */
    public int undoLimit = 50;

    /**
     * File extension of the nested diagram archives inside a process archive, matched case-insensitively.
     */
    public String diagramExtension = ".diag";

    /**
     * Name of the process definition entry inside each nested diagram archive.
     */
    public String diagramEntryName = "Diagram.xml";

    /**
     * Pool name that is skipped when choosing a diagram label, compared case-insensitively.
     */
    public String mainPoolName = "processo principal";

    /**
     * Options used for an unlabeled two-way gateway.
     */
    public List<String> binaryFallbackOptions = new ArrayList<>(List.of("Sim", "Não"));

    /**
     * Name given to newly added fields.
     */
    public String defaultFieldName = "Novo campo";

    /**
     * Name used for an object field when the project has no object type yet.
     */
    public String defaultObjectName = "Objeto";

    /**
     * Separator used when joining imported options into a field's option string.
     */
    public String optionSeparator = "; ";

    public static DesignerSettings defaults() {
        return new DesignerSettings();
    }
}
