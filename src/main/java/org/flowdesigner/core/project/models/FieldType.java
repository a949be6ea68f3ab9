package org.flowdesigner.core.project.models;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Field types offered by the designer, with the label used in saved projects.
 */
public enum FieldType {
    TEXT("Texto"),
    TEXT_AREA("Área de texto"),
    NUMERIC("Numérico"),
    LIST("Lista"),
    MULTI_LIST("Lista Vários"),
    DATE("Data"),
    INFORMATIVE("Informativo"),
    ATTACHMENT("Anexo"),
    VALUES("Valores"),
    SYSTEM_COMPONENT("Componente do sistema"),
    OBJECT("Objeto");

    private static final Set<FieldType> LIST_TYPES = EnumSet.of(LIST, MULTI_LIST);

    private final String label;

    FieldType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isList() {
        return LIST_TYPES.contains(this);
    }

    /**
     * @throws IllegalArgumentException for an unknown label
     */
    public static FieldType fromLabel(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field type: " + label));
    }
}
