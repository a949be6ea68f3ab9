package org.flowdesigner.core.process.models;

public enum DecisionFieldKind {
    LIST,
    BINARY_LIST  // options are exactly yes/no ("Sim"/"Não")
}
