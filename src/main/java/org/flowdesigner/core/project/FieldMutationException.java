package org.flowdesigner.core.project;

import lombok.Getter;

/**
 * A mutation the editor refused. The project and the history are unchanged when this is thrown.
 */
@Getter
public class FieldMutationException extends RuntimeException {

    public enum Reason {
        /** the task already has an object-typed field */
        OBJECT_TYPE_CONFLICT,
        /** an object field was requested but no object type name exists or was supplied */
        OBJECT_TYPE_UNDEFINED,
        /** the field cannot take (or keep) this origin link */
        ORIGIN_INCOMPATIBLE,
        ORIGIN_NOT_FOUND,
        DUPLICATE_RULE,
        RULE_SOURCE_NOT_FOUND,
        NAME_LOCKED,
        INVALID_VALUE
    }

    private final Reason reason;

    public FieldMutationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
