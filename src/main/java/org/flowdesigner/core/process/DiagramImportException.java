package org.flowdesigner.core.process;

import lombok.Getter;

/**
 * Raised when a process archive cannot be imported as a whole.
 * Problems confined to a single diagram never surface here; that diagram degrades to a label-only entry.
 */
@Getter
public class DiagramImportException extends RuntimeException {

    public enum Reason {
        NO_DIAGRAMS_FOUND,
        ARCHIVE_UNREADABLE
    }

    private final Reason reason;

    public DiagramImportException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DiagramImportException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
