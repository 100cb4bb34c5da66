package com.di.eventreplay.exception;

/**
 * Fatal import failure tagged with its {@link ImportErrorKind}.
 */
public class EventImportException extends RuntimeException {

    private final ImportErrorKind kind;

    public EventImportException(ImportErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EventImportException(ImportErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ImportErrorKind getKind() {
        return kind;
    }

    public static EventImportException io(String message, Throwable cause) {
        return new EventImportException(ImportErrorKind.IO_ERROR, message, cause);
    }

    public static EventImportException parse(String message, Throwable cause) {
        return new EventImportException(ImportErrorKind.PARSE_ERROR, message, cause);
    }

    public static EventImportException parse(String message) {
        return new EventImportException(ImportErrorKind.PARSE_ERROR, message);
    }
}
