package com.di.eventreplay.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Failure kinds of an event import run. Every kind is fatal; they only differ in
 * what the operator has to look at before re-running.
 * <p>Usage: {@code ImportErrorKind kind = ImportErrorKind.categorize(exception);}
 */
public enum ImportErrorKind {

    IO_ERROR("I/O error", "Event log, cache or preorg file unreadable or unwritable"),
    PARSE_ERROR("Parse error", "Malformed line or event payload"),
    CONSTRAINT_VIOLATION("Constraint violation", "Uniqueness or referential constraint failed despite bulk-load dedup"),
    STORAGE_ERROR("Storage error", "Connection loss or transaction failure"),
    UNKNOWN("Unknown error", "Unclassified failure");

    private final String name;
    private final String description;

    ImportErrorKind(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ImportErrorKind> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof DataIntegrityViolationException, CONSTRAINT_VIOLATION);
        MATCHERS.put(t -> t instanceof DataAccessException, STORAGE_ERROR);
        MATCHERS.put(t -> t instanceof com.fasterxml.jackson.core.JsonProcessingException, PARSE_ERROR);
        MATCHERS.put(t -> t instanceof IOException || t instanceof UncheckedIOException, IO_ERROR);
    }

    private static final Map<String, ImportErrorKind> SQL_STATE_PREFIX = Map.of(
            "08", STORAGE_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "40", STORAGE_ERROR,
            "57", STORAGE_ERROR
    );

    /**
     * Classifies a failure. An {@link EventImportException} anywhere in the cause
     * chain decides; otherwise the outermost throwable that matches does.
     */
    public static ImportErrorKind categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof EventImportException importEx) {
                return importEx.getKind();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof SQLException sqlEx) {
                return categorizeSqlException(sqlEx);
            }
            for (Map.Entry<Predicate<Throwable>, ImportErrorKind> e : MATCHERS.entrySet()) {
                if (e.getKey().test(t)) {
                    if (e.getValue() == STORAGE_ERROR) {
                        // a nested SQLException carries a more precise state
                        SQLException nested = findSqlException(t);
                        return nested != null ? categorizeSqlException(nested) : STORAGE_ERROR;
                    }
                    return e.getValue();
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return UNKNOWN;
    }

    private static ImportErrorKind categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && sqlState.length() >= 2) {
            ImportErrorKind byState = SQL_STATE_PREFIX.get(sqlState.substring(0, 2));
            if (byState != null) {
                return byState;
            }
        }
        return STORAGE_ERROR;
    }

    private static SQLException findSqlException(Throwable t) {
        for (Throwable c = t.getCause(); c != null && c != c.getCause(); c = c.getCause()) {
            if (c instanceof SQLException sqlEx) {
                return sqlEx;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name();
    }
}
