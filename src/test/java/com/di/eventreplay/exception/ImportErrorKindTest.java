package com.di.eventreplay.exception;

import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImportErrorKind Tests")
class ImportErrorKindTest {

    // ============================================================================
    // Import exceptions
    // ============================================================================

    @Test
    @DisplayName("Should use the kind of an EventImportException anywhere in the chain")
    void testCategorize_ImportException() {
        assertEquals(ImportErrorKind.PARSE_ERROR, ImportErrorKind.categorize(EventImportException.parse("bad")));
        assertEquals(ImportErrorKind.IO_ERROR, ImportErrorKind.categorize(
                new IllegalStateException("wrapped", EventImportException.io("gone", null))));
    }

    @Test
    @DisplayName("Should prefer a nested import exception over an outer storage failure")
    void testCategorize_ImportExceptionWinsOverStorage() {
        RuntimeException ex = new DataAccessResourceFailureException("tx failed", EventImportException.parse("line 3"));

        assertEquals(ImportErrorKind.PARSE_ERROR, ImportErrorKind.categorize(ex));
    }

    // ============================================================================
    // Storage exceptions
    // ============================================================================

    @Test
    @DisplayName("Should map integrity violations to CONSTRAINT_VIOLATION")
    void testCategorize_Integrity() {
        assertEquals(ImportErrorKind.CONSTRAINT_VIOLATION,
                ImportErrorKind.categorize(new DataIntegrityViolationException("duplicate key")));
    }

    @Test
    @DisplayName("Should refine a storage failure by the SQL state it wraps")
    void testCategorize_SqlState() {
        SQLException unique = new SQLException("duplicate key value", "23505");
        SQLException lost = new SQLException("connection lost", "08006");

        assertEquals(ImportErrorKind.CONSTRAINT_VIOLATION,
                ImportErrorKind.categorize(new UncategorizedSQLException("insert", "INSERT", unique)));
        assertEquals(ImportErrorKind.STORAGE_ERROR,
                ImportErrorKind.categorize(new UncategorizedSQLException("insert", "INSERT", lost)));
        assertEquals(ImportErrorKind.STORAGE_ERROR, ImportErrorKind.categorize(new SQLException("no state")));
    }

    // ============================================================================
    // Other exceptions
    // ============================================================================

    @Test
    @DisplayName("Should map I/O and JSON failures")
    void testCategorize_IoAndJson() {
        assertEquals(ImportErrorKind.IO_ERROR, ImportErrorKind.categorize(new IOException("disk")));
        assertEquals(ImportErrorKind.IO_ERROR,
                ImportErrorKind.categorize(new UncheckedIOException(new IOException("disk"))));
        assertEquals(ImportErrorKind.PARSE_ERROR,
                ImportErrorKind.categorize(new JsonParseException(null, "unexpected token")));
    }

    @Test
    @DisplayName("Should return UNKNOWN for null and unclassified failures")
    void testCategorize_Unknown() {
        assertEquals(ImportErrorKind.UNKNOWN, ImportErrorKind.categorize(null));
        assertEquals(ImportErrorKind.UNKNOWN, ImportErrorKind.categorize(new IllegalStateException("boom")));
    }

    @Test
    @DisplayName("Should expose a readable name and description")
    void testNameAndDescription() {
        assertEquals("Parse error", ImportErrorKind.PARSE_ERROR.getName());
        assertFalse(ImportErrorKind.STORAGE_ERROR.getDescription().isEmpty());
        assertEquals("IO_ERROR", ImportErrorKind.IO_ERROR.toString());
    }
}
