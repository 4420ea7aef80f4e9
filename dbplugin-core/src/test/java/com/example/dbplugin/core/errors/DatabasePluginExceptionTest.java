package com.example.dbplugin.core.errors;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class DatabasePluginExceptionTest {

  @Test
  @DisplayName("Should fold the cause chain into the redacted message")
  void shouldFoldCauseChain() {
    final var original =
        new TransactionException("failed to commit", new SQLException("lost secret"));

    final var copy = original.redact(text -> text.replace("secret", "***"));

    assertInstanceOf(TransactionException.class, copy);
    assertEquals("failed to commit: lost ***", copy.getMessage());
    assertNull(copy.getCause());
    assertArrayEquals(original.getStackTrace(), copy.getStackTrace());
  }

  @Test
  @DisplayName("Should keep the statement index")
  void shouldKeepStatementIndex() {
    final var copy =
        (StatementExecutionException)
            new StatementExecutionException(3, new SQLException("boom")).redact(t -> t);

    assertEquals(3, copy.statementIndex());
    assertEquals("failed to execute statement 3: boom", copy.getMessage());
  }
}
