package com.example.dbplugin.core.sanitizer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.dbplugin.core.contract.CallContext;
import com.example.dbplugin.core.contract.ChangePassword;
import com.example.dbplugin.core.contract.Database;
import com.example.dbplugin.core.contract.InitializeRequest;
import com.example.dbplugin.core.contract.NewUserRequest;
import com.example.dbplugin.core.contract.NewUserResponse;
import com.example.dbplugin.core.contract.Statements;
import com.example.dbplugin.core.contract.UpdateUserRequest;
import com.example.dbplugin.core.contract.UsernameMetadata;
import com.example.dbplugin.core.errors.ConnectionException;
import com.example.dbplugin.core.errors.StatementExecutionException;
import com.example.dbplugin.core.errors.ValidationException;
import java.sql.SQLException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class DatabaseErrorSanitizerTest {

  private static final NewUserRequest NEW_USER =
      new NewUserRequest(new UsernameMetadata("token", "ro"), Statements.of("X"), "userpw", null);

  private Database delegate;
  private DatabaseErrorSanitizer sanitizer;

  @BeforeEach
  void setUp() {
    delegate = mock(Database.class);
    sanitizer = new DatabaseErrorSanitizer(delegate, () -> Map.of("rootpw", "[password]"));
  }

  @Test
  @DisplayName("Should pass results through untouched")
  void shouldPassResultsThrough() {
    when(delegate.newUser(any(), any())).thenReturn(new NewUserResponse("v-token-ro-abc"));
    when(delegate.type()).thenReturn("mysql");

    final var response = sanitizer.newUser(CallContext.background(), NEW_USER);

    assertEquals("v-token-ro-abc", response.username());
    assertEquals("mysql", sanitizer.type());
  }

  @Test
  @DisplayName("Should redact the connection password and keep the error kind")
  void shouldRedactConnectionPassword() {
    when(delegate.initialize(any(), any()))
        .thenThrow(
            new ConnectionException(
                "error verifying connection",
                new SQLException("Access denied for root using password rootpw")));

    final var e =
        assertThrows(
            ConnectionException.class,
            () ->
                sanitizer.initialize(
                    CallContext.background(), new InitializeRequest(Map.of(), true)));

    assertFalse(e.getMessage().contains("rootpw"), e.getMessage());
    assertTrue(e.getMessage().contains("[password]"), e.getMessage());
    assertNull(e.getCause());
  }

  @Test
  @DisplayName("Should redact the password of a rejected configuration")
  void shouldRedactConfiguredPassword() {
    when(delegate.initialize(any(), any()))
        .thenThrow(new ValidationException("invalid connection configuration near n3wroot"));

    final var e =
        assertThrows(
            ValidationException.class,
            () ->
                sanitizer.initialize(
                    CallContext.background(),
                    new InitializeRequest(Map.of("password", "n3wroot"), true)));

    assertEquals("invalid connection configuration near [password]", e.getMessage());
  }

  @Test
  @DisplayName("Should redact the password carried by the request")
  void shouldRedactRequestPassword() {
    when(delegate.newUser(any(), any()))
        .thenThrow(
            new StatementExecutionException(
                2, new SQLException("syntax error near 'userpw' and rootpw")));

    final var e =
        assertThrows(
            StatementExecutionException.class,
            () -> sanitizer.newUser(CallContext.background(), NEW_USER));

    assertEquals(2, e.statementIndex());
    assertFalse(e.getMessage().contains("userpw"), e.getMessage());
    assertFalse(e.getMessage().contains("rootpw"), e.getMessage());
  }

  @Test
  @DisplayName("Should redact the new password of an update")
  void shouldRedactUpdatePassword() {
    doThrow(new IllegalStateException("could not set password to n3wpass"))
        .when(delegate)
        .updateUser(any(), any());

    final var e =
        assertThrows(
            RuntimeException.class,
            () ->
                sanitizer.updateUser(
                    CallContext.background(),
                    new UpdateUserRequest(
                        "alice", new ChangePassword("n3wpass", Statements.empty()), null)));

    assertEquals(RuntimeException.class, e.getClass());
    assertEquals("could not set password to [password]", e.getMessage());
    assertNull(e.getCause());
  }

  @Test
  @DisplayName("Should replace the longest secret first")
  void shouldReplaceLongestFirst() {
    final var overlapping =
        new DatabaseErrorSanitizer(delegate, () -> Map.of("pw", "[short]", "pw-long", "[long]"));
    doThrow(new ConnectionException("failed with pw-long")).when(delegate).close();

    final var e = assertThrows(ConnectionException.class, overlapping::close);

    assertEquals("failed with [long]", e.getMessage());
  }

  @Test
  @DisplayName("Should return the original error when there is nothing to redact")
  void shouldKeepErrorWithoutSecrets() {
    final var plain = new DatabaseErrorSanitizer(delegate, Map::of);
    final var original = new ConnectionException("down");
    doThrow(original).when(delegate).close();

    assertSame(original, assertThrows(ConnectionException.class, plain::close));
  }
}
