package com.example.dbplugin.core.sanitizer;

import com.example.dbplugin.core.contract.CallContext;
import com.example.dbplugin.core.contract.ChangePassword;
import com.example.dbplugin.core.contract.Database;
import com.example.dbplugin.core.contract.DeleteUserRequest;
import com.example.dbplugin.core.contract.InitializeRequest;
import com.example.dbplugin.core.contract.InitializeResponse;
import com.example.dbplugin.core.contract.NewUserRequest;
import com.example.dbplugin.core.contract.NewUserResponse;
import com.example.dbplugin.core.contract.UpdateUserRequest;
import com.example.dbplugin.core.errors.DatabasePluginException;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Decorator that strips secret values from every error raised by the wrapped {@link Database}.
 *
 * <p>Secrets come from two places: the wrapped backend's {@link SecretValues} (the password it
 * connects with) and the password carried by the request being served, including the {@code
 * password} key of a new configuration. Each occurrence in an error
 * message is replaced by its placeholder. Plugin errors keep their type; anything else is reported
 * as a plain {@link RuntimeException} with a redacted message and no cause.
 *
 * <pre>{@code
 * var backend = new MySqlDatabase(false);
 * Database db = new DatabaseErrorSanitizer(backend, backend);
 * }</pre>
 */
public final class DatabaseErrorSanitizer implements Database {

  static final String PASSWORD_PLACEHOLDER = "[password]";

  private final Database delegate;
  private final SecretValues secretValues;

  public DatabaseErrorSanitizer(final Database delegate, final SecretValues secretValues) {
    this.delegate = delegate;
    this.secretValues = secretValues;
  }

  @Override
  public InitializeResponse initialize(final CallContext ctx, final InitializeRequest request) {
    final var configured = request.config().get("password");
    final var secrets =
        configured == null ? Map.<String, String>of() : password(configured.toString());
    return guarded(secrets, () -> delegate.initialize(ctx, request));
  }

  @Override
  public NewUserResponse newUser(final CallContext ctx, final NewUserRequest request) {
    return guarded(password(request.password()), () -> delegate.newUser(ctx, request));
  }

  @Override
  public void updateUser(final CallContext ctx, final UpdateUserRequest request) {
    final var secrets =
        request
            .passwordChange()
            .map(ChangePassword::newPassword)
            .map(this::password)
            .orElse(Map.of());
    guarded(
        secrets,
        () -> {
          delegate.updateUser(ctx, request);
          return null;
        });
  }

  @Override
  public void deleteUser(final CallContext ctx, final DeleteUserRequest request) {
    guarded(
        Map.of(),
        () -> {
          delegate.deleteUser(ctx, request);
          return null;
        });
  }

  @Override
  public String type() {
    return guarded(Map.of(), delegate::type);
  }

  @Override
  public void close() {
    guarded(
        Map.of(),
        () -> {
          delegate.close();
          return null;
        });
  }

  private <T> T guarded(final Map<String, String> requestSecrets, final Supplier<T> call) {
    try {
      return call.get();
    } catch (final RuntimeException e) {
      throw sanitize(e, requestSecrets);
    }
  }

  private RuntimeException sanitize(final RuntimeException e, final Map<String, String> extra) {
    final var secrets = new HashMap<>(secretValues.secretValues());
    secrets.putAll(extra);
    secrets.keySet().removeIf(k -> k == null || k.isEmpty());
    if (secrets.isEmpty()) return e;

    // Longest first so a secret containing another is replaced whole.
    final var ordered =
        secrets.entrySet().stream()
            .sorted(
                Comparator.comparingInt((Map.Entry<String, String> en) -> en.getKey().length())
                    .reversed())
            .toList();

    final UnaryOperator<String> redactor =
        text -> {
          if (text == null) return null;
          var result = text;
          for (final var entry : ordered) result = result.replace(entry.getKey(), entry.getValue());
          return result;
        };

    if (e instanceof DatabasePluginException pluginException)
      return pluginException.redact(redactor);

    final var redacted = new RuntimeException(redactor.apply(String.valueOf(e.getMessage())));
    redacted.setStackTrace(e.getStackTrace());
    return redacted;
  }

  private Map<String, String> password(final String value) {
    return value == null || value.isEmpty() ? Map.of() : Map.of(value, PASSWORD_PLACEHOLDER);
  }
}
