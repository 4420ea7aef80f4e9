package com.example.dbplugin.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.dbplugin.core.contract.CallContext;
import com.example.dbplugin.core.contract.ChangePassword;
import com.example.dbplugin.core.contract.Database;
import com.example.dbplugin.core.contract.DeleteUserRequest;
import com.example.dbplugin.core.contract.InitializeRequest;
import com.example.dbplugin.core.contract.InitializeResponse;
import com.example.dbplugin.core.contract.NewUserRequest;
import com.example.dbplugin.core.contract.NewUserResponse;
import com.example.dbplugin.core.contract.Statements;
import com.example.dbplugin.core.contract.UpdateUserRequest;
import com.example.dbplugin.core.credentials.UsernameGenerator;
import com.example.dbplugin.core.credentials.UsernamePolicy;
import com.example.dbplugin.core.errors.ValidationException;
import com.example.dbplugin.core.sanitizer.SecretValues;
import com.example.dbplugin.core.template.StatementRenderer;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Credential lifecycle engine shared by SQL backends.
 *
 * <p>Subclasses supply the backend type name and the default rotation and revocation templates;
 * this class validates requests, generates usernames, renders templates and hands the result to a
 * {@link TransactionalExecutor}. Validation failures are raised before any backend I/O.
 *
 * <p>Templates see the placeholders {@code name}, {@code username}, {@code password} and {@code
 * expiration} on creation, {@code name}, {@code username} and {@code password} on rotation, and
 * only {@code name} and {@code username} on revocation.
 */
public abstract class AbstractSqlDatabase implements Database, SecretValues {

  private static final System.Logger logger =
      System.getLogger(AbstractSqlDatabase.class.getName());

  static final DateTimeFormatter EXPIRATION_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxx").withZone(ZoneOffset.UTC);

  private final ConnectionProducer producer;
  private final TransactionalExecutor executor;
  private final UsernamePolicy usernamePolicy;
  private final UsernameGenerator usernameGenerator;

  protected AbstractSqlDatabase(
      final ConnectionProducer producer,
      final StatementErrorClassifier classifier,
      final UsernamePolicy usernamePolicy,
      final UsernameGenerator usernameGenerator) {
    this.producer = producer;
    this.executor = new TransactionalExecutor(producer, classifier);
    this.usernamePolicy = usernamePolicy;
    this.usernameGenerator = usernameGenerator;
  }

  /**
   * Template used to change a password when the host supplies none.
   *
   * @return rotation statements
   */
  protected abstract String defaultRotationStatements();

  /**
   * Template used to revoke a user when the host supplies none.
   *
   * @return revocation statements
   */
  protected abstract String defaultRevocationStatements();

  @Override
  public InitializeResponse initialize(final CallContext ctx, final InitializeRequest request) {
    producer.initialize(ctx, request.config(), request.verifyConnection());
    return new InitializeResponse(request.config());
  }

  @Override
  public NewUserResponse newUser(final CallContext ctx, final NewUserRequest request) {
    if (request.statements().isEmpty())
      throw new ValidationException("empty creation statements");

    final var metadata = request.usernameConfig();
    final var username =
        usernameGenerator.generate(metadata.displayName(), metadata.roleName(), usernamePolicy);

    final var values =
        Map.of(
            "name", username,
            "username", username,
            "password", nullToEmpty(request.password()),
            "expiration", formatExpiration(request.expiration()));

    final var statements = StatementRenderer.render(request.statements().commands(), values);
    if (statements.isEmpty()) throw new ValidationException("empty creation statements");

    executor.execute(ctx, statements);
    logger.log(INFO, "Created user {0}", username);
    return new NewUserResponse(username);
  }

  @Override
  public void updateUser(final CallContext ctx, final UpdateUserRequest request) {
    if (request.passwordChange().isEmpty() && request.expirationChange().isEmpty())
      throw new ValidationException("no change requested");

    final var passwordChange = request.passwordChange();
    if (passwordChange.isPresent()) changePassword(ctx, request.username(), passwordChange.get());

    // Expiration is tracked by the host; the backend is left untouched.
    request
        .expirationChange()
        .ifPresent(
            change ->
                logger.log(
                    INFO,
                    "Expiration change for {0} to {1} accepted without backend changes",
                    request.username(),
                    change.newExpiration()));
  }

  @Override
  public void deleteUser(final CallContext ctx, final DeleteUserRequest request) {
    final var username = request.username();
    if (username == null || username.isEmpty())
      throw new ValidationException("username cannot be empty");

    final var values = Map.of("name", username, "username", username);
    executor.execute(
        ctx, renderOrDefault(request.statements(), defaultRevocationStatements(), values));
    logger.log(INFO, "Deleted user {0}", username);
  }

  @Override
  public Map<String, String> secretValues() {
    return producer.secretValues();
  }

  @Override
  public void close() {
    producer.close();
  }

  private void changePassword(
      final CallContext ctx, final String username, final ChangePassword change) {
    final var password = change.newPassword();
    if (username == null || username.isEmpty() || password == null || password.isEmpty())
      throw new ValidationException("must provide both username and password");

    final var values = Map.of("name", username, "username", username, "password", password);
    executor.execute(
        ctx, renderOrDefault(change.statements(), defaultRotationStatements(), values));
    logger.log(DEBUG, "Changed password for {0}", username);
  }

  private static List<String> renderOrDefault(
      final Statements statements, final String fallback, final Map<String, String> values) {
    final var rendered = StatementRenderer.render(statements.commands(), values);
    return rendered.isEmpty() ? StatementRenderer.render(List.of(fallback), values) : rendered;
  }

  static String formatExpiration(final Instant expiration) {
    return expiration == null ? "" : EXPIRATION_FORMAT.format(expiration);
  }

  private static String nullToEmpty(final String value) {
    return value == null ? "" : value;
  }
}
