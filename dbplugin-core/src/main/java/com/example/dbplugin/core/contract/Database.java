package com.example.dbplugin.core.contract;

/**
 * The six-operation contract a database secrets plugin exposes to its host.
 *
 * <p>The host creates short-lived database accounts with {@link #newUser}, rotates or extends them
 * with {@link #updateUser} and revokes them with {@link #deleteUser}. The plugin keeps no record of
 * issued credentials; everything it returns must be persisted by the host.
 *
 * <p>Implementations must be safe for concurrent calls. Every failure is reported as a subtype of
 * {@link com.example.dbplugin.core.errors.DatabasePluginException}.
 *
 * <pre>{@code
 * var db = MySqlPlugin.create(false);
 * db.initialize(CallContext.background(),
 *     new InitializeRequest(Map.of("connection_url", "jdbc:mysql://db:3306/",
 *         "username", "vault", "password", "secret"), true));
 *
 * var username = db.newUser(CallContext.withTimeout(Duration.ofSeconds(10)),
 *     new NewUserRequest(new UsernameMetadata("token", "readonly"),
 *         Statements.of("CREATE USER '{{name}}'@'%' IDENTIFIED BY '{{password}}';"),
 *         "A1a-generated-password", Instant.now().plus(Duration.ofHours(1))))
 *     .username();
 * }</pre>
 */
public interface Database extends AutoCloseable {

  /**
   * Stores the connection configuration and optionally verifies that the backend is reachable.
   *
   * @param ctx cancellation and deadline signal
   * @param request configuration and verify flag
   * @return the configuration the host should persist
   */
  InitializeResponse initialize(CallContext ctx, InitializeRequest request);

  /**
   * Creates a new database account by running the creation statements in one transaction.
   *
   * @param ctx cancellation and deadline signal
   * @param request creation statements and credential material
   * @return the generated username
   */
  NewUserResponse newUser(CallContext ctx, NewUserRequest request);

  /**
   * Changes the password and/or expiration of an existing account.
   *
   * @param ctx cancellation and deadline signal
   * @param request the requested changes, at least one of which must be present
   */
  void updateUser(CallContext ctx, UpdateUserRequest request);

  /**
   * Revokes and removes an account.
   *
   * @param ctx cancellation and deadline signal
   * @param request username and revocation statements
   */
  void deleteUser(CallContext ctx, DeleteUserRequest request);

  /**
   * Backend type name, e.g. {@code mysql}. Never blocks.
   *
   * @return type name
   */
  String type();

  /** Releases the backend connection. Calling it more than once is harmless. */
  @Override
  void close();
}
