package com.example.dbplugin.core.jdbc;

import com.example.dbplugin.core.contract.CallContext;
import java.sql.Connection;
import java.util.Map;

/**
 * Owns the plugin's single connection handle. The handle itself never leaves the producer; callers
 * get a connection only for the duration of {@link #withConnection}, while holding the instance
 * lock.
 */
public interface ConnectionProducer extends AutoCloseable {

  /**
   * Stores the configuration and, when asked to, eagerly connects and pings the backend. The
   * configuration is kept even if verification fails, so the host may simply call again.
   *
   * @param ctx cancellation and deadline signal
   * @param config raw configuration map
   * @param verifyConnection whether to connect before returning
   */
  void initialize(CallContext ctx, Map<String, Object> config, boolean verifyConnection);

  /**
   * Runs {@code callback} with a live connection while holding the instance lock. The connection is
   * opened lazily and reopened if the producer was closed in between.
   *
   * @param ctx cancellation and deadline signal
   * @param callback work to do with the connection
   * @param <T> result type
   * @return the callback's result
   */
  <T> T withConnection(CallContext ctx, ConnectionCallback<T> callback);

  /**
   * Secret values of the current configuration, mapped to the placeholder that replaces them.
   *
   * @return secret to placeholder map
   */
  Map<String, String> secretValues();

  /** Releases the handle. Idempotent. */
  @Override
  void close();

  /**
   * Work executed against a borrowed connection.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface ConnectionCallback<T> {
    T apply(Connection connection);
  }
}
