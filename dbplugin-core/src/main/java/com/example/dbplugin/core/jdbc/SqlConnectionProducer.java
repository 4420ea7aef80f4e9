package com.example.dbplugin.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.dbplugin.core.contract.CallContext;
import com.example.dbplugin.core.errors.ConnectionException;
import com.example.dbplugin.core.errors.OperationCancelledException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * {@link ConnectionProducer} backed by a HikariCP pool.
 *
 * <p>One {@link ReentrantLock} per instance guards the pool and the settings. Lock waits poll in
 * short slices so a cancelled {@link CallContext} is noticed without performing any backend I/O.
 *
 * <p>The ping timeout used when verifying a connection can be set through the system property
 * {@code dbplugin.connection.validation.timeout.seconds} or the environment variable {@code
 * DBPLUGIN_CONNECTION_VALIDATION_TIMEOUT_SECONDS} (default 5).
 */
public class SqlConnectionProducer implements ConnectionProducer {

  private static final System.Logger logger =
      System.getLogger(SqlConnectionProducer.class.getName());

  static final String PASSWORD_PLACEHOLDER = "[password]";
  static final long LOCK_POLL_MILLIS = 25L;

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private final String poolName;
  private final int validationTimeoutSeconds = initValidationTimeoutSeconds();
  private final ReentrantLock lock = new ReentrantLock();

  private volatile ConnectionSettings settings;
  private HikariDataSource dataSource;

  public SqlConnectionProducer(final String poolName) {
    this.poolName = poolName;
  }

  /**
   * Sets the supplier of the {@link ObjectMapper} used to bind configuration maps.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  private static int initValidationTimeoutSeconds() {
    return Optional.ofNullable(System.getProperty("dbplugin.connection.validation.timeout.seconds"))
        .or(
            () ->
                Optional.ofNullable(
                    System.getenv("DBPLUGIN_CONNECTION_VALIDATION_TIMEOUT_SECONDS")))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .flatMap(
            val -> {
              try {
                return Optional.of(Integer.parseInt(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            })
        .map(parsed -> Math.max(1, parsed))
        .orElse(5);
  }

  @Override
  public void initialize(
      final CallContext ctx, final Map<String, Object> config, final boolean verifyConnection) {
    final var parsed = ConnectionSettings.fromConfig(config, mapperSupplier.get());

    acquire(ctx);
    try {
      closePool();
      settings = parsed;
      logger.log(INFO, "Initialized {0} with {1}", poolName, parsed);

      if (!verifyConnection) return;

      try (var connection = openPool().getConnection()) {
        if (!connection.isValid(validationTimeoutSeconds))
          throw new SQLException("connection is not valid");
      } catch (final SQLException e) {
        closePool();
        throw new ConnectionException("error verifying connection: " + e.getMessage(), e);
      }
      logger.log(DEBUG, "Verified connection for {0}", poolName);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public <T> T withConnection(final CallContext ctx, final ConnectionCallback<T> callback) {
    acquire(ctx);
    try {
      if (settings == null) throw new ConnectionException("plugin has not been initialized");
      final Connection connection;
      try {
        connection = borrow();
      } catch (final SQLException e) {
        throw new ConnectionException("error obtaining connection: " + e.getMessage(), e);
      }
      try {
        return callback.apply(connection);
      } finally {
        release(connection);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Map<String, String> secretValues() {
    final var current = settings;
    if (current == null || current.password() == null || current.password().isEmpty())
      return Map.of();
    return Map.of(current.password(), PASSWORD_PLACEHOLDER);
  }

  @Override
  public void close() {
    lock.lock();
    try {
      closePool();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Hook for backends to set driver specific pool properties, e.g. TLS options.
   *
   * @param config pool configuration about to be used
   * @param settings the bound connection settings
   */
  protected void customize(final HikariConfig config, final ConnectionSettings settings) {}

  /** Borrows a connection from the pool, opening it first if needed. Called with the lock held. */
  Connection borrow() throws SQLException {
    return openPool().getConnection();
  }

  // Failures returning the connection never replace the callback's outcome.
  private void release(final Connection connection) {
    try {
      connection.close();
    } catch (final SQLException e) {
      logger.log(WARNING, "Failed to return connection to pool " + poolName, e);
    }
  }

  /** Whether a pool is currently open. */
  boolean isOpen() {
    return dataSource != null && !dataSource.isClosed();
  }

  private HikariDataSource openPool() {
    if (isOpen()) return dataSource;

    final var config = new HikariConfig();
    config.setPoolName(poolName);
    config.setJdbcUrl(settings.renderedConnectionUrl());
    Optional.ofNullable(settings.username())
        .filter(u -> !u.isEmpty())
        .ifPresent(config::setUsername);
    Optional.ofNullable(settings.password())
        .filter(p -> !p.isEmpty())
        .ifPresent(config::setPassword);
    config.setMaximumPoolSize(settings.effectiveMaxOpenConnections());
    config.setMinimumIdle(settings.effectiveMaxIdleConnections());
    config.setMaxLifetime(settings.maxConnectionLifetimeDuration().toMillis());
    config.setConnectionTimeout(Math.max(250L, settings.connectTimeoutDuration().toMillis()));
    // Let the pool start even if the backend is down; the first borrow reports the failure.
    config.setInitializationFailTimeout(-1L);
    settings.connectionProperties().forEach(config::addDataSourceProperty);
    customize(config, settings);

    try {
      dataSource = new HikariDataSource(config);
    } catch (final RuntimeException e) {
      throw new ConnectionException("error opening connection pool: " + e.getMessage(), e);
    }
    logger.log(DEBUG, "Opened connection pool {0}", poolName);
    return dataSource;
  }

  private void closePool() {
    final var current = dataSource;
    dataSource = null;
    if (current == null || current.isClosed()) return;
    try {
      current.close();
      logger.log(DEBUG, "Closed connection pool {0}", poolName);
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Failed to close connection pool " + poolName, e);
    }
  }

  private void acquire(final CallContext ctx) {
    if (ctx.isCancelled())
      throw new OperationCancelledException("operation cancelled before acquiring the lock");
    try {
      while (!lock.tryLock(LOCK_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        if (ctx.isCancelled())
          throw new OperationCancelledException("operation cancelled while waiting for the lock");
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("interrupted while waiting for the lock", e);
    }
    if (ctx.isCancelled()) {
      lock.unlock();
      throw new OperationCancelledException("operation cancelled before acquiring the lock");
    }
  }
}
