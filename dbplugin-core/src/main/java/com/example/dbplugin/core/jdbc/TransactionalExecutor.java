package com.example.dbplugin.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.dbplugin.core.contract.CallContext;
import com.example.dbplugin.core.errors.OperationCancelledException;
import com.example.dbplugin.core.errors.StatementExecutionException;
import com.example.dbplugin.core.errors.TransactionException;
import com.example.dbplugin.core.jdbc.StatementErrorClassifier.Classification;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.List;

/**
 * Runs a rendered statement sequence as a single transaction while holding the producer's lock.
 *
 * <p>One operation is one lock hold and one transaction: concurrent readers never observe a
 * partially applied script. Each statement is prepared and executed; if the backend refuses to
 * prepare it the same statement is executed directly instead. Any other failure rolls the whole
 * transaction back.
 *
 * <p>Cancelling the {@link CallContext} mid-transaction cancels the in-flight statement and rolls
 * back. A deadline on the context becomes the query timeout of each statement.
 */
public final class TransactionalExecutor {

  private static final System.Logger logger =
      System.getLogger(TransactionalExecutor.class.getName());

  private final ConnectionProducer producer;
  private final StatementErrorClassifier classifier;

  public TransactionalExecutor(
      final ConnectionProducer producer, final StatementErrorClassifier classifier) {
    this.producer = producer;
    this.classifier = classifier;
  }

  /**
   * Executes {@code statements} in order inside one transaction.
   *
   * @param ctx cancellation and deadline signal
   * @param statements rendered statements
   * @throws StatementExecutionException if a statement fails; nothing has been applied
   * @throws TransactionException if the transaction cannot be started or committed
   * @throws OperationCancelledException if the context was cancelled before commit
   */
  public void execute(final CallContext ctx, final List<String> statements) {
    producer.withConnection(
        ctx,
        connection -> {
          try (var tx = Transaction.begin(connection)) {
            for (int i = 0; i < statements.size(); i++) {
              checkCancelled(ctx);
              executeStatement(ctx, connection, i, statements.get(i));
            }
            checkCancelled(ctx);
            tx.commit();
          }
          logger.log(DEBUG, "Committed {0} statement(s)", statements.size());
          return null;
        });
  }

  private void executeStatement(
      final CallContext ctx, final Connection connection, final int index, final String sql) {
    final PreparedStatement prepared;
    try {
      prepared = connection.prepareStatement(sql);
    } catch (final SQLException e) {
      if (isNotPreparable(ctx, e)) {
        executeDirectly(ctx, connection, index, sql);
        return;
      }
      throw failure(ctx, index, e);
    }

    try (prepared;
        var ignored = ctx.onCancel(() -> cancelQuietly(prepared))) {
      applyTimeout(ctx, prepared);
      prepared.execute();
    } catch (final SQLException e) {
      if (isNotPreparable(ctx, e)) {
        executeDirectly(ctx, connection, index, sql);
        return;
      }
      throw failure(ctx, index, e);
    }
  }

  private void executeDirectly(
      final CallContext ctx, final Connection connection, final int index, final String sql) {
    logger.log(DEBUG, "Statement {0} cannot be prepared, executing it directly", index);
    try (var statement = connection.createStatement();
        var ignored = ctx.onCancel(() -> cancelQuietly(statement))) {
      applyTimeout(ctx, statement);
      statement.execute(sql);
    } catch (final SQLException e) {
      throw failure(ctx, index, e);
    }
  }

  private boolean isNotPreparable(final CallContext ctx, final SQLException e) {
    return !ctx.isCancelled() && classifier.classify(e) == Classification.NOT_PREPARABLE;
  }

  private static RuntimeException failure(
      final CallContext ctx, final int index, final SQLException e) {
    // A timeout only means cancellation when it came from the caller's deadline.
    if (ctx.isCancelled() || (ctx.deadline().isPresent() && e instanceof SQLTimeoutException))
      return new OperationCancelledException("operation cancelled at statement " + index, e);
    return new StatementExecutionException(index, e);
  }

  private static void checkCancelled(final CallContext ctx) {
    if (ctx.isCancelled())
      throw new OperationCancelledException("operation cancelled, rolling back transaction");
  }

  private static void applyTimeout(final CallContext ctx, final Statement statement)
      throws SQLException {
    final var remaining = ctx.remaining();
    if (remaining.isEmpty()) return;
    final var millis = remaining.get().toMillis();
    if (millis <= 0) throw new SQLTimeoutException("deadline exceeded");
    statement.setQueryTimeout((int) Math.max(1L, (millis + 999L) / 1000L));
  }

  private static void cancelQuietly(final Statement statement) {
    try {
      statement.cancel();
    } catch (final SQLException e) {
      logger.log(WARNING, "Failed to cancel running statement", e);
    }
  }

  /**
   * Scoped transaction: rolls back on close unless {@link #commit()} was reached. After a commit
   * attempt, successful or not, close only restores auto-commit.
   */
  private static final class Transaction implements AutoCloseable {

    private final Connection connection;
    private boolean resolved;

    private Transaction(final Connection connection) {
      this.connection = connection;
    }

    static Transaction begin(final Connection connection) {
      try {
        connection.setAutoCommit(false);
      } catch (final SQLException e) {
        throw new TransactionException("failed to begin transaction: " + e.getMessage(), e);
      }
      return new Transaction(connection);
    }

    void commit() {
      resolved = true;
      try {
        connection.commit();
      } catch (final SQLException e) {
        throw new TransactionException("failed to commit transaction: " + e.getMessage(), e);
      }
    }

    @Override
    public void close() {
      try {
        if (!resolved) {
          resolved = true;
          connection.rollback();
          logger.log(DEBUG, "Rolled back transaction");
        }
      } catch (final SQLException e) {
        logger.log(WARNING, "Failed to roll back transaction", e);
        throw new TransactionException("failed to roll back transaction: " + e.getMessage(), e);
      } finally {
        try {
          connection.setAutoCommit(true);
        } catch (final SQLException e) {
          logger.log(WARNING, "Failed to restore auto-commit", e);
        }
      }
    }
  }
}
