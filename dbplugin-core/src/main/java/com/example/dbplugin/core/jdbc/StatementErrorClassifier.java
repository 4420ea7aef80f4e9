package com.example.dbplugin.core.jdbc;

import java.sql.SQLException;

/**
 * Backend-specific translation of a driver error into the single decision the engine needs: can
 * the statement be retried without preparing it.
 */
@FunctionalInterface
public interface StatementErrorClassifier {

  /** Outcome of classifying a failed statement. */
  enum Classification {
    /** The backend refused to prepare the statement; it may still be executed directly. */
    NOT_PREPARABLE,
    /** Any other failure. */
    OTHER
  }

  Classification classify(SQLException e);

  /**
   * Classifier for backends that can prepare everything.
   *
   * @return classifier that always answers {@link Classification#OTHER}
   */
  static StatementErrorClassifier preparesEverything() {
    return e -> Classification.OTHER;
  }

  /**
   * Treats errors carrying {@code vendorCode} anywhere in their chain as unpreparable.
   *
   * @param vendorCode driver error code reported for unpreparable statements
   * @return classifier
   */
  static StatementErrorClassifier byVendorCode(final int vendorCode) {
    return e -> {
      for (Throwable t = e; t != null; t = t.getCause()) {
        if (t instanceof SQLException sql) {
          for (var next = sql; next != null; next = next.getNextException())
            if (next.getErrorCode() == vendorCode) return Classification.NOT_PREPARABLE;
        }
      }
      return Classification.OTHER;
    };
  }
}
