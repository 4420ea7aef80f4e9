package com.example.dbplugin.mysql;

import com.example.dbplugin.core.jdbc.StatementErrorClassifier;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Recognizes MySQL error 1295, "This command is not supported in the prepared statement protocol
 * yet". Statements failing with it are executed without preparing them.
 */
final class MySqlErrorClassifier implements StatementErrorClassifier {

  static final int ER_UNSUPPORTED_PS = 1295;

  private static final String UNSUPPORTED_PS_MESSAGE =
      "not supported in the prepared statement protocol";

  private final StatementErrorClassifier byCode =
      StatementErrorClassifier.byVendorCode(ER_UNSUPPORTED_PS);

  @Override
  public Classification classify(final SQLException e) {
    if (byCode.classify(e) == Classification.NOT_PREPARABLE) return Classification.NOT_PREPARABLE;

    final var msg = e.getMessage();
    if (msg != null && msg.toLowerCase(Locale.ROOT).contains(UNSUPPORTED_PS_MESSAGE))
      return Classification.NOT_PREPARABLE;

    return Classification.OTHER;
  }
}
