package com.example.dbplugin.core.jdbc;

import com.example.dbplugin.core.credentials.UsernameGenerator;
import com.example.dbplugin.core.credentials.UsernamePolicy;

/** Backend over an H2 {@code accounts} table, used to exercise the lifecycle engine. */
class H2Database extends AbstractSqlDatabase {

  static final String DEFAULT_ROTATION =
      "UPDATE accounts SET password = '{{password}}' WHERE name = '{{username}}'";
  static final String DEFAULT_REVOCATION = "DELETE FROM accounts WHERE name = '{{name}}'";

  H2Database(final ConnectionProducer producer) {
    super(
        producer,
        StatementErrorClassifier.preparesEverything(),
        UsernamePolicy.CURRENT,
        new UsernameGenerator());
  }

  @Override
  public String type() {
    return "h2";
  }

  @Override
  protected String defaultRotationStatements() {
    return DEFAULT_ROTATION;
  }

  @Override
  protected String defaultRevocationStatements() {
    return DEFAULT_REVOCATION;
  }
}
