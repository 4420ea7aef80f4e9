package com.example.dbplugin.mysql;

import com.example.dbplugin.core.credentials.UsernameGenerator;
import com.example.dbplugin.core.credentials.UsernamePolicy;
import com.example.dbplugin.core.jdbc.AbstractSqlDatabase;
import com.example.dbplugin.core.jdbc.ConnectionProducer;
import com.example.dbplugin.core.jdbc.StatementErrorClassifier;

/**
 * MySQL backend of the database secrets plugin.
 *
 * <p>The legacy variant targets servers whose user names are limited to 16 characters.
 */
public class MySqlDatabase extends AbstractSqlDatabase {

  public static final String TYPE_NAME = "mysql";

  static final String DEFAULT_REVOCATION_STATEMENTS =
      """
      REVOKE ALL PRIVILEGES, GRANT OPTION FROM '{{name}}'@'%';
      DROP USER '{{name}}'@'%'
      """;

  static final String DEFAULT_ROTATION_STATEMENTS =
      """
      ALTER USER '{{username}}'@'%' IDENTIFIED BY '{{password}}';
      """;

  public MySqlDatabase(final boolean legacy) {
    this(
        new MySqlConnectionProducer(legacy ? "dbplugin-mysql-legacy" : "dbplugin-mysql"),
        new MySqlErrorClassifier(),
        UsernamePolicy.of(legacy),
        new UsernameGenerator());
  }

  MySqlDatabase(
      final ConnectionProducer producer,
      final StatementErrorClassifier classifier,
      final UsernamePolicy usernamePolicy,
      final UsernameGenerator usernameGenerator) {
    super(producer, classifier, usernamePolicy, usernameGenerator);
  }

  @Override
  public String type() {
    return TYPE_NAME;
  }

  @Override
  protected String defaultRotationStatements() {
    return DEFAULT_ROTATION_STATEMENTS;
  }

  @Override
  protected String defaultRevocationStatements() {
    return DEFAULT_REVOCATION_STATEMENTS;
  }
}
