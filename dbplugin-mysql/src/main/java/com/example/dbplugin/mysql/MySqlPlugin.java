package com.example.dbplugin.mysql;

import com.example.dbplugin.core.contract.Database;
import com.example.dbplugin.core.sanitizer.DatabaseErrorSanitizer;

/** Entry point the plugin server uses to obtain a ready-to-serve MySQL backend. */
public final class MySqlPlugin {

  private MySqlPlugin() {}

  /**
   * Creates a MySQL backend wrapped so that no error it raises carries a secret value.
   *
   * @param legacy whether to generate usernames for 16 character identifier limits
   * @return backend ready to be served
   */
  public static Database create(final boolean legacy) {
    final var db = new MySqlDatabase(legacy);
    return new DatabaseErrorSanitizer(db, db);
  }
}
