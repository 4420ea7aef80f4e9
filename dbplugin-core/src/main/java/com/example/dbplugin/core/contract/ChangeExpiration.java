package com.example.dbplugin.core.contract;

import java.time.Instant;

/**
 * @param newExpiration new expiration of the account
 * @param statements renewal statements
 */
public record ChangeExpiration(Instant newExpiration, Statements statements) {

  public ChangeExpiration {
    if (statements == null) statements = Statements.empty();
  }
}
