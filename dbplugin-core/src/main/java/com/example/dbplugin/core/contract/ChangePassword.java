package com.example.dbplugin.core.contract;

/**
 * @param newPassword password to set
 * @param statements rotation statements; the backend default is used when empty
 */
public record ChangePassword(String newPassword, Statements statements) {

  public ChangePassword {
    if (statements == null) statements = Statements.empty();
  }
}
