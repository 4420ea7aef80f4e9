package com.example.dbplugin.core.contract;

/**
 * @param username account to revoke
 * @param statements revocation statements; the backend default is used when empty
 */
public record DeleteUserRequest(String username, Statements statements) {

  public DeleteUserRequest {
    if (statements == null) statements = Statements.empty();
  }
}
