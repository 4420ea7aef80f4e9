package com.example.dbplugin.core.contract;

import java.time.Instant;

/**
 * @param usernameConfig inputs for username generation
 * @param statements creation statements, must not be empty
 * @param password password chosen by the host for the new account
 * @param expiration when the host will revoke the account; may be null
 */
public record NewUserRequest(
    UsernameMetadata usernameConfig, Statements statements, String password, Instant expiration) {

  public NewUserRequest {
    if (usernameConfig == null) usernameConfig = new UsernameMetadata("", "");
    if (statements == null) statements = Statements.empty();
  }
}
