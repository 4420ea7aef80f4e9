package com.example.dbplugin.core.contract;

import java.util.Optional;

/**
 * Request to change an existing account. Either change may be null; a request with neither is
 * rejected.
 *
 * @param username account to change
 * @param password requested password change, or null
 * @param expiration requested expiration change, or null
 */
public record UpdateUserRequest(
    String username, ChangePassword password, ChangeExpiration expiration) {

  public Optional<ChangePassword> passwordChange() {
    return Optional.ofNullable(password);
  }

  public Optional<ChangeExpiration> expirationChange() {
    return Optional.ofNullable(expiration);
  }
}
