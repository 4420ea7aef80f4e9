package com.example.dbplugin.core.contract;

/**
 * Human-readable inputs the backend folds into a generated username.
 *
 * <p>Length limits are not part of the request: each backend instance applies its own username
 * length class, fixed when it is created.
 *
 * @param displayName display name of the token or entity requesting the credential
 * @param roleName name of the role the credential is issued for
 */
public record UsernameMetadata(String displayName, String roleName) {}
