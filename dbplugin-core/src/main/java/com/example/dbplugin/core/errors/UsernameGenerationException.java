package com.example.dbplugin.core.errors;

/** A username could not be generated within the identifier length limits. */
public class UsernameGenerationException extends DatabasePluginException {

  public UsernameGenerationException(final String message) {
    super(message);
  }

  public UsernameGenerationException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  protected DatabasePluginException copyWithMessage(final String message) {
    return new UsernameGenerationException(message);
  }
}
